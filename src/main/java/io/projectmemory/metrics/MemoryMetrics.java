package io.projectmemory.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.projectmemory.core.ServiceContext;
import io.projectmemory.ratelimit.RateLimitDecision;
import io.projectmemory.storage.ConnectionPool;
import io.projectmemory.storage.PoolStats;

/**
 * Micrometer meters for the connection pool and the rate limiter. Values are read from the live
 * components on each scrape; with the Prometheus registry they appear under
 * {@code mcp_pool_*} and {@code mcp_rate_limit_*}.
 */
public class MemoryMetrics implements MeterBinder {

    private final ServiceContext context;
    private final Tags tags;

    public MemoryMetrics(ServiceContext context) {
        this.context = context;
        this.tags = Tags.of("component", "project_memory");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        bindPool(registry, context.pool());
        bindRateLimiter(registry);
    }

    private void bindPool(MeterRegistry registry, ConnectionPool pool) {
        Gauge.builder("mcp.pool.size.total", pool, p -> p.stats().poolSize())
                .description("Configured size of the connection pool")
                .tags(tags)
                .register(registry);
        Gauge.builder("mcp.pool.available.connections", pool, p -> p.stats().available())
                .description("Connections that can be acquired right now")
                .tags(tags)
                .register(registry);
        Gauge.builder("mcp.pool.in.use.connections", pool, p -> p.stats().inUse())
                .description("Connections currently handed out")
                .tags(tags)
                .register(registry);
        Gauge.builder("mcp.pool.utilization.ratio", pool, MemoryMetrics::poolUtilization)
                .description("Share of the pool in use, 0 to 1")
                .tags(tags)
                .register(registry);
        Gauge.builder("mcp.pool.initialized", pool, p -> p.stats().warmedUp() ? 1 : 0)
                .description("1 when all connections were opened at startup")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("mcp.pool.exhaustion", pool, p -> p.stats().exhaustionCount())
                .description("Acquire attempts that timed out waiting for a connection")
                .tags(tags)
                .register(registry);
    }

    private void bindRateLimiter(MeterRegistry registry) {
        Gauge.builder("mcp.rate.limit.max.ops", context, c -> c.properties().rateLimit())
                .description("Operations allowed per window")
                .tags(tags)
                .register(registry);
        Gauge.builder("mcp.rate.limit.window.seconds", context, c -> c.properties().rateLimitWindow().toSeconds())
                .description("Length of the sliding window")
                .tags(tags)
                .register(registry);
        Gauge.builder("mcp.rate.limit.current.usage", context, c -> {
                    RateLimitDecision state = c.rateLimiter().peek();
                    return state.limit() - state.remaining();
                })
                .description("Operations counted in the current window")
                .tags(tags)
                .register(registry);
        Gauge.builder("mcp.rate.limit.remaining", context, c -> c.rateLimiter().peek().remaining())
                .description("Operations still available in the current window")
                .tags(tags)
                .register(registry);
        Gauge.builder("mcp.rate.limit.utilization.ratio", context,
                        c -> c.rateLimiter().peek().utilizationPercent() / 100.0)
                .description("Share of the window already used, 0 to 1")
                .tags(tags)
                .register(registry);
    }

    private static double poolUtilization(ConnectionPool pool) {
        PoolStats stats = pool.stats();
        return stats.poolSize() == 0 ? 0.0 : (double) stats.inUse() / stats.poolSize();
    }
}
