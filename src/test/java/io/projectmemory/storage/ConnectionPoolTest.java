package io.projectmemory.storage;

import io.projectmemory.error.PoolExhaustedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolTest {

    @TempDir
    Path tempDir;

    private ConnectionPool pool;

    @BeforeEach
    void setUp() {
        StorageEngine storage = StorageEngine.open(tempDir.resolve("memory.db"));
        pool = new ConnectionPool(storage, 2, Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void shouldWarmUpAllConnections() {
        pool.warmUp();

        PoolStats stats = pool.stats();
        assertTrue(stats.warmedUp());
        assertEquals(2, stats.poolSize());
        assertEquals(2, stats.available());
        assertEquals(0, stats.inUse());
    }

    @Test
    void shouldReuseReleasedConnection() {
        pool.warmUp();
        Connection first = pool.acquire();
        pool.release(first);

        Connection again = pool.acquire();
        Connection other = pool.acquire();

        assertTrue(again == first || other == first);
        pool.release(again);
        pool.release(other);
    }

    @Test
    void shouldFailWithPoolExhaustedAfterTimeout() {
        Connection a = pool.acquire();
        Connection b = pool.acquire();

        long start = System.nanoTime();
        assertThrows(PoolExhaustedException.class, () -> pool.acquire(Duration.ofMillis(100)));
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(waitedMillis >= 90, "should have waited for the timeout, waited " + waitedMillis);
        assertEquals(1, pool.stats().exhaustionCount());
        pool.release(a);
        pool.release(b);
    }

    @Test
    void shouldBlockUntilConnectionIsReleased() throws Exception {
        Connection a = pool.acquire();
        Connection b = pool.acquire();
        CountDownLatch started = new CountDownLatch(1);

        CompletableFuture<Connection> waiter = CompletableFuture.supplyAsync(() -> {
            started.countDown();
            return pool.acquire(Duration.ofSeconds(5));
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertFalse(waiter.isDone());

        pool.release(a);

        Connection handedOver = waiter.get(2, TimeUnit.SECONDS);
        assertNotNull(handedOver);
        assertEquals(0, pool.stats().available());
        pool.release(handedOver);
        pool.release(b);
    }

    @Test
    void shouldReleaseConnectionWhenWorkThrows() {
        assertThrows(IllegalStateException.class, () -> pool.withConnection(c -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(2, pool.stats().available());
    }

    @Test
    void shouldReplaceConnectionClosedWhileHandedOut() throws Exception {
        pool.close();
        pool = new ConnectionPool(StorageEngine.open(tempDir.resolve("single.db")), 1, Duration.ofMillis(200));
        Connection broken = pool.acquire();
        broken.close();
        pool.release(broken);

        Connection next = pool.acquire();

        assertNotSame(broken, next);
        assertFalse(next.isClosed());
        pool.release(next);
    }

    @Test
    void shouldRejectZeroCapacity() {
        StorageEngine storage = StorageEngine.open(tempDir.resolve("other.db"));

        assertThrows(IllegalArgumentException.class, () -> new ConnectionPool(storage, 0, Duration.ofSeconds(1)));
    }
}
