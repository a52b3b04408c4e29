package io.projectmemory.memory;

import java.util.List;
import java.util.Map;

/**
 * Domain API of a project memory: decisions, patterns and key/value context.
 *
 * <p>Every method validates its input before touching storage and runs as one atomic
 * transaction, so a call is either fully applied or fully rejected.</p>
 */
public interface ProjectMemory {

    /** Exact value {@link #purge(String)} requires. */
    String PURGE_CONFIRMATION = "CONFIRM_PURGE";

    /**
     * Appends a decision, evicting the oldest one when the log is full.
     *
     * @param decision     the decision made (required)
     * @param rationale    why it was made (required)
     * @param context      what triggered it (optional)
     * @param alternatives options that were considered (optional)
     * @return the storage-assigned id
     */
    long rememberDecision(String decision, String rationale, String context, String alternatives);

    /**
     * Lists decisions most-recent-first, optionally filtered by a case-insensitive substring of
     * the decision or rationale text.
     *
     * @param keyword optional filter, null or blank for all
     * @param limit   optional cap, clamped to {@code 1..maxDecisions}; null for all
     */
    List<Decision> recallDecisions(String keyword, Integer limit);

    /**
     * Inserts a pattern or replaces the one with the same name. A new name is rejected when the
     * pattern table is full.
     */
    void storePattern(String name, String description, String example, String whenToUse);

    /** All patterns ordered by name. */
    List<Pattern> getPatterns();

    /** Inserts or overwrites a context entry. A new key is rejected when the table is full. */
    void setContext(String key, String value);

    /** All context entries ordered by key. */
    Map<String, String> getContext();

    MemoryStats stats();

    /**
     * Empties all three tables in one transaction.
     *
     * @param confirmToken must equal {@link #PURGE_CONFIRMATION}
     */
    PurgeResult purge(String confirmToken);

    /** Full contents read inside one transaction. */
    MemoryDump dump();

    /**
     * Atomically replaces all contents. Every record goes through the same validation and
     * capacity rules as a live write; any failure leaves the current contents untouched.
     */
    ImportResult replaceAll(List<Decision> decisions, List<Pattern> patterns, Map<String, String> context);
}
