package io.projectmemory.memory;

/**
 * The three tables of a project memory and their capacity policy.
 *
 * <ul>
 *   <li>{@code DECISIONS} is an append log: a full table evicts its oldest row.</li>
 *   <li>{@code PATTERNS} and {@code CONTEXT} are keyed: a full table rejects new keys but still
 *       accepts updates to existing ones.</li>
 * </ul>
 */
public enum MemoryTable {
    DECISIONS("decisions", null),
    PATTERNS("patterns", "name"),
    CONTEXT("context", "key");

    private final String tableName;
    private final String keyColumn;

    MemoryTable(String tableName, String keyColumn) {
        this.tableName = tableName;
        this.keyColumn = keyColumn;
    }

    public String tableName() {
        return tableName;
    }

    public String keyColumn() {
        return keyColumn;
    }

    public boolean isAppendLog() {
        return keyColumn == null;
    }
}
