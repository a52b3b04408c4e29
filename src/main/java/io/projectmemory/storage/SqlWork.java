package io.projectmemory.storage;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of work run inside one transaction by {@link StorageEngine#execute}.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T apply(Connection connection) throws SQLException;
}
