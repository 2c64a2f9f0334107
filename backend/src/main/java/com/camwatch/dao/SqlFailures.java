package com.camwatch.dao;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class SqlFailures {
    private static final Logger logger = LoggerFactory.getLogger(SqlFailures.class);

    static final String FOREIGN_KEY_VIOLATION = "23503";
    private static final String CONNECTION_EXCEPTION_CLASS = "08";

    private SqlFailures() {
    }

    static RuntimeException translate(String op, SQLException e) {
        String state = e.getSQLState();
        if (FOREIGN_KEY_VIOLATION.equals(state)) {
            logger.warn("DB operation {} rejected by foreign key: {}", op, e.getMessage());
            return new ReferentialIntegrityException("Referenced row does not exist", e);
        }
        if (e instanceof SQLTransientConnectionException
            || (state != null && state.startsWith(CONNECTION_EXCEPTION_CLASS))) {
            logger.error("DB operation {} failed, storage unavailable", op, e);
            return new StorageUnavailableException("Storage unavailable", e);
        }
        logger.error("DB operation {} failed", op, e);
        return new IllegalStateException("Database error", e);
    }
}
