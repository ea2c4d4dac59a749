package dss.coordinator.store;

import java.sql.SQLException;

/**
 * Classification of SQL states raised by H2.
 */
final class SqlErrors {

    private static final String DUPLICATE_KEY = "23505";
    private static final String PARENT_MISSING = "23506";
    private static final String CHILD_EXISTS = "23503";
    private static final String LOCK_TIMEOUT = "HYT00";
    private static final String DEADLOCK = "40001";
    private static final String CONCURRENT_UPDATE = "90131";
    private static final String ROW_NOT_FOUND_WHEN_DELETING = "90112";

    private SqlErrors() {
    }

    static boolean isDuplicateKey(SQLException e) {
        return DUPLICATE_KEY.equals(e.getSQLState());
    }

    /** Insert referenced a row that does not exist. */
    static boolean isParentMissing(SQLException e) {
        return PARENT_MISSING.equals(e.getSQLState());
    }

    /** Delete was blocked by rows that still reference the target. */
    static boolean isChildExists(SQLException e) {
        return CHILD_EXISTS.equals(e.getSQLState());
    }

    /** Lost a race with another transaction; the operation may be retried. */
    static boolean isContention(SQLException e) {
        String state = e.getSQLState();
        return LOCK_TIMEOUT.equals(state)
                || DEADLOCK.equals(state)
                || CONCURRENT_UPDATE.equals(state)
                || ROW_NOT_FOUND_WHEN_DELETING.equals(state);
    }
}
