package com.ivamare.reliability.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Set;

/**
 * Classifies persistence failures as transient (store temporarily unavailable)
 * or permanent (bad data, constraint violation).
 *
 * <p>The audit ledger and JDBC stores use this to tag {@link AuditWriteException}
 * so callers can decide whether to retry the whole unit of work.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class StoreFailureClassifier {

    private StoreFailureClassifier() {
    }

    /**
     * SQL state classes: 08 connection, 40 rollback, 53 resources, 57 operator intervention.
     */
    private static final Set<String> TRANSIENT_SQL_STATE_CLASSES = Set.of("08", "40", "53", "57");

    private static final List<String> TRANSIENT_MESSAGE_PATTERNS = List.of(
        "connection refused",
        "connection reset",
        "connection timed out",
        "too many connections",
        "could not connect to server",
        "the database system is starting up",
        "the database system is shutting down"
    );

    /**
     * Determine whether a store failure is transient.
     *
     * @param ex the failure, walked through its cause chain
     * @return true if retrying later may succeed
     */
    public static boolean isTransient(Throwable ex) {
        Throwable current = ex;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof CannotGetJdbcConnectionException
                    || current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof SQLTransientException
                    || current instanceof SQLRecoverableException) {
                return true;
            }
            if (current instanceof SQLException sqlEx) {
                String state = sqlEx.getSQLState();
                if (state != null && state.length() >= 2
                        && TRANSIENT_SQL_STATE_CLASSES.contains(state.substring(0, 2))) {
                    return true;
                }
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase();
                for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                    if (lower.contains(pattern)) {
                        return true;
                    }
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
