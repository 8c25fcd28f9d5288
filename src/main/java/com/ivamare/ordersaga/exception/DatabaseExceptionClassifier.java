package com.ivamare.ordersaga.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a failure while handling a saga message is worth retrying.
 *
 * <p>Retryable failures are stream conflicts (another writer won the race on the same
 * order) and transient database conditions: lost connections, resource exhaustion,
 * serialization failures and deadlocks. Everything else is treated as permanent.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private DatabaseExceptionClassifier() {
    }

    /** SQLSTATE classes 08 (connection), 53 (resources), 57P (shutdown) and 40 (rollback) */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        "53000", "53100", "53200", "53300",
        "57P01", "57P02", "57P03",
        "40001", "40P01"
    );

    private static final List<String> TRANSIENT_MESSAGE_PATTERNS = List.of(
        "connection refused",
        "connection reset",
        "connection timed out",
        "socket timeout",
        "read timed out",
        "connection is not available",
        "broken pipe",
        "terminating connection",
        "server closed the connection",
        "could not connect to server",
        "the database system is starting up",
        "the database system is shutting down"
    );

    /**
     * Check whether the failure (or any of its causes) is retryable.
     */
    public static boolean isRetryable(Throwable ex) {
        return retryReason(ex).isPresent();
    }

    /**
     * Describe why a failure is retryable, for logging.
     *
     * @return Reason, or empty when the failure is permanent
     */
    public static Optional<String> retryReason(Throwable ex) {
        Throwable current = ex;
        int depth = 0;
        while (current != null && depth++ < 16) {
            Optional<String> reason = ownReason(current);
            if (reason.isPresent()) {
                return reason;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    /**
     * Find the first SQLSTATE in the cause chain.
     *
     * @return SQL state, or null if none is present
     */
    public static String sqlState(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
                return sqlEx.getSQLState();
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    private static Optional<String> ownReason(Throwable ex) {
        if (ex instanceof ConcurrencyConflictException) {
            return Optional.of("stream conflict");
        }
        if (ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException) {
            return Optional.of("Spring " + ex.getClass().getSimpleName());
        }
        if (ex instanceof SQLTransientException
                || ex instanceof SQLRecoverableException
                || ex instanceof SQLNonTransientConnectionException) {
            return Optional.of("JDBC " + ex.getClass().getSimpleName());
        }
        if (ex instanceof SQLException sqlEx) {
            String state = sqlEx.getSQLState();
            if (state != null && TRANSIENT_SQL_STATES.contains(state)) {
                return Optional.of("SQL state " + state);
            }
        }
        String message = ex.getMessage();
        if (message != null) {
            String lower = message.toLowerCase();
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lower.contains(pattern)) {
                    return Optional.of("message pattern: " + pattern);
                }
            }
        }
        return Optional.empty();
    }
}
