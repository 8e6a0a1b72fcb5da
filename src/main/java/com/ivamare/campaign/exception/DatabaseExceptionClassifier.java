package com.ivamare.campaign.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies store exceptions as transient (worth retrying later) or permanent.
 *
 * <p>Used by {@link StoreFailureException} to flag retryable failures and by the dispatch
 * scheduler to decide between backing off and logging a hard error.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private DatabaseExceptionClassifier() {
    }

    /**
     * PostgreSQL SQL states for connection loss (08), resource exhaustion (53),
     * operator intervention (57) and serialization/deadlock rollbacks (40).
     */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        "53000", "53100", "53200", "53300",
        "57P01", "57P02", "57P03",
        "40001", "40P01"
    );

    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection timed out",
        "read timed out",
        "connection is not available",
        "pool exhausted",
        "broken pipe",
        "terminating connection",
        "the database system is starting up",
        "the database system is shutting down"
    };

    /**
     * @param ex the exception to classify (may be null)
     * @return true if the failure is expected to clear up on its own
     */
    public static boolean isTransient(Throwable ex) {
        return transientReason(ex).isPresent();
    }

    /**
     * Describe why an exception was classified as transient, for logging.
     *
     * @param ex the exception to classify (may be null)
     * @return the reason, or empty when the exception is not transient
     */
    public static Optional<String> transientReason(Throwable ex) {
        Throwable current = ex;
        int depth = 0;
        while (current != null && depth++ < 16) {
            Optional<String> reason = classifySingle(current);
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

    private static Optional<String> classifySingle(Throwable ex) {
        if (ex instanceof CannotGetJdbcConnectionException
                || ex instanceof TransientDataAccessException
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
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                return Optional.of("SQL state " + sqlState);
            }
        }
        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase(Locale.ROOT);
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return Optional.of("Message pattern: " + pattern);
                }
            }
        }
        return Optional.empty();
    }
}
