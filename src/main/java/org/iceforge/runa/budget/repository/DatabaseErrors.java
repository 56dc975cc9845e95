package org.iceforge.runa.budget.repository;

import org.iceforge.runa.budget.service.AnalyticsError;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;

/**
 * Maps failures raised by the JDBC repositories onto {@link AnalyticsError}. Postgres reports a
 * cancelled statement as SQLState {@code 57014}.
 */
public final class DatabaseErrors {

    static final String QUERY_CANCELED_STATE = "57014";

    private DatabaseErrors() {
    }

    public static AnalyticsError classify(String operation, Throwable error) {
        if (isTimeout(error)) {
            return AnalyticsError.timeout(operation + " timed out", error);
        }
        return AnalyticsError.database(operation + " failed: " + rootMessage(error), error);
    }

    public static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof QueryTimeoutException || t instanceof SQLTimeoutException) {
                return true;
            }
            if (t instanceof SQLException sql && QUERY_CANCELED_STATE.equals(sql.getSQLState())) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && (message.contains(QUERY_CANCELED_STATE) || message.contains("statement timeout"))) {
                return true;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
