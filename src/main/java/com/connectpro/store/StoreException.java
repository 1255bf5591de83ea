package com.connectpro.store;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;

public class StoreException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        CONSTRAINT_VIOLATION,
        FAILURE
    }

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String QUERY_CANCELED = "57014";

    private final Reason reason;

    public StoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public StoreException(Reason reason, String message) {
        this(reason, message, null);
    }

    public Reason reason() {
        return reason;
    }

    static StoreException from(SQLException e, String message) {
        if (e instanceof SQLTimeoutException || QUERY_CANCELED.equals(e.getSQLState())) {
            return new StoreException(Reason.TIMEOUT, message, e);
        }
        if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
            return new StoreException(Reason.CONSTRAINT_VIOLATION, message, e);
        }
        return new StoreException(Reason.FAILURE, message, e);
    }
}
