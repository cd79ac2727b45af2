package com.flowcanvas.core.model;

import java.util.Optional;

/**
 * Successful outcome of a connection request.
 */
public record ConnectionResult(Status status, Connection connection, String warning) {

    public enum Status {
        /**
         * Connection inserted, no remarks.
         */
        CREATED,

        /**
         * Connection inserted although the declared port types do not match.
         */
        CREATED_WITH_TYPE_WARNING
    }

    public static ConnectionResult created(Connection connection) {
        return new ConnectionResult(Status.CREATED, connection, null);
    }

    public static ConnectionResult createdWithTypeWarning(Connection connection, String warning) {
        return new ConnectionResult(Status.CREATED_WITH_TYPE_WARNING, connection, warning);
    }

    public boolean hasWarning() {
        return status == Status.CREATED_WITH_TYPE_WARNING;
    }

    public Optional<String> warningMessage() {
        return Optional.ofNullable(warning);
    }
}
