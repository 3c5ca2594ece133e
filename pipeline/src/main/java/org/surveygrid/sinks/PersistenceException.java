package org.surveygrid.sinks;

/**
 * A write to the aggregate store failed. The unit of work it belonged to has
 * been rolled back.
 */
public class PersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
