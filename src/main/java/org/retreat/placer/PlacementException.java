package org.retreat.placer;

/**
 * Base class for failures that abort a placement run.
 */
public abstract class PlacementException extends RuntimeException {

    protected PlacementException(String message) {
        super(message);
    }

    protected PlacementException(String message, Throwable cause) {
        super(message, cause);
    }
}
