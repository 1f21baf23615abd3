package org.retreat.placer;

/**
 * Malformed room or roster input. Raised before any model is built.
 */
public class InputDataException extends PlacementException {

    public InputDataException(String message) {
        super(message);
    }

    public InputDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
