package io.facetrelay.error;

/**
 * Hard failure of a unit operation. No state is changed when one of these escapes.
 */
public final class RelayException extends RuntimeException {
    private final RelayError error;

    public RelayException(RelayError error, String message) {
        super(error.wireName() + ": " + message);
        this.error = error;
    }

    public RelayException(RelayError error, String message, Throwable cause) {
        super(error.wireName() + ": " + message, cause);
        this.error = error;
    }

    public RelayError error() {
        return error;
    }

    public static RelayException of(RelayError error, String message) {
        return new RelayException(error, message);
    }
}
