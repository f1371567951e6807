package stanzas;

/**
 * An edit request that must not reach the engine.
 */
public class InvalidIntentException extends IllegalArgumentException {

    public InvalidIntentException(String message) {
        super(message);
    }
}
