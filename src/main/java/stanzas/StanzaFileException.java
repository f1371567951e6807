package stanzas;

public class StanzaFileException extends Exception {

    public StanzaFileException(String message) {
        super(message);
    }

    public StanzaFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
