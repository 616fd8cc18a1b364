package ephemera.error;

public class EphemeraException extends RuntimeException {

    public EphemeraException(String message) {
        super(message);
    }

    public EphemeraException(String message, Throwable cause) {
        super(message, cause);
    }
}
