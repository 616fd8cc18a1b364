package ephemera.error;

public class EphemeraConfigException extends EphemeraException {

    public EphemeraConfigException(String message) {
        super(message);
    }

    public EphemeraConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
