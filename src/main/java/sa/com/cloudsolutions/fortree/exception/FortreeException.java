package sa.com.cloudsolutions.fortree.exception;

public class FortreeException extends Exception {

    public FortreeException(String message) {
        super(message);
    }

    public FortreeException(String message, Throwable cause) {
        super(message, cause);
    }

    public FortreeException(Throwable cause) {
        super(cause);
    }
}
