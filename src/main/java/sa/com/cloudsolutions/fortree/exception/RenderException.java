package sa.com.cloudsolutions.fortree.exception;

public class RenderException extends FortreeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
