package sa.com.cloudsolutions.fortree.exception;

public class TreeException extends RuntimeException {

    public TreeException(String message) {
        super(message);
    }

    public TreeException(String message, Throwable cause) {
        super(message, cause);
    }

    public TreeException(Throwable cause) {
        super(cause);
    }
}
