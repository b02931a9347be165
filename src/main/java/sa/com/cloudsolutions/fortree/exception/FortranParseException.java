package sa.com.cloudsolutions.fortree.exception;

/**
 * Raised when the units of a single source file cannot be extracted.
 * The file is left out of the index.
 */
public class FortranParseException extends FortreeException {
    private final String filename;

    public FortranParseException(String filename, String message) {
        super(filename + ": " + message);
        this.filename = filename;
    }

    public FortranParseException(String filename, String message, Throwable cause) {
        super(filename + ": " + message, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
