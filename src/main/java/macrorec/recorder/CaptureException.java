package macrorec.recorder;

/**
 * Unchecked exception thrown when input capture cannot be installed or a
 * capture worker fails.
 */
public class CaptureException extends RuntimeException {

    public CaptureException(String msg) {
        super(msg);
    }

    public CaptureException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
