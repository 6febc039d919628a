package macrorec.device;

/**
 * Thrown when the operating system refuses access to an input device, for
 * example on a headless JVM or without accessibility permission.
 */
public class DeviceUnavailableException extends RuntimeException {

    public DeviceUnavailableException(String msg) {
        super(msg);
    }

    public DeviceUnavailableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
