package sandboxstudio.playback.exception;

/**
 * Upstream feed failure: connection loss reported by the feeder or a payload that cannot be used.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
