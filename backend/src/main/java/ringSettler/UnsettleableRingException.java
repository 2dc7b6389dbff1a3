package ringSettler;

/**
 * Raised when fitting cannot make every edge of a ring consistent. Not retried; the caller
 * may propose a different ring.
 */
public class UnsettleableRingException extends RuntimeException {

    public UnsettleableRingException(String message) {
        super(message);
    }

    public UnsettleableRingException(String message, Throwable cause) {
        super(message, cause);
    }
}
