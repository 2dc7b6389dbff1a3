package ringSettler;

/**
 * A fitted order violates its own bounds. Indicates a defect in fitting, never user input.
 */
public class RingInvariantException extends IllegalStateException {

    public RingInvariantException(String message) {
        super(message);
    }
}
