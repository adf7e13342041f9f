package dqfd.replay;

// Replay bookkeeping ended up inconsistent
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
