package dqfd.replay;

// More items requested from a pool than it holds
public class UnderflowException extends IllegalStateException {

    public UnderflowException(int requested, int available) {
        super("Cannot sample " + requested + " items from a pool holding " + available);
    }
}
