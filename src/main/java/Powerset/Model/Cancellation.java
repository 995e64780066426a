package Powerset.Model;

/**
 * Bounds a subset construction, either by the number of discovered DFA states or by an external interrupt.
 */
public class Cancellation {

    private final int stateThreshold;

    private volatile boolean interrupted;

    public Cancellation() {
        this(false, Integer.MAX_VALUE);
    }

    public Cancellation(int stateThreshold) {
        this(false, stateThreshold);
    }

    public Cancellation(boolean interrupted, int stateThreshold) {
        if (stateThreshold < 1) {
            throw new IllegalArgumentException("State threshold must be positive: " + stateThreshold);
        }
        this.interrupted = interrupted;
        this.stateThreshold = stateThreshold;
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public void setInterrupted() {
        this.interrupted = true;
    }

    public boolean isAboveThreshold(int states) {
        return states > stateThreshold;
    }

    public String cancelLabel() {
        return this.isInterrupted() ? "TO" : "OOM";
    }
}
