package Powerset.Model;

/**
 * Thrown when a subset construction is stopped by its {@link Cancellation} before the worklist is exhausted.
 */
public class UnboundedConstructionException extends IllegalStateException {
    private final String label;
    private final int stateThreshold;
    private final int discoveredStates;

    public UnboundedConstructionException(Cancellation cancellation, int discoveredStates) {
        super(message(cancellation, discoveredStates));
        this.label = cancellation.cancelLabel();
        this.stateThreshold = cancellation.getStateThreshold();
        this.discoveredStates = discoveredStates;
    }

    private static String message(Cancellation cancellation, int discoveredStates) {
        if (cancellation.isInterrupted()) {
            return "Subset construction interrupted after " + discoveredStates + " DFA states";
        }
        return "Subset construction exceeded " + cancellation.getStateThreshold()
            + " DFA states (" + discoveredStates + " discovered)";
    }

    /**
     * @return "TO" for an interrupt, "OOM" for an exceeded state threshold
     */
    public String getLabel() {
        return label;
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public int getDiscoveredStates() {
        return discoveredStates;
    }
}
