package Powerset.Model;

/**
 * Thrown when an automaton description references undeclared states or symbols.
 * Raised eagerly by {@link Automaton#build}, never during construction of the DFA.
 */
public class MalformedAutomatonException extends IllegalArgumentException {

    public enum Field {
        STATES,
        ALPHABET,
        START,
        ACCEPT,
        TRANSITION_SOURCE,
        TRANSITION_SYMBOL,
        TRANSITION_TARGET
    }

    private final Field field;
    private final Object identifier;

    public MalformedAutomatonException(Field field, Object identifier, String message) {
        super(message);
        this.field = field;
        this.identifier = identifier;
    }

    /**
     * @return the part of the description that is invalid
     */
    public Field getField() {
        return field;
    }

    /**
     * @return the offending state or symbol, may be {@code null}
     */
    public Object getIdentifier() {
        return identifier;
    }
}
