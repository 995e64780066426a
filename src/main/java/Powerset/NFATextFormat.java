package Powerset;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import Powerset.Model.Automaton;
import Powerset.Model.AutomatonBuilder;
import Powerset.Model.MalformedAutomatonException;
import net.automatalib.exception.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reader for the sectioned automaton text format:
 * <pre>
 * States: q0,q1,q2
 * Alphabet: a,b
 * Start: q0
 * Accept: q2
 * Transitions:
 *   q0,a-&gt;q0,q1
 *   q1,b-&gt;q2
 *   q2,-&gt;q0   # empty symbol, i.e. an epsilon move
 * </pre>
 * Blank lines and everything after {@code #} are ignored. Repeated header lines and repeated transitions for the
 * same (source, symbol) pair are unioned.
 */
public class NFATextFormat {
    private static final Logger LOGGER = LoggerFactory.getLogger(NFATextFormat.class);

    private static final String STATES = "States:";
    private static final String ALPHABET = "Alphabet:";
    private static final String START = "Start:";
    private static final String ACCEPT = "Accept:";
    private static final String TRANSITIONS = "Transitions:";
    private static final String ARROW = "->";

    /**
     * @throws FormatException on a syntax error, with the offending line number
     * @throws MalformedAutomatonException if the description references undeclared states or symbols
     */
    public static Automaton<String, String> parse(Reader reader) throws IOException, FormatException {
        final AutomatonBuilder<String, String> builder = Automaton.builder();
        final BufferedReader in = reader instanceof BufferedReader br ? br : new BufferedReader(reader);

        boolean inTransitions = false;
        boolean hasStart = false;
        int lineNumber = 0;
        int transitionLines = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            line = stripComment(line).strip();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith(STATES)) {
                builder.withStates(identifiers(value(line, STATES)));
            } else if (line.startsWith(ALPHABET)) {
                builder.withAlphabet(identifiers(value(line, ALPHABET)));
            } else if (line.startsWith(START)) {
                final String start = value(line, START).strip();
                if (start.isEmpty()) {
                    throw new FormatException("Line " + lineNumber + ": empty start state");
                }
                if (hasStart) {
                    throw new FormatException("Line " + lineNumber + ": start state declared twice");
                }
                builder.withStart(start);
                hasStart = true;
            } else if (line.startsWith(ACCEPT)) {
                builder.withAccepting(identifiers(value(line, ACCEPT)));
            } else if (line.startsWith(TRANSITIONS)) {
                inTransitions = true;
            } else if (inTransitions) {
                parseTransition(builder, line, lineNumber);
                transitionLines++;
            } else {
                throw new FormatException("Line " + lineNumber + ": unexpected content '" + line + "'");
            }
        }

        if (!hasStart) {
            throw new FormatException("Missing '" + START + "' line");
        }

        final Automaton<String, String> automaton = builder.build();
        LOGGER.debug("Parsed {} lines: {} states, {} symbols, {} transition lines",
                     lineNumber, automaton.size(), automaton.getAlphabet().size(), transitionLines);
        return automaton;
    }

    public static Automaton<String, String> parse(InputStream is) throws IOException, FormatException {
        return parse(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    public static Automaton<String, String> parse(Path path) throws IOException, FormatException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public static Automaton<String, String> parse(String text) throws FormatException {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new IllegalStateException(e); // StringReader does not fail
        }
    }

    private static void parseTransition(AutomatonBuilder<String, String> builder, String line, int lineNumber)
        throws FormatException {
        final int arrow = line.indexOf(ARROW);
        if (arrow < 0) {
            throw new FormatException("Line " + lineNumber + ": expected 'source,symbol->targets' but got '" + line + "'");
        }
        final String left = line.substring(0, arrow);
        final String right = line.substring(arrow + ARROW.length());

        final int comma = left.indexOf(',');
        if (comma < 0 || left.indexOf(',', comma + 1) >= 0) {
            throw new FormatException("Line " + lineNumber + ": expected 'source,symbol' before '->' but got '" + left + "'");
        }
        final String source = left.substring(0, comma).strip();
        final String symbol = left.substring(comma + 1).strip();
        if (source.isEmpty()) {
            throw new FormatException("Line " + lineNumber + ": missing source state");
        }

        // an empty symbol is an epsilon move
        builder.withTransition(source, symbol.isEmpty() ? null : symbol, identifiers(right));
    }

    private static String value(String line, String key) {
        return line.substring(key.length());
    }

    private static List<String> identifiers(String csv) {
        final List<String> result = new ArrayList<>();
        for (String part : csv.split(",")) {
            final String id = part.strip();
            if (!id.isEmpty()) {
                result.add(id);
            }
        }
        return result;
    }

    private static String stripComment(String line) {
        final int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }
}
