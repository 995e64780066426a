package Powerset;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import Powerset.Model.Automaton;
import Powerset.Model.Cancellation;
import Powerset.Model.MalformedAutomatonException;
import Powerset.Model.StateSet;
import Powerset.Model.UnboundedConstructionException;
import net.automatalib.exception.FormatException;

public class PowersetCommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;

  public static void main(String[] args) {
    // the simple logger reads its level once, before the first logger is created
    if (Arrays.stream(args).anyMatch("--debug"::equalsIgnoreCase)) {
      System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
    }
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    boolean total = false;
    boolean printTrace = false;
    int maxStates = Integer.MAX_VALUE;
    List<String> words = new ArrayList<>();
    List<String> positional = new ArrayList<>(1);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        // handled in main
      } else if ("--trace".equalsIgnoreCase(arg)) {
        printTrace = true;
      } else if ("--total".equalsIgnoreCase(arg)) {
        total = true;
      } else if ("--max-states".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length) {
          err.println("Missing value for --max-states");
          printUsage(out);
          return EXIT_FAILURE;
        }
        try {
          maxStates = Integer.parseInt(args[++i]);
        } catch (NumberFormatException e) {
          err.println("Invalid value for --max-states: " + args[i]);
          return EXIT_FAILURE;
        }
        if (maxStates < 1) {
          err.println("--max-states must be positive: " + maxStates);
          return EXIT_FAILURE;
        }
      } else if ("--word".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length) {
          err.println("Missing value for --word");
          printUsage(out);
          return EXIT_FAILURE;
        }
        words.add(args[++i]);
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsage(out);
        return EXIT_FAILURE;
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 1) {
      printUsage(out);
      return EXIT_FAILURE;
    }

    final Path filePath = Paths.get(positional.get(0));
    final Automaton<String, String> nfa;
    try {
      nfa = NFATextFormat.parse(filePath);
    } catch (IOException e) {
      err.println("Cannot read " + filePath + ": " + e.getMessage());
      return EXIT_FAILURE;
    } catch (FormatException e) {
      err.println("Syntax error in " + filePath + ": " + e.getMessage());
      return EXIT_FAILURE;
    } catch (MalformedAutomatonException e) {
      err.println("Malformed automaton in " + filePath + " (" + e.getField() + " '" + e.getIdentifier() + "'): "
                  + e.getMessage());
      return EXIT_FAILURE;
    }

    out.println("Original NFA size: " + nfa.size());
    out.println("Alphabet size: " + nfa.getAlphabet().size());
    out.println("Epsilon transitions: " + (nfa.hasEpsilonTransitions() ? "yes" : "no"));

    final SubsetConstruction construction = new SubsetConstruction(new Cancellation(maxStates))
        .withTrace(printTrace)
        .withCompletion(total);

    final DeterminizationResult<String, String> result;
    long before = System.currentTimeMillis();
    try {
      result = construction.construct(nfa);
    } catch (UnboundedConstructionException e) {
      err.println(e.getLabel() + ": " + e.getMessage());
      return EXIT_FAILURE;
    }
    long after = System.currentTimeMillis();

    final Automaton<StateSet<String>, String> dfa = result.dfa();
    if (printTrace) {
      for (TraceRecord<String, String> record : result.trace()) {
        out.println(record);
      }
    }
    out.println("DFA size: " + dfa.size() + (total ? " (total)" : ""));
    out.println("DFA start state: " + dfa.getInitialState());
    out.println("DFA accepting states: " + dfa.getAcceptingStates().size());
    out.println("Iterations: " + result.iterations());
    out.println("Duration: " + ((after - before) / 1000f) + "s");

    for (String word : words) {
      final List<String> symbols = toSymbols(word);
      final boolean nfaAccepts = Simulation.accepts(nfa, symbols);
      final boolean dfaAccepts = Simulation.accepts(dfa, symbols);
      out.println("Word '" + word + "': NFA " + verdict(nfaAccepts) + ", DFA " + verdict(dfaAccepts));
    }
    return EXIT_OK;
  }

  /**
   * Split a word into symbols: comma separated if it contains a comma, one symbol per character otherwise.
   */
  static List<String> toSymbols(String word) {
    final List<String> symbols = new ArrayList<>(word.length());
    if (word.indexOf(',') >= 0) {
      for (String s : word.split(",")) {
        symbols.add(s.strip());
      }
    } else {
      word.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
    }
    return symbols;
  }

  private static String verdict(boolean accepted) {
    return accepted ? "accepts" : "rejects";
  }

  private static void printUsage(PrintStream out) {
    out.println(
        "Powerset [--debug] [--trace] [--total] [--max-states <n>] [--word <w>]... <automaton file>");
    out.println("[--debug] : Debug logging of the construction");
    out.println("[--trace] : Print one line per worklist iteration");
    out.println("[--total] : Add a dead state so that every state has a transition on every symbol");
    out.println("[--max-states <n>] : Give up once more than n DFA states are discovered");
    out.println("[--word <w>] : Check whether NFA and DFA accept w; symbols are characters, or comma separated");
    out.println();
    out.println("<automaton file> : text with 'States:', 'Alphabet:', 'Start:', 'Accept:' lines and a");
    out.println("  'Transitions:' section of 'source,symbol->target1,target2' lines; an empty symbol is an epsilon move.");
  }
}
