package Powerset;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PowersetCommandLineTest {
  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

  private int run(String... args) {
    return PowersetCommandLine.run(args,
        new PrintStream(outBytes, true, StandardCharsets.UTF_8),
        new PrintStream(errBytes, true, StandardCharsets.UTF_8));
  }

  private String out() {
    return outBytes.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return errBytes.toString(StandardCharsets.UTF_8);
  }

  private static String resource(String name) throws Exception {
    return NFATextFormatTest.getFilePath(name).toAbsolutePath().toString();
  }

  @Test
  void testConvert() throws Exception {
    Assertions.assertEquals(PowersetCommandLine.EXIT_OK,
        run("--word", "aab", "--word", "aba", resource("no_epsilon.txt")));
    Assertions.assertTrue(out().contains("Original NFA size: 3"), out());
    Assertions.assertTrue(out().contains("DFA size: 3"), out());
    Assertions.assertTrue(out().contains("DFA start state: {q0}"), out());
    Assertions.assertTrue(out().contains("Word 'aab': NFA accepts, DFA accepts"), out());
    Assertions.assertTrue(out().contains("Word 'aba': NFA rejects, DFA rejects"), out());
  }

  @Test
  void testTotalAndTrace() throws Exception {
    Assertions.assertEquals(PowersetCommandLine.EXIT_OK, run("--total", "--trace", resource("mixed.txt")));
    Assertions.assertTrue(out().contains("(total)"), out());
    Assertions.assertTrue(out().contains("0: {s,p} "), out());
  }

  @Test
  void testEpsilonChain() throws Exception {
    Assertions.assertEquals(PowersetCommandLine.EXIT_OK, run("--word", "", resource("epsilon_chain.txt")));
    Assertions.assertTrue(out().contains("DFA size: 1"), out());
    Assertions.assertTrue(out().contains("Word '': NFA accepts, DFA accepts"), out());
  }

  @Test
  void testFailures() throws Exception {
    Assertions.assertEquals(PowersetCommandLine.EXIT_FAILURE, run(resource("dangling.txt")));
    Assertions.assertTrue(err().contains("TRANSITION_TARGET 'q7'"), err());

    Assertions.assertEquals(PowersetCommandLine.EXIT_FAILURE, run(resource("syntax_error.txt")));
    Assertions.assertTrue(err().contains("Syntax error"), err());

    Assertions.assertEquals(PowersetCommandLine.EXIT_FAILURE, run("--max-states", "1", resource("no_epsilon.txt")));
    Assertions.assertTrue(err().contains("OOM"), err());

    Assertions.assertEquals(PowersetCommandLine.EXIT_FAILURE, run("--max-states", "zero", resource("no_epsilon.txt")));
    Assertions.assertEquals(PowersetCommandLine.EXIT_FAILURE, run("--bogus", resource("no_epsilon.txt")));
    Assertions.assertEquals(PowersetCommandLine.EXIT_FAILURE, run());
    Assertions.assertEquals(PowersetCommandLine.EXIT_FAILURE, run("missing-file.txt"));
    Assertions.assertTrue(out().contains("Powerset [--debug]"), out());
  }

  @Test
  void testToSymbols() {
    Assertions.assertEquals(List.of("a", "b", "a"), PowersetCommandLine.toSymbols("aba"));
    Assertions.assertEquals(List.of("ab", "c"), PowersetCommandLine.toSymbols("ab, c"));
    Assertions.assertEquals(List.of(), PowersetCommandLine.toSymbols(""));
  }
}
