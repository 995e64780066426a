package Powerset;

import java.util.List;

import Powerset.Model.Automaton;
import Powerset.Model.StateSet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class AutomataLibExportTest {
  @Test
  void testToCompactDFA() {
    Automaton<StateSet<String>, String> dfa = SubsetConstruction.determinize(SubsetConstructionTest.scenarioA()).dfa();
    CompactDFA<String> compact = AutomataLibExport.toCompactDFA(dfa);

    Assertions.assertEquals(3, compact.size());
    Assertions.assertEquals(2, compact.getInputAlphabet().size());
    Assertions.assertEquals(0, (int) compact.getInitialState());
    Assertions.assertTrue(compact.accepts(List.of("a", "a", "b")));
    Assertions.assertFalse(compact.accepts(List.of("a", "b", "a")));
    Assertions.assertEquals(1, (int) compact.getSuccessor(0, "a"));
    Assertions.assertTrue(compact.isAccepting(2));
  }

  @Test
  void testToCompactNFA() {
    Automaton<String, String> nfa = SubsetConstructionTest.scenarioA();
    CompactNFA<String> compact = AutomataLibExport.toCompactNFA(nfa);

    Assertions.assertEquals(3, compact.size());
    Assertions.assertEquals(1, compact.getInitialStates().size());
    Assertions.assertTrue(compact.getInitialStates().contains(0));
    Assertions.assertEquals(2, compact.getTransitions(0, "a").size());
    Assertions.assertTrue(compact.accepts(List.of("b", "a", "b")));
    Assertions.assertFalse(compact.accepts(List.of("b")));
  }

  @Test
  void testRejectsUnsupported() {
    assertThrows(IllegalArgumentException.class,
        () -> AutomataLibExport.toCompactNFA(SubsetConstructionTest.scenarioB()));
    assertThrows(IllegalArgumentException.class,
        () -> AutomataLibExport.toCompactDFA(SubsetConstructionTest.scenarioA()));
  }
}
