package cfg.analysis;

import java.util.*;

import org.junit.jupiter.api.Test;

import cfg.grammar.Grammar;
import cfg.grammar.GrammarParser;

import static org.junit.jupiter.api.Assertions.*;

public class ReachabilityTest {

	@Test
	public void testUnreachable(){
		Grammar grammar = new GrammarParser(true).parse("S -> a A\nA -> b | S\nB -> c\nC -> B").getGrammarOrThrow();
		assertEquals(new HashSet<>(Arrays.asList("S", "A")), Reachability.reachable(grammar));
		assertEquals(Arrays.asList("B", "C"), Reachability.unreachable(grammar));
	}

	@Test
	public void testAllReachable(){
		Grammar grammar = new GrammarParser(true).parse("E -> E + T | T\nT -> ( E ) | id").getGrammarOrThrow();
		assertTrue(Reachability.unreachable(grammar).isEmpty());
		assertEquals(Arrays.asList("E", "T"), new ArrayList<>(Reachability.reachable(grammar)));
	}
}
