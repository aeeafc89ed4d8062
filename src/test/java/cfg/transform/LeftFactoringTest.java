package cfg.transform;

import org.junit.jupiter.api.Test;

import cfg.GrammarMatcher;
import cfg.grammar.Grammar;
import cfg.grammar.GrammarParser;

import static org.junit.jupiter.api.Assertions.*;

public class LeftFactoringTest {

	private static Transformation.Result apply(String text){
		return new LeftFactoring().apply(new GrammarParser(true).parse(text).getGrammarOrThrow());
	}

	@Test
	public void testIfThenElse(){
		Transformation.Result result = apply("S -> i E t S | i E t S e S | a\nE -> b");
		assertTrue(result.changed);
		new GrammarMatcher(result.grammar)
				.format("S -> i E t S S1 | a\nE -> b\nS1 -> ε | e S")
				.run();
	}

	@Test
	public void testSecondApplicationChangesNothing(){
		Transformation.Result first = apply("S -> i E t S | i E t S e S | a\nE -> b");
		assertFalse(new LeftFactoring().apply(first.grammar).changed);
	}

	@Test
	public void testSeveralGroups(){
		new GrammarMatcher(apply("S -> a b | a c | x y | x z | q").grammar)
				.alternatives("S", "a S1", "x S2", "q")
				.alternatives("S1", "b", "c")
				.alternatives("S2", "y", "z")
				.run();
	}

	@Test
	public void testCounterSkipsUsedNames(){
		new GrammarMatcher(apply("S -> a b | a c | S1\nS1 -> d").grammar)
				.heads("S", "S1", "S2")
				.alternatives("S", "a S2", "S1")
				.alternatives("S2", "b", "c")
				.run();
	}

	@Test
	public void testCounterIsSharedBetweenNonTerminals(){
		new GrammarMatcher(apply("S -> a b | a c | T\nT -> x y | x z").grammar)
				.alternatives("S", "a S1", "T")
				.alternatives("T", "x T2")
				.alternatives("T2", "y", "z")
				.run();
	}

	@Test
	public void testNoCommonFirstSymbol(){
		Grammar grammar = new GrammarParser(true).parse("S -> a S | b | ε").getGrammarOrThrow();
		Transformation.Result result = new LeftFactoring().apply(grammar);
		assertFalse(result.changed);
		assertSame(grammar, result.grammar);
	}

	@Test
	public void testFormatParsesBackWithoutCompactNotation(){
		Grammar factored = apply("S -> x a+B | x c").grammar;
		assertEquals(factored, new GrammarParser(false).parse(factored.format()).getGrammarOrThrow());
		// a+B becomes a + B, B isn't defined
		assertFalse(new GrammarParser(true).parse(factored.format()).isSuccess());
	}
}
