package cfg.grammar;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import cfg.CFGException;
import cfg.GrammarMatcher;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarBuilderTest {

	@Test
	public void testFirstHeadIsStart(){
		new GrammarMatcher(new GrammarBuilder().add("A", "a B").add("B", "b").toGrammar())
				.start("A")
				.heads("A", "B")
				.terminals("a", "b")
				.run();
	}

	@Test
	public void testExplicitStartIsFormattedFirst(){
		Grammar grammar = new GrammarBuilder().add("A", "a").add("B", "A b").start("B").toGrammar();
		assertEquals("B", grammar.getStart());
		assertEquals("B -> A b\nA -> a", grammar.format());
	}

	@Test
	public void testEmptyRightSideIsEpsilon(){
		Grammar grammar = new GrammarBuilder().add("S", "a S").add("S", "").toGrammar();
		assertEquals(Collections.singletonList(Epsilon.EPSILON), grammar.getAlternatives("S").get(1));
	}

	@Test
	public void testSymbolArguments(){
		Grammar grammar = new GrammarBuilder().add("S", new Terminal("a"), new NonTerminal("S"))
				.add("S", Epsilon.EPSILON).toGrammar();
		assertEquals("S -> a S | ε", grammar.format());
	}

	@Test
	public void testSetKeepsPosition(){
		GrammarBuilder builder = GrammarBuilder.from(new GrammarBuilder().add("S", "A").add("A", "a").add("B", "b")
				.toGrammar());
		builder.set("A", Arrays.asList(Arrays.<Symbol>asList(new Terminal("x")),
				Arrays.<Symbol>asList(new NonTerminal("B"))));
		new GrammarMatcher(builder.toGrammar())
				.heads("S", "A", "B")
				.alternatives("A", "x", "B")
				.run();
	}

	@Test
	public void testFromCopies(){
		Grammar grammar = new GrammarBuilder().add("S", "a").toGrammar();
		GrammarBuilder builder = GrammarBuilder.from(grammar);
		builder.add("S", "b");
		assertEquals("S -> a", grammar.format());
		assertEquals("S -> a | b", builder.toGrammar().format());
		assertEquals(grammar, GrammarBuilder.from(grammar).toGrammar());
	}

	@Test
	public void testCreateNewNonTerminal(){
		GrammarBuilder builder = new GrammarBuilder().add("E", "E' a").add("E'", "b").add("T", "c");
		assertEquals("E''", builder.createNewNonTerminal("E'"));
		assertEquals("F", builder.createNewNonTerminal("F"));
		assertEquals("T'", builder.createNewNonTerminal("T"));
	}

	@Test
	public void testUndefinedNonTerminals(){
		GrammarBuilder builder = new GrammarBuilder().add("S", "A B").add("B", "b");
		assertEquals(Collections.singletonList("A"), builder.undefinedNonTerminals());
		assertTrue(builder.isUsed("A"));
		assertFalse(builder.hasProductions("A"));
		assertThrows(CFGException.class, builder::toGrammar);
	}

	@Test
	public void testInvalidGrammars(){
		assertThrows(CFGException.class, () -> new GrammarBuilder().toGrammar());
		assertThrows(CFGException.class, () -> new GrammarBuilder().add("S", "a").start("X").toGrammar());
		assertThrows(CFGException.class, () -> new GrammarBuilder().add("s", "a"));
	}
}
