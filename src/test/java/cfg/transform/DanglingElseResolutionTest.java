package cfg.transform;

import org.junit.jupiter.api.Test;

import cfg.GrammarMatcher;
import cfg.grammar.ExampleGrammars;
import cfg.grammar.Grammar;
import cfg.grammar.GrammarParser;

import static org.junit.jupiter.api.Assertions.*;

public class DanglingElseResolutionTest {

	@Test
	public void testExample(){
		Transformation.Result result = new DanglingElseResolution().apply(ExampleGrammars.get("Dangling Else"));
		assertTrue(result.changed);
		new GrammarMatcher(result.grammar)
				.format("S -> SM | SU\n" +
						"SM -> other | if cond then SM else SM\n" +
						"SU -> if cond then S | if cond then SM else SU")
				.run();
	}

	@Test
	public void testSeveralBaseStatements(){
		Grammar grammar = new GrammarParser(true)
				.parse("S -> if cond then S | if cond then S else S | a | b").getGrammarOrThrow();
		new GrammarMatcher(new DanglingElseResolution().apply(grammar).grammar)
				.alternatives("SM", "a", "b", "if cond then SM else SM")
				.run();
	}

	@Test
	public void testWithoutIfThen(){
		Grammar grammar = new GrammarParser(true).parse("S -> if cond then S else S | other").getGrammarOrThrow();
		assertFalse(new DanglingElseResolution().apply(grammar).changed);
	}
}
