package cfg.grammar;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import cfg.CFGException;
import cfg.GrammarMatcher;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarParserTest {

	private static ParseResult parse(String text){
		return new GrammarParser(true).parse(text);
	}

	private static GrammarError singleError(String text){
		ParseResult result = parse(text);
		assertFalse(result.isSuccess());
		assertNull(result.getGrammar());
		assertEquals(1, result.getErrors().size(), () -> "Errors: " + result.getErrors());
		return result.getErrors().get(0);
	}

	@Test
	public void testBasic(){
		GrammarMatcher.parse("E -> E + T | T\nT -> id")
				.start("E")
				.heads("E", "T")
				.terminals("+", "id")
				.alternatives("E", "E + T", "T")
				.alternatives("T", "id")
				.kinds("E", 1, Symbol.Kind.NON_TERMINAL, Symbol.Kind.TERMINAL, Symbol.Kind.NON_TERMINAL)
				.run();
	}

	@Test
	public void testUnicodeArrowCommentsAndBlankLines(){
		GrammarMatcher.parse("// statements\n\n  S → a B  \n\n// blocks\nB -> b\n")
				.heads("S", "B")
				.alternatives("S", "a B")
				.alternatives("B", "b")
				.run();
	}

	@Test
	public void testRepeatedHeadAppendsAlternatives(){
		GrammarMatcher.parse("S -> a\nA -> b\nS -> A")
				.heads("S", "A")
				.alternatives("S", "a", "A")
				.format("S -> a | A\nA -> b")
				.run();
	}

	@ParameterizedTest
	@ValueSource(strings = {"ε", "epsilon", "eps"})
	public void testEpsilonSpellings(String epsilon){
		Grammar grammar = parse("S -> a S | " + epsilon).getGrammarOrThrow();
		assertEquals(Epsilon.EPSILON, grammar.getAlternatives("S").get(1).get(0));
		assertEquals("S -> a S | ε", grammar.format());
	}

	@Test
	public void testNonTerminalNamesWithPrimesDigitsAndUnderscores(){
		GrammarMatcher.parse("E -> T E'\nE' -> + T E' | ε\nT -> T_1\nT_1 -> x2")
				.alternatives("E", "T E'")
				.kinds("E", 1, Symbol.Kind.NON_TERMINAL, Symbol.Kind.NON_TERMINAL)
				.alternatives("T", "T_1")
				.terminals("+", "x2")
				.run();
	}

	@Nested
	class CompactNotation {

		@Test
		public void testEmbeddedNonTerminal(){
			GrammarMatcher.parse("S -> aSb | ε")
					.alternatives("S", "a S b", "ε")
					.kinds("S", 1, Symbol.Kind.TERMINAL, Symbol.Kind.NON_TERMINAL, Symbol.Kind.TERMINAL)
					.run();
		}

		@Test
		public void testParentheses(){
			GrammarMatcher.parse("E -> (E) | id")
					.alternatives("E", "( E )", "id")
					.run();
		}

		@Test
		public void testMultiCharacterTerminalsStayWhole(){
			GrammarMatcher.parse("S -> other | id | if")
					.alternatives("S", "other", "id", "if")
					.terminals("other", "id", "if")
					.run();
		}

		@Test
		public void testNonTerminalSuffix(){
			assertEquals(Arrays.asList("A1'", "b", "B_", "c"), GrammarParser.tokenizeCompact("A1'bB_c"));
		}

		@Test
		public void testLowercaseEndsNonTerminal(){
			assertEquals(Arrays.asList("A", "b", "c"), GrammarParser.tokenizeCompact("Abc"));
		}

		@Test
		public void testDisabled(){
			Grammar grammar = new GrammarParser(false).parse("S -> aSb | c").getGrammarOrThrow();
			List<Symbol> first = grammar.getAlternatives("S").get(0);
			assertEquals(1, first.size());
			assertEquals(new Terminal("aSb"), first.get(0));
		}
	}

	@Nested
	class Errors {

		@Test
		public void testInvalidFormat(){
			GrammarError error = singleError("S -> a\n\nS a b");
			assertEquals(3, error.line());
			assertEquals(1, error.column());
			assertEquals("Invalid production format. Expected: NonTerminal -> Production1 | Production2",
					error.message);
		}

		@Test
		public void testLowercaseHead(){
			GrammarError error = singleError("s -> a");
			assertEquals(1, error.line());
			assertEquals("Non-terminal \"s\" must start with uppercase letter", error.message);
			assertEquals("Error at [1:1]: Non-terminal \"s\" must start with uppercase letter", error.toString());
		}

		@ParameterizedTest
		@ValueSource(strings = {"S -> a |", "S -> | a", "S -> a | | b"})
		public void testEmptyAlternative(String text){
			assertEquals("Empty alternative in production for S", singleError(text).message);
		}

		@Test
		public void testUndefinedNonTerminal(){
			GrammarError error = singleError("S -> A");
			assertEquals("Non-terminal \"A\" is used but never defined", error.message);
			assertEquals(Location.NONE, error.location);
		}

		@ParameterizedTest
		@ValueSource(strings = {"", "\n\n", "// only a comment"})
		public void testNoProductions(String text){
			assertEquals("No productions found", singleError(text).message);
		}

		@Test
		public void testErrorsAreCollected(){
			ParseResult result = parse("s -> a\nS -> a |\nfoo\nS -> B");
			assertEquals(4, result.getErrors().size(), () -> "Errors: " + result.getErrors());
			assertEquals(Arrays.asList(1, 2, 3, 0),
					Arrays.asList(result.getErrors().get(0).line(), result.getErrors().get(1).line(),
							result.getErrors().get(2).line(), result.getErrors().get(3).line()));
		}

		@Test
		public void testGetGrammarOrThrow(){
			CFGException exception = assertThrows(CFGException.class, () -> parse("S -> A").getGrammarOrThrow());
			assertTrue(exception.getMessage().contains("\"A\" is used but never defined"));
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {
			ExampleGrammars.EXPRESSION,
			ExampleGrammars.DANGLING_ELSE,
			ExampleGrammars.LEFT_RECURSIVE,
			ExampleGrammars.UNAMBIGUOUS,
			"E -> T E'\nE' -> + T E' | ε\nT -> id"
	})
	public void testFormatParsesToEqualGrammar(String text){
		Grammar grammar = parse(text).getGrammarOrThrow();
		assertEquals(grammar, parse(grammar.format()).getGrammarOrThrow());
	}
}
