package cfg.tree;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import cfg.grammar.ExampleGrammars;
import cfg.grammar.Grammar;
import cfg.grammar.GrammarParser;

import static org.junit.jupiter.api.Assertions.*;

public class ParseTreeGeneratorTest {

	private static Grammar parse(String text){
		return new GrammarParser(true).parse(text).getGrammarOrThrow();
	}

	@Test
	public void testBalanced(){
		List<ParseTreeNode> trees = new ParseTreeGenerator(4, 2).generate(parse("S -> a S b | ε"));
		assertEquals(2, trees.size());
		assertEquals("S(a S(ε) b)", trees.get(0).toString());
		assertEquals("S(ε)", trees.get(1).toString());
		assertEquals(Arrays.asList("a", "b"), trees.get(0).leaves());
		assertTrue(trees.get(1).leaves().isEmpty());
		assertEquals(3, trees.get(0).depth());
		assertEquals(5, trees.get(0).size());
	}

	@Test
	public void testNodeIds(){
		List<ParseTreeNode> trees = new ParseTreeGenerator(4, 2).generate(parse("S -> a S b | ε"));
		assertEquals("node_0", trees.get(0).id);
		assertEquals(Arrays.asList("node_1", "node_2", "node_4"),
				Arrays.asList(trees.get(0).children.get(0).id, trees.get(0).children.get(1).id,
						trees.get(0).children.get(2).id));
		assertEquals("node_5", trees.get(1).id);
		List<ParseTreeNode> again = new ParseTreeGenerator(4, 2).generate(parse("S -> a S b | ε"));
		assertEquals("node_0", again.get(0).id);
	}

	@Test
	public void testShortestAlternative(){
		List<ParseTreeNode> trees = new ParseTreeGenerator(4, 2).generate(ExampleGrammars.get("Expression (Ambiguous)"));
		assertEquals(Arrays.asList("E(E(id) + E(id))", "E(E(id) * E(id))"),
				Arrays.asList(trees.get(0).toString(), trees.get(1).toString()));
	}

	@Test
	public void testDepthBound(){
		ParseTreeNode tree = new ParseTreeGenerator(2, 1).generate(parse("S -> a S")).get(0);
		assertEquals("S(a S(a S(a S)))", tree.toString());
		assertEquals(Arrays.asList("a", "a", "a", "S"), tree.leaves());
		assertEquals(4, tree.depth());
	}

	@Test
	public void testTreeCount(){
		assertEquals(1, new ParseTreeGenerator(4, 1).generate(ExampleGrammars.get("Dangling Else")).size());
		assertEquals(3, new ParseTreeGenerator(4, 5).generate(ExampleGrammars.get("Dangling Else")).size());
		assertTrue(new ParseTreeGenerator(4, 0).generate(ExampleGrammars.get("Dangling Else")).isEmpty());
	}

	@Test
	public void testTerminalFlag(){
		ParseTreeNode tree = new ParseTreeGenerator(4, 1).generate(parse("S -> a B\nB -> b")).get(0);
		assertFalse(tree.terminal);
		assertTrue(tree.children.get(0).terminal);
		assertFalse(tree.children.get(1).terminal);
		assertTrue(tree.children.get(1).children.get(0).terminal);
	}

	@Test
	public void testShortestPrefersFirstOnTies(){
		Grammar grammar = parse("S -> a b | c d | e");
		assertEquals(grammar.getAlternatives("S").get(2), ParseTreeGenerator.shortest(grammar.getAlternatives("S")));
		Grammar tie = parse("S -> a b | c d");
		assertSame(tie.getAlternatives("S").get(0), ParseTreeGenerator.shortest(tie.getAlternatives("S")));
	}
}
