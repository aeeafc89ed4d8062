package cfg.tree;

import java.util.*;

import cfg.Config;
import cfg.grammar.Grammar;
import cfg.grammar.Symbol;

/**
 * Builds parse tree skeletons for display: one tree per alternative of the start non terminal.
 *
 * Every non terminal below the root is expanded with its shortest alternative (the first one on
 * ties) till the maximum depth is reached, deeper non terminals stay unexpanded. Recursive non
 * terminals are expanded again on every level, the depth is the only bound.
 *
 * This isn't a parser, the trees show the structure of the productions and not the derivation of
 * a specific input.
 */
public class ParseTreeGenerator {

	/**
	 * Node ids of a single generator call
	 */
	private static class IdGenerator {

		private int counter = 0;

		String next(){
			return "node_" + counter++;
		}
	}

	private final int maxDepth;
	private final int maxTrees;

	public ParseTreeGenerator(int maxDepth, int maxTrees) {
		this.maxDepth = maxDepth;
		this.maxTrees = maxTrees;
	}

	public ParseTreeGenerator() {
		this(Config.treeDepth(), Config.treeCount());
	}

	public static List<ParseTreeNode> generateParseTrees(Grammar grammar){
		return new ParseTreeGenerator().generate(grammar);
	}

	public List<ParseTreeNode> generate(Grammar grammar){
		IdGenerator ids = new IdGenerator();
		List<ParseTreeNode> trees = new ArrayList<>();
		for (List<Symbol> alternative : grammar.getAlternatives(grammar.getStart())){
			if (trees.size() >= maxTrees){
				break;
			}
			String id = ids.next();
			trees.add(new ParseTreeNode(id, grammar.getStart(), false, build(grammar, alternative, 0, ids)));
		}
		return trees;
	}

	private List<ParseTreeNode> build(Grammar grammar, List<Symbol> alternative, int depth, IdGenerator ids){
		List<ParseTreeNode> nodes = new ArrayList<>();
		for (Symbol symbol : alternative){
			String id = ids.next();
			switch (symbol.kind()){
				case TERMINAL:
				case EPSILON:
					nodes.add(new ParseTreeNode(id, symbol.value, true, Collections.emptyList()));
					break;
				case NON_TERMINAL:
					List<ParseTreeNode> children = Collections.emptyList();
					List<List<Symbol>> alternatives = grammar.getAlternatives(symbol.value);
					if (depth < maxDepth && !alternatives.isEmpty()){
						children = build(grammar, shortest(alternatives), depth + 1, ids);
					}
					nodes.add(new ParseTreeNode(id, symbol.value, false, children));
					break;
			}
		}
		return nodes;
	}

	static List<Symbol> shortest(List<List<Symbol>> alternatives){
		List<Symbol> ret = alternatives.get(0);
		for (List<Symbol> alternative : alternatives){
			if (alternative.size() < ret.size()){
				ret = alternative;
			}
		}
		return ret;
	}
}
