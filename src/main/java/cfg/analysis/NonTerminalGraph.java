package cfg.analysis;

import java.util.List;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import cfg.grammar.Grammar;
import cfg.grammar.Symbol;

/**
 * Directed graphs over the non terminals of a grammar.
 */
public class NonTerminalGraph {

	/**
	 * Graph with an edge A → B for every occurrence of B in a right hand side of A
	 */
	public static Graph<String, DefaultEdge> references(Grammar grammar){
		Graph<String, DefaultEdge> graph = createGraph(grammar);
		for (String head : grammar.getHeads()){
			for (List<Symbol> alternative : grammar.getAlternatives(head)){
				for (Symbol symbol : alternative){
					if (symbol.kind() == Symbol.Kind.NON_TERMINAL){
						graph.addEdge(head, symbol.value);
					}
				}
			}
		}
		return graph;
	}

	/**
	 * Graph with an edge A → B if a right hand side of A starts with B, ignoring leading non terminals
	 * that can derive epsilon.
	 */
	public static Graph<String, DefaultEdge> leftCorners(Grammar grammar){
		Graph<String, DefaultEdge> graph = createGraph(grammar);
		for (String head : grammar.getHeads()){
			for (List<Symbol> alternative : grammar.getAlternatives(head)){
				for (Symbol symbol : alternative){
					if (symbol.kind() == Symbol.Kind.TERMINAL){
						break;
					}
					if (symbol.kind() == Symbol.Kind.NON_TERMINAL){
						graph.addEdge(head, symbol.value);
						if (!grammar.isEpsilonable(symbol.value)){
							break;
						}
					}
				}
			}
		}
		return graph;
	}

	private static Graph<String, DefaultEdge> createGraph(Grammar grammar){
		Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		for (String nonTerminal : grammar.getNonTerminals()){
			graph.addVertex(nonTerminal);
		}
		return graph;
	}
}
