package cfg.analysis;

import java.util.*;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.BreadthFirstIterator;

import cfg.grammar.Grammar;

/**
 * Breadth first search over the non terminal references, starting at the start non terminal
 */
public class Reachability {

	/**
	 * Non terminals reachable from the start non terminal (including it), in visiting order
	 */
	public static Set<String> reachable(Grammar grammar){
		Graph<String, DefaultEdge> graph = NonTerminalGraph.references(grammar);
		Set<String> reached = new LinkedHashSet<>();
		BreadthFirstIterator<String, DefaultEdge> iterator = new BreadthFirstIterator<>(graph, grammar.getStart());
		while (iterator.hasNext()){
			reached.add(iterator.next());
		}
		return reached;
	}

	/**
	 * Non terminals that can't be reached from the start non terminal, in declaration order
	 */
	public static List<String> unreachable(Grammar grammar){
		Set<String> reached = reachable(grammar);
		List<String> ret = new ArrayList<>();
		for (String nonTerminal : grammar.getNonTerminals()){
			if (!reached.contains(nonTerminal)){
				ret.add(nonTerminal);
			}
		}
		return ret;
	}
}
