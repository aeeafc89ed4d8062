package cfg.analysis;

import java.util.*;

import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.graph.DefaultEdge;

import cfg.grammar.Grammar;
import cfg.grammar.Production;

/**
 * Queries for left recursive non terminals.
 */
public class LeftRecursion {

	/**
	 * Non terminals with a production that starts with the non terminal itself
	 */
	public static List<String> direct(Grammar grammar){
		List<String> ret = new ArrayList<>();
		for (String head : grammar.getHeads()){
			if (grammar.getProductionsOf(head).stream().anyMatch(Production::isLeftRecursive)){
				ret.add(head);
			}
		}
		return ret;
	}

	/**
	 * Groups of non terminals that derive each other in the leftmost position
	 * (A ⇒ B ... ⇒ A ...), each group has at least two members.
	 */
	public static List<Set<String>> indirect(Grammar grammar){
		Graph<String, DefaultEdge> graph = NonTerminalGraph.leftCorners(grammar);
		List<Set<String>> ret = new ArrayList<>();
		for (Set<String> component : new KosarajuStrongConnectivityInspector<>(graph).stronglyConnectedSets()){
			if (component.size() > 1){
				Set<String> ordered = new LinkedHashSet<>();
				for (String nonTerminal : grammar.getNonTerminals()){
					if (component.contains(nonTerminal)){
						ordered.add(nonTerminal);
					}
				}
				ret.add(ordered);
			}
		}
		return ret;
	}
}
