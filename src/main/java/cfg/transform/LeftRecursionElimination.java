package cfg.transform;

import java.util.*;
import java.util.logging.Logger;

import cfg.grammar.*;

import static cfg.util.Utils.makeArrayList;

/**
 * Eliminates direct left recursion:
 *
 * <pre>
 * A -> A a1 | ... | A an | b1 | ... | bm
 * </pre>
 * becomes
 * <pre>
 * A -> b1 A' | ... | bm A'
 * A' -> a1 A' | ... | an A' | ε
 * </pre>
 *
 * Alternatives of the form <code>A -> A</code> are dropped. Non terminals whose alternatives
 * are all left recursive are kept, they don't derive any terminal word.
 */
public class LeftRecursionElimination extends Transformation {

	private static final Logger LOG = Logger.getLogger(LeftRecursionElimination.class.getName());

	public LeftRecursionElimination() {
		super("Left Recursion Elimination",
				"Eliminated direct left recursion by introducing new non-terminals with right-recursive " +
						"epsilon productions.");
	}

	@Override
	public Result apply(Grammar grammar) {
		GrammarBuilder builder = GrammarBuilder.from(grammar);
		boolean changed = false;
		for (String head : grammar.getHeads()){
			List<List<Symbol>> tails = new ArrayList<>();
			List<List<Symbol>> others = new ArrayList<>();
			boolean cycles = false;
			for (Production production : grammar.getProductionsOf(head)){
				if (production.isLeftRecursive()){
					List<Symbol> tail = production.right.subList(1, production.right.size());
					if (tail.stream().allMatch(s -> s.kind() == Symbol.Kind.EPSILON)){
						// A -> A derives nothing new
						cycles = true;
					} else {
						tails.add(tail);
					}
				} else {
					others.add(production.right);
				}
			}
			if (others.isEmpty() || (tails.isEmpty() && !cycles)){
				continue;
			}
			changed = true;
			if (tails.isEmpty()){
				builder.set(head, others);
				LOG.fine(() -> String.format("Removed the cycles of %s", head));
				continue;
			}
			NonTerminal prime = new NonTerminal(builder.createNewNonTerminal(head + "'"));
			List<List<Symbol>> headAlternatives = new ArrayList<>();
			for (List<Symbol> other : others){
				headAlternatives.add(appendNonTerminal(other, prime));
			}
			List<List<Symbol>> primeAlternatives = new ArrayList<>();
			for (List<Symbol> tail : tails){
				primeAlternatives.add(appendNonTerminal(tail, prime));
			}
			primeAlternatives.add(makeArrayList(Epsilon.EPSILON));
			builder.set(head, headAlternatives);
			builder.set(prime.name(), primeAlternatives);
			LOG.fine(() -> String.format("Eliminated left recursion of %s via %s", head, prime));
		}
		return changed ? new Result(builder.toGrammar(), true) : Result.unchanged(grammar);
	}

	/**
	 * Appends the non terminal, epsilons are dropped as they don't contribute anything
	 */
	private static List<Symbol> appendNonTerminal(List<Symbol> term, NonTerminal nonTerminal){
		List<Symbol> ret = new ArrayList<>();
		for (Symbol symbol : term){
			if (symbol.kind() != Symbol.Kind.EPSILON){
				ret.add(symbol);
			}
		}
		ret.add(nonTerminal);
		return ret;
	}
}
