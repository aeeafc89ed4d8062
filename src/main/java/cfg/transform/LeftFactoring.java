package cfg.transform;

import java.util.*;
import java.util.logging.Logger;

import cfg.grammar.*;

import static cfg.analysis.AmbiguityDetector.commonPrefixLength;
import static cfg.util.Utils.append;
import static cfg.util.Utils.makeArrayList;

/**
 * Factors out common prefixes of alternatives that start with the same symbol:
 *
 * <pre>
 * S -> i E t S | i E t S e S | a
 * </pre>
 * becomes
 * <pre>
 * S -> i E t S S1 | a
 * S1 -> ε | e S
 * </pre>
 *
 * The new non terminals are numbered per application, starting with 1.
 */
public class LeftFactoring extends Transformation {

	private static final Logger LOG = Logger.getLogger(LeftFactoring.class.getName());

	public LeftFactoring() {
		super("Left Factoring",
				"Factored common prefixes into shared non-terminals to eliminate prefix conflicts.");
	}

	@Override
	public Result apply(Grammar grammar) {
		GrammarBuilder builder = GrammarBuilder.from(grammar);
		boolean changed = false;
		int counter = 1;
		for (String head : grammar.getHeads()){
			List<List<Symbol>> alternatives = grammar.getAlternatives(head);
			if (alternatives.size() < 2){
				continue;
			}
			Map<Symbol, List<List<Symbol>>> groups = new LinkedHashMap<>();
			for (List<Symbol> alternative : alternatives){
				Symbol first = alternative.isEmpty() ? Epsilon.EPSILON : alternative.get(0);
				groups.computeIfAbsent(first, s -> new ArrayList<>()).add(alternative);
			}
			if (groups.values().stream().noneMatch(g -> g.size() > 1)){
				continue;
			}
			changed = true;
			List<List<Symbol>> headAlternatives = new ArrayList<>();
			for (List<List<Symbol>> group : groups.values()){
				if (group.size() == 1){
					headAlternatives.add(group.get(0));
					continue;
				}
				int prefixLength = group.get(0).size();
				for (List<Symbol> alternative : group){
					prefixLength = Math.min(prefixLength, commonPrefixLength(group.get(0), alternative));
				}
				String name = head + counter++;
				while (builder.isUsed(name)){
					name = head + counter++;
				}
				NonTerminal factored = new NonTerminal(name);
				headAlternatives.add(append(group.get(0).subList(0, prefixLength), factored));
				List<List<Symbol>> suffixes = new ArrayList<>();
				for (List<Symbol> alternative : group){
					List<Symbol> suffix = alternative.subList(prefixLength, alternative.size());
					suffixes.add(suffix.isEmpty() ? makeArrayList(Epsilon.EPSILON) : new ArrayList<>(suffix));
				}
				builder.set(name, suffixes);
				int length = prefixLength;
				LOG.fine(() -> String.format("Factored prefix of length %d of %s into %s", length, head, factored));
			}
			builder.set(head, headAlternatives);
		}
		return changed ? new Result(builder.toGrammar(), true) : Result.unchanged(grammar);
	}
}
