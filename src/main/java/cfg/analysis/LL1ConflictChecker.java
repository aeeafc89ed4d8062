package cfg.analysis;

import java.util.*;

import cfg.grammar.Grammar;
import cfg.grammar.Symbol;

import static cfg.util.Utils.intersection;

/**
 * Finds LL(1) conflicts: pairs of alternatives of the same non terminal whose FIRST sets overlap
 * (FIRST/FIRST) or where one alternative can derive ε and the FIRST set of the other overlaps the
 * FOLLOW set of the non terminal (FIRST/FOLLOW).
 *
 * Conflicts are ordered by non terminal (declaration order) and then by alternative pair.
 */
public class LL1ConflictChecker {

	public static List<LL1Conflict> check(Grammar grammar){
		return check(grammar, FirstFollowSets.calculate(grammar));
	}

	public static List<LL1Conflict> check(Grammar grammar, FirstFollowSets sets){
		List<LL1Conflict> conflicts = new ArrayList<>();
		for (String head : grammar.getHeads()){
			List<List<Symbol>> alternatives = grammar.getAlternatives(head);
			for (int i = 0; i < alternatives.size(); i++){
				for (int j = i + 1; j < alternatives.size(); j++){
					Set<String> firstI = sets.firstOf(alternatives.get(i));
					Set<String> firstJ = sets.firstOf(alternatives.get(j));
					Set<String> shared = intersection(firstI, firstJ);
					shared.remove(FirstFollowSets.EPSILON);
					if (!shared.isEmpty()){
						conflicts.add(new LL1Conflict(LL1Conflict.Kind.FIRST_FIRST, head, i + 1, j + 1, shared));
					}
					if (firstI.contains(FirstFollowSets.EPSILON)){
						Set<String> followShared = intersection(firstJ, sets.follow(head));
						if (!followShared.isEmpty()){
							conflicts.add(new LL1Conflict(LL1Conflict.Kind.FIRST_FOLLOW, head, i + 1, j + 1,
									followShared));
						}
					}
				}
			}
		}
		return conflicts;
	}

	public static boolean isLL1(Grammar grammar){
		return check(grammar).isEmpty();
	}
}
