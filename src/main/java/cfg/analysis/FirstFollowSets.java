package cfg.analysis;

import java.util.*;
import java.util.logging.Logger;

import cfg.grammar.Grammar;
import cfg.grammar.Symbol;

/**
 * FIRST(1) and FOLLOW(1) sets of a grammar.
 *
 * The FIRST map contains an entry for every non terminal and every terminal (a terminal maps to
 * itself), {@link #EPSILON} marks that a non terminal can derive the empty word. The FOLLOW map
 * contains an entry for every non terminal, {@link #END_OF_INPUT} marks the end of the input and
 * is always in the FOLLOW set of the start non terminal. FOLLOW sets never contain epsilon.
 */
public class FirstFollowSets {

	private static final Logger LOG = Logger.getLogger(FirstFollowSets.class.getName());

	public static final String EPSILON = "ε";

	public static final String END_OF_INPUT = "$";

	private final Map<String, Set<String>> first;
	private final Map<String, Set<String>> follow;

	private FirstFollowSets(Map<String, Set<String>> first, Map<String, Set<String>> follow) {
		this.first = freeze(first);
		this.follow = freeze(follow);
	}

	private static Map<String, Set<String>> freeze(Map<String, Set<String>> map){
		Map<String, Set<String>> ret = new LinkedHashMap<>();
		for (Map.Entry<String, Set<String>> entry : map.entrySet()){
			ret.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return Collections.unmodifiableMap(ret);
	}

	public Map<String, Set<String>> getFirst(){
		return first;
	}

	public Map<String, Set<String>> getFollow(){
		return follow;
	}

	public Set<String> first(String symbol){
		return first.getOrDefault(symbol, Collections.emptySet());
	}

	public Set<String> follow(String nonTerminal){
		return follow.getOrDefault(nonTerminal, Collections.emptySet());
	}

	/**
	 * FIRST set of a sequence of symbols, contains epsilon if the whole sequence can derive the
	 * empty word (this includes the empty sequence).
	 */
	public Set<String> firstOf(List<Symbol> term){
		return firstOf(term, first);
	}

	/**
	 * Scans the term from left to right and stops at the first symbol that can't derive epsilon.
	 */
	private static Set<String> firstOf(List<Symbol> term, Map<String, Set<String>> first){
		Set<String> ret = new LinkedHashSet<>();
		for (Symbol symbol : term){
			switch (symbol.kind()){
				case EPSILON:
					continue;
				case TERMINAL:
					ret.add(symbol.value);
					return ret;
				case NON_TERMINAL:
					Set<String> symFirst = first.getOrDefault(symbol.value, Collections.emptySet());
					for (String f : symFirst){
						if (!f.equals(EPSILON)){
							ret.add(f);
						}
					}
					if (!symFirst.contains(EPSILON)){
						return ret;
					}
			}
		}
		ret.add(EPSILON);
		return ret;
	}

	/**
	 * Calculate the first and follow sets for all non terminals via fix point iterations.
	 *
	 * FIRST: for each production A → b, FIRST(b) is placed in FIRST(A).
	 *
	 * FOLLOW: first put $ (the end of input marker) in FOLLOW(S) (S is the start symbol).
	 * If there is a production A → aBb, (where a can be a whole string) then everything in FIRST(b)
	 * except for ε is placed in FOLLOW(B). If FIRST(b) contains ε (b can be empty), then everything in
	 * FOLLOW(A) is placed in FOLLOW(B).
	 */
	public static FirstFollowSets calculate(Grammar grammar){
		Map<String, Set<String>> first = new LinkedHashMap<>();
		Map<String, Set<String>> follow = new LinkedHashMap<>();
		for (String nonTerminal : grammar.getNonTerminals()){
			first.put(nonTerminal, new LinkedHashSet<>());
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		for (String terminal : grammar.getTerminals()){
			first.put(terminal, new LinkedHashSet<>(Collections.singleton(terminal)));
		}
		Map<String, List<List<Symbol>>> productions = grammar.getProductionMap();

		int firstIterations = 0;
		boolean firstChanged;
		do {
			firstChanged = false;
			firstIterations++;
			for (Map.Entry<String, List<List<Symbol>>> entry : productions.entrySet()){
				Set<String> headFirst = first.get(entry.getKey());
				for (List<Symbol> alternative : entry.getValue()){
					firstChanged = headFirst.addAll(firstOf(alternative, first)) || firstChanged;
				}
			}
		} while (firstChanged);

		follow.get(grammar.getStart()).add(END_OF_INPUT);
		int followIterations = 0;
		boolean followChanged;
		do {
			followChanged = false;
			followIterations++;
			for (Map.Entry<String, List<List<Symbol>>> entry : productions.entrySet()){
				Set<String> headFollow = follow.get(entry.getKey());
				for (List<Symbol> alternative : entry.getValue()){
					for (int i = 0; i < alternative.size(); i++){
						Symbol symbol = alternative.get(i);
						if (symbol.kind() != Symbol.Kind.NON_TERMINAL){
							continue;
						}
						Set<String> symFollow = follow.get(symbol.value);
						Set<String> restFirst = firstOf(alternative.subList(i + 1, alternative.size()), first);
						for (String f : restFirst){
							if (!f.equals(EPSILON)){
								followChanged = symFollow.add(f) || followChanged;
							}
						}
						if (restFirst.contains(EPSILON)){
							followChanged = symFollow.addAll(headFollow) || followChanged;
						}
					}
				}
			}
		} while (followChanged);

		int fi = firstIterations;
		int fo = followIterations;
		LOG.fine(() -> String.format("FIRST sets stable after %d, FOLLOW sets after %d iteration(s)", fi, fo));
		return new FirstFollowSets(first, follow);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (String nonTerminal : follow.keySet()){
			builder.append(String.format("%s: FIRST = %s, FOLLOW = %s%n", nonTerminal, first(nonTerminal),
					follow(nonTerminal)));
		}
		return builder.toString();
	}
}
