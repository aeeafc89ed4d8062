package cfg.grammar;

import java.util.*;

import static cfg.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions.
 *
 * A grammar is immutable, every transformation creates a new one.
 * Use the GrammarBuilder or the GrammarParser to create a grammar instance properly.
 *
 * @see GrammarBuilder GrammarBuilder
 * @see GrammarParser GrammarParser
 */
public class Grammar {

	/**
	 * Name of the start non terminal
	 */
	private final String start;

	/**
	 * Non terminals in the grammar (heads and used non terminals), in order of appearance
	 */
	private final Set<String> nonTerminals;

	/**
	 * Terminals used in the right hand sides, in order of appearance
	 */
	private final Set<String> terminals;

	/**
	 * Alternatives per non terminal, in declaration order of the non terminals
	 */
	private final Map<String, List<List<Symbol>>> productions;

	/**
	 * Non terminals that can derive the empty word
	 */
	private final Set<String> epsilonableNonTerminals;

	Grammar(String start, Set<String> nonTerminals, Set<String> terminals,
	        Map<String, List<List<Symbol>>> productions) {
		this.start = start;
		this.nonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(nonTerminals));
		this.terminals = Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
		Map<String, List<List<Symbol>>> prods = new LinkedHashMap<>();
		for (Map.Entry<String, List<List<Symbol>>> entry : productions.entrySet()){
			List<List<Symbol>> alternatives = new ArrayList<>();
			for (List<Symbol> alternative : entry.getValue()){
				alternatives.add(Collections.unmodifiableList(new ArrayList<>(alternative)));
			}
			prods.put(entry.getKey(), Collections.unmodifiableList(alternatives));
		}
		this.productions = Collections.unmodifiableMap(prods);
		this.epsilonableNonTerminals = calculateEpsilonable(this.productions);
	}

	public String getStart(){
		return start;
	}

	public Set<String> getNonTerminals(){
		return nonTerminals;
	}

	public Set<String> getTerminals(){
		return terminals;
	}

	/**
	 * Non terminals that have productions, in declaration order
	 */
	public Set<String> getHeads(){
		return productions.keySet();
	}

	public Map<String, List<List<Symbol>>> getProductionMap(){
		return productions;
	}

	public boolean hasProductions(String nonTerminal){
		return productions.containsKey(nonTerminal);
	}

	/**
	 * Right hand sides of the passed non terminal, empty if it has no productions
	 */
	public List<List<Symbol>> getAlternatives(String nonTerminal){
		return productions.getOrDefault(nonTerminal, Collections.emptyList());
	}

	public List<Production> getProductionsOf(String nonTerminal){
		List<Production> ret = new ArrayList<>();
		List<List<Symbol>> alternatives = getAlternatives(nonTerminal);
		for (int i = 0; i < alternatives.size(); i++){
			ret.add(new Production(nonTerminal, i + 1, alternatives.get(i)));
		}
		return ret;
	}

	/**
	 * All productions, grouped by non terminal in declaration order
	 */
	public List<Production> getProductions(){
		List<Production> ret = new ArrayList<>();
		for (String head : productions.keySet()){
			ret.addAll(getProductionsOf(head));
		}
		return ret;
	}

	/**
	 * Non terminals that can produce an epsilon.
	 */
	public Set<String> calculateEpsilonable(){
		return epsilonableNonTerminals;
	}

	private static Set<String> calculateEpsilonable(Map<String, List<List<Symbol>>> productions){
		Set<String> epsSet = new HashSet<>();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Map.Entry<String, List<List<Symbol>>> entry : productions.entrySet()){
				if (epsSet.contains(entry.getKey())){
					continue;
				}
				for (List<Symbol> alternative : entry.getValue()){
					if (isEpsilonable(alternative, epsSet)){
						somethingChanged = epsSet.add(entry.getKey()) || somethingChanged;
						break;
					}
				}
			}
		} while (somethingChanged);
		return Collections.unmodifiableSet(epsSet);
	}

	public boolean isEpsilonable(String nonTerminal){
		return calculateEpsilonable().contains(nonTerminal);
	}

	private static boolean isEpsilonable(List<Symbol> term, Set<String> epsSet){
		for (Symbol symbol : term){
			switch (symbol.kind()){
				case TERMINAL:
					return false;
				case NON_TERMINAL:
					if (!epsSet.contains(symbol.value)){
						return false;
					}
					break;
				case EPSILON:
					break;
			}
		}
		return true;
	}

	/**
	 * Serializes the grammar, the productions of the start non terminal come first, all other
	 * non terminals follow in declaration order. Each line has the form
	 * <code>Head -> alt | alt | ...</code>.
	 * <p>
	 * The output parses back to an equal grammar with compact notation turned off. With compact
	 * notation a single symbol alternative like <code>a+B</code> is split into several symbols.
	 */
	public String format(){
		List<String> lines = new ArrayList<>();
		if (productions.containsKey(start)){
			lines.add(formatProductions(start));
		}
		for (String head : productions.keySet()){
			if (!head.equals(start)){
				lines.add(formatProductions(head));
			}
		}
		return join(lines, "\n");
	}

	public String formatProductions(String head){
		List<String> alternatives = new ArrayList<>();
		for (List<Symbol> alternative : getAlternatives(head)){
			alternatives.add(Production.formatRightSide(alternative));
		}
		return head + " -> " + join(alternatives, " | ");
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(getProductions(), "\n");
	}

	/**
	 * Two grammars are equal if they have the same start symbol and the same productions in the
	 * same order.
	 */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Grammar)){
			return false;
		}
		Grammar other = (Grammar)obj;
		return start.equals(other.start)
				&& new ArrayList<>(productions.entrySet()).equals(new ArrayList<>(other.productions.entrySet()));
	}

	@Override
	public int hashCode() {
		return start.hashCode() ^ productions.hashCode();
	}

	@Override
	public String toString() {
		return format();
	}
}
