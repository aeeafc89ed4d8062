package cfg.grammar;

import java.util.*;

import cfg.CFGException;

/**
 * Allows the simple creation of grammars.
 *
 * The first non terminal that gets productions is the start non terminal, unless another one is
 * set explicitly. Replacing the productions of a non terminal keeps its position in the
 * declaration order, new non terminals are appended.
 */
public class GrammarBuilder {

	private String start;
	private final Map<String, List<List<Symbol>>> productions = new LinkedHashMap<>();

	public GrammarBuilder() {
	}

	/**
	 * Creates a builder that contains the start symbol and the productions of the passed grammar.
	 */
	public static GrammarBuilder from(Grammar grammar){
		GrammarBuilder builder = new GrammarBuilder();
		builder.start = grammar.getStart();
		for (Map.Entry<String, List<List<Symbol>>> entry : grammar.getProductionMap().entrySet()){
			builder.set(entry.getKey(), entry.getValue());
		}
		return builder;
	}

	public GrammarBuilder start(String start){
		this.start = start;
		return this;
	}

	/**
	 * Adds a new production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, List<Symbol> right){
		checkName(left);
		if (start == null){
			start = left;
		}
		productions.computeIfAbsent(left, k -> new ArrayList<>()).add(new ArrayList<>(right));
		return this;
	}

	public GrammarBuilder add(String left, Symbol... right){
		return add(left, Arrays.asList(right));
	}

	/**
	 * Adds a new production with a whitespace separated right hand side, every token is converted
	 * with {@link Symbol#of(String)}.
	 */
	public GrammarBuilder add(String left, String right){
		List<Symbol> symbols = new ArrayList<>();
		for (String token : right.trim().split("\\s+")){
			if (!token.isEmpty()){
				symbols.add(Symbol.of(token));
			}
		}
		if (symbols.isEmpty()){
			symbols.add(Epsilon.EPSILON);
		}
		return add(left, symbols);
	}

	/**
	 * Replaces all productions of the passed non terminal.
	 */
	public GrammarBuilder set(String left, List<List<Symbol>> alternatives){
		checkName(left);
		if (start == null){
			start = left;
		}
		List<List<Symbol>> copy = new ArrayList<>();
		for (List<Symbol> alternative : alternatives){
			copy.add(new ArrayList<>(alternative));
		}
		productions.put(left, copy);
		return this;
	}

	public List<List<Symbol>> getAlternatives(String left){
		return Collections.unmodifiableList(productions.getOrDefault(left, Collections.emptyList()));
	}

	public boolean isEmpty(){
		return productions.isEmpty();
	}

	public boolean hasProductions(String left){
		return productions.containsKey(left);
	}

	/**
	 * Is the passed name used as a head or anywhere on a right hand side?
	 */
	public boolean isUsed(String name){
		return productions.containsKey(name) || usedNonTerminals().contains(name);
	}

	/**
	 * Creates a new non terminal name based on the passed one, appending primes till the name is
	 * unused in the current productions.
	 *
	 * @param name preferred name of the new non terminal
	 * @return unused name
	 */
	public String createNewNonTerminal(String name){
		String ret = name;
		while (isUsed(ret)){
			ret += "'";
		}
		return ret;
	}

	/**
	 * Non terminals used in right hand sides that don't have any productions
	 */
	public List<String> undefinedNonTerminals(){
		List<String> ret = new ArrayList<>();
		for (String nonTerminal : usedNonTerminals()){
			if (!productions.containsKey(nonTerminal)){
				ret.add(nonTerminal);
			}
		}
		return ret;
	}

	private Set<String> usedNonTerminals(){
		Set<String> used = new LinkedHashSet<>();
		for (List<List<Symbol>> alternatives : productions.values()){
			for (List<Symbol> alternative : alternatives){
				for (Symbol symbol : alternative){
					if (symbol.kind() == Symbol.Kind.NON_TERMINAL){
						used.add(symbol.value);
					}
				}
			}
		}
		return used;
	}

	private void checkName(String left){
		if (!NonTerminal.isValidName(left)){
			throw new CFGException(String.format("\"%s\" isn't a valid non terminal name", left));
		}
	}

	/**
	 * Creates the grammar.
	 *
	 * @throws CFGException if there are no productions, if the start non terminal has no productions
	 *                      or if a used non terminal isn't defined
	 */
	public Grammar toGrammar(){
		if (productions.isEmpty()){
			throw new CFGException("Grammar without productions");
		}
		if (!productions.containsKey(start)){
			throw new CFGException(String.format("Start non terminal %s has no productions", start));
		}
		List<String> undefined = undefinedNonTerminals();
		if (!undefined.isEmpty()){
			throw new CFGException(String.format("Non terminals %s are used but never defined", undefined));
		}
		Set<String> nonTerminals = new LinkedHashSet<>(productions.keySet());
		nonTerminals.addAll(usedNonTerminals());
		Set<String> terminals = new LinkedHashSet<>();
		for (List<List<Symbol>> alternatives : productions.values()){
			for (List<Symbol> alternative : alternatives){
				for (Symbol symbol : alternative){
					if (symbol.kind() == Symbol.Kind.TERMINAL){
						terminals.add(symbol.value);
					}
				}
			}
		}
		return new Grammar(start, nonTerminals, terminals, productions);
	}
}
