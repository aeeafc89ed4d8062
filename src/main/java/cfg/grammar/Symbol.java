package cfg.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for terminal symbols, non terminal symbols and epsilon.
 *
 * Two symbols are equal if they are of the same kind and have the same value.
 */
public abstract class Symbol implements Comparable<Symbol> {

	/**
	 * The three kinds of symbols that can appear in the right hand side of a production
	 */
	public enum Kind {
		TERMINAL,
		NON_TERMINAL,
		EPSILON
	}

	/**
	 * Accepted spellings of epsilon in grammar texts
	 */
	public static final Set<String> EPSILON_SPELLINGS =
			Collections.unmodifiableSet(new HashSet<>(Arrays.asList(Epsilon.VALUE, "epsilon", "eps")));

	/**
	 * Name of the non terminal or text of the terminal, "ε" for epsilon
	 */
	public final String value;

	Symbol(String value) {
		this.value = Objects.requireNonNull(value);
	}

	public abstract Kind kind();

	/**
	 * Creates the symbol for a single token: an epsilon spelling is epsilon, a valid non terminal
	 * name is a non terminal and everything else is a terminal.
	 */
	public static Symbol of(String token){
		if (EPSILON_SPELLINGS.contains(token)){
			return Epsilon.EPSILON;
		}
		if (NonTerminal.isValidName(token)){
			return new NonTerminal(token);
		}
		return new Terminal(token);
	}

	public boolean isEpsOrTerminal(){
		return kind() != Kind.NON_TERMINAL;
	}

	/**
	 * Is this the non terminal with the passed name?
	 */
	public boolean isNonTerminal(String name){
		return kind() == Kind.NON_TERMINAL && value.equals(name);
	}

	/**
	 * Is this a terminal with the passed text?
	 */
	public boolean isTerminal(String text){
		return kind() == Kind.TERMINAL && value.equals(text);
	}

	@Override
	public int hashCode() {
		return value.hashCode() * 31 + kind().hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Symbol && ((Symbol)obj).kind() == kind() && ((Symbol)obj).value.equals(value);
	}

	@Override
	public int compareTo(Symbol o) {
		if (kind() != o.kind()){
			return kind().compareTo(o.kind());
		}
		return value.compareTo(o.value);
	}

	@Override
	public String toString() {
		return value;
	}
}
