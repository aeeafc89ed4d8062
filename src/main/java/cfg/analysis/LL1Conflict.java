package cfg.analysis;

import java.util.Collections;
import java.util.Set;

import static cfg.util.Utils.formatSet;

/**
 * A pair of alternatives of a non terminal that can't be distinguished with one lookahead terminal
 */
public class LL1Conflict {

	public enum Kind {
		FIRST_FIRST("FIRST/FIRST"),
		FIRST_FOLLOW("FIRST/FOLLOW");

		public final String description;

		Kind(String description){
			this.description = description;
		}

		@Override
		public String toString() {
			return description;
		}
	}

	public final Kind kind;

	public final String nonTerminal;

	/**
	 * 1-based indices of the conflicting alternatives, first &lt; second
	 */
	public final int firstAlternative;
	public final int secondAlternative;

	/**
	 * Lookahead terminals that are shared
	 */
	public final Set<String> terminals;

	public LL1Conflict(Kind kind, String nonTerminal, int firstAlternative, int secondAlternative,
	                   Set<String> terminals) {
		this.kind = kind;
		this.nonTerminal = nonTerminal;
		this.firstAlternative = firstAlternative;
		this.secondAlternative = secondAlternative;
		this.terminals = Collections.unmodifiableSet(terminals);
	}

	public String message(){
		String terms = formatSet(terminals);
		switch (kind){
			case FIRST_FIRST:
				return String.format("%s conflict in %s: alternatives %d and %d share %s", kind, nonTerminal,
						firstAlternative, secondAlternative, terms);
			case FIRST_FOLLOW:
			default:
				return String.format("%s conflict in %s: alternative %d FIRST intersects FOLLOW on %s", kind,
						nonTerminal, secondAlternative, terms);
		}
	}

	@Override
	public String toString() {
		return message();
	}
}
