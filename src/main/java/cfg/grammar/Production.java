package cfg.grammar;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A single alternative of a non terminal: a left and a right hand side.
 */
public class Production {

	/**
	 * Left hand side of the production (name of the non terminal)
	 */
	public final String left;

	/**
	 * 1-based index of this alternative in the list of alternatives of {@link #left}
	 */
	public final int alternative;

	/**
	 * Right hand side of the production
	 */
	public final List<Symbol> right;

	public Production(String left, int alternative, List<Symbol> right) {
		this.left = left;
		this.alternative = alternative;
		this.right = Collections.unmodifiableList(right);
	}

	public String formatRightSide(){
		return formatRightSide(right);
	}

	public static String formatRightSide(List<Symbol> right){
		return right.stream().map(s -> s.value).collect(Collectors.joining(" "));
	}

	/**
	 * Formats a single production as <code>left -> right</code>
	 */
	public static String format(String left, List<Symbol> right){
		return left + " -> " + formatRightSide(right);
	}

	/**
	 * Can this production only derive epsilon?
	 */
	public boolean isEpsilonProduction(){
		return right.stream().allMatch(s -> s.kind() == Symbol.Kind.EPSILON);
	}

	public boolean isLeftRecursive(){
		return !right.isEmpty() && right.get(0).isNonTerminal(left);
	}

	public boolean isRightRecursive(){
		return !right.isEmpty() && right.get(right.size() - 1).isNonTerminal(left);
	}

	@Override
	public String toString() {
		return format(left, right);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).left.equals(left)
				&& ((Production)obj).alternative == alternative && ((Production)obj).right.equals(right);
	}

	@Override
	public int hashCode() {
		return left.hashCode() ^ right.hashCode() ^ alternative;
	}
}
