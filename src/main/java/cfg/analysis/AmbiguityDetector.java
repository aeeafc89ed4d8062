package cfg.analysis;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import cfg.analysis.AmbiguityReason.Severity;
import cfg.grammar.Grammar;
import cfg.grammar.Production;
import cfg.grammar.Symbol;

/**
 * Heuristic detection of ambiguity sources.
 *
 * Ambiguity of context free grammars is undecidable in general, therefore the detector only looks
 * for patterns that are commonly associated with ambiguous grammars. The checks run in a fixed
 * order, each appends its reasons.
 */
public class AmbiguityDetector {

	private static final Logger LOG = Logger.getLogger(AmbiguityDetector.class.getName());

	public static final String EXPRESSION_AMBIGUITY = "Expression Ambiguity";
	public static final String DANGLING_ELSE = "Dangling Else";
	public static final String PREFIX_CONFLICT = "Prefix Conflict";
	public static final String MIXED_RECURSION = "Mixed Recursion";
	public static final String LL1_CONFLICT = "LL(1) Conflict";

	/**
	 * A single structural check
	 */
	public interface Check {

		void check(Grammar grammar, List<AmbiguityReason> reasons);
	}

	/**
	 * <code>E -> E op E</code>: self recursive on both ends, allows left and right association
	 */
	public static class ExpressionCheck implements Check {

		@Override
		public void check(Grammar grammar, List<AmbiguityReason> reasons) {
			for (Production production : grammar.getProductions()){
				List<Symbol> right = production.right;
				if (right.size() >= 3 && production.isLeftRecursive() && production.isRightRecursive()){
					String ops = Production.formatRightSide(right.subList(1, right.size() - 1));
					String head = production.left;
					reasons.add(new AmbiguityReason(EXPRESSION_AMBIGUITY,
							String.format("Production \"%s -> %s %s %s\" is ambiguous because it allows both left " +
									"and right association. For input like \"a %s b %s c\", multiple parse trees exist.",
									head, head, ops, head, ops, ops),
							Collections.singletonList(production.toString()), Severity.HIGH));
				}
			}
		}
	}

	/**
	 * If-then-else and if-then alternatives of the same non terminal
	 */
	public static class DanglingElseCheck implements Check {

		@Override
		public void check(Grammar grammar, List<AmbiguityReason> reasons) {
			for (String head : grammar.getHeads()){
				if (hasDanglingElse(grammar.getAlternatives(head))){
					reasons.add(new AmbiguityReason(DANGLING_ELSE,
							String.format("Non-terminal \"%s\" has both if-then and if-then-else productions, " +
									"creating the classic dangling else ambiguity. Nested if statements can be parsed " +
									"in multiple ways.", head),
							formatAll(grammar, head), Severity.HIGH));
				}
			}
		}
	}

	/**
	 * Alternatives that share a common prefix
	 */
	public static class PrefixCheck implements Check {

		@Override
		public void check(Grammar grammar, List<AmbiguityReason> reasons) {
			for (String head : grammar.getHeads()){
				List<Production> productions = grammar.getProductionsOf(head);
				for (int i = 0; i < productions.size(); i++){
					for (int j = i + 1; j < productions.size(); j++){
						List<Symbol> first = productions.get(i).right;
						List<Symbol> second = productions.get(j).right;
						int prefixLength = commonPrefixLength(first, second);
						boolean identical = first.size() == second.size() && prefixLength == first.size();
						if (prefixLength > 0 && !identical){
							reasons.add(new AmbiguityReason(PREFIX_CONFLICT,
									String.format("Productions for \"%s\" share a common prefix of length %d. " +
											"This can cause parsing conflicts and may indicate ambiguity.",
											head, prefixLength),
									Arrays.asList(productions.get(i).toString(), productions.get(j).toString()),
									Severity.LOW));
						}
					}
				}
			}
		}
	}

	/**
	 * A left recursive and a (different) right recursive alternative of the same non terminal
	 */
	public static class MixedRecursionCheck implements Check {

		@Override
		public void check(Grammar grammar, List<AmbiguityReason> reasons) {
			for (String head : grammar.getHeads()){
				List<Production> productions = grammar.getProductionsOf(head);
				boolean leftOnly = productions.stream()
						.anyMatch(p -> p.right.size() >= 2 && p.isLeftRecursive() && !p.isRightRecursive());
				boolean rightOnly = productions.stream()
						.anyMatch(p -> p.right.size() >= 2 && p.isRightRecursive() && !p.isLeftRecursive());
				if (leftOnly && rightOnly){
					reasons.add(new AmbiguityReason(MIXED_RECURSION,
							String.format("Non-terminal \"%s\" has both left-recursive and right-recursive " +
									"productions, which can lead to ambiguity in certain derivations.", head),
							formatAll(grammar, head), Severity.MEDIUM));
				}
			}
		}
	}

	/**
	 * LL(1) conflicts, they don't imply ambiguity but often come with it
	 */
	public static class LL1Check implements Check {

		@Override
		public void check(Grammar grammar, List<AmbiguityReason> reasons) {
			for (LL1Conflict conflict : LL1ConflictChecker.check(grammar)){
				List<Production> productions = grammar.getProductionsOf(conflict.nonTerminal);
				reasons.add(new AmbiguityReason(LL1_CONFLICT, conflict.message(),
						Arrays.asList(productions.get(conflict.firstAlternative - 1).toString(),
								productions.get(conflict.secondAlternative - 1).toString()),
						Severity.MEDIUM));
			}
		}
	}

	public static final List<Check> DEFAULT_CHECKS = Collections.unmodifiableList(Arrays.asList(
			new ExpressionCheck(), new DanglingElseCheck(), new PrefixCheck(), new MixedRecursionCheck(),
			new LL1Check()));

	private final List<Check> checks;

	public AmbiguityDetector(List<Check> checks) {
		this.checks = checks;
	}

	public AmbiguityDetector() {
		this(DEFAULT_CHECKS);
	}

	public static AmbiguityResult detectAmbiguity(Grammar grammar){
		return new AmbiguityDetector().detect(grammar);
	}

	public AmbiguityResult detect(Grammar grammar){
		List<AmbiguityReason> reasons = new ArrayList<>();
		for (Check check : checks){
			check.check(grammar, reasons);
		}
		AmbiguityResult result = new AmbiguityResult(reasons);
		LOG.fine(() -> String.format("%d reason(s) found, status %s", reasons.size(), result.status));
		return result;
	}

	/**
	 * Has one alternative an "if" and an "else" terminal and another one an "if" without "else"?
	 */
	public static boolean hasDanglingElse(List<List<Symbol>> alternatives){
		boolean ifThenElse = alternatives.stream().anyMatch(a -> containsTerminal(a, "if") && containsTerminal(a, "else"));
		boolean ifThen = alternatives.stream().anyMatch(a -> containsTerminal(a, "if") && !containsTerminal(a, "else"));
		return ifThenElse && ifThen;
	}

	public static boolean containsTerminal(List<Symbol> alternative, String text){
		return alternative.stream().anyMatch(s -> s.isTerminal(text));
	}

	/**
	 * Number of leading symbols that are equal in both terms
	 */
	public static int commonPrefixLength(List<Symbol> first, List<Symbol> second){
		int length = 0;
		while (length < first.size() && length < second.size() && first.get(length).equals(second.get(length))){
			length++;
		}
		return length;
	}

	private static List<String> formatAll(Grammar grammar, String head){
		return grammar.getProductionsOf(head).stream().map(Production::toString).collect(Collectors.toList());
	}
}
