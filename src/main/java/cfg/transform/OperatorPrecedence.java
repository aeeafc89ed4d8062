package cfg.transform;

import java.util.*;
import java.util.logging.Logger;

import cfg.grammar.*;

import static cfg.util.Utils.makeArrayList;

/**
 * Restructures <code>E -> E op E</code> alternatives with operators of different precedence into
 * one non terminal per precedence level:
 *
 * <pre>
 * E -> E + E | E * E | ( E ) | id
 * </pre>
 * becomes
 * <pre>
 * E -> E + ET | ET
 * ET -> ET * EF | EF
 * EF -> ( EF ) | id
 * </pre>
 *
 * The multiplicative operators (*, /, %) bind stronger than all other operators, all operators are
 * left associative afterwards. A non terminal is only restructured if it has at least one operator
 * of each precedence level.
 */
public class OperatorPrecedence extends Transformation {

	private static final Logger LOG = Logger.getLogger(OperatorPrecedence.class.getName());

	public static final Set<String> HIGH_PRECEDENCE_OPERATORS =
			Collections.unmodifiableSet(new HashSet<>(Arrays.asList("*", "/", "%")));

	/**
	 * Used as the only factor if the non terminal has no alternative besides the operator ones
	 */
	public static final String DEFAULT_OPERAND = "id";

	public OperatorPrecedence() {
		super("Operator Precedence & Associativity",
				"Restructured grammar to enforce operator precedence and left associativity by introducing " +
						"new non-terminals for each precedence level.");
	}

	@Override
	public Result apply(Grammar grammar) {
		GrammarBuilder builder = GrammarBuilder.from(grammar);
		boolean changed = false;
		for (String head : grammar.getHeads()){
			List<List<Symbol>> highPrecedence = new ArrayList<>();
			List<List<Symbol>> lowPrecedence = new ArrayList<>();
			List<List<Symbol>> base = new ArrayList<>();
			for (List<Symbol> alternative : grammar.getAlternatives(head)){
				if (isOperatorAlternative(head, alternative)){
					if (HIGH_PRECEDENCE_OPERATORS.contains(alternative.get(1).value)){
						highPrecedence.add(alternative);
					} else {
						lowPrecedence.add(alternative);
					}
				} else {
					base.add(alternative);
				}
			}
			if (highPrecedence.size() + lowPrecedence.size() < 2 || highPrecedence.isEmpty() || lowPrecedence.isEmpty()){
				continue;
			}
			changed = true;
			NonTerminal self = new NonTerminal(head);
			NonTerminal term = new NonTerminal(builder.createNewNonTerminal(head + "T"));
			NonTerminal factor = new NonTerminal(builder.createNewNonTerminal(head + "F"));

			List<List<Symbol>> headAlternatives = new ArrayList<>();
			for (List<Symbol> alternative : lowPrecedence){
				headAlternatives.add(makeArrayList(self, alternative.get(1), term));
			}
			headAlternatives.add(makeArrayList(term));

			List<List<Symbol>> termAlternatives = new ArrayList<>();
			for (List<Symbol> alternative : highPrecedence){
				termAlternatives.add(makeArrayList(term, alternative.get(1), factor));
			}
			termAlternatives.add(makeArrayList(factor));

			List<List<Symbol>> factorAlternatives = new ArrayList<>();
			for (List<Symbol> alternative : base){
				List<Symbol> retargeted = new ArrayList<>();
				for (Symbol symbol : alternative){
					retargeted.add(symbol.equals(self) ? factor : symbol);
				}
				factorAlternatives.add(retargeted);
			}
			if (factorAlternatives.isEmpty()){
				factorAlternatives.add(makeArrayList(new Terminal(DEFAULT_OPERAND)));
			}

			builder.set(head, headAlternatives);
			builder.set(term.name(), termAlternatives);
			builder.set(factor.name(), factorAlternatives);
			LOG.fine(() -> String.format("Split %s into %s and %s", head, term, factor));
		}
		return changed ? new Result(builder.toGrammar(), true) : Result.unchanged(grammar);
	}

	/**
	 * Is the alternative of the form <code>head op head</code> with a terminal operator?
	 */
	static boolean isOperatorAlternative(String head, List<Symbol> alternative){
		return alternative.size() == 3 && alternative.get(0).isNonTerminal(head)
				&& alternative.get(1).kind() == Symbol.Kind.TERMINAL && alternative.get(2).isNonTerminal(head);
	}
}
