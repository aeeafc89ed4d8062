package cfg.transform;

import java.util.*;
import java.util.logging.Logger;

import cfg.analysis.AmbiguityDetector;
import cfg.grammar.*;

import static cfg.util.Utils.makeArrayList;

/**
 * Resolves the dangling else by splitting statements into matched ones (every "if" has an "else")
 * and unmatched ones, binding each "else" to the nearest "if":
 *
 * <pre>
 * S -> if cond then S else S | if cond then S | other
 * </pre>
 * becomes
 * <pre>
 * S -> SM | SU
 * SM -> other | if cond then SM else SM
 * SU -> if cond then S | if cond then SM else SU
 * </pre>
 */
public class DanglingElseResolution extends Transformation {

	private static final Logger LOG = Logger.getLogger(DanglingElseResolution.class.getName());

	public DanglingElseResolution() {
		super("Dangling Else Resolution",
				"Resolved dangling else by separating matched and unmatched statement non-terminals.");
	}

	@Override
	public Result apply(Grammar grammar) {
		GrammarBuilder builder = GrammarBuilder.from(grammar);
		boolean changed = false;
		for (String head : grammar.getHeads()){
			List<List<Symbol>> alternatives = grammar.getAlternatives(head);
			if (!AmbiguityDetector.hasDanglingElse(alternatives)){
				continue;
			}
			changed = true;
			NonTerminal self = new NonTerminal(head);
			NonTerminal matched = new NonTerminal(builder.createNewNonTerminal(head + "M"));
			NonTerminal unmatched = new NonTerminal(builder.createNewNonTerminal(head + "U"));

			List<List<Symbol>> matchedAlternatives = new ArrayList<>();
			for (List<Symbol> alternative : alternatives){
				if (!AmbiguityDetector.containsTerminal(alternative, "if")){
					matchedAlternatives.add(alternative);
				}
			}
			matchedAlternatives.add(ifThenElse(matched, matched));

			List<List<Symbol>> unmatchedAlternatives = new ArrayList<>();
			unmatchedAlternatives.add(ifThen(self));
			unmatchedAlternatives.add(ifThenElse(matched, unmatched));

			List<List<Symbol>> headAlternatives = new ArrayList<>();
			headAlternatives.add(makeArrayList(matched));
			headAlternatives.add(makeArrayList(unmatched));

			builder.set(head, headAlternatives);
			builder.set(matched.name(), matchedAlternatives);
			builder.set(unmatched.name(), unmatchedAlternatives);
			LOG.fine(() -> String.format("Split %s into %s and %s", head, matched, unmatched));
		}
		return changed ? new Result(builder.toGrammar(), true) : Result.unchanged(grammar);
	}

	private static List<Symbol> ifThen(NonTerminal body){
		return makeArrayList(new Terminal("if"), new Terminal("cond"), new Terminal("then"), body);
	}

	private static List<Symbol> ifThenElse(NonTerminal thenBody, NonTerminal elseBody){
		List<Symbol> ret = ifThen(thenBody);
		ret.add(new Terminal("else"));
		ret.add(elseBody);
		return ret;
	}
}
