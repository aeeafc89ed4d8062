package cfg.tree;

import java.util.*;

import cfg.Config;
import cfg.grammar.Grammar;
import cfg.grammar.Symbol;

import static cfg.util.Utils.join;

/**
 * A generator of example sentences that are valid for a given grammar.
 *
 * The generator expands the leftmost non terminal depth first, alternatives in declaration
 * order. Partial sentences with more than the maximum number of terminals are dropped, as are
 * expansions deeper than twice the maximum length. The empty sentence isn't reported.
 */
public class SampleGenerator {

	private final int maxLength;
	private final int maxSamples;

	public SampleGenerator(int maxLength, int maxSamples) {
		this.maxLength = maxLength;
		this.maxSamples = maxSamples;
	}

	public SampleGenerator() {
		this(Config.sampleLength(), Config.sampleCount());
	}

	public static List<String> generateSampleStrings(Grammar grammar){
		return new SampleGenerator().generate(grammar);
	}

	/**
	 * @return distinct sentences, tokens separated by a single space
	 */
	public List<String> generate(Grammar grammar){
		Set<String> samples = new LinkedHashSet<>();
		for (List<Symbol> alternative : grammar.getAlternatives(grammar.getStart())){
			if (samples.size() >= maxSamples){
				break;
			}
			expand(grammar, alternative, Collections.emptyList(), 0, samples);
		}
		return new ArrayList<>(samples);
	}

	/**
	 * @param pending symbols that still have to be derived
	 * @param prefix terminals that are already derived
	 */
	private void expand(Grammar grammar, List<Symbol> pending, List<String> prefix, int depth, Set<String> samples){
		if (samples.size() >= maxSamples || depth > maxLength * 2){
			return;
		}
		List<String> terminals = new ArrayList<>(prefix);
		int i = 0;
		for (; i < pending.size() && pending.get(i).isEpsOrTerminal(); i++){
			if (pending.get(i).kind() == Symbol.Kind.TERMINAL){
				terminals.add(pending.get(i).value);
			}
		}
		if (terminals.size() + countTerminals(pending.subList(i, pending.size())) > maxLength){
			return;
		}
		if (i == pending.size()){
			if (!terminals.isEmpty()){
				samples.add(join(terminals, " "));
			}
			return;
		}
		List<Symbol> rest = pending.subList(i + 1, pending.size());
		for (List<Symbol> alternative : grammar.getAlternatives(pending.get(i).value)){
			if (samples.size() >= maxSamples){
				break;
			}
			List<Symbol> next = new ArrayList<>(alternative);
			next.addAll(rest);
			expand(grammar, next, terminals, depth + 1, samples);
		}
	}

	private static int countTerminals(List<Symbol> term){
		int count = 0;
		for (Symbol symbol : term){
			if (symbol.kind() == Symbol.Kind.TERMINAL){
				count++;
			}
		}
		return count;
	}
}
