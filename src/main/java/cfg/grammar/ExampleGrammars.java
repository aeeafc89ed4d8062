package cfg.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import cfg.CFGException;

/**
 * Small reference grammars that show the typical ambiguity patterns
 */
public class ExampleGrammars {

	public static final String EXPRESSION = "E -> E + E | E * E | ( E ) | id";

	public static final String DANGLING_ELSE = "S -> if cond then S else S | if cond then S | other";

	public static final String LEFT_RECURSIVE = "E -> E + T | T\nT -> T * F | F\nF -> ( E ) | id";

	public static final String UNAMBIGUOUS = "S -> a S b | ε";

	public static final Map<String, String> EXAMPLES;

	static {
		Map<String, String> examples = new LinkedHashMap<>();
		examples.put("Expression (Ambiguous)", EXPRESSION);
		examples.put("Dangling Else", DANGLING_ELSE);
		examples.put("Left Recursive", LEFT_RECURSIVE);
		examples.put("Simple Unambiguous", UNAMBIGUOUS);
		EXAMPLES = Collections.unmodifiableMap(examples);
	}

	public static Grammar get(String name){
		if (!EXAMPLES.containsKey(name)){
			throw new CFGException(String.format("Unknown example grammar \"%s\"", name));
		}
		return GrammarParser.parseGrammar(EXAMPLES.get(name)).getGrammarOrThrow();
	}
}
