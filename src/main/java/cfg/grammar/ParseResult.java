package cfg.grammar;

import java.util.Collections;
import java.util.List;

import cfg.CFGException;

import static cfg.util.Utils.join;

/**
 * Result of parsing a grammar text: either a valid grammar without errors or a non empty list
 * of errors without a grammar.
 */
public class ParseResult {

	private final Grammar grammar;
	private final List<GrammarError> errors;

	private ParseResult(Grammar grammar, List<GrammarError> errors) {
		this.grammar = grammar;
		this.errors = Collections.unmodifiableList(errors);
	}

	static ParseResult success(Grammar grammar){
		return new ParseResult(grammar, Collections.emptyList());
	}

	static ParseResult failure(List<GrammarError> errors){
		if (errors.isEmpty()){
			throw new CFGException("A failed parse needs at least one error");
		}
		return new ParseResult(null, errors);
	}

	public boolean isSuccess(){
		return grammar != null;
	}

	/**
	 * @return null if the text contained errors
	 */
	public Grammar getGrammar(){
		return grammar;
	}

	public List<GrammarError> getErrors(){
		return errors;
	}

	/**
	 * @throws CFGException containing all error messages if the text contained errors
	 */
	public Grammar getGrammarOrThrow(){
		if (grammar == null){
			throw new CFGException("Invalid grammar:\n" + join(errors, "\n"));
		}
		return grammar;
	}
}
