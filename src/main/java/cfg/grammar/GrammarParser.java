package cfg.grammar;

import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import cfg.Config;

/**
 * Parses grammars written in the arrow notation, one non terminal per line:
 *
 * <pre>
 * // comment
 * E -> E + T | T
 * T → ( E ) | id
 * </pre>
 *
 * Tokens of an alternative are separated by whitespace. Tokens that are valid non terminal names
 * (uppercase first letter) are non terminals, "ε", "epsilon" and "eps" denote epsilon and all other
 * tokens are terminals.
 *
 * The compact notation allows to omit the whitespace in alternatives that embed a non terminal:
 * <code>aSb</code> is read as <code>a S b</code> and <code>(E)</code> as <code>( E )</code>.
 * A non terminal consists of an uppercase letter followed by digits, primes and underscores, every
 * other character is a terminal on its own.
 *
 * Errors are collected, a line with an error is skipped.
 */
public class GrammarParser {

	private static final Logger LOG = Logger.getLogger(GrammarParser.class.getName());

	private static final Pattern PRODUCTION = Pattern.compile("^([A-Z][A-Za-z0-9'_]*)\\s*(?:->|→)\\s*(.+)$");
	private static final Pattern ANY_PRODUCTION = Pattern.compile("^(\\S+?)\\s*(?:->|→)\\s*(.+)$");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final boolean compactNotation;

	public GrammarParser(boolean compactNotation) {
		this.compactNotation = compactNotation;
	}

	public GrammarParser() {
		this(Config.compactNotation());
	}

	/**
	 * Parses the passed grammar with the default settings
	 */
	public static ParseResult parseGrammar(String input){
		return new GrammarParser().parse(input);
	}

	public ParseResult parse(String input){
		List<GrammarError> errors = new ArrayList<>();
		GrammarBuilder builder = new GrammarBuilder();
		String[] lines = input.split("\n", -1);
		for (int i = 0; i < lines.length; i++){
			String line = lines[i].trim();
			int lineNumber = i + 1;
			if (line.isEmpty() || line.startsWith("//")){
				continue;
			}
			Matcher matcher = PRODUCTION.matcher(line);
			if (!matcher.matches()){
				matcher = ANY_PRODUCTION.matcher(line);
				if (!matcher.matches()){
					errors.add(new GrammarError(lineNumber, 1,
							"Invalid production format. Expected: NonTerminal -> Production1 | Production2"));
					continue;
				}
			}
			String head = matcher.group(1);
			if (!NonTerminal.isValidName(head)){
				errors.add(new GrammarError(lineNumber, 1,
						String.format("Non-terminal \"%s\" must start with uppercase letter", head)));
				continue;
			}
			List<List<Symbol>> alternatives = new ArrayList<>(builder.getAlternatives(head));
			for (String alternative : matcher.group(2).split("\\|", -1)){
				alternative = alternative.trim();
				if (alternative.isEmpty()){
					errors.add(new GrammarError(lineNumber, 1,
							String.format("Empty alternative in production for %s", head)));
					continue;
				}
				alternatives.add(parseAlternative(alternative));
			}
			builder.set(head, alternatives);
		}
		for (String undefined : builder.undefinedNonTerminals()){
			errors.add(new GrammarError(Location.NONE,
					String.format("Non-terminal \"%s\" is used but never defined", undefined)));
		}
		if (errors.isEmpty() && builder.isEmpty()){
			errors.add(new GrammarError(Location.NONE, "No productions found"));
		}
		if (!errors.isEmpty()){
			LOG.fine(() -> String.format("Grammar text contains %d error(s)", errors.size()));
			return ParseResult.failure(errors);
		}
		Grammar grammar = builder.toGrammar();
		LOG.fine(() -> String.format("Parsed grammar with %d non terminal(s) and %d production(s)",
				grammar.getHeads().size(), grammar.getProductions().size()));
		return ParseResult.success(grammar);
	}

	/**
	 * Splits a single (non empty, trimmed) alternative into symbols
	 */
	public List<Symbol> parseAlternative(String alternative){
		List<Symbol> symbols = new ArrayList<>();
		if (WHITESPACE.matcher(alternative).find() || !compactNotation || !embedsNonTerminal(alternative)){
			for (String token : WHITESPACE.split(alternative)){
				symbols.add(Symbol.of(token));
			}
			return symbols;
		}
		for (String token : tokenizeCompact(alternative)){
			symbols.add(Symbol.of(token));
		}
		return symbols;
	}

	/**
	 * Does the token contain a non terminal next to other characters?
	 */
	private static boolean embedsNonTerminal(String token){
		if (NonTerminal.isValidName(token) || Symbol.EPSILON_SPELLINGS.contains(token)){
			return false;
		}
		for (char c : token.toCharArray()){
			if (c >= 'A' && c <= 'Z'){
				return true;
			}
		}
		return false;
	}

	static List<String> tokenizeCompact(String input){
		List<String> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()){
			char c = input.charAt(i);
			if (c >= 'A' && c <= 'Z'){
				StringBuilder nonTerminal = new StringBuilder().append(c);
				i++;
				while (i < input.length() && isNonTerminalSuffix(input.charAt(i))){
					nonTerminal.append(input.charAt(i));
					i++;
				}
				tokens.add(nonTerminal.toString());
			} else {
				tokens.add(String.valueOf(c));
				i++;
			}
		}
		return tokens;
	}

	private static boolean isNonTerminalSuffix(char c){
		return (c >= '0' && c <= '9') || c == '\'' || c == '_';
	}
}
