package cfg.grammar;

/**
 * An error found while parsing a grammar text
 */
public class GrammarError {

	public final Location location;
	public final String message;

	public GrammarError(Location location, String message) {
		this.location = location;
		this.message = message;
	}

	public GrammarError(int line, int column, String message) {
		this(new Location(line, column), message);
	}

	public int line(){
		return location.line;
	}

	public int column(){
		return location.column;
	}

	@Override
	public String toString() {
		if (location.line == 0){
			return message;
		}
		return String.format("Error at %s: %s", location, message);
	}
}
