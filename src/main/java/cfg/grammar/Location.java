package cfg.grammar;

/**
 * Position in a grammar text, line 0 denotes an error that isn't related to a specific line
 */
public class Location {

	public static final Location NONE = new Location(0, 0);

	public final int line;
	public final int column;

	public Location(int line, int column){
		this.line = line;
		this.column = column;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Location && ((Location)obj).line == line && ((Location)obj).column == column;
	}

	@Override
	public int hashCode() {
		return line * 31 + column;
	}

	@Override
	public String toString() {
		return "[" + line + ":" + column + "]";
	}
}
