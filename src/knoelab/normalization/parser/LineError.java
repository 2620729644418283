package knoelab.normalization.parser;

/**
 * A line (or axiom) that could not be turned into an axiom.
 */
public class LineError {

	private final int lineNumber;
	private final String line;
	private final String message;
	
	public LineError(int lineNumber, String line, String message) {
		this.lineNumber = lineNumber;
		this.line = line;
		this.message = message;
	}
	
	/**
	 * @return 1-based line number in the source text
	 */
	public int getLineNumber() {
		return lineNumber;
	}
	
	public String getLine() {
		return line;
	}
	
	public String getMessage() {
		return message;
	}
	
	@Override
	public String toString() {
		return "line " + lineNumber + ": " + message;
	}
}
