package knoelab.normalization.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of parsing a whole text: whatever could be built, plus one 
 * {@link LineError} for every line that was rejected.
 * 
 * @param <T> the structure built from the text
 */
public class ParseStatus<T> {

	private final T result;
	private final List<LineError> errors;
	
	public ParseStatus(T result, List<LineError> errors) {
		this.result = result;
		this.errors = Collections.unmodifiableList(new ArrayList<LineError>(errors));
	}
	
	public T getResult() {
		return result;
	}
	
	public List<LineError> getErrors() {
		return errors;
	}
	
	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
