package knoelab.normalization.tbox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import knoelab.normalization.concept.Concept;

/**
 * Thrown when definitions refer to each other cyclically, e.g. 
 * <code>A == (and (B C))</code> and <code>B == A</code>. Expanding such 
 * definitions by substitution would never reach a fixpoint.
 */
public class DefinitionCycleException extends Exception {

	private static final long serialVersionUID = 1L;
	
	private final List<Concept> definedConcepts;
	
	public DefinitionCycleException(List<Concept> definedConcepts) {
		super("Cyclic definitions involving " + definedConcepts);
		this.definedConcepts = Collections.unmodifiableList(
				new ArrayList<Concept>(definedConcepts));
	}
	
	/**
	 * @return left-hand sides of the definitions found on the cycle
	 */
	public List<Concept> getDefinedConcepts() {
		return definedConcepts;
	}
}
