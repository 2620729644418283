package knoelab.normalization.abox;

import knoelab.normalization.concept.Concept;
import knoelab.normalization.concept.Individual;
import knoelab.normalization.misc.Constants;

/**
 * <code>C[x]</code>: individual x is an instance of concept C.
 */
public class ConceptAxiom extends ABoxAxiom {

	private final Concept concept;
	private final Individual individual;
	
	public ConceptAxiom(Concept concept, Individual individual) {
		if(concept == null || individual == null)
			throw new IllegalArgumentException("Concept and individual are required");
		this.concept = concept;
		this.individual = individual;
	}
	
	public Concept getConcept() {
		return concept;
	}
	
	public Individual getIndividual() {
		return individual;
	}
	
	@Override
	public ABoxAxiomType getAxiomType() {
		return ABoxAxiomType.CONCEPT;
	}
	
	@Override
	public String toString() {
		return concept.getCanonicalForm() + Constants.ARGUMENTS_OPEN + 
				individual.getName() + Constants.ARGUMENTS_CLOSE;
	}
}
