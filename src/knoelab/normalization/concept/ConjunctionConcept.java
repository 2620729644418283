package knoelab.normalization.concept;

import java.util.Arrays;
import java.util.List;

/**
 * <code>(and (C1 C2 ... Cn))</code>
 */
public final class ConjunctionConcept extends NaryConcept {

	public ConjunctionConcept(List<? extends Concept> subconcepts) {
		super(subconcepts);
	}
	
	public ConjunctionConcept(Concept... subconcepts) {
		super(Arrays.asList(subconcepts));
	}
	
	@Override
	public ConceptType getConceptType() {
		return ConceptType.AND;
	}
	
	@Override
	public <T> T accept(ConceptVisitor<T> visitor) {
		return visitor.visit(this);
	}
}
