package knoelab.normalization.concept;

import java.util.Arrays;
import java.util.List;

/**
 * <code>(or (C1 C2 ... Cn))</code>
 */
public final class DisjunctionConcept extends NaryConcept {

	public DisjunctionConcept(List<? extends Concept> subconcepts) {
		super(subconcepts);
	}
	
	public DisjunctionConcept(Concept... subconcepts) {
		super(Arrays.asList(subconcepts));
	}
	
	@Override
	public ConceptType getConceptType() {
		return ConceptType.OR;
	}
	
	@Override
	public <T> T accept(ConceptVisitor<T> visitor) {
		return visitor.visit(this);
	}
}
