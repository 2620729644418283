package knoelab.normalization.concept;

/**
 * Existential restriction, <code>(some r C)</code>.
 */
public final class SomeConcept extends RestrictionConcept {

	public SomeConcept(Relation relation, Concept subconcept) {
		super(relation, subconcept);
	}
	
	@Override
	public ConceptType getConceptType() {
		return ConceptType.SOME;
	}
	
	@Override
	public <T> T accept(ConceptVisitor<T> visitor) {
		return visitor.visit(this);
	}
}
