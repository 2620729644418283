package knoelab.normalization.concept;

final class SubtermFinder implements ConceptVisitor<Boolean> {

	private final String subtermKey;
	
	SubtermFinder(Concept subterm) {
		if(subterm == null)
			throw new IllegalArgumentException("Subterm cannot be null");
		subtermKey = subterm.getCanonicalForm();
	}
	
	private boolean matches(Concept concept) {
		return subtermKey.equals(concept.getCanonicalForm());
	}
	
	public Boolean visit(AtomicConcept concept) {
		return matches(concept);
	}
	
	public Boolean visit(NotConcept concept) {
		return matches(concept) || concept.getSubconcept().accept(this);
	}
	
	public Boolean visit(ConjunctionConcept concept) {
		return matches(concept) || anyContains(concept);
	}
	
	public Boolean visit(DisjunctionConcept concept) {
		return matches(concept) || anyContains(concept);
	}
	
	public Boolean visit(OnlyConcept concept) {
		return matches(concept) || concept.getSubconcept().accept(this);
	}
	
	public Boolean visit(SomeConcept concept) {
		return matches(concept) || concept.getSubconcept().accept(this);
	}
	
	private boolean anyContains(NaryConcept concept) {
		for(Concept c : concept.getSubconcepts()) {
			if(c.accept(this))
				return true;
		}
		return false;
	}
}
