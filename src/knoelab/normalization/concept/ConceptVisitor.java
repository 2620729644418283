package knoelab.normalization.concept;

/**
 * Dispatch over the variants of {@link Concept}. Every operation that
 * depends on the kind of concept is written as one of these.
 * 
 * @param <T> result type of the visit
 */
public interface ConceptVisitor<T> {

	public T visit(AtomicConcept concept);
	
	public T visit(NotConcept concept);
	
	public T visit(ConjunctionConcept concept);
	
	public T visit(DisjunctionConcept concept);
	
	public T visit(OnlyConcept concept);
	
	public T visit(SomeConcept concept);
}
