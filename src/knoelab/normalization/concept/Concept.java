package knoelab.normalization.concept;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A DL concept expression. The set of variants is closed: only the
 * six subclasses of this package exist (atomic, not, and, or, only, some).
 * Concepts are immutable; rewriting always builds new trees.
 * <p>
 * Two concepts are equal iff their canonical forms are equal. This is
 * structural equality, <code>(and (A B))</code> and <code>(and (B A))</code> 
 * are different concepts.
 * </p>
 */
public abstract class Concept {

	private String canonicalForm;
	
	Concept() {
		// only subclasses in this package
	}
	
	public abstract ConceptType getConceptType();
	
	public abstract <T> T accept(ConceptVisitor<T> visitor);
	
	/**
	 * Renders this concept in the syntax accepted by the concept parser.
	 * The rendering is a deterministic function of the structure and is the
	 * key used for equality, hashing and substitution matching.
	 */
	protected abstract String render();
	
	public final String getCanonicalForm() {
		if(canonicalForm == null)
			canonicalForm = render();
		return canonicalForm;
	}
	
	/**
	 * Wraps this concept in a negation. No simplification is done here,
	 * see {@link #convertToNNF()}.
	 */
	public Concept negate() {
		return new NotConcept(this);
	}
	
	/**
	 * @return an equivalent concept in which negation is applied 
	 * to atomic concepts only
	 */
	public Concept convertToNNF() {
		return accept(NNFConverter.INSTANCE);
	}
	
	public boolean isNNF() {
		return accept(NNFChecker.INSTANCE);
	}
	
	/**
	 * Replaces every subtree structurally equal to <code>oldConcept</code>
	 * with <code>newConcept</code>, at every depth.
	 * 
	 * @return a new tree; this one is left untouched
	 */
	public Concept replaceConcept(Concept oldConcept, Concept newConcept) {
		return accept(new ConceptReplacer(oldConcept, newConcept));
	}
	
	/**
	 * @return true if <code>subterm</code> occurs in this concept 
	 * (this concept included) as a structural subterm
	 */
	public boolean contains(Concept subterm) {
		return accept(new SubtermFinder(subterm));
	}
	
	public Set<AtomicConcept> getAtomicConcepts() {
		Set<AtomicConcept> atomicConcepts = new LinkedHashSet<AtomicConcept>();
		collectSignature(atomicConcepts, new LinkedHashSet<Relation>());
		return atomicConcepts;
	}
	
	public Set<Relation> getRelations() {
		Set<Relation> relations = new LinkedHashSet<Relation>();
		collectSignature(new LinkedHashSet<AtomicConcept>(), relations);
		return relations;
	}
	
	abstract void collectSignature(Set<AtomicConcept> atomicConcepts, 
			Set<Relation> relations);
	
	@Override
	public boolean equals(Object obj) {
		if(this == obj)
			return true;
		if(!(obj instanceof Concept))
			return false;
		return getCanonicalForm().equals(((Concept) obj).getCanonicalForm());
	}
	
	@Override
	public int hashCode() {
		return getCanonicalForm().hashCode();
	}
	
	@Override
	public String toString() {
		return getCanonicalForm();
	}
}
