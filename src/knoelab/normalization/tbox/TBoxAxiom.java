package knoelab.normalization.tbox;

import knoelab.normalization.concept.Concept;

/**
 * A concept-level axiom, either a definition <code>lhs == rhs</code> or an 
 * inclusion <code>lhs -> rhs</code>. Equality and hashing use the canonical 
 * text <code>"{lhs} {delimiter} {rhs}"</code>.
 */
public class TBoxAxiom {

	private final TBoxAxiomType axiomType;
	private final Concept lhs;
	private final Concept rhs;
	private final String canonicalForm;
	
	public TBoxAxiom(TBoxAxiomType axiomType, Concept lhs, Concept rhs) {
		if(axiomType == null || lhs == null || rhs == null)
			throw new IllegalArgumentException("Axiom type, lhs and rhs are required");
		this.axiomType = axiomType;
		this.lhs = lhs;
		this.rhs = rhs;
		canonicalForm = lhs.getCanonicalForm() + " " + axiomType.getSymbol() + 
				" " + rhs.getCanonicalForm();
	}
	
	public TBoxAxiomType getAxiomType() {
		return axiomType;
	}
	
	public Concept getLhs() {
		return lhs;
	}
	
	public Concept getRhs() {
		return rhs;
	}
	
	public boolean isDefinition() {
		return axiomType == TBoxAxiomType.DEFINITION;
	}
	
	public boolean isInclusion() {
		return axiomType == TBoxAxiomType.INCLUSION;
	}
	
	@Override
	public boolean equals(Object obj) {
		if(this == obj)
			return true;
		if(!(obj instanceof TBoxAxiom))
			return false;
		return canonicalForm.equals(((TBoxAxiom) obj).canonicalForm);
	}
	
	@Override
	public int hashCode() {
		return canonicalForm.hashCode();
	}
	
	@Override
	public String toString() {
		return canonicalForm;
	}
}
