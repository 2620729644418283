package knoelab.normalization.abox;

/**
 * An assertion about named individuals. Axioms are immutable and
 * identified by their textual form, which is also the line syntax 
 * they are parsed from.
 */
public abstract class ABoxAxiom {

	ABoxAxiom() {
		// only ConceptAxiom and RelationAxiom
	}
	
	public abstract ABoxAxiomType getAxiomType();
	
	@Override
	public boolean equals(Object obj) {
		if(this == obj)
			return true;
		if(!(obj instanceof ABoxAxiom))
			return false;
		return toString().equals(obj.toString());
	}
	
	@Override
	public int hashCode() {
		return toString().hashCode();
	}
}
