package knoelab.normalization.abox;

import knoelab.normalization.concept.Individual;
import knoelab.normalization.concept.Relation;
import knoelab.normalization.misc.Constants;

/**
 * <code>r[x,y]</code>: x is related to y through r.
 */
public class RelationAxiom extends ABoxAxiom {

	private final Relation relation;
	private final Individual lhs;
	private final Individual rhs;
	
	public RelationAxiom(Relation relation, Individual lhs, Individual rhs) {
		if(relation == null || lhs == null || rhs == null)
			throw new IllegalArgumentException("Relation and both individuals are required");
		this.relation = relation;
		this.lhs = lhs;
		this.rhs = rhs;
	}
	
	public Relation getRelation() {
		return relation;
	}
	
	public Individual getLhs() {
		return lhs;
	}
	
	public Individual getRhs() {
		return rhs;
	}
	
	@Override
	public ABoxAxiomType getAxiomType() {
		return ABoxAxiomType.RELATION;
	}
	
	@Override
	public String toString() {
		return relation.getName() + Constants.ARGUMENTS_OPEN + lhs.getName() + 
				Constants.ARGUMENT_SEPARATOR + rhs.getName() + 
				Constants.ARGUMENTS_CLOSE;
	}
}
