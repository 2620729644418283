package knoelab.normalization.tbox;

import knoelab.normalization.misc.Constants;

public enum TBoxAxiomType {
	// lhs == rhs, lhs is synonymous with rhs
	DEFINITION(Constants.DEFINITION_SYMBOL),
	// lhs -> rhs, lhs is subsumed by rhs (a GCI)
	INCLUSION(Constants.INCLUSION_SYMBOL);
	
	private String symbol;
	
	private TBoxAxiomType(String symbol) {
		this.symbol = symbol;
	}
	
	/**
	 * @return the delimiter used in the canonical form of an axiom
	 */
	public String getSymbol() {
		return symbol;
	}
}
