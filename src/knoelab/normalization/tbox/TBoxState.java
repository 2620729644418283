package knoelab.normalization.tbox;

/**
 * Stages a TBox goes through. Each stage is a precondition of the 
 * operations of the next one: definitions are expanded before they are 
 * propagated, and inclusions are definition free before they are aggregated.
 */
public enum TBoxState {
	// axioms can still be added
	PARSED,
	// no definition refers to another defined concept
	EXPANDED,
	// inclusions are free of defined concepts
	PROPAGATED;
}
