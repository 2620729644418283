package knoelab.normalization.abox;

public enum ABoxAxiomType {
	// C[x]
	CONCEPT,
	// r[x,y]
	RELATION;
}
