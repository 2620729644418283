package knoelab.normalization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import knoelab.normalization.abox.ABox;
import knoelab.normalization.concept.ConjunctionConcept;
import knoelab.normalization.parser.LineError;
import knoelab.normalization.tbox.TBox;

/**
 * What is handed over to the reasoning engine: the ABox with all defined 
 * concepts expanded and the single concept all GCIs were aggregated into.
 * Lines rejected while parsing are kept alongside.
 */
public class NormalizedKB {

	private final TBox tbox;
	private final ABox abox;
	private final ConjunctionConcept aggregatedInclusions;
	private final List<LineError> tboxErrors;
	private final List<LineError> aboxErrors;
	
	public NormalizedKB(TBox tbox, ABox abox, ConjunctionConcept aggregatedInclusions, 
			List<LineError> tboxErrors, List<LineError> aboxErrors) {
		this.tbox = tbox;
		this.abox = abox;
		this.aggregatedInclusions = aggregatedInclusions;
		this.tboxErrors = Collections.unmodifiableList(
				new ArrayList<LineError>(tboxErrors));
		this.aboxErrors = Collections.unmodifiableList(
				new ArrayList<LineError>(aboxErrors));
	}
	
	public TBox getTBox() {
		return tbox;
	}
	
	public ABox getABox() {
		return abox;
	}
	
	/**
	 * @return conjunction of all GCIs, or null if the TBox has none
	 */
	public ConjunctionConcept getAggregatedInclusions() {
		return aggregatedInclusions;
	}
	
	public List<LineError> getTBoxErrors() {
		return tboxErrors;
	}
	
	public List<LineError> getABoxErrors() {
		return aboxErrors;
	}
	
	public boolean hasErrors() {
		return !tboxErrors.isEmpty() || !aboxErrors.isEmpty();
	}
	
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(abox).append("\nGCI: ");
		sb.append(aggregatedInclusions == null ? "none" : aggregatedInclusions);
		for(LineError error : tboxErrors)
			sb.append("\nTBox ").append(error);
		for(LineError error : aboxErrors)
			sb.append("\nABox ").append(error);
		return sb.toString();
	}
}
