package knoelab.normalization.tbox;

import java.util.ArrayList;
import java.util.List;

import knoelab.normalization.concept.Concept;
import knoelab.normalization.concept.UnsupportedConstructException;
import knoelab.normalization.misc.PropertyFileHandler;
import knoelab.normalization.misc.Util;
import knoelab.normalization.parser.ConceptParseException;
import knoelab.normalization.parser.ConceptParser;
import knoelab.normalization.parser.LineError;
import knoelab.normalization.parser.ParseStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses TBox text, one axiom per line: <code>C == D</code> for definitions,
 * <code>C -> D</code> for inclusions. The definition symbol is looked for 
 * first and the line is split on its first occurrence. Both sides are 
 * converted to NNF right away. Blank lines and comment lines are skipped.
 */
public class TBoxParser {

	private final ConceptParser conceptParser;
	private final String definitionSymbol;
	private final String inclusionSymbol;
	private final String commentPrefix;
	private final Logger logger;
	
	public TBoxParser() {
		this(PropertyFileHandler.getInstance().getDefinitionSymbol(), 
				PropertyFileHandler.getInstance().getInclusionSymbol(), 
				PropertyFileHandler.getInstance().getCommentPrefix(), 
				LoggerFactory.getLogger(TBoxParser.class));
	}
	
	public TBoxParser(String definitionSymbol, String inclusionSymbol, 
			String commentPrefix, Logger logger) {
		this.definitionSymbol = definitionSymbol;
		this.inclusionSymbol = inclusionSymbol;
		this.commentPrefix = commentPrefix;
		this.logger = logger;
		conceptParser = new ConceptParser(logger);
	}
	
	/**
	 * Parses every line of the given text. Lines that fail are reported in 
	 * the returned status and do not prevent the rest from being parsed.
	 */
	public ParseStatus<TBox> parse(String tboxStr) {
		logger.info("Parsing TBox...");
		TBox tbox = new TBox(logger);
		List<LineError> errors = new ArrayList<LineError>();
		String[] lines = Util.splitLines(tboxStr);
		for(int i=0; i<lines.length; i++) {
			String line = lines[i];
			if(Util.isSkippable(line, commentPrefix))
				continue;
			logger.debug("Parsing line {}: {}", i + 1, line);
			try {
				if(!tbox.add(parseAxiom(line)))
					logger.debug("Duplicate axiom on line {}: {}", i + 1, line);
			}
			catch(ConceptParseException e) {
				logger.warn("Skipping TBox line {}: {}", i + 1, e.getMessage());
				errors.add(new LineError(i + 1, line, e.getMessage()));
			}
			catch(UnsupportedConstructException e) {
				logger.warn("Skipping TBox line {}: {}", i + 1, e.getMessage());
				errors.add(new LineError(i + 1, line, e.getMessage()));
			}
		}
		logger.info("Parsed TBox: {} axioms, {} rejected lines", tbox.size(), 
				errors.size());
		return new ParseStatus<TBox>(tbox, errors);
	}
	
	public TBoxAxiom parseAxiom(String tboxLine) throws ConceptParseException {
		String line = tboxLine.trim();
		String delimiter;
		TBoxAxiomType axiomType;
		if(line.contains(definitionSymbol)) {
			delimiter = definitionSymbol;
			axiomType = TBoxAxiomType.DEFINITION;
		}
		else if(line.contains(inclusionSymbol)) {
			delimiter = inclusionSymbol;
			axiomType = TBoxAxiomType.INCLUSION;
		}
		else
			throw new ConceptParseException("Expected '" + definitionSymbol + 
					"' or '" + inclusionSymbol + "'", line);
		
		int delimiterIndex = line.indexOf(delimiter);
		String lhsStr = line.substring(0, delimiterIndex);
		String rhsStr = line.substring(delimiterIndex + delimiter.length());
		if(lhsStr.trim().isEmpty())
			throw new ConceptParseException("Missing left-hand side", line);
		if(rhsStr.trim().isEmpty())
			throw new ConceptParseException("Missing right-hand side", line);
		Concept lhs = conceptParser.parseConcept(lhsStr).convertToNNF();
		Concept rhs = conceptParser.parseConcept(rhsStr).convertToNNF();
		return new TBoxAxiom(axiomType, lhs, rhs);
	}
}
