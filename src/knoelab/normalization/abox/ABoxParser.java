package knoelab.normalization.abox;

import java.util.ArrayList;
import java.util.List;

import knoelab.normalization.concept.Individual;
import knoelab.normalization.concept.Relation;
import knoelab.normalization.concept.UnsupportedConstructException;
import knoelab.normalization.misc.Constants;
import knoelab.normalization.misc.PropertyFileHandler;
import knoelab.normalization.misc.Util;
import knoelab.normalization.parser.ConceptParseException;
import knoelab.normalization.parser.ConceptParser;
import knoelab.normalization.parser.LineError;
import knoelab.normalization.parser.ParseStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses ABox text, one axiom per line:
 * <ul>
 * <li><code>C[x]</code>, <code>(some r C)[x]</code> - concept assertions</li>
 * <li><code>r[x,y]</code> - relation assertions</li>
 * </ul>
 * The predicate of a concept assertion is parsed as a concept, the one 
 * of a relation assertion is taken literally as the relation name.
 */
public class ABoxParser {

	private final ConceptParser conceptParser;
	private final String commentPrefix;
	private final Logger logger;
	
	public ABoxParser() {
		this(PropertyFileHandler.getInstance().getCommentPrefix(), 
				LoggerFactory.getLogger(ABoxParser.class));
	}
	
	public ABoxParser(String commentPrefix, Logger logger) {
		this.commentPrefix = commentPrefix;
		this.logger = logger;
		conceptParser = new ConceptParser(logger);
	}
	
	/**
	 * Parses every line of the given text. Lines that fail are reported in 
	 * the returned status and do not prevent the rest from being parsed.
	 */
	public ParseStatus<ABox> parse(String aboxStr) {
		ABox abox = new ABox();
		List<LineError> errors = new ArrayList<LineError>();
		String[] lines = Util.splitLines(aboxStr);
		for(int i=0; i<lines.length; i++) {
			String line = lines[i];
			if(Util.isSkippable(line, commentPrefix))
				continue;
			logger.debug("Parsing line {}: {}", i + 1, line);
			try {
				if(!abox.add(parseAxiom(line)))
					logger.debug("Duplicate axiom on line {}: {}", i + 1, line);
			}
			catch(ConceptParseException e) {
				logger.warn("Skipping ABox line {}: {}", i + 1, e.getMessage());
				errors.add(new LineError(i + 1, line, e.getMessage()));
			}
			catch(UnsupportedConstructException e) {
				logger.warn("Skipping ABox line {}: {}", i + 1, e.getMessage());
				errors.add(new LineError(i + 1, line, e.getMessage()));
			}
		}
		logger.info("Parsed ABox: {} axioms, {} rejected lines", abox.size(), 
				errors.size());
		return new ParseStatus<ABox>(abox, errors);
	}
	
	public ABoxAxiom parseAxiom(String axiomStr) throws ConceptParseException {
		String str = axiomStr.trim();
		int openIndex = str.indexOf(Constants.ARGUMENTS_OPEN);
		if(openIndex == -1)
			throw new ConceptParseException("Missing '" + 
					Constants.ARGUMENTS_OPEN + "'", str);
		if(str.charAt(str.length() - 1) != Constants.ARGUMENTS_CLOSE)
			throw new ConceptParseException("Missing closing '" + 
					Constants.ARGUMENTS_CLOSE + "'", str);
		String predicate = str.substring(0, openIndex).trim();
		if(predicate.isEmpty())
			throw new ConceptParseException("Missing predicate", str);
		String argumentsStr = str.substring(openIndex + 1, str.length() - 1);
		if(argumentsStr.indexOf(Constants.ARGUMENTS_OPEN) != -1 || 
				argumentsStr.indexOf(Constants.ARGUMENTS_CLOSE) != -1)
			throw new ConceptParseException("Nested brackets in argument list", str);
		if(argumentsStr.trim().isEmpty())
			throw new ConceptParseException("Empty argument list", str);
		
		String[] arguments = argumentsStr.split(Constants.ARGUMENT_SEPARATOR, -1);
		List<Individual> individuals = new ArrayList<Individual>(arguments.length);
		for(String argument : arguments) {
			String name = argument.trim();
			if(name.isEmpty())
				throw new ConceptParseException("Blank argument", str);
			if(!Relation.isValidName(name))
				throw new ConceptParseException("Invalid individual '" + name + "'", str);
			individuals.add(new Individual(name));
		}
		
		if(individuals.size() == 1) 
			return new ConceptAxiom(conceptParser.parseConcept(predicate), 
					individuals.get(0));
		else if(individuals.size() == 2) {
			if(!Relation.isValidName(predicate))
				throw new ConceptParseException("Invalid relation name '" + 
						predicate + "'", str);
			return new RelationAxiom(new Relation(predicate), 
					individuals.get(0), individuals.get(1));
		}
		else
			throw new ConceptParseException("Expected one or two arguments, found " + 
					individuals.size(), str);
	}
}
