package knoelab.normalization.parser;

import java.util.ArrayList;
import java.util.List;

import knoelab.normalization.concept.AtomicConcept;
import knoelab.normalization.concept.Concept;
import knoelab.normalization.concept.ConceptType;
import knoelab.normalization.concept.ConjunctionConcept;
import knoelab.normalization.concept.DisjunctionConcept;
import knoelab.normalization.concept.NotConcept;
import knoelab.normalization.concept.OnlyConcept;
import knoelab.normalization.concept.Relation;
import knoelab.normalization.concept.SomeConcept;
import knoelab.normalization.misc.PropertyFileHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the textual concept syntax:
 * <pre>
 * concept  := atomic | "(" concept ")" | "not" concept
 *           | "and" operands | "or" operands
 *           | "only" relation concept | "some" relation concept
 * operands := "(" concept+ ")" | concept+
 * </pre>
 * Dispatch is on the leading token of the trimmed input. Operands of 
 * <code>and</code>/<code>or</code> are separated by whitespace, so compound
 * operands have to be bracketed, e.g. <code>and ((not A) B)</code> or 
 * <code>and (not A) B</code>.
 * <p>
 * Every nested construct (and every pair of wrapping brackets) is one level
 * of recursion; input nested deeper than the configured limit is rejected.
 * </p>
 */
public class ConceptParser {

	private final Logger logger;
	private final int maxNestingDepth;
	
	public ConceptParser() {
		this(LoggerFactory.getLogger(ConceptParser.class));
	}
	
	public ConceptParser(Logger logger) {
		this(logger, PropertyFileHandler.getInstance().getMaxNestingDepth());
	}
	
	public ConceptParser(Logger logger, int maxNestingDepth) {
		if(maxNestingDepth < 1)
			throw new IllegalArgumentException("Nesting depth limit has to be positive");
		this.logger = logger;
		this.maxNestingDepth = maxNestingDepth;
	}
	
	public Concept parseConcept(String conceptStr) throws ConceptParseException {
		if(conceptStr == null)
			throw new IllegalArgumentException("Concept string cannot be null");
		return parseConcept(conceptStr, 0);
	}
	
	private Concept parseConcept(String conceptStr, int depth) 
			throws ConceptParseException {
		String str = conceptStr.trim();
		if(depth > maxNestingDepth)
			throw new ConceptParseException("Nesting too deep (more than " + 
					maxNestingDepth + " levels)", str);
		logger.trace("Parsing concept: {}", str);
		if(str.isEmpty())
			throw new ConceptParseException("Empty concept", conceptStr);
		
		if(str.charAt(0) == '(') {
			// concept wrapped up in brackets "(..)"
			int closeIndex = findClosingBracket(str, 0);
			if(closeIndex == -1)
				throw new ConceptParseException("Unbalanced brackets", str);
			if(closeIndex != str.length() - 1)
				throw new ConceptParseException("Unexpected text after '" + 
						str.substring(0, closeIndex + 1) + "'", str);
			return parseConcept(str.substring(1, closeIndex), depth + 1);
		}
		
		String token = leadingToken(str);
		ConceptType type = ConceptType.forKeyword(token);
		if(type == null) {
			if(!AtomicConcept.isValidName(str))
				throw new ConceptParseException("Not a concept", str);
			return new AtomicConcept(str);
		}
		String remainder = str.substring(token.length()).trim();
		switch(type) {
			case NOT:
				if(remainder.isEmpty())
					throw new ConceptParseException("Missing operand of 'not'", str);
				return new NotConcept(parseConcept(remainder, depth + 1));
			case AND:
				return new ConjunctionConcept(parseOperands(remainder, str, depth));
			case OR:
				return new DisjunctionConcept(parseOperands(remainder, str, depth));
			case ONLY:
				return new OnlyConcept(parseRelation(remainder, str), 
						parseFiller(remainder, str, depth));
			case SOME:
				return new SomeConcept(parseRelation(remainder, str), 
						parseFiller(remainder, str, depth));
			default: 
				throw new ConceptParseException("Unknown construct " + type, str);
		}
	}
	
	/**
	 * Operands are either one bracketed list, <code>(C1 C2 ...)</code>, or 
	 * whitespace separated siblings, <code>C1 C2 ...</code>. A single bracketed 
	 * group whose content starts with a keyword, e.g. <code>(not A)</code>, is 
	 * one operand rather than a list.
	 */
	private List<Concept> parseOperands(String operandsStr, String conceptStr, 
			int depth) throws ConceptParseException {
		if(operandsStr.isEmpty())
			throw new ConceptParseException("Missing operands", conceptStr);
		List<String> siblings = splitConcepts(operandsStr);
		if(siblings.size() == 1 && operandsStr.charAt(0) == '(') {
			int closeIndex = findClosingBracket(operandsStr, 0);
			if(closeIndex != operandsStr.length() - 1)
				throw new ConceptParseException("Unexpected text after the list " +
						"of concepts", conceptStr);
			String content = operandsStr.substring(1, closeIndex).trim();
			if(!ConceptType.isKeyword(leadingToken(content)))
				siblings = splitConcepts(content);
		}
		List<Concept> operands = new ArrayList<Concept>(siblings.size());
		for(String sibling : siblings)
			operands.add(parseConcept(sibling, depth + 1));
		return operands;
	}
	
	private Relation parseRelation(String restrictionStr, String conceptStr) 
			throws ConceptParseException {
		String relationName = leadingToken(restrictionStr);
		if(relationName.isEmpty())
			throw new ConceptParseException("Missing relation", conceptStr);
		if(!Relation.isValidName(relationName))
			throw new ConceptParseException("Invalid relation name '" + 
					relationName + "'", conceptStr);
		return new Relation(relationName);
	}
	
	private Concept parseFiller(String restrictionStr, String conceptStr, 
			int depth) throws ConceptParseException {
		String relationName = leadingToken(restrictionStr);
		String filler = restrictionStr.substring(relationName.length()).trim();
		if(filler.isEmpty())
			throw new ConceptParseException("Missing concept after relation '" + 
					relationName + "'", conceptStr);
		return parseConcept(filler, depth + 1);
	}
	
	/**
	 * Splits a whitespace separated list of sibling concepts (the operands
	 * of <code>and</code>/<code>or</code>). Splits happen at bracket depth 
	 * zero only.
	 * 
	 * @return the sibling concept strings, at least one
	 * @throws ConceptParseException if brackets are unbalanced or the list is empty
	 */
	public static List<String> splitConcepts(String conceptsStr) 
			throws ConceptParseException {
		List<String> siblings = new ArrayList<String>();
		int depth = 0;
		int start = -1;
		for(int i=0; i<conceptsStr.length(); i++) {
			char c = conceptsStr.charAt(i);
			if(c == '(') 
				depth++;		// going a level deeper
			else if(c == ')') {
				depth--;		// going a level out
				if(depth < 0)
					throw new ConceptParseException("Unbalanced brackets", conceptsStr);
			}
			if(depth == 0 && Character.isWhitespace(c)) {
				if(start != -1) {
					siblings.add(conceptsStr.substring(start, i));
					start = -1;
				}
			}
			else if(start == -1)
				start = i;
		}
		if(depth != 0)
			throw new ConceptParseException("Unbalanced brackets", conceptsStr);
		if(start != -1)
			siblings.add(conceptsStr.substring(start));
		if(siblings.isEmpty())
			throw new ConceptParseException("Expected at least one concept", 
					conceptsStr);
		return siblings;
	}
	
	/**
	 * @return index of the bracket closing the one at <code>openIndex</code>, 
	 * or -1 if it is never closed
	 */
	static int findClosingBracket(String str, int openIndex) {
		int depth = 0;
		for(int i=openIndex; i<str.length(); i++) {
			char c = str.charAt(i);
			if(c == '(')
				depth++;
			else if(c == ')') {
				depth--;
				if(depth == 0)
					return i;
			}
		}
		return -1;
	}
	
	/**
	 * @return the text up to the first whitespace or opening bracket
	 */
	private static String leadingToken(String str) {
		int end = 0;
		while(end < str.length() && !Character.isWhitespace(str.charAt(end)) 
				&& str.charAt(end) != '(')
			end++;
		return str.substring(0, end);
	}
}
