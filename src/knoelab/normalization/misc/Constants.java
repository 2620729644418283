package knoelab.normalization.misc;


/**
 * An interface which holds all the global (project level) constants
 * @author Raghava
 *
 */
public interface Constants {

	public final String PROPERTY_FILE = "Normalizer.properties";
	// system property naming a properties file that overrides the classpath one
	public final String CONFIG_SYSTEM_PROPERTY = "normalizer.config";
	
	public final String DEFINITION_SYMBOL = "==";
	public final String INCLUSION_SYMBOL = "->";
	public final String COMMENT_PREFIX = "#";
	
	public final char ARGUMENTS_OPEN = '[';
	public final char ARGUMENTS_CLOSE = ']';
	public final String ARGUMENT_SEPARATOR = ",";
	// levels of nested constructs a concept may have
	public final int MAX_NESTING_DEPTH = 500;
	
	public final String ONTOLOGY_IRI = "http://knoelab.wright.edu/normalizer/kb";
	public final String ENTITY_PREFIX = ONTOLOGY_IRI + "#";
	
	public final double NANO = 1000000000;
}
