package knoelab.normalization.misc;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * This class handles all the read requests for
 * the Normalizer.properties file. The file is looked up on the 
 * classpath; a file named by the <code>normalizer.config</code> system
 * property overrides individual keys. Missing keys fall back to 
 * {@link Constants}.
 * 
 * @author Raghava
 */
public class PropertyFileHandler {
	private static final Logger LOGGER = 
			LoggerFactory.getLogger(PropertyFileHandler.class);
	private final static PropertyFileHandler propertyFileHandler = 
			new PropertyFileHandler();
	private Properties normalizerProperties = null;
	
	private PropertyFileHandler() {
		// does not allow instantiation of this class
		normalizerProperties = new Properties();
		InputStream in = PropertyFileHandler.class.getClassLoader().
				getResourceAsStream(Constants.PROPERTY_FILE);
		if(in == null)
			LOGGER.warn("{} not found on the classpath, using defaults", 
					Constants.PROPERTY_FILE);
		else
			load(in, Constants.PROPERTY_FILE);
		String overrideFile = System.getProperty(Constants.CONFIG_SYSTEM_PROPERTY);
		if(overrideFile != null) {
			try {
				load(new FileInputStream(overrideFile), overrideFile);
			}
			catch(IOException e) {
				LOGGER.error("Cannot read " + overrideFile, e);
			}
		}
	}
	
	private void load(InputStream in, String source) {
		try {
			normalizerProperties.load(in);
			LOGGER.debug("Loaded configuration from {}", source);
		}
		catch(IOException e) {
			LOGGER.error("Cannot read " + source, e);
		}
		finally {
			try {
				in.close();
			} catch (IOException e) {
				LOGGER.warn("Cannot close " + source, e);
			}
		}
	}
	
	public static PropertyFileHandler getInstance() {
		return propertyFileHandler;
	}
	
	public Object clone() throws CloneNotSupportedException {
		throw new CloneNotSupportedException("Cannot clone an instance of this class");
	}
	
	private String getProperty(String key, String defaultValue) {
		String value = normalizerProperties.getProperty(key);
		if(value == null || value.trim().isEmpty())
			return defaultValue;
		return value.trim();
	}
	
	public String getDefinitionSymbol() {
		return getProperty("tbox.definition.symbol", Constants.DEFINITION_SYMBOL);
	}
	
	public String getInclusionSymbol() {
		return getProperty("tbox.inclusion.symbol", Constants.INCLUSION_SYMBOL);
	}
	
	public String getCommentPrefix() {
		return getProperty("comment.prefix", Constants.COMMENT_PREFIX);
	}
	
	public int getMaxNestingDepth() {
		String depth = getProperty("concept.max.nesting.depth", null);
		if(depth == null)
			return Constants.MAX_NESTING_DEPTH;
		try {
			return Integer.parseInt(depth);
		}
		catch(NumberFormatException e) {
			LOGGER.warn("Invalid concept.max.nesting.depth '{}', using {}", depth, 
					Constants.MAX_NESTING_DEPTH);
			return Constants.MAX_NESTING_DEPTH;
		}
	}
	
	public String getOntologyIRI() {
		return getProperty("owl.ontology.iri", Constants.ONTOLOGY_IRI);
	}
	
	public String getClassPrefix() {
		return getProperty("owl.class.prefix", Constants.ENTITY_PREFIX);
	}
	
	public String getPropertyPrefix() {
		return getProperty("owl.property.prefix", Constants.ENTITY_PREFIX);
	}
	
	public String getIndividualPrefix() {
		return getProperty("owl.individual.prefix", Constants.ENTITY_PREFIX);
	}
}
