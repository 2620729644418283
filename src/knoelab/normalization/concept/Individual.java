package knoelab.normalization.concept;

/**
 * An ABox individual, identified by its name only.
 */
public final class Individual {

	private final String name;
	
	public Individual(String name) {
		if(!Relation.isValidName(name))
			throw new IllegalArgumentException("Invalid individual name: '" 
					+ name + "'");
		this.name = name;
	}
	
	public String getName() {
		return name;
	}
	
	@Override
	public boolean equals(Object obj) {
		if(this == obj)
			return true;
		if(!(obj instanceof Individual))
			return false;
		return name.equals(((Individual) obj).name);
	}
	
	@Override
	public int hashCode() {
		return name.hashCode();
	}
	
	@Override
	public String toString() {
		return name;
	}
}
