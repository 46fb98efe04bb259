package uk.ac.imperial.lsds.mobilenet.types;

public enum LearningRateDecayPolicy {
	
	FIXED(0), COSINE(1);
	
	private int id;
	
	LearningRateDecayPolicy (int id) {
		this.id = id;
	}
	
	public String toString () {
		switch (id) {
		case 0: return "FIXED";
		case 1: return "COSINE";
		default:
			throw new IllegalArgumentException ("error: invalid learning rate decay policy");
		}
	}

	public static LearningRateDecayPolicy fromString (String policy) {
		if      (policy.toUpperCase().equals("FIXED"))  return FIXED;
		else if (policy.toUpperCase().equals("COSINE")) return COSINE;
		else
			throw new IllegalArgumentException (String.format("error: invalid learning rate decay policy: %s", policy));
	}
}
