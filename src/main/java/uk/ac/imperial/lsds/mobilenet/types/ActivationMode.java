package uk.ac.imperial.lsds.mobilenet.types;

public enum ActivationMode {
	
	RELU(0), HARD_SWISH(1), HARD_SIGMOID(2);
	
	private int id;
	
	ActivationMode (int id) {
		this.id = id;
	}
	
	public String toString () {
		switch (id) {
		case 0: return "RELU";
		case 1: return "HARD_SWISH";
		case 2: return "HARD_SIGMOID";
		default:
			throw new IllegalArgumentException ("error: invalid activation mode");
		}
	}
	
	/*
	 * Block schedules name activations by their two-letter tags,
	 * "RE" (ReLU) and "HS" (hard-swish).
	 */
	public static ActivationMode fromTag (String tag) {
		
		if      (tag.toUpperCase().equals("RE")) return RELU;
		else if (tag.toUpperCase().equals("HS")) return HARD_SWISH;
		else
			throw new IllegalArgumentException (String.format("error: invalid activation tag: %s", tag));
	}
}
