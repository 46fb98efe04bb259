package uk.ac.imperial.lsds.mobilenet.types;

public enum InitialiserType {
	
	CONSTANT(0), GAUSSIAN(1), MSRA(2);
	
	private int id;
	
	InitialiserType (int id) {
		this.id = id;
	}
	
	public String toString () {
		switch (id) {
		case 0: return "CONSTANT";
		case 1: return "GAUSSIAN";
		case 2: return     "MSRA";
		default:
			throw new IllegalArgumentException ("error: invalid initialiser type");
		}
	}
	
	public static InitialiserType fromString (String type) {
			
		if      (type.toUpperCase().equals("CONSTANT")) return CONSTANT;
		else if (type.toUpperCase().equals("GAUSSIAN")) return GAUSSIAN;
		else if (type.toUpperCase().equals("MSRA"))     return MSRA;
		else
			throw new IllegalArgumentException (String.format("error: invalid initialiser type: %s", type));
	}
}
