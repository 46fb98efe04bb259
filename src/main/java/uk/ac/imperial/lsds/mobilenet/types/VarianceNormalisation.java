package uk.ac.imperial.lsds.mobilenet.types;

public enum VarianceNormalisation {
	
	FAN_IN, FAN_OUT, AVG;
}
