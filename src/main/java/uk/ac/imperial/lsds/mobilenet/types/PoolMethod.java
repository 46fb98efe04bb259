package uk.ac.imperial.lsds.mobilenet.types;

public enum PoolMethod {
	
	MAX, AVERAGE;
}
