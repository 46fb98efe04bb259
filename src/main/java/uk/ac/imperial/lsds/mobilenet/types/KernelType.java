package uk.ac.imperial.lsds.mobilenet.types;

/*
 * Tags every kernel with the kind of computation it performs. Composite
 * kernels (sub-graphs and blocks) are tagged as well, so that a network
 * can be inspected stage by stage without knowing the concrete classes.
 */
public enum KernelType {
	
	CONV, BATCHNORM, ACTIVATION, POOL, INNER_PRODUCT, DROPOUT, 
	
	SUBGRAPH, CONV_NORM_ACT, SQUEEZE_EXCITE, INVERTED_RESIDUAL;
}
