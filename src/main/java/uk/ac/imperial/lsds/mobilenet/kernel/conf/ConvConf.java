package uk.ac.imperial.lsds.mobilenet.kernel.conf;

import uk.ac.imperial.lsds.mobilenet.model.InitialiserConf;

/*
 * Windows are square: kernel, stride, padding and dilation apply to both
 * spatial axes. When left unset, they default to 1, 1, 0 and 1 respectively.
 */
public class ConvConf implements IConf {
	
	private int outputs;
	
	private boolean bias;
	
	private InitialiserConf weightInitialiserConf, biasInitialiserConf;
	
	private int kernel;
	private int stride;
	private int padding;
	private int dilation;
	
	private int groups;
	
	public ConvConf () {
		
		outputs = 1;
		
		bias = true;
		
		weightInitialiserConf = new InitialiserConf();
		biasInitialiserConf = new InitialiserConf();
		
		kernel = 1;
		stride = 1;
		padding = 0;
		dilation = 1;
		
		groups = 1;
	}
	
	public int numberOfOutputs () {
		return outputs;
	}
	
	public ConvConf setNumberOfOutputs (int outputs) {
		this.outputs = outputs;
		return this;
	}
	
	public boolean hasBias () {
		return bias;
	}
	
	public ConvConf setBias (boolean bias) {
		this.bias = bias;
		return this;
	}
	
	public InitialiserConf getWeightInitialiser () {
		return weightInitialiserConf;
	}
	
	public ConvConf setWeightInitialiser (InitialiserConf weightInitialiserConf) {
		this.weightInitialiserConf = weightInitialiserConf;
		return this;
	}
	
	public InitialiserConf getBiasInitialiser () {
		return biasInitialiserConf;
	}
	
	public ConvConf setBiasInitialiser (InitialiserConf biasInitialiserConf) {
		this.biasInitialiserConf = biasInitialiserConf;
		return this;
	}
	
	public ConvConf setKernel (int kernel) {
		this.kernel = kernel;
		return this;
	}
	
	public int getKernelHeight () {
		return kernel;
	}
	
	public int getKernelWidth () {
		return kernel;
	}
	
	public ConvConf setStride (int stride) {
		this.stride = stride;
		return this;
	}
	
	public int getStrideHeight () {
		return stride;
	}
	
	public int getStrideWidth () {
		return stride;
	}
	
	public ConvConf setPadding (int padding) {
		this.padding = padding;
		return this;
	}
	
	public int getPaddingHeight () {
		return padding;
	}
	
	public int getPaddingWidth () {
		return padding;
	}
	
	public ConvConf setDilation (int dilation) {
		this.dilation = dilation;
		return this;
	}
	
	public int getDilationHeight () {
		return dilation;
	}
	
	public int getDilationWidth () {
		return dilation;
	}
	
	public ConvConf setNumberOfGroups (int groups) {
		this.groups = groups;
		return this;
	}
	
	public int numberOfGroups () {
		return groups;
	}
}
