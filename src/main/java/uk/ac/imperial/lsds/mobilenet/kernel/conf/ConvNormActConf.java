package uk.ac.imperial.lsds.mobilenet.kernel.conf;

import uk.ac.imperial.lsds.mobilenet.types.ActivationMode;

/*
 * A convolution followed by an optional normalisation and an optional 
 * activation. By default, padding is (kernel - 1) / 2 x dilation, which 
 * preserves the spatial size at stride 1, and the convolution has a bias
 * only when there is no normalisation.
 */
public class ConvNormActConf implements IConf {
	
	private int outputs;
	
	private int kernel, stride, dilation, groups;
	
	/* Negative means derived from kernel and dilation */
	private int padding;
	
	private BatchNormConf normalisation;
	
	private ActivationMode activation;
	
	/* Null means derived from the presence of a normalisation */
	private Boolean bias;
	
	public ConvNormActConf () {
		
		outputs = 1;
		
		kernel = 3;
		stride = 1;
		dilation = 1;
		groups = 1;
		
		padding = -1;
		
		normalisation = new BatchNormConf ();
		
		activation = ActivationMode.RELU;
		
		bias = null;
	}
	
	public int numberOfOutputs () {
		return outputs;
	}
	
	public ConvNormActConf setNumberOfOutputs (int outputs) {
		this.outputs = outputs;
		return this;
	}
	
	public int getKernel () {
		return kernel;
	}
	
	public ConvNormActConf setKernel (int kernel) {
		this.kernel = kernel;
		return this;
	}
	
	public int getStride () {
		return stride;
	}
	
	public ConvNormActConf setStride (int stride) {
		this.stride = stride;
		return this;
	}
	
	public int getDilation () {
		return dilation;
	}
	
	public ConvNormActConf setDilation (int dilation) {
		this.dilation = dilation;
		return this;
	}
	
	public int numberOfGroups () {
		return groups;
	}
	
	public ConvNormActConf setNumberOfGroups (int groups) {
		this.groups = groups;
		return this;
	}
	
	public int getPadding () {
		return (padding < 0) ? (kernel - 1) / 2 * dilation : padding;
	}
	
	public ConvNormActConf setPadding (int padding) {
		this.padding = padding;
		return this;
	}
	
	public BatchNormConf getNormalisation () {
		return normalisation;
	}
	
	public ConvNormActConf setNormalisation (BatchNormConf normalisation) {
		this.normalisation = normalisation;
		return this;
	}
	
	public ActivationMode getActivation () {
		return activation;
	}
	
	public ConvNormActConf setActivation (ActivationMode activation) {
		this.activation = activation;
		return this;
	}
	
	public boolean hasBias () {
		return (bias == null) ? (normalisation == null) : bias.booleanValue();
	}
	
	public ConvNormActConf setBias (boolean bias) {
		this.bias = bias;
		return this;
	}
	
	/* The convolution part of this configuration */
	public ConvConf toConvConf () {
		
		return new ConvConf ()
			.setNumberOfOutputs (outputs)
			.setBias (hasBias ())
			.setKernel (kernel)
			.setStride (stride)
			.setPadding (getPadding ())
			.setDilation (dilation)
			.setNumberOfGroups (groups);
	}
}
