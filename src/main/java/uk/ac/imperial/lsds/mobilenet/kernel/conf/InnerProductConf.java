package uk.ac.imperial.lsds.mobilenet.kernel.conf;

import uk.ac.imperial.lsds.mobilenet.model.InitialiserConf;

public class InnerProductConf implements IConf {
	
	private int outputs;
	
	private boolean bias;
	
	private InitialiserConf weightInitialiserConf, biasInitialiserConf;
	
	public InnerProductConf() {
		outputs = 1;
		bias = true;
		weightInitialiserConf = new InitialiserConf();
		biasInitialiserConf = new InitialiserConf();
	}
	
	public int numberOfOutputs () {
		return outputs;
	}

	public InnerProductConf setNumberOfOutputs (int outputs) {
		this.outputs = outputs;
		return this;
	}
	
	public boolean hasBias () {
		return bias;
	}

	public InnerProductConf setBias (boolean bias) {
		this.bias = bias;
		return this;
	}
	
	public InitialiserConf getWeightInitialiser () {
		return weightInitialiserConf;
	}

	public InnerProductConf setWeightInitialiser (InitialiserConf weightInitialiserConf) {
		this.weightInitialiserConf = weightInitialiserConf;
		return this;
	}
	
	public InitialiserConf getBiasInitialiser () {
		return biasInitialiserConf;
	}

	public InnerProductConf setBiasInitialiser (InitialiserConf biasInitialiserConf) {
		this.biasInitialiserConf = biasInitialiserConf;
		return this;
	}
}
