package uk.ac.imperial.lsds.mobilenet.model;

import uk.ac.imperial.lsds.mobilenet.types.InitialiserType;
import uk.ac.imperial.lsds.mobilenet.types.VarianceNormalisation;

public class InitialiserConf {
	
	private InitialiserType type;
	
	private float value;
	
	private float mean, std;
	
	private VarianceNormalisation norm;
	
	public InitialiserConf () {
		type = InitialiserType.CONSTANT;
		value = 0;
		mean = 0;
		std = 0;
		norm = VarianceNormalisation.FAN_IN;
	}
	
	public InitialiserType getType () {
		return type;
	}

	public InitialiserConf setType (InitialiserType type) {
		this.type = type;
		return this;
	}
	
	public float getValue () {
		return value;
	}
	
	public InitialiserConf setValue (float value) {
		this.value = value;
		return this;
	}

	public float getMean () {
		return mean;
	}

	public InitialiserConf setMean (float mean) {
		this.mean = mean;
		return this;
	}

	public float getStd () {
		return std;
	}

	public InitialiserConf setStd (float std) {
		this.std = std;
		return this;
	}

	public VarianceNormalisation getNorm () {
		return norm;
	}

	public InitialiserConf setNorm (VarianceNormalisation norm) {
		this.norm = norm;
		return this;
	}
}
