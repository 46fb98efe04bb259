package uk.ac.imperial.lsds.mobilenet.kernel.conf;

import uk.ac.imperial.lsds.mobilenet.model.InitialiserConf;
import uk.ac.imperial.lsds.mobilenet.types.InitialiserType;

public class BatchNormConf implements IConf {

	private double epsilon;

	/* Weight given to the running estimate when folding in a batch statistic */
	private double movingAverageFraction;
	
	private InitialiserConf weightInitialiserConf, biasInitialiserConf;
	
	public BatchNormConf () {

		epsilon = 0.00001D;
		movingAverageFraction = 0.9D;

		weightInitialiserConf = new InitialiserConf().setType(InitialiserType.CONSTANT).setValue(1);
		biasInitialiserConf = new InitialiserConf();
	}

	public BatchNormConf setEpsilon (double epsilon) {
		this.epsilon = epsilon;
		return this;
	}

	public double getEpsilon () {
		return epsilon;
	}
	
	public BatchNormConf setMovingAverageFraction (double movingAverageFraction) {
		this.movingAverageFraction = movingAverageFraction;
		return this;
	}
	
	public double getMovingAverageFraction () {
		return movingAverageFraction;
	}
	
	public InitialiserConf getWeightInitialiser () {
		return weightInitialiserConf;
	}

	public BatchNormConf setWeightInitialiser (InitialiserConf weightInitialiserConf) {
		this.weightInitialiserConf = weightInitialiserConf;
		return this;
	}
	
	public InitialiserConf getBiasInitialiser () {
		return biasInitialiserConf;
	}

	public BatchNormConf setBiasInitialiser (InitialiserConf biasInitialiserConf) {
		this.biasInitialiserConf = biasInitialiserConf;
		return this;
	}
	
	public String toString () {
		return String.format("BatchNorm (eps %g, moving average fraction %g)", epsilon, movingAverageFraction);
	}
}
