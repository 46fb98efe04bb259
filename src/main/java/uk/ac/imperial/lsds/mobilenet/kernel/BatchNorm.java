package uk.ac.imperial.lsds.mobilenet.kernel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.kernel.conf.BatchNormConf;
import uk.ac.imperial.lsds.mobilenet.model.InitialiserConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.InitialiserType;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/*
 * Per-channel batch normalisation:
 * 
 * y = weight * (x - mean) / sqrt(var + eps) + bias
 * 
 * In the training phase, mean and (biased) variance are those of the batch, 
 * taken over the M = N x H x W values of each channel, and the running 
 * estimates are updated as
 * 
 * running = f * running + (1 - f) * batch
 * 
 * where f is the moving average fraction and the variance folded in is the
 * unbiased one, var x M / (M - 1). In the test phase, the running estimates 
 * are used instead.
 */
public class BatchNorm extends Kernel {
	
	private final static Logger log = LogManager.getLogger (BatchNorm.class);
	
	private BatchNormConf conf;
	
	private Variable weights, bias;
	
	private Variable runningMean, runningVariance;
	
	/* Saved by the last training-phase forward pass */
	private float [] normalised = null;
	private float [] inverseStd = null;
	
	public BatchNorm (BatchNormConf conf) {
		
		this.conf = conf;
	}
	
	public KernelType getKernelType () {
		return KernelType.BATCHNORM;
	}
	
	public BatchNorm setup (String name, int channels, Model model) {
		
		log.debug(String.format("Setup kernel %s", name));
		
		if (channels < 1)
			throw new IllegalArgumentException (String.format("error: kernel %s needs a positive number of channels", name));
		
		if (conf.getEpsilon() <= 0)
			throw new IllegalArgumentException (String.format("error: epsilon of kernel %s must be greater than 0", name));
		
		this.name = name;
		this.inputs = this.outputs = channels;
		
		Shape shape = new Shape (new int [] { channels });
		
		weights = new Variable (name + ".weight", shape.copy());
		weights.initialise (conf.getWeightInitialiser(), model.getRandomGenerator());
		register (model, weights, true);
		
		bias = new Variable (name + ".bias", shape.copy());
		bias.initialise (conf.getBiasInitialiser(), model.getRandomGenerator());
		register (model, bias, true);
		
		runningMean = new Variable (name + ".running_mean", shape.copy());
		register (model, runningMean, false);
		
		runningVariance = new Variable (name + ".running_var", shape.copy());
		runningVariance.initialise (new InitialiserConf ().setType (InitialiserType.CONSTANT).setValue (1), model.getRandomGenerator());
		register (model, runningVariance, false);
		
		return this;
	}
	
	public Variable getWeights () {
		return weights;
	}
	
	public Variable getBias () {
		return bias;
	}
	
	public Variable getRunningMean () {
		return runningMean;
	}
	
	public Variable getRunningVariance () {
		return runningVariance;
	}
	
	public double getEpsilon () {
		return conf.getEpsilon();
	}
	
	public Variable compute (Variable input, Phase phase) {
		
		checkInput (input, 0);
		
		Shape shape = input.getShape();
		
		int batchSize = shape.numberOfExamples();
		int spatial = input.capacity() / (batchSize * inputs);
		int M = batchSize * spatial;
		
		if (phase == Phase.TRAIN && M < 2)
			throw new IllegalArgumentException (String.format("error: kernel %s expects more than 1 value per channel in the training phase (input %s)", name, shape));
		
		Variable output = new Variable (shape.copy());
		
		float [] x = input.getData();
		float [] y = output.getData();
		float [] gamma = weights.getData();
		float [] beta = bias.getData();
		float [] mu = runningMean.getData();
		float [] sigma = runningVariance.getData();
		
		double eps = conf.getEpsilon();
		double f = conf.getMovingAverageFraction();
		
		if (phase == Phase.TRAIN) {
			normalised = new float [input.capacity()];
			inverseStd = new float [inputs];
		}
		else {
			normalised = null;
			inverseStd = null;
		}
		
		for (int c = 0; c < inputs; ++c) {
			
			double mean, variance;
			
			if (phase == Phase.TRAIN) {
				
				double sum = 0;
				for (int n = 0; n < batchSize; ++n) {
					int offset = (n * inputs + c) * spatial;
					for (int p = offset; p < offset + spatial; ++p)
						sum += x[p];
				}
				mean = sum / M;
				
				double squares = 0;
				for (int n = 0; n < batchSize; ++n) {
					int offset = (n * inputs + c) * spatial;
					for (int p = offset; p < offset + spatial; ++p) {
						double d = x[p] - mean;
						squares += d * d;
					}
				}
				variance = squares / M;
				
				mu[c] = (float) (f * mu[c] + (1 - f) * mean);
				sigma[c] = (float) (f * sigma[c] + (1 - f) * variance * M / (M - 1));
			}
			else {
				mean = mu[c];
				variance = sigma[c];
			}
			
			float invstd = (float) (1.0 / Math.sqrt(variance + eps));
			
			if (inverseStd != null)
				inverseStd[c] = invstd;
			
			for (int n = 0; n < batchSize; ++n) {
				int offset = (n * inputs + c) * spatial;
				for (int p = offset; p < offset + spatial; ++p) {
					float xhat = (float) (x[p] - mean) * invstd;
					if (normalised != null)
						normalised[p] = xhat;
					y[p] = gamma[c] * xhat + beta[c];
				}
			}
		}
		
		retain (input, phase);
		
		return output;
	}
	
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient) {
		
		Variable input = getRetainedInput ();
		
		Shape shape = input.getShape();
		
		checkGradient (gradient, shape);
		
		int batchSize = shape.numberOfExamples();
		int spatial = input.capacity() / (batchSize * inputs);
		int M = batchSize * spatial;
		
		Variable inputGradient = new Variable (shape.copy());
		
		float [] dy = gradient.getData();
		float [] dx = inputGradient.getData();
		float [] gamma = weights.getData();
		float [] dgamma = modelGradient.getGradient(weights);
		float [] dbeta  = modelGradient.getGradient(bias);
		
		for (int c = 0; c < inputs; ++c) {
			
			double sum = 0, dot = 0;
			
			for (int n = 0; n < batchSize; ++n) {
				int offset = (n * inputs + c) * spatial;
				for (int p = offset; p < offset + spatial; ++p) {
					sum += dy[p];
					dot += dy[p] * normalised[p];
				}
			}
			
			dgamma[c] += (float) dot;
			dbeta [c] += (float) sum;
			
			double scale = gamma[c] * inverseStd[c] / M;
			
			for (int n = 0; n < batchSize; ++n) {
				int offset = (n * inputs + c) * spatial;
				for (int p = offset; p < offset + spatial; ++p)
					dx[p] = (float) (scale * (M * dy[p] - sum - normalised[p] * dot));
			}
		}
		
		return inputGradient;
	}
}
