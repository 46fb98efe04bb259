package uk.ac.imperial.lsds.mobilenet.kernel;

import java.util.HashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.kernel.conf.SolverConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.LearningRateDecayPolicy;

/*
 * Stochastic gradient descent with L2 weight decay and (Polyak) momentum.
 * For every trainable variable p with gradient g:
 * 
 * d = g + decay * p
 * buffer = momentum * buffer + d    (buffer = d on the first step)
 * p = p - rate * buffer
 * 
 * The learning rate is set per epoch by the decay policy; the cosine policy
 * anneals the base rate to 0 over `epochs` epochs.
 */
public class GradientDescentOptimiser {
	
	private final static Logger log = LogManager.getLogger (GradientDescentOptimiser.class);

	private SolverConf conf;
	
	private int epochs;
	
	private Map<Variable, float []> buffers;
	
	public GradientDescentOptimiser (SolverConf conf, int epochs) {
		
		if (epochs < 1)
			throw new IllegalArgumentException ("error: number of epochs must be greater than 0");
		
		this.conf = conf;
		this.epochs = epochs;
		
		buffers = new HashMap<Variable, float []>();
	}
	
	public float getLearningRate (int epoch) {
		
		float rate;
		
		float base = conf.getBaseLearningRate();
		
		LearningRateDecayPolicy policy = conf.getLearningRateDecayPolicy();
		switch (policy) {
		
		case FIXED:
			rate = base;
			break;
			
		case COSINE:
			rate = base * (float) ((1D + Math.cos(Math.PI * epoch / epochs)) / 2D);
			break;
		
		default:
			throw new IllegalArgumentException("error: invalid learning rate decay policy");
		}
		
		return rate;
	}
	
	public void apply (Model model, ModelGradient gradient, float rate) {
		
		float decay = conf.getWeightDecay();
		float momentum = conf.getMomentum();
		
		for (Variable variable: model.getTrainableVariables()) {
			
			float [] p = variable.getData();
			float [] g = gradient.getGradient(variable);
			
			float [] buffer = buffers.get(variable);
			boolean first = (buffer == null);
			if (first) {
				buffer = new float [p.length];
				buffers.put(variable, buffer);
			}
			
			for (int i = 0; i < p.length; ++i) {
				
				float d = g[i] + decay * p[i];
				
				if (momentum != 0F)
					buffer[i] = first ? d : momentum * buffer[i] + d;
				else
					buffer[i] = d;
				
				p[i] -= rate * buffer[i];
			}
		}
		
		if (log.isDebugEnabled())
			log.debug(String.format("Applied gradient (checksum %.5f) at rate %.6f", gradient.computeChecksum(), rate));
	}
	
	public void reset () {
		buffers.clear();
	}
	
	public SolverConf getConf () {
		return conf;
	}
}
