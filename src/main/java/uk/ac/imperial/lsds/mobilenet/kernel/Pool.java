package uk.ac.imperial.lsds.mobilenet.kernel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.kernel.conf.PoolConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.KernelType;
import uk.ac.imperial.lsds.mobilenet.types.Phase;
import uk.ac.imperial.lsds.mobilenet.types.PoolMethod;

/*
 * Global average pooling: [N, C, H, W] to [N, C, 1, 1].
 */
public class Pool extends Kernel {
	
	private final static Logger log = LogManager.getLogger (Pool.class);
	
	private PoolConf conf;
	
	public Pool (PoolConf conf) {
		this.conf = conf;
	}
	
	public KernelType getKernelType () {
		return KernelType.POOL;
	}
	
	public Pool setup (String name, int channels, Model model) {
		
		log.debug(String.format("Setup kernel %s", name));
		
		if (conf.getMethod() != PoolMethod.AVERAGE || ! conf.isGlobal())
			throw new UnsupportedOperationException (String.format("error: kernel %s only supports global average pooling", name));
		
		this.name = name;
		this.inputs = this.outputs = channels;
		
		return this;
	}
	
	public Variable compute (Variable input, Phase phase) {
		
		checkInput (input, 4);
		
		Shape shape = input.getShape();
		
		int batchSize = shape.numberOfExamples();
		int area = shape.height() * shape.width();
		
		Variable output = new Variable (new Shape (new int [] { batchSize, outputs, 1, 1 }));
		
		float [] x = input.getData();
		float [] y = output.getData();
		
		for (int i = 0; i < batchSize * inputs; ++i) {
			float sum = 0;
			for (int p = i * area; p < (i + 1) * area; ++p)
				sum += x[p];
			y[i] = sum / area;
		}
		
		retain (input, phase);
		
		return output;
	}
	
	public Variable computeGradient (Variable gradient, ModelGradient modelGradient) {
		
		Variable input = getRetainedInput ();
		
		Shape shape = input.getShape();
		
		int batchSize = shape.numberOfExamples();
		int area = shape.height() * shape.width();
		
		checkGradient (gradient, new Shape (new int [] { batchSize, outputs, 1, 1 }));
		
		Variable inputGradient = new Variable (shape.copy());
		
		float [] dy = gradient.getData();
		float [] dx = inputGradient.getData();
		
		for (int i = 0; i < batchSize * inputs; ++i) {
			float delta = dy[i] / area;
			for (int p = i * area; p < (i + 1) * area; ++p)
				dx[p] = delta;
		}
		
		return inputGradient;
	}
}
