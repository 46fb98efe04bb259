package uk.ac.imperial.lsds.mobilenet.kernel;

import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;

/*
 * Mean cross-entropy of the softmax of [B, K] logits against integer labels.
 * 
 * The gradient w.r.t. the logits is (softmax - onehot(label)) / B.
 */
public class SoftMaxLoss {
	
	private float [] probabilities = null;
	
	private int [] labels = null;
	
	private Shape shape = null;
	
	public float compute (Variable logits, int [] labels) {
		
		Shape s = logits.getShape();
		
		if (s.dimensions() != 2)
			throw new IllegalArgumentException (String.format("error: loss expects [batch, classes] logits but got %s", s));
		
		int batchSize = s.get(0);
		int classes = s.get(1);
		
		if (labels.length != batchSize)
			throw new IllegalArgumentException (String.format("error: %d labels for a batch of %d examples", labels.length, batchSize));
		
		float [] x = logits.getData();
		
		probabilities = new float [x.length];
		
		double loss = 0;
		
		for (int n = 0; n < batchSize; ++n) {
			
			int label = labels[n];
			if (label < 0 || label >= classes)
				throw new IllegalArgumentException (String.format("error: label %d is out of range [0, %d)", label, classes));
			
			int offset = n * classes;
			
			float max = x[offset];
			for (int k = 1; k < classes; ++k)
				max = Math.max(max, x[offset + k]);
			
			double sum = 0;
			for (int k = 0; k < classes; ++k)
				sum += Math.exp(x[offset + k] - max);
			
			for (int k = 0; k < classes; ++k)
				probabilities[offset + k] = (float) (Math.exp(x[offset + k] - max) / sum);
			
			loss -= (x[offset + label] - max) - Math.log(sum);
		}
		
		this.labels = labels;
		this.shape = s.copy();
		
		return (float) (loss / batchSize);
	}
	
	public Variable computeGradient () {
		
		if (probabilities == null)
			throw new IllegalStateException ("error: loss gradient requested before the loss was computed");
		
		int batchSize = shape.get(0);
		int classes = shape.get(1);
		
		Variable gradient = new Variable (shape.copy());
		
		float [] dx = gradient.getData();
		
		for (int n = 0; n < batchSize; ++n) {
			for (int k = 0; k < classes; ++k) {
				float target = (k == labels[n]) ? 1F : 0F;
				dx[n * classes + k] = (probabilities[n * classes + k] - target) / batchSize;
			}
		}
		
		return gradient;
	}
}
