package uk.ac.imperial.lsds.mobilenet.kernel;

import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;

/*
 * Counts the examples whose arg-max logit matches the label. Ties resolve
 * to the lowest class index.
 */
public class Accuracy {
	
	public static int compute (Variable logits, int [] labels) {
		
		Shape s = logits.getShape();
		
		if (s.dimensions() != 2 || s.get(0) != labels.length)
			throw new IllegalArgumentException (String.format("error: cannot score logits shaped %s against %d labels", s, labels.length));
		
		int batchSize = s.get(0);
		int classes = s.get(1);
		
		float [] x = logits.getData();
		
		int correct = 0;
		
		for (int n = 0; n < batchSize; ++n) {
			
			int offset = n * classes;
			int best = 0;
			
			for (int k = 1; k < classes; ++k)
				if (x[offset + k] > x[offset + best])
					best = k;
			
			if (best == labels[n])
				correct ++;
		}
		
		return correct;
	}
}
