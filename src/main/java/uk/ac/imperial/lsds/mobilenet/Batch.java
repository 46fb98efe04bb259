package uk.ac.imperial.lsds.mobilenet;

import uk.ac.imperial.lsds.mobilenet.model.Variable;

/*
 * Normalised images [B, 3, 32, 32] and their labels.
 */
public class Batch {
	
	private Variable examples;
	
	private int [] labels;
	
	public Batch (Variable examples, int [] labels) {
		
		if (examples.getShape().numberOfExamples() != labels.length)
			throw new IllegalArgumentException (String.format("error: %d labels for a batch shaped %s", labels.length, examples.getShape()));
		
		this.examples = examples;
		this.labels = labels;
	}
	
	public Variable getExamples () {
		return examples;
	}
	
	public int [] getLabels () {
		return labels;
	}
	
	public int size () {
		return labels.length;
	}
}
