package uk.ac.imperial.lsds.mobilenet.model;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/*
 * One gradient buffer per trainable model variable. Kernels accumulate 
 * into these buffers during the gradient pass; the optimiser consumes 
 * them and the training loop zeroes them before the next batch.
 */
public class ModelGradient {
	
	private Model parent;
	
	private Map<String, float []> gradients;
	
	public ModelGradient (Model parent) {
		
		this.parent = parent;
		
		gradients = new LinkedHashMap<String, float []>();
		
		for (Variable v: parent.getTrainableVariables())
			gradients.put(v.getName(), new float [v.capacity()]);
	}
	
	public Model getParent () {
		return parent;
	}
	
	public float [] getGradient (Variable variable) {
		
		float [] g = gradients.get(variable.getName());
		if (g == null)
			throw new IllegalArgumentException (String.format("error: variable %s is not trainable", variable.getName()));
		return g;
	}
	
	public void zero () {
		for (float [] g: gradients.values())
			Arrays.fill(g, 0F);
	}
	
	public float computeChecksum () {
		float checksum = 0F;
		for (float [] g: gradients.values())
			for (int i = 0; i < g.length; ++i)
				checksum += g[i];
		return checksum;
	}
}
