package uk.ac.imperial.lsds.mobilenet.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Random;

import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/*
 * Compares the analytic gradients of a kernel against central differences
 * of the scalar objective L = sum(y * r), for a fixed random projection r.
 */
public class GradientCheck {
	
	private static final float DELTA = 1e-3F;
	
	private static final double TOLERANCE = 2e-2;
	
	public static Variable random (Shape shape, long seed) {
		
		Random random = new Random (seed);
		
		Variable v = new Variable (shape);
		float [] data = v.getData();
		for (int i = 0; i < data.length; ++i)
			data[i] = (float) random.nextGaussian();
		return v;
	}
	
	/* Replaces every trainable variable with N(0, 0.5^2) values */
	public static void randomise (Model model, long seed) {
		
		Random random = new Random (seed);
		
		for (Variable v: model.getTrainableVariables()) {
			float [] data = v.getData();
			for (int i = 0; i < data.length; ++i)
				data[i] = (float) (0.5 * random.nextGaussian());
		}
	}
	
	private static double objective (IKernel kernel, Variable input, float [] projection) {
		
		float [] y = kernel.compute (input, Phase.TRAIN).getData();
		
		double sum = 0;
		for (int i = 0; i < y.length; ++i)
			sum += (double) y[i] * projection[i];
		return sum;
	}
	
	public static void check (IKernel kernel, Model model, Variable input) {
		
		Variable output = kernel.compute (input, Phase.TRAIN);
		
		Variable projection = random (output.getShape().copy(), 7L);
		float [] r = projection.getData();
		
		ModelGradient gradient = new ModelGradient (model);
		gradient.zero ();
		
		/* Analytic gradients of the last forward pass */
		kernel.compute (input, Phase.TRAIN);
		float [] dx = kernel.computeGradient (projection, gradient).getData();
		
		float [] x = input.getData();
		for (int i = 0; i < x.length; ++i)
			compare (String.format("input[%d]", i), dx[i], numerical (kernel, input, r, x, i));
		
		for (Variable v: model.getTrainableVariables()) {
			
			float [] p = v.getData();
			float [] dp = gradient.getGradient(v);
			
			for (int i = 0; i < p.length; ++i)
				compare (String.format("%s[%d]", v.getName(), i), dp[i], numerical (kernel, input, r, p, i));
		}
	}
	
	private static double numerical (IKernel kernel, Variable input, float [] r, float [] values, int ndx) {
		
		float saved = values[ndx];
		
		values[ndx] = saved + DELTA;
		double plus = objective (kernel, input, r);
		
		values[ndx] = saved - DELTA;
		double minus = objective (kernel, input, r);
		
		values[ndx] = saved;
		
		return (plus - minus) / (2 * DELTA);
	}
	
	private static void compare (String what, double analytic, double numerical) {
		
		double scale = Math.max(1, Math.max(Math.abs(analytic), Math.abs(numerical)));
		assertEquals(numerical, analytic, TOLERANCE * scale, what);
	}
}
