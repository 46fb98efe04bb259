package uk.ac.imperial.lsds.mobilenet.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.SolverConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.LearningRateDecayPolicy;

public class GradientDescentOptimiserTest {
	
	@Test
	public void testCosineSchedule () {
		
		GradientDescentOptimiser optimiser = new GradientDescentOptimiser (new SolverConf ().setBaseLearningRate (0.1F), 10);
		
		assertEquals(0.1F, optimiser.getLearningRate (0), 1e-7F);
		assertEquals(0.05F, optimiser.getLearningRate (5), 1e-7F);
		assertEquals(0.1F * (float) ((1 + Math.cos(Math.PI * 3 / 10)) / 2), optimiser.getLearningRate (3), 1e-7F);
		
		float previous = Float.MAX_VALUE;
		for (int epoch = 0; epoch < 10; ++epoch) {
			float rate = optimiser.getLearningRate (epoch);
			assertTrue(rate < previous && rate > 0);
			previous = rate;
		}
	}
	
	@Test
	public void testFixedSchedule () {
		
		SolverConf conf = new SolverConf ().setBaseLearningRate (0.05F).setLearningRateDecayPolicy (LearningRateDecayPolicy.FIXED);
		
		GradientDescentOptimiser optimiser = new GradientDescentOptimiser (conf, 4);
		
		for (int epoch = 0; epoch < 4; ++epoch)
			assertEquals(0.05F, optimiser.getLearningRate (epoch), 0F);
	}
	
	@Test
	public void testMomentumAndWeightDecay () {
		
		Model model = new Model (new RandomGenerator (1L));
		Variable p = model.register (new Variable ("p", new Shape (new int [] { 1 })), true);
		model.finalise ();
		
		p.getData()[0] = 1F;
		
		SolverConf conf = new SolverConf ().setMomentum (0.9F).setWeightDecay (0.1F);
		GradientDescentOptimiser optimiser = new GradientDescentOptimiser (conf, 1);
		
		ModelGradient gradient = new ModelGradient (model);
		
		/* Step 1: d = 0.5 + 0.1 * 1 = 0.6, buffer = 0.6, p = 1 - 0.1 * 0.6 = 0.94 */
		gradient.getGradient(p)[0] = 0.5F;
		optimiser.apply (model, gradient, 0.1F);
		assertEquals(0.94F, p.getData()[0], 1e-6F);
		
		/* Step 2: d = 0.5 + 0.094 = 0.594, buffer = 0.54 + 0.594 = 1.134, p = 0.94 - 0.1134 */
		optimiser.apply (model, gradient, 0.1F);
		assertEquals(0.8266F, p.getData()[0], 1e-6F);
		
		/* A reset forgets the momentum buffer */
		optimiser.reset ();
		optimiser.apply (model, gradient, 0.1F);
		assertEquals(0.8266F - 0.1F * (0.5F + 0.1F * 0.8266F), p.getData()[0], 1e-6F);
	}
	
	@Test
	public void testInvalidEpochs () {
		
		assertThrows(IllegalArgumentException.class, () -> new GradientDescentOptimiser (new SolverConf (), 0));
	}
}
