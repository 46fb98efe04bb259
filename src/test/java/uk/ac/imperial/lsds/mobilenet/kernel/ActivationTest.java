package uk.ac.imperial.lsds.mobilenet.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.ActivationMode;

public class ActivationTest {
	
	@Test
	public void testRelu () {
		
		assertEquals(0F, Activation.apply (ActivationMode.RELU, -2F), 0F);
		assertEquals(3F, Activation.apply (ActivationMode.RELU,  3F), 0F);
	}
	
	@Test
	public void testHardSwish () {
		
		assertEquals(0F, Activation.apply (ActivationMode.HARD_SWISH, -4F), 0F);
		assertEquals(0F, Activation.apply (ActivationMode.HARD_SWISH,  0F), 0F);
		assertEquals(4F, Activation.apply (ActivationMode.HARD_SWISH,  4F), 0F);
		assertEquals(2F / 3F, Activation.apply (ActivationMode.HARD_SWISH, 1F), 1e-6F);
	}
	
	@Test
	public void testHardSigmoid () {
		
		assertEquals(0F,   Activation.apply (ActivationMode.HARD_SIGMOID, -3F), 0F);
		assertEquals(0.5F, Activation.apply (ActivationMode.HARD_SIGMOID,  0F), 0F);
		assertEquals(1F,   Activation.apply (ActivationMode.HARD_SIGMOID,  5F), 0F);
		
		for (float x = -10F; x <= 10F; x += 0.25F) {
			float y = Activation.apply (ActivationMode.HARD_SIGMOID, x);
			assertTrue(y >= 0F && y <= 1F);
		}
	}
	
	@Test
	public void testGradient () {
		
		for (ActivationMode mode: ActivationMode.values()) {
			
			Model model = new Model (new RandomGenerator (1L));
			
			Activation activation = new Activation (mode);
			activation.setup ("act", 3, model);
			model.finalise ();
			
			/* Keep values away from the kinks at -3, 0 and 3 */
			Variable input = new Variable (new Shape (new int [] { 2, 3, 2, 2 }));
			float [] x = input.getData();
			for (int i = 0; i < x.length; ++i)
				x[i] = -5.5F + 0.45F * i;
			for (int i = 0; i < x.length; ++i)
				if (Math.abs(x[i]) < 0.05F || Math.abs(Math.abs(x[i]) - 3F) < 0.05F)
					x[i] += 0.2F;
			
			GradientCheck.check (activation, model, input);
		}
	}
}
