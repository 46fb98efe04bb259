package uk.ac.imperial.lsds.mobilenet.block;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.kernel.GradientCheck;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

public class SqueezeExciteTest {
	
	@Test
	public void testSqueezeChannels () {
		
		assertEquals(8, SqueezeExcite.squeezeChannels (16));
		assertEquals(24, SqueezeExcite.squeezeChannels (96));
		assertEquals(64, SqueezeExcite.squeezeChannels (240));
		assertEquals(32, SqueezeExcite.squeezeChannels (120));
		assertEquals(144, SqueezeExcite.squeezeChannels (576));
	}
	
	@Test
	public void testVariableNames () {
		
		Model model = new Model (new RandomGenerator (1L));
		
		SqueezeExcite gate = new SqueezeExcite (8);
		gate.setup ("se", 16, model);
		
		assertEquals(new Shape (new int [] { 8, 16, 1, 1 }), model.getVariable ("se.fc1.weight").getShape());
		assertEquals(new Shape (new int [] { 8 }), model.getVariable ("se.fc1.bias").getShape());
		assertEquals(new Shape (new int [] { 16, 8, 1, 1 }), model.getVariable ("se.fc2.weight").getShape());
		assertEquals(new Shape (new int [] { 16 }), model.getVariable ("se.fc2.bias").getShape());
		
		assertEquals(5, gate.getChildren().size());
	}
	
	@Test
	public void testScaleIsBounded () {
		
		Model model = new Model (new RandomGenerator (1L));
		
		SqueezeExcite gate = new SqueezeExcite (8);
		gate.setup ("se", 16, model);
		model.finalise ();
		
		GradientCheck.randomise (model, 1L);
		
		/* Scale inputs up so that the gate saturates on both sides */
		Variable input = GradientCheck.random (new Shape (new int [] { 2, 16, 3, 3 }), 23L);
		float [] x = input.getData();
		for (int i = 0; i < x.length; ++i)
			x[i] *= 50F;
		
		Variable scale = gate.computeScale (input, Phase.CHECK);
		assertEquals(new Shape (new int [] { 2, 16, 1, 1 }), scale.getShape());
		for (float s: scale.getData())
			assertTrue(s >= 0F && s <= 1F);
		
		/* Each channel of the output is the input channel times its scale */
		Variable output = gate.compute (input, Phase.CHECK);
		float [] y = output.getData();
		float [] s = scale.getData();
		for (int plane = 0; plane < 32; ++plane)
			for (int p = 0; p < 9; ++p)
				assertEquals(x[plane * 9 + p] * s[plane], y[plane * 9 + p], 1e-4F);
	}
	
	@Test
	public void testGradient () {
		
		Model model = new Model (new RandomGenerator (3L));
		
		SqueezeExcite gate = new SqueezeExcite (8);
		gate.setup ("se", 4, model);
		model.finalise ();
		
		GradientCheck.randomise (model, 3L);
		
		GradientCheck.check (gate, model, GradientCheck.random (new Shape (new int [] { 2, 4, 3, 3 }), 29L));
	}
}
