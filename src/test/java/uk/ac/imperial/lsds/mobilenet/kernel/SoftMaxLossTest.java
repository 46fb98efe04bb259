package uk.ac.imperial.lsds.mobilenet.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;

public class SoftMaxLossTest {
	
	private static Variable logits (float [] values, int classes) {
		return new Variable (null, new Shape (new int [] { values.length / classes, classes }), values);
	}
	
	@Test
	public void testUniformLogits () {
		
		SoftMaxLoss loss = new SoftMaxLoss ();
		
		float value = loss.compute (logits (new float [] { 0, 0, 0, 0, 5, 5, 5, 5 }, 4), new int [] { 1, 3 });
		
		assertEquals((float) Math.log(4), value, 1e-6F);
	}
	
	@Test
	public void testLargeLogitsAreStable () {
		
		SoftMaxLoss loss = new SoftMaxLoss ();
		
		float value = loss.compute (logits (new float [] { 1000, 0, -1000 }, 3), new int [] { 0 });
		
		assertTrue(Float.isFinite(value));
		assertEquals(0F, value, 1e-6F);
	}
	
	@Test
	public void testGradient () {
		
		SoftMaxLoss loss = new SoftMaxLoss ();
		
		float [] x = { 0.5F, -1F, 2F, 0.1F, 0.3F, -0.7F };
		int [] labels = { 2, 0 };
		
		loss.compute (logits (x.clone(), 3), labels);
		float [] dx = loss.computeGradient ().getData();
		
		float delta = 1e-3F;
		for (int i = 0; i < x.length; ++i) {
			
			float [] plus = x.clone();
			plus[i] += delta;
			float [] minus = x.clone();
			minus[i] -= delta;
			
			double numerical = (new SoftMaxLoss ().compute (logits (plus, 3), labels) 
					- new SoftMaxLoss ().compute (logits (minus, 3), labels)) / (2 * delta);
			
			assertEquals(numerical, dx[i], 1e-3);
		}
		
		/* Each row of the gradient sums to 0 */
		assertEquals(0F, dx[0] + dx[1] + dx[2], 1e-6F);
		assertEquals(0F, dx[3] + dx[4] + dx[5], 1e-6F);
	}
	
	@Test
	public void testInvalidLabels () {
		
		SoftMaxLoss loss = new SoftMaxLoss ();
		
		assertThrows(IllegalArgumentException.class, () -> loss.compute (logits (new float [] { 0, 0, 0 }, 3), new int [] { 3 }));
		assertThrows(IllegalArgumentException.class, () -> loss.compute (logits (new float [] { 0, 0, 0 }, 3), new int [] { 0, 1 }));
		assertThrows(IllegalStateException.class, () -> new SoftMaxLoss ().computeGradient ());
	}
	
	@Test
	public void testAccuracy () {
		
		Variable x = logits (new float [] { 
				0.1F, 0.9F, 0.0F, 
				0.5F, 0.5F, 0.2F, 
				0.0F, 0.0F, 1.0F }, 3);
		
		/* Row 1 ties between classes 0 and 1 and resolves to 0 */
		assertEquals(3, Accuracy.compute (x, new int [] { 1, 0, 2 }));
		assertEquals(1, Accuracy.compute (x, new int [] { 1, 1, 0 }));
	}
}
