package uk.ac.imperial.lsds.mobilenet.kernel;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.PoolConf;
import uk.ac.imperial.lsds.mobilenet.model.Model;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.Phase;
import uk.ac.imperial.lsds.mobilenet.types.PoolMethod;

public class PoolTest {
	
	private static Pool global (int channels, Model model) {
		
		Pool pool = new Pool (new PoolConf ().setMethod (PoolMethod.AVERAGE).setGlobal (true));
		pool.setup ("avgpool", channels, model);
		return pool;
	}
	
	@Test
	public void testGlobalAverage () {
		
		Model model = new Model (new RandomGenerator (1L));
		
		Pool pool = global (2, model);
		
		Variable input = new Variable (new Shape (new int [] { 1, 2, 2, 2 }));
		float [] x = input.getData();
		for (int i = 0; i < 8; ++i)
			x[i] = i;
		
		Variable output = pool.compute (input, Phase.CHECK);
		
		assertEquals(new Shape (new int [] { 1, 2, 1, 1 }), output.getShape());
		assertArrayEquals(new float [] { 1.5F, 5.5F }, output.getData(), 1e-6F);
	}
	
	@Test
	public void testGradient () {
		
		Model model = new Model (new RandomGenerator (1L));
		
		Pool pool = global (3, model);
		model.finalise ();
		
		GradientCheck.check (pool, model, GradientCheck.random (new Shape (new int [] { 2, 3, 3, 3 }), 17L));
	}
	
	@Test
	public void testOnlyGlobalAverage () {
		
		Model model = new Model (new RandomGenerator (1L));
		
		assertThrows(UnsupportedOperationException.class, 
				() -> new Pool (new PoolConf ().setMethod (PoolMethod.MAX).setGlobal (true)).setup ("pool", 3, model));
		assertThrows(UnsupportedOperationException.class, 
				() -> new Pool (new PoolConf ()).setup ("pool", 3, model));
	}
}
