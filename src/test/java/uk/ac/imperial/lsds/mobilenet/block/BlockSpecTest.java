package uk.ac.imperial.lsds.mobilenet.block;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import uk.ac.imperial.lsds.mobilenet.types.ActivationMode;

public class BlockSpecTest {
	
	@Test
	public void testChannelsAreScaled () {
		
		BlockSpec spec = new BlockSpec (16, 3, 72, 24, false, "RE", 2, 1, 0.25);
		
		assertEquals(8, spec.getInputChannels());
		assertEquals(24, spec.getExpandedChannels());
		assertEquals(8, spec.getOutChannels());
		
		assertEquals(3, spec.getKernel());
		assertEquals(2, spec.getStride());
		assertEquals(1, spec.getDilation());
		assertEquals(ActivationMode.RELU, spec.getActivation());
		assertFalse(spec.useGate());
	}
	
	@Test
	public void testUnitWidthKeepsNominalChannels () {
		
		BlockSpec spec = new BlockSpec (40, 5, 240, 40, true, "HS", 1, 1, 1.0);
		
		assertEquals(40, spec.getInputChannels());
		assertEquals(240, spec.getExpandedChannels());
		assertEquals(40, spec.getOutChannels());
		assertEquals(ActivationMode.HARD_SWISH, spec.getActivation());
		assertTrue(spec.useGate());
	}
	
	@Test
	public void testShortcut () {
		
		assertTrue (new BlockSpec (24, 3,  88, 24, false, "RE", 1, 1, 1.0).hasShortcut());
		
		/* Equal channels but strided */
		assertFalse(new BlockSpec (16, 3,  16, 16, true,  "RE", 2, 1, 1.0).hasShortcut());
		
		/* Stride 1 but channels change */
		assertFalse(new BlockSpec (40, 5, 120, 48, true,  "HS", 1, 1, 1.0).hasShortcut());
	}
	
	@Test
	public void testInvalidArguments () {
		
		assertThrows(IllegalArgumentException.class, () -> new BlockSpec (16, 3, 16, 16, true, "RE", 3, 1, 1.0));
		assertThrows(IllegalArgumentException.class, () -> new BlockSpec (16, 3, 16, 16, true, "RE", 0, 1, 1.0));
		assertThrows(IllegalArgumentException.class, () -> new BlockSpec (16, 4, 16, 16, true, "RE", 1, 1, 1.0));
		assertThrows(IllegalArgumentException.class, () -> new BlockSpec (16, 3, 16, 16, true, "RE", 1, 0, 1.0));
		assertThrows(IllegalArgumentException.class, () -> new BlockSpec (16, 3, 16, 16, true, "RE", 1, 1, 0.0));
		assertThrows(IllegalArgumentException.class, () -> new BlockSpec (16, 3, 16, 16, true, "XX", 1, 1, 1.0));
	}
}
