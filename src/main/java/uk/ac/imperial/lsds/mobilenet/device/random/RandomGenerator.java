package uk.ac.imperial.lsds.mobilenet.device.random;

import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Seeded source of randomness. Each network and each data loader owns
 * its own instance; there is no process-wide generator.
 */
public class RandomGenerator {
	
	private final static Logger log = LogManager.getLogger (RandomGenerator.class);
	
	private Random random;
	
	public RandomGenerator (long seed) {
		random = new Random (seed);
		log.debug(String.format("Random generator seeded with %d", seed));
	}
	
	public void randomGaussianFill (float [] buffer, int count, float mean, float std) {
		
		if (count > buffer.length)
			throw new IllegalArgumentException ("error: random fill exceeds buffer capacity");
		
		for (int i = 0; i < count; ++i)
			buffer[i] = (float) (random.nextGaussian() * std + mean);
	}
	
	public float nextFloat () {
		return random.nextFloat();
	}
	
	public int nextInt (int bound) {
		return random.nextInt(bound);
	}
	
	public boolean nextBoolean () {
		return random.nextBoolean();
	}
	
	/* Fisher-Yates shuffle */
	public void shuffle (int [] array) {
		for (int i = array.length - 1; i > 0; --i) {
			int j = random.nextInt(i + 1);
			int t = array[i];
			array[i] = array[j];
			array[j] = t;
		}
	}
}
