package uk.ac.imperial.lsds.mobilenet;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.model.Shape;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/**
 * CIFAR-10 in its binary distribution format.
 * <p>
 * Each record is one label byte followed by 3 x 32 x 32 pixel bytes (channel-major).
 * The training split is {@code data_batch_1.bin} to {@code data_batch_5.bin}, the test
 * split is {@code test_batch.bin}; both are looked up in the data directory or in its
 * {@code cifar-10-batches-bin} sub-directory.
 */
public class Dataset {
	
	private final static Logger log = LogManager.getLogger (Dataset.class);
	
	public static final int CHANNELS = 3;
	public static final int HEIGHT = 32;
	public static final int WIDTH = 32;
	
	public static final int IMAGE_SIZE = CHANNELS * HEIGHT * WIDTH;
	public static final int RECORD_SIZE = 1 + IMAGE_SIZE;
	
	public static final int NUMBER_OF_CLASSES = 10;
	
	public static final String SUBDIRECTORY = "cifar-10-batches-bin";
	
	public static final String [] TRAINING_FILES = {
		"data_batch_1.bin", "data_batch_2.bin", "data_batch_3.bin", "data_batch_4.bin", "data_batch_5.bin"
	};
	
	public static final String [] TEST_FILES = { "test_batch.bin" };
	
	private static final float [] MEAN = { 0.4914F, 0.4822F, 0.4465F };
	private static final float [] STD  = { 0.2023F, 0.1994F, 0.2010F };
	
	/* Random crop padding */
	public static final int PADDING = 4;
	
	private Phase phase;
	
	private byte [] images;
	
	private int [] labels;
	
	private int size;
	
	public Dataset (Phase phase, byte [] images, int [] labels) {
		
		if (images.length != labels.length * IMAGE_SIZE)
			throw new IllegalArgumentException (String.format("error: %d bytes do not hold %d images", images.length, labels.length));
		
		this.phase = phase;
		this.images = images;
		this.labels = labels;
		this.size = labels.length;
	}
	
	public static Dataset load (String dataPath, Phase phase) throws IOException {
		
		File directory = resolve (dataPath, phase);
		
		String [] filenames = (phase == Phase.TRAIN) ? TRAINING_FILES : TEST_FILES;
		
		List<byte []> parts = new ArrayList<byte []>();
		int records = 0;
		
		for (String filename: filenames) {
			byte [] part = read (new File (directory, filename));
			parts.add (part);
			records += part.length / RECORD_SIZE;
		}
		
		byte [] images = new byte [records * IMAGE_SIZE];
		int [] labels = new int [records];
		
		int n = 0;
		for (byte [] part: parts) {
			for (int offset = 0; offset < part.length; offset += RECORD_SIZE, ++n) {
				labels[n] = part[offset] & 0xFF;
				if (labels[n] >= NUMBER_OF_CLASSES)
					throw new IOException (String.format("error: invalid label %d in record %d", labels[n], n));
				System.arraycopy(part, offset + 1, images, n * IMAGE_SIZE, IMAGE_SIZE);
			}
		}
		
		log.info(String.format("Loaded %d %s examples from %s", records, phase, directory));
		
		return new Dataset (phase, images, labels);
	}
	
	private static File resolve (String dataPath, Phase phase) throws FileNotFoundException {
		
		String first = ((phase == Phase.TRAIN) ? TRAINING_FILES : TEST_FILES)[0];
		
		File directory = new File (dataPath, SUBDIRECTORY);
		if (new File (directory, first).exists())
			return directory;
		
		directory = new File (dataPath);
		if (new File (directory, first).exists())
			return directory;
		
		throw new FileNotFoundException (String.format("error: CIFAR-10 file %s not found in %s or %s", first, dataPath, SUBDIRECTORY));
	}
	
	private static byte [] read (File file) throws IOException {
		
		if (! file.exists())
			throw new FileNotFoundException (String.format("error: file %s not found", file));
		
		RandomAccessFile f = new RandomAccessFile (file, "r");
		try {
			FileChannel channel = f.getChannel();
			
			long length = channel.size();
			
			if (length == 0 || (length % RECORD_SIZE) != 0 || length > Integer.MAX_VALUE)
				throw new IOException (String.format("error: file %s is not a sequence of %d-byte records", file, RECORD_SIZE));
			
			ByteBuffer buffer = ByteBuffer.allocate ((int) length);
			while (buffer.hasRemaining())
				if (channel.read(buffer) < 0)
					throw new IOException (String.format("error: unexpected end of file %s", file));
			
			return buffer.array();
			
		} finally {
			f.close();
		}
	}
	
	public Phase getPhase () {
		return phase;
	}
	
	public int size () {
		return size;
	}
	
	public int getLabel (int ndx) {
		return labels[ndx];
	}
	
	public int numberOfBatches (int batchSize) {
		return (size + batchSize - 1) / batchSize;
	}
	
	/* Example order for one epoch */
	public int [] order (boolean shuffle, RandomGenerator random) {
		
		int [] indices = new int [size];
		for (int i = 0; i < size; ++i)
			indices[i] = i;
		
		if (shuffle)
			random.shuffle(indices);
		
		return indices;
	}
	
	/*
	 * Assembles the examples indices[from..to) into a batch. With augmentation, each
	 * image is randomly cropped from its zero-padded version and randomly mirrored.
	 */
	public Batch getBatch (int [] indices, int from, int to, boolean augment, RandomGenerator random) {
		
		if (from < 0 || to > indices.length || from >= to)
			throw new IllegalArgumentException (String.format("error: invalid batch range [%d, %d)", from, to));
		
		int batchSize = to - from;
		
		Variable examples = new Variable (new Shape (new int [] { batchSize, CHANNELS, HEIGHT, WIDTH }));
		int [] batchLabels = new int [batchSize];
		
		float [] x = examples.getData();
		
		for (int n = 0; n < batchSize; ++n) {
			
			int ndx = indices[from + n];
			
			batchLabels[n] = labels[ndx];
			
			int heightOffset = 0, widthOffset = 0;
			boolean mirror = false;
			
			if (augment) {
				heightOffset = random.nextInt (2 * PADDING + 1) - PADDING;
				 widthOffset = random.nextInt (2 * PADDING + 1) - PADDING;
				mirror = random.nextBoolean ();
			}
			
			int input = ndx * IMAGE_SIZE;
			int output = n * IMAGE_SIZE;
			
			for (int c = 0; c < CHANNELS; ++c) {
				for (int h = 0; h < HEIGHT; ++h) {
					for (int w = 0; w < WIDTH; ++w) {
						
						int ih = h + heightOffset;
						int iw = w + widthOffset;
						
						float pixel = 0;
						if (ih >= 0 && ih < HEIGHT && iw >= 0 && iw < WIDTH)
							pixel = (images[input + (c * HEIGHT + ih) * WIDTH + iw] & 0xFF) / 255F;
						
						int ow = mirror ? (WIDTH - 1 - w) : w;
						x[output + (c * HEIGHT + h) * WIDTH + ow] = (pixel - MEAN[c]) / STD[c];
					}
				}
			}
		}
		
		return new Batch (examples, batchLabels);
	}
}
