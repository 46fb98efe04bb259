package uk.ac.imperial.lsds.mobilenet;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.device.random.RandomGenerator;
import uk.ac.imperial.lsds.mobilenet.kernel.Accuracy;
import uk.ac.imperial.lsds.mobilenet.kernel.GradientDescentOptimiser;
import uk.ac.imperial.lsds.mobilenet.kernel.SoftMaxLoss;
import uk.ac.imperial.lsds.mobilenet.kernel.conf.SolverConf;
import uk.ac.imperial.lsds.mobilenet.model.ModelCheckpoint;
import uk.ac.imperial.lsds.mobilenet.model.ModelGradient;
import uk.ac.imperial.lsds.mobilenet.model.Variable;
import uk.ac.imperial.lsds.mobilenet.result.Measurement;
import uk.ac.imperial.lsds.mobilenet.result.MeasurementQueue;
import uk.ac.imperial.lsds.mobilenet.result.ResultWriter;
import uk.ac.imperial.lsds.mobilenet.result.Results;
import uk.ac.imperial.lsds.mobilenet.types.Phase;

/*
 * Trains a network, keeps the checkpoint with the best validation accuracy,
 * tests a fresh network restored from that checkpoint and writes the result
 * record.
 * 
 * Each training step runs forward pass, loss, gradient pass and optimiser 
 * update strictly in this order.
 */
public class ExecutionContext {
	
	private final static Logger log = LogManager.getLogger (ExecutionContext.class);
	
	private ModelConf modelConf;
	private SolverConf solverConf;
	private SystemConf systemConf;
	
	private MobileNetV3 network;
	
	private GradientDescentOptimiser optimiser;
	
	private RandomGenerator random;
	
	private MeasurementQueue trainingLog, validationLog;
	
	private double bestAccuracy;
	
	public ExecutionContext (ModelConf modelConf, SolverConf solverConf, SystemConf systemConf) {
		
		if (systemConf.getBatchSize() < 1)
			throw new IllegalArgumentException ("error: batch size must be greater than 0");
		
		if (systemConf.getDisplayInterval() < 1)
			throw new IllegalArgumentException ("error: log interval must be greater than 0");
		
		this.modelConf = modelConf;
		this.solverConf = solverConf;
		this.systemConf = systemConf;
		
		network = new MobileNetV3 (modelConf);
		
		optimiser = new GradientDescentOptimiser (solverConf, systemConf.numberOfEpochs());
		
		/* Shuffling and augmentation draw from their own stream */
		random = new RandomGenerator (modelConf.getRandomSeed() + 1);
		
		trainingLog = new MeasurementQueue (Phase.TRAIN);
		validationLog = new MeasurementQueue (Phase.CHECK);
		
		bestAccuracy = -1;
	}
	
	public MobileNetV3 getNetwork () {
		return network;
	}
	
	public MeasurementQueue getTrainingLog () {
		return trainingLog;
	}
	
	public MeasurementQueue getValidationLog () {
		return validationLog;
	}
	
	public double getBestAccuracy () {
		return Math.max(bestAccuracy, 0);
	}
	
	/*
	 * Trains for the configured number of epochs, validating after each one.
	 * The first checkpoint is written after the first epoch; later ones only
	 * when validation accuracy improves.
	 */
	public double train (Dataset training, Dataset validation) throws IOException {
		
		File checkpoint = systemConf.getCheckpointFile();
		
		int batchSize = systemConf.getBatchSize();
		
		ModelGradient gradient = new ModelGradient (network.getModel());
		SoftMaxLoss criterion = new SoftMaxLoss ();
		
		int batches = training.numberOfBatches (batchSize);
		
		/* Batch normalisation cannot train on a single example */
		if (batches > 1 && (training.size() % batchSize) == 1) {
			log.warn(String.format("Drop the last training batch of every epoch (1 out of %d examples)", training.size()));
			batches --;
		}
		
		for (int epoch = 0; epoch < systemConf.numberOfEpochs(); ++epoch) {
			
			float rate = optimiser.getLearningRate (epoch);
			
			int [] order = training.order (true, random);
			
			double loss = 0;
			int correct = 0, total = 0;
			
			for (int b = 0; b < batches; ++b) {
				
				int from = b * batchSize;
				int to = Math.min(from + batchSize, training.size());
				
				Batch batch = training.getBatch (order, from, to, systemConf.useAugmentation(), random);
				
				gradient.zero ();
				
				Variable logits = network.forward (batch.getExamples(), Phase.TRAIN);
				
				loss += criterion.compute (logits, batch.getLabels());
				
				network.computeGradient (criterion.computeGradient(), gradient);
				
				optimiser.apply (network.getModel(), gradient, rate);
				
				correct += Accuracy.compute (logits, batch.getLabels());
				total += batch.size();
				
				if (b % systemConf.getDisplayInterval() == 0)
					trainingLog.add (new Measurement (epoch, b, loss / (b + 1), 100D * correct / total, rate));
			}
			
			Measurement m = evaluate (network, validation);
			validationLog.add (new Measurement (epoch, m.getLoss(), m.getAcc()));
			
			if (m.getAcc() > bestAccuracy) {
				
				bestAccuracy = m.getAcc();
				
				ModelCheckpoint.store (network.getModel().getState(), checkpoint);
				
				log.info(String.format("New best validation accuracy %.3f%%; checkpoint saved to %s", bestAccuracy, checkpoint));
			}
		}
		
		return getBestAccuracy ();
	}
	
	/* Mean batch loss and accuracy (%) over a dataset, in the test phase */
	public Measurement evaluate (MobileNetV3 net, Dataset dataset) {
		
		int batchSize = systemConf.getBatchSize();
		
		SoftMaxLoss criterion = new SoftMaxLoss ();
		
		int [] order = dataset.order (false, null);
		
		double loss = 0;
		int correct = 0;
		
		int batches = dataset.numberOfBatches (batchSize);
		
		for (int b = 0; b < batches; ++b) {
			
			int from = b * batchSize;
			int to = Math.min(from + batchSize, dataset.size());
			
			Batch batch = dataset.getBatch (order, from, to, false, null);
			
			Variable logits = net.forward (batch.getExamples(), Phase.CHECK);
			
			loss += criterion.compute (logits, batch.getLabels());
			correct += Accuracy.compute (logits, batch.getLabels());
		}
		
		Measurement m = new Measurement ();
		m.setLoss (loss / batches);
		m.setAcc (100D * correct / dataset.size());
		return m;
	}
	
	/* Restores the best checkpoint into a fresh network and evaluates it */
	public Measurement test (Dataset dataset) throws IOException {
		
		MobileNetV3 fresh = new MobileNetV3 (modelConf);
		
		fresh.getModel().load (ModelCheckpoint.load (systemConf.getCheckpointFile()));
		
		Measurement m = evaluate (fresh, dataset);
		
		log.info(String.format("Test - Loss: %.3f, Acc: %.3f%%", m.getLoss(), m.getAcc()));
		
		return m;
	}
	
	public Map<String, Object> getConfiguration () {
		
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		
		map.putAll (systemConf.toMap());
		map.putAll (modelConf.toMap());
		map.putAll (solverConf.toMap());
		
		return map;
	}
	
	/*
	 * Full run: train and validate on the training and test splits of the
	 * data directory, test the best checkpoint and write the result record.
	 */
	public Results run () throws IOException {
		
		File directory = new File (systemConf.getOutputDirectory());
		if (! directory.isDirectory() && ! directory.mkdirs())
			throw new IOException (String.format("error: cannot create output directory %s", directory));
		
		log.info(String.format("Outputs will be saved to %s", directory));
		
		Dataset training = Dataset.load (systemConf.getDataPath(), Phase.TRAIN);
		Dataset test = Dataset.load (systemConf.getDataPath(), Phase.CHECK);
		
		long start = System.nanoTime();
		
		double best = train (training, test);
		
		double elapsed = (System.nanoTime() - start) / 1e9;
		
		Measurement m = test (test);
		
		Results results = new Results (
				new Results.FinalInfo (best, m.getAcc(), elapsed, getConfiguration ()), 
				trainingLog.list(), 
				validationLog.list());
		
		new ResultWriter ().write (results, systemConf.getResultFile());
		
		log.info(String.format("Training completed. Best validation accuracy: %.2f%%", best));
		log.info(String.format("Test accuracy: %.2f%%", m.getAcc()));
		log.info(String.format("Total training time: %.2f minutes", elapsed / 60));
		
		return results;
	}
}
