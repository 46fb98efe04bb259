package uk.ac.imperial.lsds.mobilenet.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uk.ac.imperial.lsds.mobilenet.types.Phase;

/*
 * Ordered log of measurements taken in one phase.
 */
public class MeasurementQueue {
	
	private final static Logger log = LogManager.getLogger (MeasurementQueue.class);
	
	private Phase phase;
	
	private List<Measurement> measurements;
	
	public MeasurementQueue (Phase phase) {
		
		this.phase = phase;
		
		measurements = new ArrayList<Measurement>();
	}
	
	public Phase getPhase () {
		return phase;
	}
	
	public void add (Measurement m) {
		
		measurements.add (m);
		
		if (phase == Phase.TRAIN)
			log.info(m);
		else
			log.info(String.format("Validation - Loss: %.3f, Acc: %.3f%%", m.getLoss(), m.getAcc()));
	}
	
	public int size () {
		return measurements.size();
	}
	
	public Measurement get (int ndx) {
		return measurements.get(ndx);
	}
	
	public Measurement last () {
		return measurements.isEmpty() ? null : measurements.get(measurements.size() - 1);
	}
	
	public List<Measurement> list () {
		return Collections.unmodifiableList(measurements);
	}
}
