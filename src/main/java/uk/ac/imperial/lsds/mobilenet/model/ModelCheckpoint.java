package uk.ac.imperial.lsds.mobilenet.model;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Persists a flat name-to-variable mapping. The file layout is (little-endian):
 * 
 * int magic, int version, int count, followed by `count` entries of
 * 
 * int name length, name bytes (UTF-8), int rank, `rank` x int dimensions, floats
 */
public class ModelCheckpoint {
	
	private final static Logger log = LogManager.getLogger (ModelCheckpoint.class);
	
	private static final int MAGIC = 0x4D4E5633; /* "MNV3" */
	private static final int VERSION = 1;
	
	public static void store (Map<String, Variable> state, File file) throws IOException {
		
		int bytes = 12;
		for (Map.Entry<String, Variable> entry: state.entrySet()) {
			Variable v = entry.getValue();
			bytes += 4 + entry.getKey().getBytes(StandardCharsets.UTF_8).length;
			bytes += 4 + 4 * v.getShape().dimensions();
			bytes += 4 * v.capacity();
		}
		
		ByteBuffer buffer = ByteBuffer.allocate(bytes).order(ByteOrder.LITTLE_ENDIAN);
		
		buffer.putInt(MAGIC);
		buffer.putInt(VERSION);
		buffer.putInt(state.size());
		
		for (Map.Entry<String, Variable> entry: state.entrySet()) {
			
			byte [] name = entry.getKey().getBytes(StandardCharsets.UTF_8);
			buffer.putInt(name.length);
			buffer.put(name);
			
			Variable v = entry.getValue();
			int [] dimensions = v.getShape().array();
			buffer.putInt(dimensions.length);
			for (int d: dimensions)
				buffer.putInt(d);
			
			float [] data = v.getData();
			for (int i = 0; i < v.capacity(); ++i)
				buffer.putFloat(data[i]);
		}
		
		buffer.flip();
		
		RandomAccessFile f = new RandomAccessFile (file, "rw");
		try {
			FileChannel channel = f.getChannel();
			channel.truncate(0);
			while (buffer.hasRemaining())
				channel.write(buffer);
			channel.force(true);
		} finally {
			f.close();
		}
		
		log.debug(String.format("Stored %d variables (%d bytes) to %s", state.size(), bytes, file));
	}
	
	public static Map<String, Variable> load (File file) throws IOException {
		
		ByteBuffer buffer;
		
		RandomAccessFile f = new RandomAccessFile (file, "r");
		try {
			FileChannel channel = f.getChannel();
			
			long size = channel.size();
			if (size > Integer.MAX_VALUE)
				throw new IOException (String.format("error: checkpoint %s is too large", file));
			
			buffer = ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
			while (buffer.hasRemaining()) {
				if (channel.read(buffer) < 0)
					break;
			}
			buffer.flip();
		} finally {
			f.close();
		}
		
		try {
			if (buffer.getInt() != MAGIC)
				throw new IOException (String.format("error: %s is not a model checkpoint", file));
			
			int version = buffer.getInt();
			if (version != VERSION)
				throw new IOException (String.format("error: unsupported checkpoint version %d in %s", version, file));
			
			int count = buffer.getInt();
			if (count < 0)
				throw new IOException (String.format("error: invalid variable count %d in %s", count, file));
			
			Map<String, Variable> state = new LinkedHashMap<String, Variable>();
			
			for (int n = 0; n < count; ++n) {
				
				byte [] name = new byte [checkLength (buffer.getInt(), buffer.remaining(), "name length", file)];
				buffer.get(name);
				
				int [] dimensions = new int [checkLength (buffer.getInt(), buffer.remaining() / 4, "rank", file)];
				long elements = 1;
				for (int i = 0; i < dimensions.length; ++i) {
					dimensions[i] = buffer.getInt();
					if (dimensions[i] < 1)
						throw new IOException (String.format("error: invalid dimension %d in %s", dimensions[i], file));
					elements *= dimensions[i];
					if (elements > buffer.remaining() / 4)
						throw new IOException (String.format("error: checkpoint %s is truncated", file));
				}
				
				Variable v = new Variable (new String (name, StandardCharsets.UTF_8), new Shape (dimensions));
				float [] data = v.getData();
				for (int i = 0; i < v.capacity(); ++i)
					data[i] = buffer.getFloat();
				
				state.put(v.getName(), v);
			}
			
			log.debug(String.format("Loaded %d variables from %s", state.size(), file));
			
			return state;
			
		} catch (BufferUnderflowException e) {
			throw new IOException (String.format("error: checkpoint %s is truncated", file), e);
		}
	}
	
	private static int checkLength (int length, int limit, String what, File file) throws IOException {
		
		if (length < 0 || length > limit)
			throw new IOException (String.format("error: invalid %s %d in %s", what, length, file));
		
		return length;
	}
}
