package uk.ac.imperial.lsds.mobilenet.cli;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Options {
	
	private Map<String, Option> opts;
	
	private String program;
	
	public Options (String program, IConfiguration... configurations) {
		
		opts = new LinkedHashMap<String, Option>();
		
		for (IConfiguration conf: configurations)
			for (Option opt: conf.getOptions())
				addOption (opt);
		
		this.program = program;
	}
	
	public Options addOption (String opt, String description, Class<?> type, String defaultValue) {
		
		return addOption (new Option (opt, description, false, type, defaultValue));
	}
	
	public Options addOption (Option option) {
		String key = option.getOpt();
		if (opts.containsKey(key))
			throw new IllegalStateException (String.format("error: option \"%s\" is already set", key));
		opts.put(key, option);
		return this;
	}
	
	public Option find (String opt) {
		
		return opts.get(opt);
	}
	
	public Collection<Option> values () {
		
		return Collections.unmodifiableCollection(opts.values());
	}
	
	public int size () {
		
		return opts.size();
	}
	
	/**
	 * Check if required options are set.
	 * Fails on the first missing option.
	 */
	public void check () {
		
		for (Map.Entry<String, Option> entry: opts.entrySet()) {
			
			String key = entry.getKey();
			Option opt = entry.getValue();
			
			if (opt.isRequired() && ! opt.isInitialised())
				throw new IllegalArgumentException (String.format("error: option \"%s\" not set", key));
		}
	}
	
	@Override
	public String toString () {
		
		StringBuilder s = new StringBuilder(String.format("Usage: java %s [options]\n", program));
		
		s.append("\nOptions:\n\n");
		
		int L1 = 0, L2 = 0;
		
		for (Option opt: opts.values()) {
			
			if (L1 < opt.getOpt().length())         
				L1 = opt.getOpt().length();
			
			if (L2 < opt.getDescription().length()) 
				L2 = opt.getDescription().length();
		}
		
		String fmt = String.format("   %%-%ds : %%-%ds (type: %%-7s default value: %%s)\n", L1, L2); /* %-{L1}s: %-{L2}s ... */
		
		for (Option opt: opts.values())
			s.append(String.format(fmt, opt.getOpt(), opt.getDescription(), opt.getTypeString(), opt.getDefaultValue()));
		
		return s.toString();
	}
}
