package mstate.tools;

import java.io.IOException;
import java.io.UncheckedIOException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;

import com.google.common.collect.RangeSet;

import mstate.model.ContinuousRecording;
import mstate.util.Executor;
import mstate.util.IO;
import mstate.util.Intervals;

/** Options and input handling shared by the microstate tools. */
public abstract class MicrostateTool extends Executor {

	protected String in_file = null;
	protected String out_prefix = null;
	protected boolean named = false;
	protected double sfreq = 1.0;
	protected RangeSet<Integer> bad_intervals = null;

	@Override
	protected Options options() {
		Options options = new Options();
		options.addOption(Option.builder("i").longOpt("input").hasArg().required()
				.desc("Input matrix, one channel per line (plain or .gz).").build());
		options.addOption(Option.builder("o").longOpt("prefix").hasArg().required()
				.desc("Output file prefix.").build());
		options.addOption(Option.builder("N").longOpt("names")
				.desc("First column of the input holds channel names.").build());
		options.addOption(Option.builder("s").longOpt("sfreq").hasArg()
				.desc("Sampling frequency in Hz (default 1).").build());
		options.addOption(Option.builder("b").longOpt("bad-intervals").hasArg()
				.desc("Bad sample intervals as start-end[,start-end...], end exclusive.").build());
		addOptions(options);
		return options;
	}

	protected abstract void addOptions(Options options);

	@Override
	protected void configure(CommandLine cmd) {
		in_file = cmd.getOptionValue("i");
		out_prefix = cmd.getOptionValue("o");
		named = cmd.hasOption("N");
		if(cmd.hasOption("s")) sfreq = Double.parseDouble(cmd.getOptionValue("s"));
		if(cmd.hasOption("b")) bad_intervals = Intervals.parse(cmd.getOptionValue("b"));
		configureTool(cmd);
	}

	protected abstract void configureTool(CommandLine cmd);

	protected ContinuousRecording readRecording() {
		try {
			IO.Table table = IO.read(in_file, named);
			double[][] data = table.getValues();
			String[] names = table.getNames();
			if(names==null) {
				names = new String[data.length];
				for(int i=0; i<names.length; i++) names[i] = "ch"+(i+1);
			}
			myLogger.info("Read "+data.length+" channels x "
					+(data.length==0 ? 0 : data[0].length)+" samples from "+in_file);
			return new ContinuousRecording(data, names, sfreq, null, bad_intervals);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	protected static double[][] readCenters(String file) {
		try {
			return IO.read(file, false).getValues();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
