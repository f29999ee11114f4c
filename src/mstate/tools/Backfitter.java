package mstate.tools;

import java.io.IOException;
import java.io.UncheckedIOException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.math3.exception.DimensionMismatchException;

import mstate.cluster.Segmentation;
import mstate.model.ContinuousRecording;
import mstate.util.Constants;
import mstate.util.IO;
import mstate.util.Utils;

/** Labels every sample of a recording with the closest of a set of fitted maps. */
public class Backfitter extends MicrostateTool {

	private String centers_file = null;
	private int half_window = Constants.DEFAULT_HALF_WINDOW;
	private double factor = Constants.DEFAULT_FACTOR;
	private double criterion = Constants.DEFAULT_CRIT;

	public Backfitter() {}

	@Override
	public String getName() {
		return "backfit";
	}

	@Override
	protected void addOptions(Options options) {
		options.addOption(Option.builder("C").longOpt("centers").hasArg().required()
				.desc("Fitted maps, one map per line.").build());
		options.addOption(Option.builder("w").longOpt("half-window").hasArg()
				.desc("Half window size of the label smoothing (default "+Constants.DEFAULT_HALF_WINDOW+").").build());
		options.addOption(Option.builder("f").longOpt("factor").hasArg()
				.desc("Smoothing factor, 0 for none (default "+Constants.DEFAULT_FACTOR+").").build());
		options.addOption(Option.builder("c").longOpt("criterion").hasArg()
				.desc("Convergence criterion (default "+Constants.DEFAULT_CRIT+").").build());
	}

	@Override
	protected void configureTool(CommandLine cmd) {
		centers_file = cmd.getOptionValue("C");
		if(cmd.hasOption("w")) half_window = Integer.parseInt(cmd.getOptionValue("w"));
		if(cmd.hasOption("f")) factor = Double.parseDouble(cmd.getOptionValue("f"));
		if(cmd.hasOption("c")) criterion = Double.parseDouble(cmd.getOptionValue("c"));
	}

	@Override
	public void run() {
		ContinuousRecording raw = readRecording();
		double[][] maps = readCenters(centers_file);
		if(maps.length==0 || maps[0].length!=raw.nChannels())
			throw new DimensionMismatchException(maps.length==0 ? 0 : maps[0].length, raw.nChannels());
		Segmentation segmentation = new Segmentation(half_window, factor, criterion);
		int[] labels = raw.getBadIntervals().isEmpty() ?
				segmentation.segment(raw.data(), maps) :
				segmentation.segment(raw.data(), maps, raw.retainedRanges(0, raw.nSamples()));
		try {
			IO.write(out_prefix+".labels.txt", labels);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		myLogger.info("["+Utils.getSystemTime()+"] Labelled "+labels.length+" samples.");
	}
}
