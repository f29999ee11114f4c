package mstate.tools;

import java.io.IOException;
import java.io.UncheckedIOException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.math3.exception.DimensionMismatchException;

import mstate.cluster.ModKMeans;
import mstate.model.ContinuousRecording;
import mstate.util.IO;

/** Writes, per sample, the absolute spatial correlation with the closest map. */
public class Transformer extends MicrostateTool {

	private String centers_file = null;

	public Transformer() {}

	@Override
	public String getName() {
		return "transform";
	}

	@Override
	protected void addOptions(Options options) {
		options.addOption(Option.builder("C").longOpt("centers").hasArg().required()
				.desc("Fitted maps, one map per line.").build());
	}

	@Override
	protected void configureTool(CommandLine cmd) {
		centers_file = cmd.getOptionValue("C");
	}

	@Override
	public void run() {
		ContinuousRecording raw = readRecording();
		double[][] maps = readCenters(centers_file);
		if(maps.length==0 || maps[0].length!=raw.nChannels())
			throw new DimensionMismatchException(maps.length==0 ? 0 : maps[0].length, raw.nChannels());
		double[] distances = ModKMeans.distances(raw.data(), maps);
		try {
			IO.write(out_prefix+".transform.txt", new double[][]{distances}, null);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
