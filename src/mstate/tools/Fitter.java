package mstate.tools;

import java.io.IOException;
import java.io.UncheckedIOException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;

import mstate.cluster.ModKMeans;
import mstate.model.ClusterCenters;
import mstate.model.ContinuousRecording;
import mstate.util.Constants;
import mstate.util.IO;
import mstate.util.Utils;

/** Fits microstate maps on a recording and writes maps and GEV. */
public class Fitter extends MicrostateTool {

	private int n_clusters = 4;
	private int n_init = Constants.DEFAULT_N_INIT;
	private int max_iter = Constants.DEFAULT_MAX_ITER;
	private double tol = Constants.DEFAULT_TOL;
	private Long seed = null;
	private boolean gfp = false;
	private boolean reorder = false;

	public Fitter() {}

	@Override
	public String getName() {
		return "fit";
	}

	@Override
	protected void addOptions(Options options) {
		options.addOption(Option.builder("k").longOpt("n-clusters").hasArg()
				.desc("Number of microstates (default 4).").build());
		options.addOption(Option.builder("n").longOpt("n-init").hasArg()
				.desc("Number of restarts (default "+Constants.DEFAULT_N_INIT+").").build());
		options.addOption(Option.builder("x").longOpt("max-iter").hasArg()
				.desc("Maximum iterations of a single run (default "+Constants.DEFAULT_MAX_ITER+").").build());
		options.addOption(Option.builder("e").longOpt("tol").hasArg()
				.desc("Relative convergence tolerance (default "+Constants.DEFAULT_TOL+").").build());
		options.addOption(Option.builder("S").longOpt("random-seed").hasArg()
				.desc("Random seed for this run.").build());
		options.addOption(Option.builder("t").longOpt("threads").hasArg()
				.desc("Restarts run in parallel (default 1).").build());
		options.addOption(Option.builder("g").longOpt("gfp")
				.desc("Fit on global field power peaks only.").build());
		options.addOption(Option.builder("r").longOpt("reorder")
				.desc("Reorder maps after the built-in reference template.").build());
	}

	@Override
	protected void configureTool(CommandLine cmd) {
		if(cmd.hasOption("k")) n_clusters = Integer.parseInt(cmd.getOptionValue("k"));
		if(cmd.hasOption("n")) n_init = Integer.parseInt(cmd.getOptionValue("n"));
		if(cmd.hasOption("x")) max_iter = Integer.parseInt(cmd.getOptionValue("x"));
		if(cmd.hasOption("e")) tol = Double.parseDouble(cmd.getOptionValue("e"));
		if(cmd.hasOption("S")) seed = Long.parseLong(cmd.getOptionValue("S"));
		if(cmd.hasOption("t")) THREADS = Integer.parseInt(cmd.getOptionValue("t"));
		gfp = cmd.hasOption("g");
		reorder = cmd.hasOption("r");
	}

	@Override
	public void run() {
		ContinuousRecording raw = readRecording();
		ModKMeans modK = new ModKMeans(n_clusters, n_init, max_iter, tol, seed);
		modK.fit(raw, gfp, THREADS);
		if(reorder) modK.smartReorder();

		ClusterCenters centers = modK.getClusterCenters();
		try {
			IO.write(out_prefix+".centers.txt", centers.toArray(), null);
			IO.write(out_prefix+".gev.txt", String.valueOf(modK.getGEV()));
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		myLogger.info("["+Utils.getSystemTime()+"] "+modK+", GEV "+modK.getGEV());
	}
}
