package mstate.cluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotFiniteNumberException;
import org.apache.commons.math3.exception.NullArgumentException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.log4j.Logger;

import com.google.common.collect.Range;

import mstate.model.AveragedResponse;
import mstate.model.ClusterCenters;
import mstate.model.ContinuousRecording;
import mstate.model.EpochedRecording;
import mstate.model.FitResult;
import mstate.model.FitState;
import mstate.model.NotFittedException;
import mstate.model.TimeSeries;
import mstate.util.Algebra;
import mstate.util.Constants;
import mstate.util.Executor;
import mstate.util.Intervals;

/**
 * Modified K-means microstate clustering.
 * <p>
 * {@code fit} runs the single-run solver {@code nInit} times and keeps the
 * run with the highest global explained variance (GEV); ties go to the
 * earliest restart. Every restart draws its initial maps from its own seed,
 * derived from the base seed and the restart index, so the result does not
 * depend on how restarts are scheduled across threads.
 * <p>
 * The fitted centers, GEV and fit state are published together as one
 * immutable snapshot. {@link #reorder(int[])} and {@link #smartReorder()}
 * swap in a row-permuted snapshot; callers running them concurrently with
 * {@code predict} or {@code transform} on the same model must synchronize.
 */
public class ModKMeans {

	private final static Logger myLogger = Logger.getLogger(ModKMeans.class);

	private final int nClusters;
	private final int nInit;
	private final ModKMeansSolver solver;
	private final Long seed;
	private final RandomGenerator rg;

	private volatile Fitted fitted = null;

	private final static class Fitted {
		private final ClusterCenters centers;
		private final double gev;
		private final FitState state;

		private Fitted(ClusterCenters centers, double gev, FitState state) {
			this.centers = centers;
			this.gev = gev;
			this.state = state;
		}
	}

	public ModKMeans(int nClusters) {
		this(nClusters, Constants.DEFAULT_N_INIT, Constants.DEFAULT_MAX_ITER,
				Constants.DEFAULT_TOL, (Long) null);
	}

	/**
	 * @param seed base seed, or {@code null} for a nondeterministic fit
	 */
	public ModKMeans(int nClusters,
			int nInit,
			int maxIter,
			double tol,
			Long seed) {
		this(nClusters, nInit, maxIter, tol, seed, null);
	}

	/**
	 * @param rg generator the per-restart seeds are drawn from, in restart
	 * order, at each fit
	 */
	public ModKMeans(int nClusters,
			int nInit,
			int maxIter,
			double tol,
			RandomGenerator rg) {
		this(nClusters, nInit, maxIter, tol, null, rg);
		if(rg==null) throw new NullArgumentException();
	}

	private ModKMeans(int nClusters,
			int nInit,
			int maxIter,
			double tol,
			Long seed,
			RandomGenerator rg) {
		if(nInit<1) throw new NumberIsTooSmallException(nInit, 1, true);
		this.solver = new ModKMeansSolver(nClusters, maxIter, tol);
		this.nClusters = nClusters;
		this.nInit = nInit;
		this.seed = seed;
		this.rg = rg;
	}

	/** Result of one restart. */
	private final static class Restart {
		private final double gev;
		private final double[][] maps;
		private final int[] segmentation;

		private Restart(double gev, double[][] maps, int[] segmentation) {
			this.gev = gev;
			this.maps = maps;
			this.segmentation = segmentation;
		}
	}

	/**
	 * Fits the maps on a bare (channels, samples) matrix, taken as continuous
	 * data without channel names.
	 *
	 * @param nJobs number of restarts run in parallel
	 */
	public FitResult fit(double[][] data, int nJobs) {
		checkData(data);
		FitResult result = select(data, nJobs, null);
		this.fitted = new Fitted(result.getCenters(), result.getGEV(), FitState.CONTINUOUS);
		return result;
	}

	public FitResult fit(double[][] data) {
		return fit(data, 1);
	}

	/** Fits on the whole source, rejecting bad intervals of continuous data. */
	public FitResult fit(TimeSeries inst, boolean gfp, int nJobs) {
		return fit(inst, null, null, true, gfp, nJobs);
	}

	/**
	 * Fits on a source and keeps the result as this model's state.
	 *
	 * @param start first sample used (continuous data only), {@code null} for 0
	 * @param stop end sample, exclusive (continuous data only), {@code null}
	 * for the last
	 * @param rejectBad leave bad intervals of continuous data out of the fit
	 * @param gfp fit on global field power peaks only
	 */
	public FitResult fit(TimeSeries inst,
			Integer start,
			Integer stop,
			boolean rejectBad,
			boolean gfp,
			int nJobs) {
		if(inst==null) throw new NullArgumentException();
		if(!inst.getBadChannels().isEmpty())
			myLogger.warn("Bad channels are present in the recording "+inst.getBadChannels()
					+". They will still be used to compute microstate topographies. "
					+ "Consider dropping or interpolating them before fitting.");

		double[][] data;
		switch(inst.kind()) {
		case CONTINUOUS:
			data = ((ContinuousRecording) inst).data(start, stop, rejectBad);
			if(gfp) data = PeakExtractor.extract(data);
			break;
		case EPOCHED:
			EpochedRecording epochs = (EpochedRecording) inst;
			if(gfp) {
				double[][][] peaks = new double[epochs.nEpochs()][][];
				for(int i=0; i<peaks.length; i++)
					peaks[i] = PeakExtractor.extract(epochs.epoch(i));
				data = Algebra.hstack(peaks);
			} else {
				data = epochs.data();
			}
			break;
		case AVERAGED:
			data = inst.data();
			if(gfp) data = PeakExtractor.extract(data);
			break;
		default:
			throw new IllegalArgumentException("Unsupported source "+inst.kind());
		}

		checkData(data);
		String[] names = inst.getChannelNames().toArray(new String[inst.nChannels()]);
		FitResult result = select(data, nJobs, names);
		this.fitted = new Fitted(result.getCenters(), result.getGEV(), inst.kind());
		myLogger.info("Fitted "+nClusters+" microstates on "+data[0].length
				+" samples ("+inst.kind()+"), GEV = "+result.getGEV());
		return result;
	}

	private void checkData(double[][] data) {
		if(data==null) throw new NullArgumentException();
		if(data.length<2) throw new NumberIsTooSmallException(data.length, 2, true);
		int n = data[0].length;
		for(double[] row : data) {
			if(row.length!=n) throw new DimensionMismatchException(row.length, n);
			for(double v : row)
				if(Double.isNaN(v) || Double.isInfinite(v)) throw new NotFiniteNumberException(v);
		}
		if(n<nClusters) throw new DimensionMismatchException(n, nClusters);
	}

	private long[] restartSeeds() {
		if(rg!=null) return Constants.drawSeeds(rg, nInit);
		long base = seed==null ? Constants.nondeterministicSeed() : seed;
		return Constants.deriveSeeds(base, nInit);
	}

	private Restart runOnce(double[][] data, long restartSeed) {
		ModKMeansSolver.Run run = solver.run(data, Constants.randomGenerator(restartSeed));
		double[][] maps = run.getMaps();
		int[] segmentation = ModKMeansSolver.segment(maps, data);
		double gev = ModKMeansSolver.gev(maps, data, segmentation);
		return new Restart(gev, maps, segmentation);
	}

	private FitResult select(final double[][] data, int nJobs, String[] channelNames) {
		if(nJobs<1) throw new NumberIsTooSmallException(nJobs, 1, true);
		final long[] seeds = restartSeeds();
		Restart[] runs = new Restart[nInit];

		if(nJobs==1) {
			for(int i=0; i<nInit; i++) runs[i] = runOnce(data, seeds[i]);
		} else {
			ExecutorService executor = Executor.newThreadPool(Math.min(nJobs, nInit));
			List<Future<Restart>> futures = new ArrayList<Future<Restart>>(nInit);
			try {
				for(int i=0; i<nInit; i++) {
					futures.add(executor.submit(new Callable<Restart>() {
						private int i;

						@Override
						public Restart call() {
							return runOnce(data, seeds[i]);
						}

						public Callable<Restart> init(int i) {
							this.i = i;
							return this;
						}
					}.init(i)));
				}
			} finally {
				Executor.shutdown(executor);
			}
			for(int i=0; i<nInit; i++) {
				try {
					runs[i] = futures.get(i).get();
				} catch (ExecutionException e) {
					throw new RuntimeException("Restart "+i+" failed.", e.getCause());
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new RuntimeException("Interrupted while collecting restart "+i+".", e);
				}
			}
		}

		double[] gevs = new double[nInit];
		for(int i=0; i<nInit; i++) {
			gevs[i] = runs[i].gev;
			myLogger.debug("Restart "+i+", GEV = "+gevs[i]);
		}
		Restart r = runs[best(gevs)];
		return new FitResult(new ClusterCenters(r.maps, channelNames), r.gev, r.segmentation);
	}

	/** Index of the strictly highest GEV; the earliest restart wins ties. */
	static int best(double[] gevs) {
		int best = 0;
		for(int i=1; i<gevs.length; i++)
			if(gevs[i]>gevs[best]) best = i;
		return best;
	}

	private Fitted fitted() {
		Fitted f = this.fitted;
		if(f==null) throw new NotFittedException(getClass().getSimpleName());
		return f;
	}

	/**
	 * Microstate labels of a continuous recording or averaged response:
	 * 1..K for the fitted maps, 0 for unlabeled samples.
	 *
	 * @param rejectBad segment each run of good samples on its own; ignored
	 * for averaged responses
	 */
	public int[] predict(TimeSeries inst,
			int halfWindow,
			double factor,
			double crit,
			boolean rejectBad) {
		Fitted f = fitted();
		if(inst==null) throw new NullArgumentException();
		Segmentation segmentation = new Segmentation(halfWindow, factor, crit);
		double[][] maps = f.centers.toArray();
		checkChannels(inst.nChannels(), f.centers);
		switch(inst.kind()) {
		case CONTINUOUS:
			ContinuousRecording raw = (ContinuousRecording) inst;
			double[][] data = raw.data();
			if(rejectBad && !raw.getBadIntervals().isEmpty()) {
				List<Range<Integer>> retained = raw.retainedRanges(0, raw.nSamples());
				return segmentation.segment(data, maps, retained);
			}
			return segmentation.segment(data, maps);
		case AVERAGED:
			return segmentation.segment(((AveragedResponse) inst).data(), maps);
		default:
			throw new IllegalArgumentException("Prediction needs a continuous recording "
					+ "or an averaged response, got "+inst.kind());
		}
	}

	public int[] predict(TimeSeries inst) {
		return predict(inst, Constants.DEFAULT_HALF_WINDOW,
				Constants.DEFAULT_FACTOR, Constants.DEFAULT_CRIT, true);
	}

	/**
	 * Labels for a bare matrix, with {@code excluded} closed-open sample
	 * ranges left unlabeled. {@code excluded} may be empty.
	 */
	public int[] predict(double[][] data,
			int halfWindow,
			double factor,
			double crit,
			List<Range<Integer>> excluded) {
		Fitted f = fitted();
		if(data==null) throw new NullArgumentException();
		checkChannels(data.length, f.centers);
		Segmentation segmentation = new Segmentation(halfWindow, factor, crit);
		double[][] maps = f.centers.toArray();
		if(excluded==null || excluded.isEmpty()) return segmentation.segment(data, maps);
		return segmentation.segment(data, maps,
				Intervals.retained(0, data[0].length, excluded));
	}

	/**
	 * Absolute spatial correlation of every sample with its closest map:
	 * {@code double[1][T]} for continuous and averaged data,
	 * {@code double[nEpochs][nTimes]} for epochs.
	 */
	public double[][] transform(TimeSeries inst) {
		Fitted f = fitted();
		if(inst==null) throw new NullArgumentException();
		checkChannels(inst.nChannels(), f.centers);
		double[] distances = distances(inst.data(), f.centers.toArray());
		int[] bounds = inst.trialBoundaries();
		int n = inst.nSamples()/bounds.length;
		double[][] out = new double[bounds.length][n];
		for(int i=0; i<bounds.length; i++)
			System.arraycopy(distances, bounds[i], out[i], 0, n);
		return out;
	}

	public double[] transform(double[][] data) {
		Fitted f = fitted();
		if(data==null) throw new NullArgumentException();
		checkChannels(data.length, f.centers);
		return distances(data, f.centers.toArray());
	}

	/** Max absolute correlation of each sample (column of {@code data}) with the rows of {@code maps}. */
	public static double[] distances(double[][] data, double[][] maps) {
		int nSamples = data.length==0 ? 0 : data[0].length;
		double[] d = new double[nSamples];
		double[][] repeated = new double[data.length][nSamples];
		for(double[] map : maps) {
			for(int c=0; c<data.length; c++)
				Arrays.fill(repeated[c], map[c]);
			double[] corr = Correlation.corrVectors(data, repeated);
			for(int t=0; t<nSamples; t++)
				d[t] = Math.max(d[t], Math.abs(corr[t]));
		}
		return d;
	}

	private static void checkChannels(int nChannels, ClusterCenters centers) {
		if(nChannels!=centers.nChannels())
			throw new DimensionMismatchException(nChannels, centers.nChannels());
	}

	/**
	 * Reorders the fitted maps: map {@code i} becomes the former map
	 * {@code order[i]}. GEV and fit state are kept.
	 *
	 * @throws mstate.model.InvalidOrderException if {@code order} is not a
	 * permutation of {@code [0, K)}
	 */
	public ModKMeans reorder(int[] order) {
		Fitted f = fitted();
		this.fitted = new Fitted(f.centers.permute(order), f.gev, f.state);
		return this;
	}

	/** Reorders the fitted maps after the built-in reference template. */
	public ModKMeans smartReorder() {
		return smartReorder(new TemplateReorderer());
	}

	/**
	 * Reorders the fitted maps after the given template. Leaves the order
	 * unchanged, with a warning, when too few channels are shared.
	 */
	public ModKMeans smartReorder(TemplateReorderer reorderer) {
		Fitted f = fitted();
		ClusterCenters reordered = reorderer.reorder(f.centers);
		if(reordered!=f.centers)
			this.fitted = new Fitted(reordered, f.gev, f.state);
		return this;
	}

	public ClusterCenters getClusterCenters() {
		return fitted().centers;
	}

	public double getGEV() {
		return fitted().gev;
	}

	public FitState getFitState() {
		Fitted f = this.fitted;
		return f==null ? FitState.UNFITTED : f.state;
	}

	public int getNClusters() {
		return nClusters;
	}

	public int getNInit() {
		return nInit;
	}

	@Override
	public String toString() {
		FitState state = getFitState();
		String s = state==FitState.UNFITTED ? "| unfitted" : "| fitted ("+state+")";
		return getClass().getSimpleName()+" | n = "+nClusters+" cluster centers "+s;
	}
}
