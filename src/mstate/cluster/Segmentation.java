package mstate.cluster;

import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.log4j.Logger;

import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;

import mstate.util.Algebra;
import mstate.util.Constants;

/**
 * Competitive back-fitting of fixed microstate maps onto new data, with
 * optional temporal smoothing. Labels are 1-based; 0 marks samples left
 * unlabeled (the truncated first and last segments, excluded samples and
 * pieces too short to smooth).
 * <p>
 * Each smoothing pass relabels all samples at once from the labels of the
 * previous pass rather than sweeping sample by sample.
 */
public class Segmentation {

	private final static Logger myLogger = Logger.getLogger(Segmentation.class);

	private final int halfWindow;
	private final double factor;
	private final double crit;
	private final int maxIter;

	public Segmentation() {
		this(Constants.DEFAULT_HALF_WINDOW,
				Constants.DEFAULT_FACTOR,
				Constants.DEFAULT_CRIT);
	}

	public Segmentation(int halfWindow, double factor, double crit) {
		this(halfWindow, factor, crit, Constants.SEGMENT_MAX_ITER);
	}

	/**
	 * @param halfWindow samples on each side of the smoothing window
	 * @param factor weight of the window label count; 0 disables smoothing
	 * @param crit relative change of unexplained variance that ends the loop
	 * @param maxIter cap on smoothing passes
	 */
	public Segmentation(int halfWindow, double factor, double crit, int maxIter) {
		if(halfWindow<0) throw new NotPositiveException(halfWindow);
		if(factor<0) throw new NotPositiveException(factor);
		if(crit<=0) throw new NotStrictlyPositiveException(crit);
		if(maxIter<1) throw new NotStrictlyPositiveException(maxIter);
		this.halfWindow = halfWindow;
		this.factor = factor;
		this.crit = crit;
		this.maxIter = maxIter;
	}

	/** Labels for every sample of one contiguous (channels, samples) block. */
	public int[] segment(double[][] data, double[][] maps) {
		int nChannels = data.length;
		if(maps.length==0) throw new NotStrictlyPositiveException(0);
		if(maps[0].length!=nChannels)
			throw new DimensionMismatchException(maps[0].length, nChannels);
		int nSamples = data[0].length;
		if(nSamples==0) return new int[0];
		int nStates = maps.length;

		double[][] x = Algebra.copy(data);
		double[][] s = Algebra.copy(maps);
		int flat = 0;
		for(double[] row : x) if(!scale(row)) flat++;
		if(flat>0) myLogger.warn(flat+" channels have zero variance and are left unscaled.");
		flat = 0;
		for(double[] row : s) if(!scale(row)) flat++;
		if(flat>0) myLogger.warn(flat+" maps have zero variance and are left unscaled.");

		double[] vvar = new double[nSamples];
		for(int t=0; t<nSamples; t++)
			for(int c=0; c<nChannels; c++) vvar[t] += x[c][t]*x[c][t];
		// proj2: squared projection on the map direction, so that
		// vvar-proj2 is the variance the map leaves unexplained (>= 0)
		double[][] activation = new double[nStates][nSamples];
		double[][] proj2 = new double[nStates][nSamples];
		ModKMeansSolver.activate(s, x, activation);
		for(int k=0; k<nStates; k++) {
			double n2 = Algebra.dot(s[k], s[k]);
			for(int t=0; t<nSamples; t++) {
				double p = activation[k][t];
				proj2[k][t] = n2==0 ? 0 : p*p/n2;
			}
		}

		int[] labels = new int[nSamples];
		ModKMeansSolver.assign(activation, labels);
		double norm = nSamples*(nChannels-1.0);
		double e0 = unexplained(vvar, proj2, labels)/norm;

		if(e0>0) {
			double prev = 0;
			double[][] score = new double[nStates][nSamples];
			boolean converged = false;
			for(int iter=0; iter<maxIter; iter++) {
				int[][] nb = windowCounts(labels, nStates, halfWindow);
				for(int k=0; k<nStates; k++)
					for(int t=0; t<nSamples; t++)
						score[k][t] = (vvar[t]-proj2[k][t])/(2*e0*(nChannels-1))-factor*nb[k][t];
				for(int t=0; t<nSamples; t++) {
					int best = 0;
					for(int k=1; k<nStates; k++)
						if(score[k][t]<score[best][t]) best = k;
					labels[t] = best;
				}
				double e = unexplained(vvar, proj2, labels)/norm;
				if(Math.abs(e-prev)<=Math.abs(crit*e)) {
					converged = true;
					break;
				}
				prev = e;
			}
			if(!converged)
				myLogger.warn("Segmentation did not converge after "+maxIter+" iterations.");
		}

		for(int t=0; t<nSamples; t++) labels[t]++;
		unlabelEdges(labels);
		return labels;
	}

	/**
	 * Labels for a recording with excluded samples. Each retained range (any
	 * bound type, bounded on both ends) is
	 * segmented on its own and spliced back at its offset; excluded samples
	 * and ranges shorter than the smoothing window stay 0.
	 */
	public int[] segment(double[][] data, double[][] maps, List<Range<Integer>> retained) {
		int nSamples = data[0].length;
		int[] labels = new int[nSamples];
		int minLength = 2*halfWindow+1;
		for(Range<Integer> r : retained) {
			r = r.canonical(DiscreteDomain.integers());
			if(r.isEmpty()) continue;
			int from = r.lowerEndpoint(), to = r.upperEndpoint();
			if(to-from<minLength) {
				myLogger.debug("Segment ["+from+", "+to+") is shorter than the smoothing window; left unlabeled.");
				continue;
			}
			int[] piece = segment(Algebra.columns(data, from, to), maps);
			System.arraycopy(piece, 0, labels, from, piece.length);
		}
		return labels;
	}

	/**
	 * {@code counts[k][t]}: samples labelled {@code k} within
	 * {@code [t-h, t+h]}, clipped to the sequence.
	 */
	static int[][] windowCounts(int[] labels, int nStates, int h) {
		int n = labels.length;
		int[][] counts = new int[nStates][n];
		int[] prefix = new int[n+1];
		for(int k=0; k<nStates; k++) {
			for(int t=0; t<n; t++)
				prefix[t+1] = prefix[t]+(labels[t]==k ? 1 : 0);
			for(int t=0; t<n; t++) {
				int lo = Math.max(0, t-h), hi = Math.min(n, t+h+1);
				counts[k][t] = prefix[hi]-prefix[lo];
			}
		}
		return counts;
	}

	/** Zeroes the leading run of the first label and the trailing run of the last. */
	static void unlabelEdges(int[] labels) {
		int n = labels.length;
		if(n==0) return;
		int i = 0;
		int first = labels[i];
		while(labels[i]==first && i<n-1) {
			labels[i] = 0;
			i++;
		}
		i = n-1;
		int last = labels[i];
		while(labels[i]==last && i>0) {
			labels[i] = 0;
			i--;
		}
	}

	private static double unexplained(double[] vvar, double[][] proj2, int[] labels) {
		double e = 0;
		for(int t=0; t<labels.length; t++) e += vvar[t]-proj2[labels[t]][t];
		return e;
	}

	// divides by the population std; false for a flat row, which is kept as is
	private static boolean scale(double[] row) {
		double sd = Algebra.std(row);
		if(sd==0 || Double.isNaN(sd)) return false;
		for(int i=0; i<row.length; i++) row[i] /= sd;
		return true;
	}

	public int getHalfWindow() {
		return halfWindow;
	}

	public double getFactor() {
		return factor;
	}

	public double getCrit() {
		return crit;
	}
}
