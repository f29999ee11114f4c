package mstate.cluster;

import java.util.Arrays;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.log4j.Logger;

import mstate.util.Algebra;

/**
 * One run of the modified (polarity invariant) K-means. A map and its
 * negation are the same microstate: samples go to the map with the largest
 * absolute activation and each map is rebuilt from its samples weighted by
 * their signed activation.
 */
public class ModKMeansSolver {

	private final static Logger myLogger = Logger.getLogger(ModKMeansSolver.class);

	private final int nClusters;
	private final int maxIter;
	private final double tol;

	public ModKMeansSolver(int nClusters, int maxIter, double tol) {
		if(nClusters<2) throw new NumberIsTooSmallException(nClusters, 2, true);
		if(maxIter<1) throw new NumberIsTooSmallException(maxIter, 1, true);
		if(tol<=0) throw new NotStrictlyPositiveException(tol);
		this.nClusters = nClusters;
		this.maxIter = maxIter;
		this.tol = tol;
	}

	/** Maps found by a single run along with how the run ended. */
	public static class Run {
		private final double[][] maps;
		private final int iterations;
		private final boolean converged;

		private Run(double[][] maps, int iterations, boolean converged) {
			this.maps = maps;
			this.iterations = iterations;
			this.converged = converged;
		}

		public double[][] getMaps() {
			return maps;
		}

		public int getIterations() {
			return iterations;
		}

		public boolean isConverged() {
			return converged;
		}
	}

	/**
	 * @param data (channels, samples) matrix, read only
	 * @param rg source of the initial sample draw
	 */
	public Run run(double[][] data, RandomGenerator rg) {
		int nChannels = data.length;
		if(nChannels<2) throw new NumberIsTooSmallException(nChannels, 2, true);
		int nSamples = data[0].length;
		if(nSamples<nClusters) throw new DimensionMismatchException(nSamples, nClusters);

		double dataSumSq = Algebra.sumSq(data);

		int[] init = new RandomDataGenerator(rg).nextPermutation(nSamples, nClusters);
		double[][] maps = new double[nClusters][];
		for(int k=0; k<nClusters; k++) {
			maps[k] = Algebra.column(data, init[k]);
			normalize(maps[k]);
		}

		double prevResidual = Double.POSITIVE_INFINITY;
		double[][] activation = new double[nClusters][nSamples];
		int[] segmentation = new int[nSamples];
		for(int iter=1; iter<=maxIter; iter++) {
			activate(maps, data, activation);
			assign(activation, segmentation);

			for(int k=0; k<nClusters; k++) {
				double[] map = maps[k];
				Arrays.fill(map, 0);
				int n = 0;
				for(int t=0; t<nSamples; t++) {
					if(segmentation[t]!=k) continue;
					n++;
					double a = activation[k][t];
					for(int c=0; c<nChannels; c++) map[c] += data[c][t]*a;
				}
				if(n==0) {
					myLogger.warn("Microstate "+k+" is never activated; its map is set to zero.");
					continue;
				}
				if(!normalize(map))
					myLogger.warn("Microstate "+k+" has a zero-norm map; its map is set to zero.");
			}

			double actSumSq = 0;
			for(int t=0; t<nSamples; t++) {
				double p = Algebra.dotColumn(maps[segmentation[t]], data, t);
				actSumSq += p*p;
			}
			double residual = Math.abs(dataSumSq-actSumSq)/(nSamples*(nChannels-1.0));

			if(prevResidual-residual<=tol*residual) {
				myLogger.debug("Converged at "+iter+" iterations.");
				return new Run(maps, iter, true);
			}
			prevResidual = residual;
		}
		myLogger.warn("Modified K-means algorithm failed to converge after "+maxIter+" iterations.");
		return new Run(maps, maxIter, false);
	}

	/** Activation {@code maps . data} into {@code out} (K, T). */
	static void activate(double[][] maps, double[][] data, double[][] out) {
		int nSamples = data[0].length;
		for(int k=0; k<maps.length; k++)
			for(int t=0; t<nSamples; t++)
				out[k][t] = Algebra.dotColumn(maps[k], data, t);
	}

	/** Index of the largest absolute activation per sample, first on ties. */
	static void assign(double[][] activation, int[] out) {
		for(int t=0; t<out.length; t++) {
			int best = 0;
			double max = Math.abs(activation[0][t]);
			for(int k=1; k<activation.length; k++) {
				double a = Math.abs(activation[k][t]);
				if(a>max) {
					max = a;
					best = k;
				}
			}
			out[t] = best;
		}
	}

	/** Polarity-invariant nearest map of every sample. */
	public static int[] segment(double[][] maps, double[][] data) {
		int nSamples = data[0].length;
		double[][] activation = new double[maps.length][nSamples];
		activate(maps, data, activation);
		int[] segmentation = new int[nSamples];
		assign(activation, segmentation);
		return segmentation;
	}

	/**
	 * Global explained variance: squared correlation of each sample with its
	 * assigned map, weighted by the sample's power, over the total power.
	 */
	public static double gev(double[][] maps, double[][] data, int[] segmentation) {
		int nSamples = segmentation.length;
		double[][] assigned = new double[data.length][nSamples];
		for(int t=0; t<nSamples; t++) {
			double[] map = maps[segmentation[t]];
			for(int c=0; c<data.length; c++) assigned[c][t] = map[c];
		}
		double[] mapCorr = Correlation.corrVectors(data, assigned);
		double explained = 0;
		for(int t=0; t<nSamples; t++) {
			double r2 = mapCorr[t]*mapCorr[t];
			for(int c=0; c<data.length; c++) explained += data[c][t]*data[c][t]*r2;
		}
		double total = Algebra.sumSq(data);
		return total==0 ? 0 : explained/total;
	}

	// in place; false (and a zero vector) when the norm is zero
	private static boolean normalize(double[] v) {
		double norm = Algebra.norm(v);
		if(norm==0 || Double.isNaN(norm)) {
			Arrays.fill(v, 0);
			return false;
		}
		for(int i=0; i<v.length; i++) v[i] /= norm;
		return true;
	}

	public int getNClusters() {
		return nClusters;
	}

	public int getMaxIter() {
		return maxIter;
	}

	public double getTol() {
		return tol;
	}
}
