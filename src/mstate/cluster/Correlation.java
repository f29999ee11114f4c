package mstate.cluster;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.log4j.Logger;

/**
 * Pearson correlation kernels. Vectors with zero variance correlate 0 with
 * everything, never NaN.
 */
public class Correlation {

	private final static Logger myLogger = Logger.getLogger(Correlation.class);

	public static double corr(double[] a, double[] b) {
		return sanitize(pearson(a, b));
	}

	/**
	 * Correlation of each column pair: element {@code j} of the result is the
	 * correlation of column {@code j} of {@code a} with column {@code j} of
	 * {@code b}, taken across rows.
	 */
	public static double[] corrVectors(double[][] a, double[][] b) {
		if(a.length!=b.length) throw new DimensionMismatchException(b.length, a.length);
		int n = a.length, m = n==0 ? 0 : a[0].length;
		if(n>0 && b[0].length!=m) throw new DimensionMismatchException(b[0].length, m);
		double[] corr = new double[m];
		double[] u = new double[n], v = new double[n];
		int degenerate = 0;
		for(int j=0; j<m; j++) {
			for(int i=0; i<n; i++) {
				u[i] = a[i][j];
				v[i] = b[i][j];
			}
			double r = pearson(u, v);
			if(!isFinite(r)) degenerate++;
			corr[j] = sanitize(r);
		}
		if(degenerate>0)
			myLogger.warn(degenerate+" of "+m+" vector pairs have zero variance; their correlation is set to 0.");
		return corr;
	}

	/** Correlation matrix between every row of {@code a} and every row of {@code b}. */
	public static double[][] corrRows(double[][] a, double[][] b) {
		double[][] corr = new double[a.length][b.length];
		int degenerate = 0;
		for(int i=0; i<a.length; i++) {
			for(int j=0; j<b.length; j++) {
				double r = pearson(a[i], b[j]);
				if(!isFinite(r)) degenerate++;
				corr[i][j] = sanitize(r);
			}
		}
		if(degenerate>0)
			myLogger.warn(degenerate+" row pairs have zero variance; their correlation is set to 0.");
		return corr;
	}

	// NaN for a zero-variance vector or fewer than two values
	private static double pearson(double[] a, double[] b) {
		if(a.length!=b.length) throw new DimensionMismatchException(b.length, a.length);
		if(a.length<2) return Double.NaN;
		return new PearsonsCorrelation().correlation(a, b);
	}

	private static boolean isFinite(double r) {
		return !Double.isNaN(r) && !Double.isInfinite(r);
	}

	private static double sanitize(double r) {
		return isFinite(r) ? r : 0;
	}
}
