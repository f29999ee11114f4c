package mstate.cluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.exception.NumberIsTooSmallException;

import mstate.util.Algebra;
import mstate.util.Constants;

/**
 * Global field power (GFP) peaks. Fitting on the columns at GFP maxima keeps
 * the high signal-to-noise topographies and drops the transitions between
 * them.
 */
public class PeakExtractor {

	public static double[] gfp(double[][] data) {
		int n = data.length==0 ? 0 : data[0].length;
		double[] gfp = new double[n];
		for(int t=0; t<n; t++)
			gfp[t] = Algebra.std(Algebra.column(data, t));
		return gfp;
	}

	/**
	 * Local maxima of {@code signal} at least {@code distance} samples apart.
	 * A flat top counts once, at its middle sample (rounded down); the two
	 * edge samples are never peaks. When two peaks are too close the smaller
	 * one is dropped first.
	 *
	 * @return peak indices in ascending order
	 */
	public static int[] peaks(double[] signal, int distance) {
		if(distance<1) throw new NumberIsTooSmallException(distance, 1, true);
		int[] peaks = localMaxima(signal);
		if(distance==1 || peaks.length<2) return peaks;

		Integer[] byHeight = new Integer[peaks.length];
		for(int i=0; i<peaks.length; i++) byHeight[i] = i;
		// highest first, later peak first among equal heights
		Arrays.sort(byHeight, new Comparator<Integer>() {
			@Override
			public int compare(Integer a, Integer b) {
				int c = Double.compare(signal[peaks[b]], signal[peaks[a]]);
				return c!=0 ? c : Integer.compare(b, a);
			}
		});

		boolean[] keep = new boolean[peaks.length];
		Arrays.fill(keep, true);
		for(int j : byHeight) {
			if(!keep[j]) continue;
			for(int k=j-1; k>=0 && peaks[j]-peaks[k]<distance; k--) keep[k] = false;
			for(int k=j+1; k<peaks.length && peaks[k]-peaks[j]<distance; k++) keep[k] = false;
		}
		List<Integer> kept = new ArrayList<Integer>();
		for(int i=0; i<peaks.length; i++)
			if(keep[i]) kept.add(peaks[i]);
		return ArrayUtils.toPrimitive(kept.toArray(new Integer[kept.size()]));
	}

	private static int[] localMaxima(double[] x) {
		List<Integer> maxima = new ArrayList<Integer>();
		int i = 1, last = x.length-1;
		while(i<last) {
			if(x[i-1]<x[i]) {
				int ahead = i+1;
				while(ahead<last && x[ahead]==x[i]) ahead++;
				if(x[ahead]<x[i]) {
					maxima.add((i+ahead-1)/2);
					i = ahead;
				}
			}
			i++;
		}
		return ArrayUtils.toPrimitive(maxima.toArray(new Integer[maxima.size()]));
	}

	/** Columns of {@code data} at GFP peaks; may be empty. */
	public static double[][] extract(double[][] data, int distance) {
		return Algebra.columns(data, peaks(gfp(data), distance));
	}

	public static double[][] extract(double[][] data) {
		return extract(data, Constants.MIN_PEAK_DIST);
	}
}
