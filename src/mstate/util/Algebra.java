package mstate.util;

import org.apache.commons.math3.stat.StatUtils;

public class Algebra {

	public static double[][] copy(double[][] mat) {
		double[][] c = new double[mat.length][];
		for(int i=0; i<mat.length; i++) c[i] = mat[i].clone();
		return c;
	}

	public static double dot(double[] a, double[] b) {
		double s = 0;
		for(int i=0; i<a.length; i++) s += a[i]*b[i];
		return s;
	}

	/** Dot product of {@code v} with column {@code t} of {@code mat}. */
	public static double dotColumn(double[] v, double[][] mat, int t) {
		double s = 0;
		for(int i=0; i<v.length; i++) s += v[i]*mat[i][t];
		return s;
	}

	public static double norm(double[] a) {
		return Math.sqrt(StatUtils.sumSq(a));
	}

	public static double sumSq(double[][] mat) {
		double s = 0;
		for(int i=0; i<mat.length; i++) s += StatUtils.sumSq(mat[i]);
		return s;
	}

	/** Population (biased) standard deviation. */
	public static double std(double[] a) {
		return Math.sqrt(StatUtils.populationVariance(a));
	}

	public static double[] column(double[][] mat, int t) {
		double[] c = new double[mat.length];
		for(int i=0; i<mat.length; i++) c[i] = mat[i][t];
		return c;
	}

	/** Sub-matrix of {@code mat} holding the given columns in order. */
	public static double[][] columns(double[][] mat, int[] cols) {
		double[][] sub = new double[mat.length][cols.length];
		for(int i=0; i<mat.length; i++)
			for(int j=0; j<cols.length; j++)
				sub[i][j] = mat[i][cols[j]];
		return sub;
	}

	/** Columns {@code [from, to)} of {@code mat}. */
	public static double[][] columns(double[][] mat, int from, int to) {
		double[][] sub = new double[mat.length][to-from];
		for(int i=0; i<mat.length; i++)
			System.arraycopy(mat[i], from, sub[i], 0, to-from);
		return sub;
	}

	/** Concatenates matrices of equal row count along the column axis. */
	public static double[][] hstack(double[][]... mats) {
		int rows = mats[0].length, cols = 0;
		for(double[][] m : mats) cols += m.length==0 ? 0 : m[0].length;
		double[][] s = new double[rows][cols];
		int p = 0;
		for(double[][] m : mats) {
			if(m.length==0) continue;
			int w = m[0].length;
			for(int i=0; i<rows; i++)
				System.arraycopy(m[i], 0, s[i], p, w);
			p += w;
		}
		return s;
	}
}
