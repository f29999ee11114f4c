package mstate.cluster;

import java.util.Random;

/** Block-structured test recordings built from known topographies. */
class Synthetic {

	/** Three orthogonal, zero-mean, unit-length 4-channel topographies. */
	static final double[][] TOPOGRAPHIES = new double[][] {
		{ 0.5,  0.5, -0.5, -0.5},
		{ 0.5, -0.5,  0.5, -0.5},
		{ 0.5, -0.5, -0.5,  0.5}
	};

	/**
	 * Samples cycle through {@code states} in blocks of {@code block}
	 * samples. The sign alternates from sample to sample and the amplitude
	 * drifts slowly; Gaussian noise of sd {@code noise} is added.
	 */
	static double[][] blocks(double[][] maps, int[] states, int block,
			double noise, long seed) {
		Random random = new Random(seed);
		int c = maps[0].length, n = states.length*block;
		double[][] data = new double[c][n];
		for(int t=0; t<n; t++) {
			double[] map = maps[states[t/block]];
			double amp = (t%2==0 ? 1 : -1)*(1.0+0.25*Math.sin(t/7.0));
			for(int i=0; i<c; i++)
				data[i][t] = amp*map[i]+noise*random.nextGaussian();
		}
		return data;
	}

	/** {@code n} samples cycling through all maps in blocks of {@code block}. */
	static double[][] cycle(double[][] maps, int n, int block, double noise, long seed) {
		int[] states = new int[n/block];
		for(int i=0; i<states.length; i++) states[i] = i%maps.length;
		return blocks(maps, states, block, noise, seed);
	}
}
