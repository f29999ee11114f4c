package mstate.util;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

public class Constants {

	public final static int DEFAULT_N_INIT = 100;
	public final static int DEFAULT_MAX_ITER = 300;
	public final static double DEFAULT_TOL = 1e-6;

	public final static int DEFAULT_HALF_WINDOW = 3;
	public final static double DEFAULT_FACTOR = 0;
	public final static double DEFAULT_CRIT = 10e-6;
	// safety cap for the smoothing loop, which has no natural bound
	public final static int SEGMENT_MAX_ITER = 10000;

	public final static int MIN_PEAK_DIST = 2;
	public final static int MIN_COMMON_CHANNELS = 11;

	private final static long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

	/**
	 * Seed for restart {@code index} derived from {@code base}. Counter based,
	 * so the seed of a restart depends only on its index and never on the
	 * order in which restarts are scheduled.
	 */
	public static long deriveSeed(long base, int index) {
		return mix64(base+GOLDEN_GAMMA*(index+1L));
	}

	public static long[] deriveSeeds(long base, int n) {
		long[] seeds = new long[n];
		for(int i=0; i<n; i++) seeds[i] = deriveSeed(base, i);
		return seeds;
	}

	/** Draws {@code n} seeds in sequence from a caller-owned generator. */
	public static long[] drawSeeds(RandomGenerator rg, int n) {
		long[] seeds = new long[n];
		for(int i=0; i<n; i++) seeds[i] = rg.nextLong();
		return seeds;
	}

	public static long nondeterministicSeed() {
		return mix64(System.nanoTime());
	}

	public static RandomGenerator randomGenerator(long seed) {
		return new Well19937c(seed);
	}

	// splitmix64 finalizer
	private static long mix64(long z) {
		z = (z^(z>>>30))*0xbf58476d1ce4e5b9L;
		z = (z^(z>>>27))*0x94d049bb133111ebL;
		return z^(z>>>31);
	}
}
