package mstate.cluster;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.junit.jupiter.api.Test;

public class PeakExtractorTest {

	@Test
	public void testLocalMaxima() {
		double[] x = {0, 1, 0, 2, 3, 1, 0, 5, 0};
		assertArrayEquals(new int[] {1, 4, 7}, PeakExtractor.peaks(x, 1));
	}

	@Test
	public void testEdgesAreNeverPeaks() {
		double[] x = {5, 1, 2, 1, 5};
		assertArrayEquals(new int[] {2}, PeakExtractor.peaks(x, 1));
		assertEquals(0, PeakExtractor.peaks(new double[] {3, 2, 1}, 1).length);
		assertEquals(0, PeakExtractor.peaks(new double[0], 2).length);
	}

	@Test
	public void testPlateauMiddle() {
		// plateau 2..5, middle rounded down
		double[] x = {0, 1, 3, 3, 3, 3, 1, 0};
		assertArrayEquals(new int[] {3}, PeakExtractor.peaks(x, 1));
		// plateau 2..4
		double[] y = {0, 1, 3, 3, 3, 1};
		assertArrayEquals(new int[] {3}, PeakExtractor.peaks(y, 1));
		// a plateau running into the last sample is no peak
		double[] z = {0, 1, 3, 3};
		assertEquals(0, PeakExtractor.peaks(z, 1).length);
	}

	@Test
	public void testDistanceKeepsHigherPeak() {
		double[] x = {0, 2, 0, 3, 0, 0, 0, 1, 0};
		assertArrayEquals(new int[] {1, 3, 7}, PeakExtractor.peaks(x, 1));
		assertArrayEquals(new int[] {3, 7}, PeakExtractor.peaks(x, 3));
		assertArrayEquals(new int[] {3}, PeakExtractor.peaks(x, 5));
	}

	@Test
	public void testDistanceMustBePositive() {
		assertThrows(NumberIsTooSmallException.class,
				() -> PeakExtractor.peaks(new double[] {0, 1, 0}, 0));
	}

	@Test
	public void testExtractColumnsAtGfpPeaks() {
		double[][] data = {
				{0, 1, 0, 4, 0},
				{0, -1, 0, -4, 0}};
		double[][] peaks = PeakExtractor.extract(data);
		assertEquals(2, peaks.length);
		assertArrayEquals(new double[] {1, 4}, peaks[0], 0);
		assertArrayEquals(new double[] {-1, -4}, peaks[1], 0);
		assertArrayEquals(new double[] {0, 1, 0, 4, 0}, PeakExtractor.gfp(data), 1e-12);
	}
}
