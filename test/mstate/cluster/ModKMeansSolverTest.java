package mstate.cluster;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.junit.jupiter.api.Test;

import mstate.util.Algebra;
import mstate.util.Constants;

public class ModKMeansSolverTest {

	private final double[][] data = Synthetic.cycle(Synthetic.TOPOGRAPHIES, 300, 25, 0.05, 3);

	@Test
	public void testMapsAreUnitLength() {
		ModKMeansSolver solver = new ModKMeansSolver(3, 300, 1e-6);
		ModKMeansSolver.Run run = solver.run(data, Constants.randomGenerator(11));
		assertEquals(3, run.getMaps().length);
		for(double[] map : run.getMaps())
			assertEquals(1.0, Algebra.norm(map), 1e-9);
		assertTrue(run.isConverged());
		assertTrue(run.getIterations()>=1);
	}

	@Test
	public void testSameSeedSameMaps() {
		ModKMeansSolver solver = new ModKMeansSolver(3, 300, 1e-6);
		double[][] a = solver.run(data, Constants.randomGenerator(5)).getMaps();
		double[][] b = solver.run(data, Constants.randomGenerator(5)).getMaps();
		for(int k=0; k<a.length; k++) assertArrayEquals(a[k], b[k], 0);
	}

	@Test
	public void testEmptyClusterGetsZeroMap() {
		// columns v, w, v: two of the three initial maps coincide
		double[][] x = {
				{1, 3, 1},
				{2, -1, 2},
				{3, 0.5, 3}};
		ModKMeansSolver solver = new ModKMeansSolver(3, 20, 1e-6);
		try (LogCapture log = new LogCapture(ModKMeansSolver.class)) {
			double[][] maps = solver.run(x, Constants.randomGenerator(1)).getMaps();
			int zero = 0;
			for(double[] map : maps) {
				double norm = Algebra.norm(map);
				if(norm==0) zero++;
				else assertEquals(1.0, norm, 1e-9);
			}
			assertEquals(1, zero);
			assertTrue(log.hasWarning("never activated"));
		}
	}

	@Test
	public void testIterationBudgetExhausted() {
		ModKMeansSolver solver = new ModKMeansSolver(3, 1, 1e-6);
		try (LogCapture log = new LogCapture(ModKMeansSolver.class)) {
			ModKMeansSolver.Run run = solver.run(data, Constants.randomGenerator(11));
			assertFalse(run.isConverged());
			assertEquals(1, run.getIterations());
			assertEquals(3, run.getMaps().length);
			for(double[] map : run.getMaps())
				assertEquals(1.0, Algebra.norm(map), 1e-9);
			assertTrue(log.hasWarning("failed to converge"));
		}
	}

	@Test
	public void testAssignIsPolarityInvariant() {
		double[][] activation = {{0.5, -0.2, 1.0}, {-0.9, 0.1, 1.0}};
		int[] out = new int[3];
		ModKMeansSolver.assign(activation, out);
		assertArrayEquals(new int[] {1, 0, 0}, out);
	}

	@Test
	public void testGevOfPerfectFit() {
		double[][] maps = Synthetic.TOPOGRAPHIES;
		double[][] clean = Synthetic.cycle(maps, 60, 10, 0, 1);
		int[] segmentation = ModKMeansSolver.segment(maps, clean);
		for(int t=0; t<60; t++) assertEquals((t/10)%3, segmentation[t]);
		assertEquals(1.0, ModKMeansSolver.gev(maps, clean, segmentation), 1e-9);
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(NumberIsTooSmallException.class, () -> new ModKMeansSolver(1, 10, 1e-6));
		ModKMeansSolver solver = new ModKMeansSolver(4, 10, 1e-6);
		assertThrows(DimensionMismatchException.class,
				() -> solver.run(new double[][] {{1, 2, 3}, {3, 2, 1}}, Constants.randomGenerator(1)));
		assertThrows(NumberIsTooSmallException.class,
				() -> solver.run(new double[][] {{1, 2, 3, 4, 5}}, Constants.randomGenerator(1)));
	}
}
