package mstate.cluster;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import mstate.model.ClusterCenters;

public class TemplateReordererTest {

	private static String[] upperCaseNames() {
		List<String> names = ReferenceTemplate.channelNames();
		String[] upper = new String[names.size()];
		for(int i=0; i<upper.length; i++) upper[i] = names.get(i).toUpperCase();
		return upper;
	}

	@Test
	public void testShuffledTemplateIsRestored() {
		double[][] template = ReferenceTemplate.maps();
		int[] shuffle = {3, 0, 4, 1, 2};
		double[][] maps = new double[5][];
		for(int i=0; i<5; i++) maps[i] = template[shuffle[i]].clone();
		for(int c=0; c<maps[1].length; c++) maps[1][c] = -maps[1][c];

		ClusterCenters centers = new ClusterCenters(maps, upperCaseNames());
		ClusterCenters ordered = new TemplateReorderer().reorder(centers);
		for(int i=0; i<5; i++)
			assertEquals(1.0, Math.abs(Correlation.corr(template[i], ordered.get(i))), 1e-9);
		assertEquals(centers.getChannelNames(), ordered.getChannelNames());
	}

	@Test
	public void testUnmatchedMapsGoLast() {
		double[][] template = ReferenceTemplate.maps();
		Random random = new Random(17);
		double[] extra = new double[template[0].length];
		for(int c=0; c<extra.length; c++) extra[c] = random.nextGaussian();
		double[][] maps = {template[4], template[2], extra, template[0], template[1], template[3]};

		int[] order = new TemplateReorderer().order(maps, ReferenceTemplate.channelNames());
		assertArrayEquals(new int[] {3, 4, 1, 5, 0, 2}, order);
	}

	@Test
	public void testTooFewCommonChannels() {
		List<String> names = new ArrayList<String>(ReferenceTemplate.channelNames().subList(0, 10));
		names.add("X1");
		names.add("X2");
		double[][] maps = new double[3][12];
		for(int k=0; k<3; k++) maps[k][k] = 1;
		TemplateReorderer reorderer = new TemplateReorderer();
		try (LogCapture log = new LogCapture(TemplateReorderer.class)) {
			assertNull(reorderer.order(maps, names));
			ClusterCenters centers = new ClusterCenters(maps, names.toArray(new String[12]));
			assertSame(centers, reorderer.reorder(centers));
			assertTrue(log.hasWarning("Not enough common electrodes"));
		}
	}

	@Test
	public void testCustomTemplate() {
		List<String> names = new ArrayList<String>();
		for(int i=0; i<12; i++) names.add("e"+i);
		double[][] template = new double[2][12];
		double[][] maps = new double[2][12];
		for(int c=0; c<12; c++) {
			template[0][c] = c;
			template[1][c] = (c%3)-1;
			maps[0][c] = (c%3)-1+0.01*c;
			maps[1][c] = -2*c;
		}
		TemplateReorderer reorderer = new TemplateReorderer(template, names);
		assertArrayEquals(new int[] {1, 0}, reorderer.order(maps, names));
		// names are matched by label, not by position
		List<String> reversed = new ArrayList<String>(names);
		Collections.reverse(reversed);
		double[][] flipped = new double[2][12];
		for(int k=0; k<2; k++)
			for(int c=0; c<12; c++) flipped[k][c] = maps[k][11-c];
		assertArrayEquals(new int[] {1, 0}, reorderer.order(flipped, reversed));
	}

	@Test
	public void testGreedyMatch() {
		assertArrayEquals(new int[] {1, 0},
				TemplateReorderer.match(new double[][] {{0.1, 0.9}, {0.8, 0.7}}));
		assertArrayEquals(new int[] {1, 2, 0},
				TemplateReorderer.match(new double[][] {{0.2, -0.95, 0.1}, {0.3, 0.5, 0.6}}));
		// more template rows than maps
		assertArrayEquals(new int[] {1, 0},
				TemplateReorderer.match(new double[][] {{0.1, 0.2}, {0.3, 0.9}, {0.8, 0.4}}));
	}

	@Test
	public void testInvalidInput() {
		assertThrows(DimensionMismatchException.class,
				() -> new TemplateReorderer(new double[][] {{1, 2}}, Arrays.asList("a")));
		assertThrows(IllegalArgumentException.class,
				() -> new TemplateReorderer().reorder(new ClusterCenters(new double[][] {{1, 0}, {0, 1}})));
	}
}
