package mstate.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class IOTest {

	@TempDir
	File dir;

	@Test
	public void testNamedTable() throws IOException {
		String file = new File(dir, "eeg.txt.gz").getPath();
		IO.write(file, new double[][] {{1, 2.5}, {-3, 4e-3}}, new String[] {"Cz", "Pz"});
		IO.Table table = IO.read(file, true);
		assertArrayEquals(new String[] {"Cz", "Pz"}, table.getNames());
		assertArrayEquals(new double[] {1, 2.5}, table.getValues()[0], 0);
		assertArrayEquals(new double[] {-3, 4e-3}, table.getValues()[1], 0);
	}

	@Test
	public void testCommentsAndRaggedRows() throws IOException {
		String file = new File(dir, "m.txt").getPath();
		try (BufferedWriter bw = Utils.getBufferedWriter(file)) {
			bw.write("# maps\n\n1 2 3\n  4\t5 6\n");
		}
		IO.Table table = IO.read(file, false);
		assertNull(table.getNames());
		assertEquals(2, table.getValues().length);
		assertArrayEquals(new double[] {4, 5, 6}, table.getValues()[1], 0);

		try (BufferedWriter bw = Utils.getBufferedWriter(file)) {
			bw.write("1 2 3\n4 5\n");
		}
		assertThrows(DimensionMismatchException.class, () -> IO.read(file, false));
		assertThrows(UncheckedIOException.class,
				() -> IO.read(new File(dir, "missing.txt").getPath(), false));
	}

	@Test
	public void testLabels() throws IOException {
		String file = new File(dir, "labels.txt").getPath();
		IO.write(file, new int[] {0, 1, 2});
		IO.Table table = IO.read(file, false);
		assertEquals(3, table.getValues().length);
		assertEquals(2.0, table.getValues()[2][0], 0);
	}
}
