package mstate.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Whitespace-delimited matrix files: one row per line, blank lines and lines
 * starting with '#' skipped. With {@code named} set, the first field of each
 * row is its name (a channel label).
 */
public class IO {

	/** A matrix read from a file, with its row names if any. */
	public static class Table {
		private final double[][] values;
		private final String[] names;

		private Table(double[][] values, String[] names) {
			this.values = values;
			this.names = names;
		}

		public double[][] getValues() {
			return values;
		}

		public String[] getNames() {
			return names;
		}
	}

	public static Table read(String file, boolean named) throws IOException {
		List<double[]> rows = new ArrayList<double[]>();
		List<String> names = new ArrayList<String>();
		try (BufferedReader br = Utils.getBufferedReader(file)) {
			String line;
			while((line=br.readLine())!=null) {
				line = line.trim();
				if(line.isEmpty() || line.startsWith("#")) continue;
				String[] s = StringUtils.split(line);
				int offset = named ? 1 : 0;
				if(named) names.add(s[0]);
				double[] row = new double[s.length-offset];
				for(int i=offset; i<s.length; i++)
					row[i-offset] = Double.parseDouble(s[i]);
				if(!rows.isEmpty() && rows.get(0).length!=row.length)
					throw new DimensionMismatchException(row.length, rows.get(0).length);
				rows.add(row);
			}
		}
		return new Table(rows.toArray(new double[rows.size()][]),
				named ? names.toArray(new String[names.size()]) : null);
	}

	public static void write(String file, double[][] values, String[] names) throws IOException {
		try (BufferedWriter bw = Utils.getBufferedWriter(file)) {
			for(int i=0; i<values.length; i++) {
				if(names!=null) {
					bw.write(names[i]);
					bw.write("\t");
				}
				bw.write(Utils.paste(values[i], "\t"));
				bw.write("\n");
			}
		}
	}

	public static void write(String file, int[] values) throws IOException {
		try (BufferedWriter bw = Utils.getBufferedWriter(file)) {
			bw.write(Utils.paste(values, "\n"));
			bw.write("\n");
		}
	}

	public static void write(String file, String line) throws IOException {
		try (BufferedWriter bw = Utils.getBufferedWriter(file)) {
			bw.write(line);
			bw.write("\n");
		}
	}
}
