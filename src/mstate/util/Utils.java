package mstate.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.apache.log4j.Logger;

public class Utils {

	private final static Logger myLogger = Logger.getLogger(Utils.class);

	public static String getSystemTime(){
		return new SimpleDateFormat("yyyy-MM-dd HH:mm:ss").
				format(Calendar.getInstance().getTime());
	}

	/** Reader over a plain or gzipped (".gz") file. */
	public static BufferedReader getBufferedReader(String inSourceName) {
		try {
			if (inSourceName.endsWith(".gz")) {
				return new BufferedReader(new InputStreamReader(new GZIPInputStream(
						new FileInputStream(inSourceName)), StandardCharsets.UTF_8));
			} else {
				return new BufferedReader(new InputStreamReader(
						new FileInputStream(inSourceName), StandardCharsets.UTF_8));
			}
		} catch (IOException e) {
			myLogger.error("getBufferedReader: Error getting reader for: " + inSourceName);
			throw new UncheckedIOException(e);
		}
	}

	public static BufferedWriter getBufferedWriter(String filename) {
		return getBufferedWriter(new File(filename), false);
	}

	/** Writer to a plain or gzipped (".gz") file. */
	public static BufferedWriter getBufferedWriter(File file, boolean append) {
		try {
			if (file.getName().endsWith(".gz")) {
				return new BufferedWriter(new OutputStreamWriter(new GZIPOutputStream(
						new FileOutputStream(file, append)), StandardCharsets.UTF_8));
			} else {
				return new BufferedWriter(new OutputStreamWriter(
						new FileOutputStream(file, append), StandardCharsets.UTF_8));
			}
		} catch (IOException e) {
			myLogger.error("getBufferedWriter: Error getting writer for: " + file);
			throw new UncheckedIOException(e);
		}
	}

	public static String paste(double[] array, String collapse) {
		StringBuilder s = new StringBuilder();
		if(array.length==0) return "";
		s.append(array[0]);
		for(int i=1; i<array.length; i++) {
			s.append(collapse);
			s.append(array[i]);
		}
		return s.toString();
	}

	public static String paste(int[] array, String collapse) {
		StringBuilder s = new StringBuilder();
		if(array.length==0) return "";
		s.append(array[0]);
		for(int i=1; i<array.length; i++) {
			s.append(collapse);
			s.append(array[i]);
		}
		return s.toString();
	}
}
