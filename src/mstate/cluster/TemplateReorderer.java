package mstate.cluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.log4j.Logger;

import mstate.model.ClusterCenters;
import mstate.util.Algebra;
import mstate.util.Constants;

/**
 * Orders fitted maps after a reference template. Maps and template are
 * compared on the channels they share (case-insensitive names); the most
 * correlated (template, map) pair is matched first, then the next best among
 * the remaining rows and columns, and so on.
 */
public class TemplateReorderer {

	private final static Logger myLogger = Logger.getLogger(TemplateReorderer.class);

	private final double[][] template;
	private final List<String> templateNames;

	/** Reorderer against the built-in {@link ReferenceTemplate}. */
	public TemplateReorderer() {
		this(ReferenceTemplate.maps(), ReferenceTemplate.channelNames());
	}

	public TemplateReorderer(double[][] template, List<String> templateNames) {
		for(double[] row : template)
			if(row.length!=templateNames.size())
				throw new DimensionMismatchException(row.length, templateNames.size());
		this.template = Algebra.copy(template);
		this.templateNames = new ArrayList<String>(templateNames);
	}

	/**
	 * New row order for {@code maps}, or {@code null} when fewer than
	 * {@link Constants#MIN_COMMON_CHANNELS} channels are shared with the
	 * template.
	 */
	public int[] order(double[][] maps, List<String> channelNames) {
		if(maps.length>0 && maps[0].length!=channelNames.size())
			throw new DimensionMismatchException(maps[0].length, channelNames.size());

		Map<String, Integer> templateIndex = new HashMap<String, Integer>();
		for(int i=0; i<templateNames.size(); i++)
			templateIndex.put(StringUtils.lowerCase(templateNames.get(i)), i);
		List<Integer> commonTemplate = new ArrayList<Integer>();
		List<Integer> commonMaps = new ArrayList<Integer>();
		Set<String> seen = new HashSet<String>();
		for(int j=0; j<channelNames.size(); j++) {
			String name = StringUtils.lowerCase(channelNames.get(j));
			Integer i = templateIndex.get(name);
			if(i==null || !seen.add(name)) continue;
			commonTemplate.add(i);
			commonMaps.add(j);
		}

		if(commonMaps.size()<Constants.MIN_COMMON_CHANNELS) {
			myLogger.warn("Not enough common electrodes with the template ("+commonMaps.size()
					+") to reorder maps automatically. Order hasn't been changed.");
			return null;
		}

		double[][] reducedTemplate = select(template, commonTemplate);
		double[][] reducedMaps = select(maps, commonMaps);
		double[][] corr = Correlation.corrRows(reducedTemplate, reducedMaps);
		return match(corr);
	}

	/**
	 * Greedy matching on the absolute correlation matrix (template rows, map
	 * columns). Maps are ordered by their matched template row; unmatched maps
	 * follow in their original order.
	 */
	static int[] match(double[][] corr) {
		int nTemplate = corr.length, nMaps = nTemplate==0 ? 0 : corr[0].length;
		boolean[] rowUsed = new boolean[nTemplate];
		boolean[] colUsed = new boolean[nMaps];
		int[] matchedMap = new int[nTemplate];
		Arrays.fill(matchedMap, -1);
		int matched = 0;
		while(matched<nTemplate && matched<nMaps) {
			int bestRow = -1, bestCol = -1;
			double best = Double.NEGATIVE_INFINITY;
			for(int i=0; i<nTemplate; i++) {
				if(rowUsed[i]) continue;
				for(int j=0; j<nMaps; j++) {
					if(colUsed[j]) continue;
					double v = Math.abs(corr[i][j]);
					if(v>best) {
						best = v;
						bestRow = i;
						bestCol = j;
					}
				}
			}
			rowUsed[bestRow] = true;
			colUsed[bestCol] = true;
			matchedMap[bestRow] = bestCol;
			matched++;
		}
		List<Integer> order = new ArrayList<Integer>();
		for(int i=0; i<nTemplate; i++)
			if(matchedMap[i]>=0) order.add(matchedMap[i]);
		for(int j=0; j<nMaps; j++)
			if(!colUsed[j]) order.add(j);
		return ArrayUtils.toPrimitive(order.toArray(new Integer[order.size()]));
	}

	/**
	 * {@code centers} reordered after the template, or {@code centers} itself
	 * when no reliable order exists.
	 */
	public ClusterCenters reorder(ClusterCenters centers) {
		if(!centers.hasChannelNames())
			throw new IllegalArgumentException("Cluster centers carry no channel names to match against the template.");
		int[] order = order(centers.toArray(), centers.getChannelNames());
		return order==null ? centers : centers.permute(order);
	}

	private static double[][] select(double[][] mat, List<Integer> cols) {
		double[][] sub = new double[mat.length][cols.size()];
		for(int i=0; i<mat.length; i++)
			for(int j=0; j<cols.size(); j++)
				sub[i][j] = mat[i][cols.get(j)];
		return sub;
	}
}
