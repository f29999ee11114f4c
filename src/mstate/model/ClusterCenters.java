package mstate.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NullArgumentException;

import mstate.util.Algebra;

/**
 * K cluster centers (microstate maps) over C channels. Rows are unit length,
 * or exactly zero for a cluster that never received a sample. Instances are
 * immutable; reordering produces a new instance.
 */
public class ClusterCenters {

	private final double[][] maps;
	private final String[] channelNames;

	public ClusterCenters(double[][] maps) {
		this(maps, null);
	}

	/**
	 * @param channelNames channel label of each column, or {@code null} when
	 * the centers were fitted on a bare matrix
	 */
	public ClusterCenters(double[][] maps, String[] channelNames) {
		if(maps==null) throw new NullArgumentException();
		int c = maps.length==0 ? 0 : maps[0].length;
		for(double[] m : maps)
			if(m.length!=c) throw new DimensionMismatchException(m.length, c);
		if(channelNames!=null && channelNames.length!=c)
			throw new DimensionMismatchException(channelNames.length, c);
		this.maps = Algebra.copy(maps);
		this.channelNames = channelNames==null ? null : channelNames.clone();
	}

	public int nClusters() {
		return maps.length;
	}

	public int nChannels() {
		return maps.length==0 ? 0 : maps[0].length;
	}

	public double[] get(int k) {
		return maps[k].clone();
	}

	public double[][] toArray() {
		return Algebra.copy(maps);
	}

	public boolean hasChannelNames() {
		return channelNames!=null;
	}

	public List<String> getChannelNames() {
		return channelNames==null ? null :
			Collections.unmodifiableList(Arrays.asList(channelNames));
	}

	/**
	 * Rows rearranged so that row {@code i} of the result is row
	 * {@code order[i]} of this instance.
	 *
	 * @throws InvalidOrderException if {@code order} is not a bijection on
	 * {@code [0, K)}
	 */
	public ClusterCenters permute(int[] order) {
		if(order==null) throw new NullArgumentException();
		int k = maps.length;
		if(order.length!=k) throw new InvalidOrderException(order, k);
		boolean[] seen = new boolean[k];
		for(int o : order) {
			if(o<0 || o>=k || seen[o]) throw new InvalidOrderException(order, k);
			seen[o] = true;
		}
		double[][] permuted = new double[k][];
		for(int i=0; i<k; i++) permuted[i] = maps[order[i]];
		return new ClusterCenters(permuted, channelNames);
	}

	@Override
	public boolean equals(Object o) {
		if(this==o) return true;
		if(!(o instanceof ClusterCenters)) return false;
		ClusterCenters that = (ClusterCenters) o;
		return Arrays.deepEquals(maps, that.maps) &&
				Arrays.equals(channelNames, that.channelNames);
	}

	@Override
	public int hashCode() {
		return 31*Arrays.deepHashCode(maps)+Arrays.hashCode(channelNames);
	}

	@Override
	public String toString() {
		return "ClusterCenters | "+nClusters()+" x "+nChannels();
	}
}
