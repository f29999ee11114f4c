package mstate.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NullArgumentException;

/**
 * A multichannel recording the clustering can consume. Whatever its layout,
 * a source hands out one (channels, samples) matrix; trial boundaries are
 * only used to reshape outputs.
 */
public abstract class TimeSeries {

	protected final String[] channelNames;
	protected final Set<String> badChannels;

	protected TimeSeries(String[] channelNames,
			Set<String> badChannels) {
		if(channelNames==null) throw new NullArgumentException();
		this.channelNames = channelNames.clone();
		this.badChannels = badChannels==null ? Collections.<String>emptySet() :
			Collections.unmodifiableSet(new LinkedHashSet<String>(badChannels));
	}

	public abstract FitState kind();

	/** All samples as one (channels, samples) matrix. Callers own the copy. */
	public abstract double[][] data();

	/** Start offset of each trial within {@link #data()}. */
	public int[] trialBoundaries() {
		return new int[]{0};
	}

	public abstract int nSamples();

	public int nChannels() {
		return channelNames.length;
	}

	public List<String> getChannelNames() {
		return Collections.unmodifiableList(Arrays.asList(channelNames));
	}

	public Set<String> getBadChannels() {
		return badChannels;
	}

	protected static double[][] checkMatrix(double[][] data, int nChannels) {
		if(data==null) throw new NullArgumentException();
		if(data.length!=nChannels)
			throw new DimensionMismatchException(data.length, nChannels);
		int t = data.length==0 ? 0 : data[0].length;
		double[][] copy = new double[data.length][];
		for(int i=0; i<data.length; i++) {
			if(data[i].length!=t)
				throw new DimensionMismatchException(data[i].length, t);
			copy[i] = data[i].clone();
		}
		return copy;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()+" | "+nChannels()+" channels x "+nSamples()+" samples";
	}
}
