package mstate.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.OutOfRangeException;

import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

import mstate.util.Algebra;
import mstate.util.Intervals;

/**
 * A continuous recording with optional bad (excluded) sample intervals. Bad
 * intervals are closed-open sample ranges.
 */
public class ContinuousRecording extends TimeSeries {

	private final double[][] data;
	private final double sfreq;
	private final ImmutableRangeSet<Integer> badIntervals;

	public ContinuousRecording(double[][] data,
			String[] channelNames,
			double sfreq) {
		this(data, channelNames, sfreq, null, null);
	}

	public ContinuousRecording(double[][] data,
			String[] channelNames,
			double sfreq,
			Set<String> badChannels,
			RangeSet<Integer> badIntervals) {
		super(channelNames, badChannels);
		if(sfreq<=0) throw new NotStrictlyPositiveException(sfreq);
		this.data = checkMatrix(data, channelNames.length);
		this.sfreq = sfreq;
		if(badIntervals==null) {
			this.badIntervals = ImmutableRangeSet.of();
		} else {
			int n = nSamples();
			RangeSet<Integer> bounded = TreeRangeSet.create();
			bounded.addAll(badIntervals.subRangeSet(Range.closedOpen(0, n)));
			this.badIntervals = ImmutableRangeSet.copyOf(bounded);
		}
	}

	@Override
	public FitState kind() {
		return FitState.CONTINUOUS;
	}

	@Override
	public double[][] data() {
		return Algebra.copy(data);
	}

	/**
	 * Samples in {@code [start, stop)}, with bad intervals left out when
	 * {@code rejectBad} is set. A {@code null} bound means the recording
	 * edge.
	 */
	public double[][] data(Integer start, Integer stop, boolean rejectBad) {
		int n = nSamples();
		int from = start==null ? 0 : start;
		int to = stop==null ? n : stop;
		if(from<0 || from>n) throw new OutOfRangeException(from, 0, n);
		if(to<from || to>n) throw new OutOfRangeException(to, from, n);
		if(!rejectBad) return Algebra.columns(data, from, to);
		List<double[][]> pieces = new ArrayList<double[][]>();
		for(Range<Integer> r : retainedRanges(from, to))
			pieces.add(Algebra.columns(data, r.lowerEndpoint(), r.upperEndpoint()));
		if(pieces.isEmpty()) return new double[data.length][0];
		return Algebra.hstack(pieces.toArray(new double[pieces.size()][][]));
	}

	/** Closed-open ranges in {@code [from, to)} not covered by a bad interval. */
	public List<Range<Integer>> retainedRanges(int from, int to) {
		return Intervals.retained(from, to, badIntervals.asRanges());
	}

	public ImmutableRangeSet<Integer> getBadIntervals() {
		return badIntervals;
	}

	public double getSfreq() {
		return sfreq;
	}

	@Override
	public int nSamples() {
		return data.length==0 ? 0 : data[0].length;
	}
}
