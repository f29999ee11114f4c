package mstate.model;

import java.util.Set;

import mstate.util.Algebra;

/** A trial-averaged (evoked) response. */
public class AveragedResponse extends TimeSeries {

	private final double[][] data;

	public AveragedResponse(double[][] data,
			String[] channelNames) {
		this(data, channelNames, null);
	}

	public AveragedResponse(double[][] data,
			String[] channelNames,
			Set<String> badChannels) {
		super(channelNames, badChannels);
		this.data = checkMatrix(data, channelNames.length);
	}

	@Override
	public FitState kind() {
		return FitState.AVERAGED;
	}

	@Override
	public double[][] data() {
		return Algebra.copy(data);
	}

	@Override
	public int nSamples() {
		return data.length==0 ? 0 : data[0].length;
	}
}
