package mstate.model;

import java.util.Set;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;

import mstate.util.Algebra;

/** Trials of equal length cut from a recording. */
public class EpochedRecording extends TimeSeries {

	private final double[][][] epochs;

	public EpochedRecording(double[][][] epochs,
			String[] channelNames) {
		this(epochs, channelNames, null);
	}

	public EpochedRecording(double[][][] epochs,
			String[] channelNames,
			Set<String> badChannels) {
		super(channelNames, badChannels);
		if(epochs==null || epochs.length==0) throw new NoDataException();
		this.epochs = new double[epochs.length][][];
		for(int i=0; i<epochs.length; i++) {
			this.epochs[i] = checkMatrix(epochs[i], channelNames.length);
			if(this.epochs[i][0].length!=this.epochs[0][0].length)
				throw new DimensionMismatchException(this.epochs[i][0].length,
						this.epochs[0][0].length);
		}
	}

	@Override
	public FitState kind() {
		return FitState.EPOCHED;
	}

	/** Trials concatenated along the sample axis. */
	@Override
	public double[][] data() {
		return Algebra.hstack(epochs);
	}

	public double[][] epoch(int i) {
		return Algebra.copy(epochs[i]);
	}

	public int nEpochs() {
		return epochs.length;
	}

	public int nTimes() {
		return epochs[0][0].length;
	}

	@Override
	public int[] trialBoundaries() {
		int[] b = new int[epochs.length];
		for(int i=0; i<b.length; i++) b[i] = i*nTimes();
		return b;
	}

	@Override
	public int nSamples() {
		return epochs.length*nTimes();
	}
}
