package mstate.model;

/** Which kind of source, if any, the cluster centers were fitted on. */
public enum FitState {
	UNFITTED,
	CONTINUOUS,
	EPOCHED,
	AVERAGED
}
