package mstate.model;

import java.util.Arrays;

/** Thrown when a reorder is not a permutation of the cluster indices. */
public class InvalidOrderException extends IllegalArgumentException {

	private static final long serialVersionUID = -3702291160983215834L;

	public InvalidOrderException(int[] order, int n) {
		super("Order "+Arrays.toString(order)+" is not a permutation of [0, "+n+")");
	}
}
