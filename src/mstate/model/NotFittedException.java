package mstate.model;

/** Thrown when cluster centers are needed before any fit. */
public class NotFittedException extends IllegalStateException {

	private static final long serialVersionUID = 6183405528437760513L;

	public NotFittedException(String name) {
		super("Algorithm must be fitted before using "+name);
	}
}
