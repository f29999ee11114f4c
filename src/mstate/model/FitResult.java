package mstate.model;

/**
 * Outcome of one fit: the winning centers, their global explained variance
 * and the cluster index (0-based) each fitted sample was assigned to.
 */
public class FitResult {

	private final ClusterCenters centers;
	private final double gev;
	private final int[] assignment;

	public FitResult(ClusterCenters centers,
			double gev,
			int[] assignment) {
		this.centers = centers;
		this.gev = gev;
		this.assignment = assignment.clone();
	}

	public ClusterCenters getCenters() {
		return centers;
	}

	public double getGEV() {
		return gev;
	}

	public int[] getAssignment() {
		return assignment.clone();
	}
}
