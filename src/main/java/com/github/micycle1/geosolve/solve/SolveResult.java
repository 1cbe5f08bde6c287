package com.github.micycle1.geosolve.solve;

/**
 * Outcome of solving one {@code OrderPlan}: either an {@link Assignment}, or a
 * failure {@link Reason}. A failure never means the figure has no solution.
 */
public final class SolveResult {

	public enum Reason {
		/** Every candidate of every point was tried for this plan. */
		EXHAUSTED,
		/** The step or time budget ran out first. */
		BUDGET_EXCEEDED,
		/** The caller's cancellation signal fired. */
		CANCELLED
	}

	private final Assignment assignment;
	private final Reason reason;
	private final boolean degenerate;
	private final int backtracks;

	private SolveResult(Assignment assignment, Reason reason, boolean degenerate, int backtracks) {
		this.assignment = assignment;
		this.reason = reason;
		this.degenerate = degenerate;
		this.backtracks = backtracks;
	}

	static SolveResult success(Assignment assignment, boolean degenerate, int backtracks) {
		return new SolveResult(assignment, null, degenerate, backtracks);
	}

	static SolveResult failure(Reason reason, boolean degenerate, int backtracks) {
		return new SolveResult(null, reason, degenerate, backtracks);
	}

	public boolean isSuccess() {
		return assignment != null;
	}

	/** @return the assignment, or null on failure */
	public Assignment getAssignment() {
		return assignment;
	}

	/** @return why solving stopped, or null on success */
	public Reason getReason() {
		return reason;
	}

	/**
	 * True if some point hit a degenerate (infinite or undefined) locus during
	 * the search. When such a point blocks progress the figure likely carries
	 * redundant or conflicting constraints.
	 */
	public boolean isDegenerate() {
		return degenerate;
	}

	public int getBacktracks() {
		return backtracks;
	}

	@Override
	public String toString() {
		return isSuccess() ? "SolveResult[success, backtracks=" + backtracks + "]"
				: "SolveResult[" + reason + (degenerate ? ", degenerate" : "") + ", backtracks=" + backtracks + "]";
	}
}
