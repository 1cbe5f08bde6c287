package com.github.micycle1.geosolve;

import com.github.micycle1.geosolve.order.OrderPlan;
import com.github.micycle1.geosolve.solve.Assignment;

/**
 * What {@link GeoSolver#solve} reports. Only {@link Status#SOLVED} carries an
 * assignment; no status claims the figure is unsatisfiable.
 */
public final class SolveOutcome {

	public enum Status {
		/** Every point has a position satisfying every constraint. */
		SOLVED,
		/** No order discovers every point; nothing was solved. */
		ORDERING_FAILED,
		/** Plans were tried but none yielded a solution within the budget. */
		NOT_FOUND_WITHIN_BUDGET,
		/** The caller's cancellation signal fired. */
		CANCELLED
	}

	private final Status status;
	private final Assignment assignment;
	private final OrderPlan plan;
	private final int plansTried;
	private final long steps;
	private final boolean degenerate;

	SolveOutcome(Status status, Assignment assignment, OrderPlan plan, int plansTried, long steps, boolean degenerate) {
		this.status = status;
		this.assignment = assignment;
		this.plan = plan;
		this.plansTried = plansTried;
		this.steps = steps;
		this.degenerate = degenerate;
	}

	public Status getStatus() {
		return status;
	}

	public boolean isSolved() {
		return status == Status.SOLVED;
	}

	/** @return the solution, or null unless {@link Status#SOLVED} */
	public Assignment getAssignment() {
		return assignment;
	}

	/** @return the plan that produced the solution, or null */
	public OrderPlan getPlan() {
		return plan;
	}

	public int getPlansTried() {
		return plansTried;
	}

	/** Resolution and backtrack steps consumed across all plans. */
	public long getSteps() {
		return steps;
	}

	/** True if a degenerate locus was met during any attempt. */
	public boolean isDegenerate() {
		return degenerate;
	}

	@Override
	public String toString() {
		return "SolveOutcome[" + status + ", plansTried=" + plansTried + ", steps=" + steps + (degenerate ? ", degenerate" : "") + "]";
	}
}
