package com.github.micycle1.geosolve.solve;

/**
 * Tunables for ordering and solving. Setters chain; every option has a usable
 * default, so {@code new SolverOptions()} is a valid configuration.
 */
public class SolverOptions {

	/** How candidate positions are ordered before being tried. */
	public enum Selection {
		/** Intersection order as produced by the geometry provider. */
		FIRST,
		/**
		 * Prefer candidates that keep the loci of the next few points in the order
		 * intersecting.
		 */
		LOOKAHEAD
	}

	private double epsilon = 1e-9;
	private double tolerance = 1e-6;
	private int orbiterSamples = 8;
	private int maxPlans = 64;
	private long maxSteps = 1_000_000L;
	private long timeoutMillis = 0;
	private Selection selection = Selection.FIRST;
	private int lookaheadDepth = 2;

	/** Numerical zero for tangency, parallelism and coincidence tests. Default 1e-9. */
	public double getEpsilon() {
		return epsilon;
	}

	public SolverOptions setEpsilon(double epsilon) {
		if (!(epsilon > 0)) {
			throw new IllegalArgumentException("epsilon must be positive");
		}
		this.epsilon = epsilon;
		return this;
	}

	/** Distance within which a position satisfies a locus. Default 1e-6. */
	public double getTolerance() {
		return tolerance;
	}

	public SolverOptions setTolerance(double tolerance) {
		if (!(tolerance > 0)) {
			throw new IllegalArgumentException("tolerance must be positive");
		}
		this.tolerance = tolerance;
		return this;
	}

	/**
	 * Number of alternative provisional positions tried for an orbiter along its
	 * seed curve. Default 8; 1 keeps only the canonical position.
	 */
	public int getOrbiterSamples() {
		return orbiterSamples;
	}

	public SolverOptions setOrbiterSamples(int orbiterSamples) {
		if (orbiterSamples < 1) {
			throw new IllegalArgumentException("orbiterSamples must be at least 1");
		}
		this.orbiterSamples = orbiterSamples;
		return this;
	}

	/** Most plans the driver attempts before giving up. Default 64. */
	public int getMaxPlans() {
		return maxPlans;
	}

	public SolverOptions setMaxPlans(int maxPlans) {
		if (maxPlans < 1) {
			throw new IllegalArgumentException("maxPlans must be at least 1");
		}
		this.maxPlans = maxPlans;
		return this;
	}

	/** Resolution plus backtrack steps allowed across all plans. Default 1e6. */
	public long getMaxSteps() {
		return maxSteps;
	}

	public SolverOptions setMaxSteps(long maxSteps) {
		if (maxSteps < 1) {
			throw new IllegalArgumentException("maxSteps must be at least 1");
		}
		this.maxSteps = maxSteps;
		return this;
	}

	/** Wall-clock budget for one solve, 0 for none. Default 0. */
	public long getTimeoutMillis() {
		return timeoutMillis;
	}

	public SolverOptions setTimeoutMillis(long timeoutMillis) {
		if (timeoutMillis < 0) {
			throw new IllegalArgumentException("timeoutMillis must not be negative");
		}
		this.timeoutMillis = timeoutMillis;
		return this;
	}

	public Selection getSelection() {
		return selection;
	}

	public SolverOptions setSelection(Selection selection) {
		if (selection == null) {
			throw new IllegalArgumentException("selection must not be null");
		}
		this.selection = selection;
		return this;
	}

	/** Number of later steps the LOOKAHEAD selection inspects. Default 2. */
	public int getLookaheadDepth() {
		return lookaheadDepth;
	}

	public SolverOptions setLookaheadDepth(int lookaheadDepth) {
		if (lookaheadDepth < 1) {
			throw new IllegalArgumentException("lookaheadDepth must be at least 1");
		}
		this.lookaheadDepth = lookaheadDepth;
		return this;
	}

	/** A fresh budget sized from these options. */
	public Budget newBudget() {
		return Budget.of(maxSteps, timeoutMillis);
	}

	@Override
	public String toString() {
		return "SolverOptions[epsilon=" + epsilon + ", tolerance=" + tolerance + ", orbiterSamples=" + orbiterSamples + ", maxPlans=" + maxPlans
				+ ", maxSteps=" + maxSteps + ", timeoutMillis=" + timeoutMillis + ", selection=" + selection + ", lookaheadDepth=" + lookaheadDepth + "]";
	}
}
