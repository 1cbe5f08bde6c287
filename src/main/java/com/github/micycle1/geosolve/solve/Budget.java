package com.github.micycle1.geosolve.solve;

/**
 * Step and wall-clock allowance for a search. Not thread-safe: a budget belongs
 * to one in-flight search.
 */
public final class Budget {

	private final long maxSteps;
	private final long deadline;
	private final boolean timed;
	private long steps;

	private Budget(long maxSteps, long timeoutMillis) {
		this.maxSteps = maxSteps;
		this.timed = timeoutMillis > 0;
		this.deadline = timed ? System.nanoTime() + timeoutMillis * 1_000_000L : 0L;
	}

	public static Budget unlimited() {
		return new Budget(Long.MAX_VALUE, 0);
	}

	/**
	 * @param maxSteps      steps allowed in total
	 * @param timeoutMillis wall-clock allowance from now, 0 for none
	 */
	public static Budget of(long maxSteps, long timeoutMillis) {
		return new Budget(maxSteps, timeoutMillis);
	}

	/**
	 * Consumes one step.
	 *
	 * @return false once the budget is exceeded
	 */
	public boolean tick() {
		steps++;
		return !isExceeded();
	}

	public boolean isExceeded() {
		return steps > maxSteps || (timed && System.nanoTime() - deadline > 0);
	}

	public long getSteps() {
		return steps;
	}
}
