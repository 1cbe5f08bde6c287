package com.github.micycle1.geosolve.solve;

/**
 * Cooperative cancellation. The solver polls it once per resolution step and
 * once per backtrack step.
 */
@FunctionalInterface
public interface CancellationSignal {

	CancellationSignal NEVER = () -> false;

	boolean isCancelled();
}
