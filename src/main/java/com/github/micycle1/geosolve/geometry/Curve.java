package com.github.micycle1.geosolve.geometry;

import java.util.List;

/**
 * A one-dimensional locus. Intersection code dispatches on {@link #type()}
 * rather than on the implementing class.
 */
public interface Curve {

	enum Type {
		CIRCLE, LINE
	}

	Type type();

	/** True if p lies on the curve within the given tolerance. */
	boolean contains(Vector p, double tolerance);

	/**
	 * Evenly spread sample points on the curve. The first sample is always the
	 * canonical point of the curve, so a count of 1 gives a deterministic pick.
	 */
	List<Vector> sample(int count);
}
