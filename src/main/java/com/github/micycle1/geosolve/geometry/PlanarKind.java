package com.github.micycle1.geosolve.geometry;

import com.github.micycle1.geosolve.graph.ConstraintKind;

/**
 * Constraint kinds understood by {@link PlanarGeometryProvider}. Point roles
 * are listed in reference order.
 */
public enum PlanarKind implements ConstraintKind {

	/** [a, b]: |b - a| = value. */
	DISTANCE(2, 2),
	/** [a, b]: the direction from a to b has angle value (radians). */
	ORIENTATION(2, 2),
	/** [a, v, b]: the signed CCW angle from (a - v) to (b - v) is value. */
	ANGLE(3, 3),
	/** [a, b, c]: the three points lie on one line. */
	COLLINEAR(3, 3),
	/** [a, b, c, d]: segment cd is parallel to segment ab. */
	PARALLEL(4, 4),
	/** [a, b]: |b - a| &lt;= value. Areal. */
	WITHIN(2, 2),
	/** [a, b, p]: p is left of a-&gt;b when value &gt; 0, right when value &lt; 0. Areal. */
	SIDE(3, 3),
	/** [h1 .. hk, p]: p is inside the convex hull of h1..hk. Areal. */
	INSIDE(4, Integer.MAX_VALUE);

	private final int minArity;
	private final int maxArity;

	PlanarKind(int minArity, int maxArity) {
		this.minArity = minArity;
		this.maxArity = maxArity;
	}

	@Override
	public int minArity() {
		return minArity;
	}

	@Override
	public int maxArity() {
		return maxArity;
	}
}
