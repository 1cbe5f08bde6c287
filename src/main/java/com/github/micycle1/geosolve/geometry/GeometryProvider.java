package com.github.micycle1.geosolve.geometry;

import java.util.List;

import com.github.micycle1.geosolve.geometry.PossibilitySpace.Dimension;
import com.github.micycle1.geosolve.graph.Constraint;

/**
 * <p>
 * The geometric half of the solver: turns constraints into possibility spaces
 * and intersects them. The ordering and solving core never interprets a
 * {@link com.github.micycle1.geosolve.graph.ConstraintKind} itself; everything
 * kind-specific lives behind this interface.
 * </p>
 *
 * <p>
 * Implementations must be pure: the same constraint and positions always give
 * the same space, and the same spaces always give the same candidates in the
 * same order. Solving determinism rests on this.
 * </p>
 */
public interface GeometryProvider {

	/**
	 * Rejects malformed constraints (bad values, unsupported kinds) before any
	 * solving starts. Default: accepts everything.
	 *
	 * @throws IllegalArgumentException if the constraint can never be evaluated
	 */
	default void validate(Constraint constraint) {
	}

	/**
	 * Structural query, answered without any positions.
	 *
	 * @return the dimension of the locus the constraint yields for
	 *         {@code target} once its other points are known, or null if this
	 *         constraint cannot place that point
	 */
	Dimension dimension(Constraint constraint, int target);

	/**
	 * Structural degeneracy: true if both constraints always yield the same 1D
	 * locus for {@code target} (e.g. the same distance to the same point
	 * declared twice). Such a pair never intersects in a finite set and must not
	 * count twice toward making a point discrete.
	 */
	boolean coincident(Constraint first, Constraint second, int target);

	/**
	 * Computes the locus of {@code target} from the positions of the
	 * constraint's other points.
	 *
	 * @param positions point positions indexed by point id; every referenced
	 *                  point except {@code target} must be non-null
	 * @throws DegenerateGeometryException if the known positions leave the locus
	 *                                     undefined
	 */
	PossibilitySpace possibilitySpace(Constraint constraint, int target, Vector[] positions);

	/**
	 * Common intersection of the spaces.
	 *
	 * @return a finite candidate list, empty when the spaces have no common
	 *         position
	 * @throws DegenerateGeometryException if the intersection is infinite
	 */
	List<Vector> intersect(List<PossibilitySpace> spaces);

	/** Distance within which a position counts as satisfying a space. */
	double tolerance();

	/**
	 * True if fully resolved positions satisfy the constraint. The default
	 * evaluates the locus of the first point this constraint can place and tests
	 * membership.
	 */
	default boolean isSatisfied(Constraint constraint, Vector[] positions) {
		for (int p : constraint.points()) {
			if (dimension(constraint, p) != null) {
				try {
					return possibilitySpace(constraint, p, positions).contains(positions[p], tolerance());
				} catch (DegenerateGeometryException e) {
					return false;
				}
			}
		}
		throw new IllegalArgumentException("Constraint places none of its points: " + constraint);
	}
}
