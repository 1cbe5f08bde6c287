package com.github.micycle1.geosolve.geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.github.micycle1.geosolve.geometry.PossibilitySpace.Dimension;
import com.github.micycle1.geosolve.graph.Constraint;
import com.github.micycle1.geosolve.graph.ConstraintKind;

/**
 * {@link GeometryProvider} for the Euclidean plane and the {@link PlanarKind}
 * constraint set.
 * <p>
 * Loci per kind, for target t:
 * <ul>
 * <li>DISTANCE: circle around the other point.</li>
 * <li>ORIENTATION [a, b]: ray from a at the angle (t = b), or from b at the
 * angle + pi (t = a).</li>
 * <li>ANGLE [a, v, b]: ray from v, (a - v) rotated by the angle (t = b) or
 * (b - v) rotated back by it (t = a). The vertex cannot be placed.</li>
 * <li>COLLINEAR: line through the two other points.</li>
 * <li>PARALLEL [a, b, c, d]: line through t's partner with the direction of the
 * other pair.</li>
 * <li>WITHIN: disk around the other point.</li>
 * <li>SIDE, INSIDE: half plane or convex hull; only the last point can be
 * placed.</li>
 * </ul>
 */
public class PlanarGeometryProvider implements GeometryProvider {

	private final double epsilon;
	private final double tolerance;

	/**
	 * @param epsilon   numerical zero for tangency, parallelism and coincidence
	 * @param tolerance distance within which a point satisfies a locus
	 */
	public PlanarGeometryProvider(double epsilon, double tolerance) {
		if (!(epsilon > 0) || !(tolerance > 0)) {
			throw new IllegalArgumentException("epsilon and tolerance must be positive");
		}
		this.epsilon = epsilon;
		this.tolerance = tolerance;
	}

	@Override
	public double tolerance() {
		return tolerance;
	}

	@Override
	public void validate(Constraint c) {
		PlanarKind kind = kindOf(c);
		double v = c.value();
		if (!Double.isFinite(v)) {
			throw new IllegalArgumentException("Constraint value must be finite: " + c);
		}
		switch (kind) {
			case DISTANCE :
				if (v <= 0) {
					throw new IllegalArgumentException("Distance must be positive: " + c);
				}
				break;
			case WITHIN :
				if (v < 0) {
					throw new IllegalArgumentException("Distance bound must be non-negative: " + c);
				}
				break;
			case SIDE :
				if (v == 0) {
					throw new IllegalArgumentException("Side must be positive (left) or negative (right): " + c);
				}
				break;
			default :
				break;
		}
	}

	@Override
	public Dimension dimension(Constraint c, int target) {
		int role = c.roleOf(target);
		if (role < 0) {
			return null;
		}
		switch (kindOf(c)) {
			case DISTANCE :
			case ORIENTATION :
			case COLLINEAR :
			case PARALLEL :
				return Dimension.CURVE;
			case ANGLE :
				return role == 1 ? null : Dimension.CURVE;
			case WITHIN :
				return Dimension.REGION;
			case SIDE :
			case INSIDE :
				return role == c.points().size() - 1 ? Dimension.REGION : null;
			default :
				throw new IllegalArgumentException("Unsupported kind " + c.kind());
		}
	}

	@Override
	public boolean coincident(Constraint first, Constraint second, int target) {
		if (dimension(first, target) != Dimension.CURVE || dimension(second, target) != Dimension.CURVE) {
			return false;
		}
		PlanarKind kind = kindOf(first);
		if (kind != kindOf(second)) {
			// mixed kinds can only coincide numerically; Intersections catches those
			return false;
		}
		switch (kind) {
			case DISTANCE :
				return other(first, target) == other(second, target) && MathUtil.aboutEq(first.value(), second.value(), epsilon);
			case ORIENTATION :
				return rayStart(first, target) == rayStart(second, target)
						&& MathUtil.sameDirection(rayAngle(first, target), rayAngle(second, target), epsilon);
			case ANGLE :
				return first.point(1) == second.point(1) && angleReference(first, target) == angleReference(second, target)
						&& MathUtil.sameDirection(signedAngle(first, target), signedAngle(second, target), epsilon);
			case COLLINEAR :
				return others(first, target).equals(others(second, target));
			case PARALLEL :
				return partner(first, target) == partner(second, target)
						&& Set.copyOf(directionPair(first, target)).equals(Set.copyOf(directionPair(second, target)));
			default :
				return false;
		}
	}

	@Override
	public PossibilitySpace possibilitySpace(Constraint c, int target, Vector[] positions) {
		int role = c.roleOf(target);
		if (role < 0) {
			throw new IllegalArgumentException(c + " does not reference point " + target);
		}
		switch (kindOf(c)) {
			case DISTANCE :
				return PossibilitySpace.curve(new Circle(known(positions, other(c, target)), c.value()));
			case ORIENTATION :
				return PossibilitySpace.curve(Line.ray(known(positions, rayStart(c, target)), Vector.fromAngle(rayAngle(c, target))));
			case ANGLE : {
				if (role == 1) {
					throw new IllegalArgumentException("ANGLE cannot place its vertex: " + c);
				}
				Vector vertex = known(positions, c.point(1));
				Vector arm = known(positions, angleReference(c, target)).subtract(vertex);
				if (arm.magnitude() <= epsilon) {
					throw new DegenerateGeometryException("Angle arm has zero length: " + c);
				}
				return PossibilitySpace.curve(Line.ray(vertex, arm.rotate(signedAngle(c, target))));
			}
			case COLLINEAR : {
				List<Integer> o = others(c, target);
				Vector p = known(positions, o.get(0));
				Vector q = known(positions, o.get(1));
				if (p.distanceTo(q) <= epsilon) {
					throw new DegenerateGeometryException("Collinearity with two coincident points is undefined: " + c);
				}
				return PossibilitySpace.curve(Line.through(p, q.subtract(p)));
			}
			case PARALLEL : {
				List<Integer> pair = directionPair(c, target);
				Vector dir = known(positions, pair.get(1)).subtract(known(positions, pair.get(0)));
				if (dir.magnitude() <= epsilon) {
					throw new DegenerateGeometryException("Parallel reference segment has zero length: " + c);
				}
				return PossibilitySpace.curve(Line.through(known(positions, partner(c, target)), dir));
			}
			case WITHIN :
				return PossibilitySpace.region(new Disk(known(positions, other(c, target)), c.value()));
			case SIDE :
				requireLast(c, role);
				return PossibilitySpace.region(new HalfPlane(known(positions, c.point(0)), known(positions, c.point(1)), c.value() > 0));
			case INSIDE : {
				requireLast(c, role);
				List<Vector> hull = new ArrayList<>(c.points().size() - 1);
				for (int i = 0; i < c.points().size() - 1; i++) {
					hull.add(known(positions, c.point(i)));
				}
				return PossibilitySpace.region(new HullRegion(hull));
			}
			default :
				throw new IllegalArgumentException("Unsupported kind " + c.kind());
		}
	}

	@Override
	public List<Vector> intersect(List<PossibilitySpace> spaces) {
		return Intersections.intersect(spaces, epsilon, tolerance);
	}

	private static PlanarKind kindOf(Constraint c) {
		ConstraintKind kind = c.kind();
		if (!(kind instanceof PlanarKind)) {
			throw new IllegalArgumentException("Not a planar constraint kind: " + kind.name());
		}
		return (PlanarKind) kind;
	}

	private static Vector known(Vector[] positions, int point) {
		Vector p = positions[point];
		if (p == null) {
			throw new IllegalStateException("Point " + point + " is not resolved yet");
		}
		return p;
	}

	private static void requireLast(Constraint c, int role) {
		if (role != c.points().size() - 1) {
			throw new IllegalArgumentException(c.kind().name() + " can only place its last point: " + c);
		}
	}

	// two-point kinds: the point that is not the target
	private static int other(Constraint c, int target) {
		return c.point(0) == target ? c.point(1) : c.point(0);
	}

	// every referenced point but the target, sorted
	private static List<Integer> others(Constraint c, int target) {
		List<Integer> o = new ArrayList<>(c.points());
		o.remove(Integer.valueOf(target));
		o.sort(null);
		return o;
	}

	private static int rayStart(Constraint c, int target) {
		return c.point(1) == target ? c.point(0) : c.point(1);
	}

	private static double rayAngle(Constraint c, int target) {
		return c.point(1) == target ? c.value() : c.value() + Math.PI;
	}

	private static int angleReference(Constraint c, int target) {
		return c.point(2) == target ? c.point(0) : c.point(2);
	}

	private static double signedAngle(Constraint c, int target) {
		return c.point(2) == target ? c.value() : -c.value();
	}

	// PARALLEL [a, b, c, d]: the point paired with the target
	private static int partner(Constraint c, int target) {
		int role = c.roleOf(target);
		return c.point(role ^ 1);
	}

	// PARALLEL: the pair whose direction the target's line follows
	private static List<Integer> directionPair(Constraint c, int target) {
		int role = c.roleOf(target);
		return role < 2 ? List.of(c.point(2), c.point(3)) : List.of(c.point(0), c.point(1));
	}
}
