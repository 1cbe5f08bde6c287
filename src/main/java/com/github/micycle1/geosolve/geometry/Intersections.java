package com.github.micycle1.geosolve.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;

/**
 * <p>
 * Intersection of possibility spaces.
 * </p>
 *
 * <p>
 * Pairwise curve intersection dispatches on the pair of {@link Curve.Type}
 * tags: circle/circle, circle/line and line/line. Every pairwise routine
 * returns a finite (possibly empty) list, or throws
 * {@link DegenerateGeometryException} when the two curves share a continuous
 * range (identical circles, overlapping lines).
 * </p>
 *
 * <p>
 * The n-ary {@link #intersect(List, double, double)} works in three stages:
 * </p>
 * <ol>
 * <li>Seed a finite candidate set, either from a 0D space or from the first
 * pair of curves whose intersection is finite. Coincident curve pairs are
 * skipped over while looking for that pair.</li>
 * <li>Filter the candidates by membership in every remaining point set and
 * curve.</li>
 * <li>Filter by membership in every region.</li>
 * </ol>
 * If the spaces never collapse to a finite set (a single curve, only regions,
 * or only mutually coincident curves) the intersection is infinite and a
 * {@link DegenerateGeometryException} is thrown.
 */
public final class Intersections {

	private Intersections() {
	}

	/**
	 * @param spaces    possibility spaces for one point
	 * @param epsilon   numerical zero used for tangency and parallelism tests
	 * @param tolerance distance within which a candidate counts as lying on a
	 *                  space
	 * @return finite, duplicate-free candidate list (possibly empty)
	 */
	public static List<Vector> intersect(List<PossibilitySpace> spaces, double epsilon, double tolerance) {
		List<PossibilitySpace> finite = new ArrayList<>();
		List<Curve> curves = new ArrayList<>();
		List<Region> regions = new ArrayList<>();
		for (PossibilitySpace s : spaces) {
			switch (s.dimension()) {
				case POINTS :
					finite.add(s);
					break;
				case CURVE :
					curves.add(s.curve());
					break;
				case REGION :
					regions.add(s.region());
					break;
				default :
					throw new IllegalStateException("Unknown dimension " + s.dimension());
			}
		}

		List<Vector> candidates;
		int seedA = -1;
		int seedB = -1;
		if (!finite.isEmpty()) {
			candidates = new ArrayList<>(finite.get(0).points());
		} else {
			candidates = null;
			// first pair of curves with a finite intersection
			search: for (int i = 0; i < curves.size(); i++) {
				for (int j = i + 1; j < curves.size(); j++) {
					try {
						candidates = intersect(curves.get(i), curves.get(j), epsilon);
						seedA = i;
						seedB = j;
						break search;
					} catch (DegenerateGeometryException e) {
						// coincident pair adds no information, try the next one
						continue;
					}
				}
			}
			if (candidates == null) {
				throw new DegenerateGeometryException("Possibility spaces do not collapse to a finite set: " + spaces);
			}
		}

		List<Vector> out = new ArrayList<>(candidates.size());
		for (Vector p : candidates) {
			if (accepts(p, finite, curves, regions, seedA, seedB, tolerance)) {
				out.add(p);
			}
		}
		return MathUtil.dedupe(out, tolerance);
	}

	private static boolean accepts(Vector p, List<PossibilitySpace> finite, List<Curve> curves, List<Region> regions, int seedA, int seedB,
			double tolerance) {
		for (int k = 1; k < finite.size(); k++) {
			if (!finite.get(k).contains(p, tolerance)) {
				return false;
			}
		}
		for (int k = 0; k < curves.size(); k++) {
			if (k == seedA || k == seedB) {
				continue;
			}
			if (!curves.get(k).contains(p, tolerance)) {
				return false;
			}
		}
		for (Region r : regions) {
			if (!r.contains(p, tolerance)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Intersects two curves.
	 *
	 * @throws DegenerateGeometryException if the curves coincide over a
	 *                                     continuous range
	 */
	public static List<Vector> intersect(Curve a, Curve b, double epsilon) {
		switch (a.type()) {
			case CIRCLE :
				if (b.type() == Curve.Type.CIRCLE) {
					return circleCircle((Circle) a, (Circle) b, epsilon);
				}
				return circleLine((Circle) a, (Line) b, epsilon);
			case LINE :
				if (b.type() == Curve.Type.CIRCLE) {
					return circleLine((Circle) b, (Line) a, epsilon);
				}
				return lineLine((Line) a, (Line) b, epsilon);
			default :
				throw new IllegalStateException("Unknown curve type " + a.type());
		}
	}

	static List<Vector> circleCircle(Circle c0, Circle c1, double epsilon) {
		double r0 = c0.radius();
		double r1 = c1.radius();
		Vector delta = c1.center().subtract(c0.center());
		double d = delta.magnitude();
		if (d <= epsilon) {
			if (MathUtil.aboutEq(r0, r1, epsilon)) {
				throw new DegenerateGeometryException("Coincident circles " + c0 + " and " + c1);
			}
			// concentric, different radii
			return Collections.emptyList();
		}
		// separated, or one circle contains the other
		if (d > r0 + r1 + epsilon || d < Math.abs(r0 - r1) - epsilon) {
			return Collections.emptyList();
		}
		Vector dir = delta.scale(1.0 / d);
		double a = (r0 * r0 - r1 * r1 + d * d) / (2.0 * d);
		Vector mid = c0.center().add(dir.scale(a));
		double h2 = r0 * r0 - a * a;
		// touching circles
		if (h2 <= epsilon * Math.max(1.0, r0 * r0)) {
			return List.of(mid);
		}
		Vector hv = dir.perp().scale(Math.sqrt(h2));
		return List.of(mid.add(hv), mid.subtract(hv));
	}

	static List<Vector> circleLine(Circle c, Line l, double epsilon) {
		double r = c.radius();
		Vector oc = l.origin().subtract(c.center());
		double b = l.direction().dot(oc);
		double disc = b * b - (oc.dot(oc) - r * r);
		double scale = epsilon * Math.max(1.0, r * r);
		List<Double> ts = new ArrayList<>(2);
		if (disc < -scale) {
			return Collections.emptyList();
		} else if (disc <= scale) {
			// tangent
			ts.add(-b);
		} else {
			double s = Math.sqrt(disc);
			ts.add(-b + s);
			ts.add(-b - s);
		}
		List<Vector> out = new ArrayList<>(2);
		for (double t : ts) {
			if (l.admits(t, epsilon)) {
				out.add(l.at(t));
			}
		}
		return out;
	}

	// Solves o0 + t0*v0 = o1 + t1*v1 as the 2x2 system [v0 -v1] [t0 t1]^T = o1 - o0
	static List<Vector> lineLine(Line l0, Line l1, double epsilon) {
		Vector v0 = l0.direction();
		Vector v1 = l1.direction();
		Vector b = l1.origin().subtract(l0.origin());

		DMatrixRMaj A = new DMatrixRMaj(2, 2, true, v0.x, -v1.x, v0.y, -v1.y);
		if (Math.abs(CommonOps_DDRM.det(A)) <= epsilon) {
			return parallel(l0, l1, epsilon);
		}
		var solver = LinearSolverFactory_DDRM.lu(2);
		if (!solver.setA(A)) {
			throw new IllegalStateException("Line system is singular for " + l0 + " and " + l1);
		}
		DMatrixRMaj rhs = new DMatrixRMaj(2, 1, true, b.x, b.y);
		DMatrixRMaj t = new DMatrixRMaj(2, 1);
		solver.solve(rhs, t);
		double t0 = t.get(0, 0);
		double t1 = t.get(1, 0);
		if (!l0.admits(t0, epsilon) || !l1.admits(t1, epsilon)) {
			// the lines cross before the start of a ray
			return Collections.emptyList();
		}
		return List.of(l0.at(t0));
	}

	private static List<Vector> parallel(Line l0, Line l1, double epsilon) {
		Vector offset = l1.origin().subtract(l0.origin());
		if (Math.abs(l0.direction().cross(offset)) > epsilon) {
			// distinct parallel lines
			return Collections.emptyList();
		}
		// collinear from here on
		if (!l0.isRay() || !l1.isRay()) {
			throw new DegenerateGeometryException("Overlapping lines " + l0 + " and " + l1);
		}
		boolean sameDirection = l0.direction().dot(l1.direction()) > 0;
		if (sameDirection) {
			throw new DegenerateGeometryException("Overlapping rays " + l0 + " and " + l1);
		}
		// opposite rays on one line: l1 starts at parameter s along l0
		double s = l0.project(l1.origin());
		if (Math.abs(s) <= epsilon) {
			return List.of(l0.origin());
		}
		if (s > 0) {
			throw new DegenerateGeometryException("Rays " + l0 + " and " + l1 + " overlap on a segment");
		}
		return Collections.emptyList();
	}

}
