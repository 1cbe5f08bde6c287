package com.github.micycle1.geosolve.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.tinfour.common.IIncrementalTin;
import org.tinfour.common.IQuadEdge;
import org.tinfour.common.Vertex;
import org.tinfour.standard.IncrementalTin;

/**
 * Convex hull of a set of known points. The hull ring is read off the
 * perimeter of a Tinfour TIN, which is disposed as soon as the ring is
 * extracted. Points within tolerance of the hull boundary count as inside.
 */
public final class HullRegion implements Region {

	// hull corners, CCW
	private final List<Vector> ring;

	public HullRegion(List<Vector> points) {
		if (points.size() < 3) {
			throw new IllegalArgumentException("Hull region needs at least 3 points, got " + points.size());
		}
		IIncrementalTin tin = new IncrementalTin();
		try {
			List<Vertex> vs = new ArrayList<>(points.size());
			for (int i = 0; i < points.size(); i++) {
				Vector p = points.get(i);
				vs.add(new Vertex(p.x, p.y, 0.0, i));
			}
			tin.add(vs, null);
			if (!tin.isBootstrapped()) {
				// all hull points are collinear (or coincident)
				throw new DegenerateGeometryException("Hull points are collinear: " + points);
			}
			ring = perimeterRing(tin);
		} finally {
			tin.dispose();
		}
	}

	private static List<Vector> perimeterRing(IIncrementalTin tin) {
		List<IQuadEdge> perimeter = new ArrayList<>();
		tin.getPerimeter().forEach(perimeter::add);

		List<Vertex> boundary = new ArrayList<>();
		boundary.add(perimeter.get(0).getA());
		for (IQuadEdge e : perimeter) {
			Vertex last = boundary.get(boundary.size() - 1);
			if (last.equals(e.getA())) {
				boundary.add(e.getB());
			} else if (last.equals(e.getB())) {
				boundary.add(e.getA());
			} else {
				throw new IllegalStateException("Perimeter edges are not contiguous");
			}
		}
		if (boundary.size() > 1 && boundary.get(0).equals(boundary.get(boundary.size() - 1))) {
			boundary.remove(boundary.size() - 1);
		}

		List<Vector> out = new ArrayList<>(boundary.size());
		for (Vertex v : boundary) {
			out.add(new Vector(v.getX(), v.getY()));
		}
		if (signedArea(out) < 0) {
			Collections.reverse(out);
		}
		return List.copyOf(out);
	}

	private static double signedArea(List<Vector> ring) {
		double a = 0;
		for (int i = 0; i < ring.size(); i++) {
			a += ring.get(i).cross(ring.get((i + 1) % ring.size()));
		}
		return a / 2;
	}

	/** True if p is left of (or within tolerance of) every CCW hull edge. */
	@Override
	public boolean contains(Vector p, double tolerance) {
		int n = ring.size();
		for (int i = 0; i < n; i++) {
			Vector a = ring.get(i);
			Vector edge = ring.get((i + 1) % n).subtract(a);
			double len = edge.magnitude();
			if (len == 0.0) {
				continue;
			}
			if (edge.cross(p.subtract(a)) / len < -tolerance) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return "HullRegion" + ring;
	}
}
