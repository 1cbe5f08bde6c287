package com.github.micycle1.geosolve.geometry;

import java.util.ArrayList;
import java.util.List;

final class MathUtil {

	private static final double TWO_PI = 2.0 * Math.PI;

	private MathUtil() {
	}

	public static boolean aboutEq(double a, double b, double eps) {
		return Math.abs(a - b) <= eps;
	}

	// Wraps an angle into [0, 2*pi)
	public static double normalizeAngle(double angle) {
		double a = angle % TWO_PI;
		if (a < 0) {
			a += TWO_PI;
		}
		return a;
	}

	// True if two angles describe the same direction (modulo 2*pi)
	public static boolean sameDirection(double a, double b, double eps) {
		double d = Math.abs(normalizeAngle(a) - normalizeAngle(b));
		return d <= eps || TWO_PI - d <= eps;
	}

	// Removes near-duplicate points, keeping the first occurrence of each.
	public static List<Vector> dedupe(List<Vector> points, double tolerance) {
		List<Vector> out = new ArrayList<>(points.size());
		for (Vector p : points) {
			boolean seen = false;
			for (Vector q : out) {
				if (p.aboutEquals(q, tolerance)) {
					seen = true;
					break;
				}
			}
			if (!seen) {
				out.add(p);
			}
		}
		return out;
	}
}
