package com.github.micycle1.geosolve.geometry;

import java.util.List;
import java.util.Objects;

/**
 * The locus of positions a point may occupy while satisfying one constraint,
 * given the constraint's other (already resolved) points.
 * <p>
 * Tagged variant over three dimensionalities: a finite point set
 * ({@link Dimension#POINTS}), a {@link Curve} ({@link Dimension#CURVE}) or a
 * {@link Region} ({@link Dimension#REGION}). Exactly one payload is non-null,
 * matching the tag. Instances are ephemeral: they are recomputed whenever the
 * known points they depend on change.
 */
public final class PossibilitySpace {

	public enum Dimension {
		/** 0D: finite point set. */
		POINTS,
		/** 1D: a curve. */
		CURVE,
		/** 2D: an area. */
		REGION
	}

	private final Dimension dimension;
	private final List<Vector> points;
	private final Curve curve;
	private final Region region;

	private PossibilitySpace(Dimension dimension, List<Vector> points, Curve curve, Region region) {
		this.dimension = dimension;
		this.points = points;
		this.curve = curve;
		this.region = region;
	}

	public static PossibilitySpace points(List<Vector> points) {
		return new PossibilitySpace(Dimension.POINTS, List.copyOf(points), null, null);
	}

	public static PossibilitySpace curve(Curve curve) {
		return new PossibilitySpace(Dimension.CURVE, null, Objects.requireNonNull(curve), null);
	}

	public static PossibilitySpace region(Region region) {
		return new PossibilitySpace(Dimension.REGION, null, null, Objects.requireNonNull(region));
	}

	public Dimension dimension() {
		return dimension;
	}

	/** @return the finite point set; only valid for {@link Dimension#POINTS} */
	public List<Vector> points() {
		if (dimension != Dimension.POINTS) {
			throw new IllegalStateException("Not a point set: " + this);
		}
		return points;
	}

	public Curve curve() {
		if (dimension != Dimension.CURVE) {
			throw new IllegalStateException("Not a curve: " + this);
		}
		return curve;
	}

	public Region region() {
		if (dimension != Dimension.REGION) {
			throw new IllegalStateException("Not a region: " + this);
		}
		return region;
	}

	public boolean contains(Vector p, double tolerance) {
		switch (dimension) {
			case POINTS :
				for (Vector q : points) {
					if (q.distanceTo(p) <= tolerance) {
						return true;
					}
				}
				return false;
			case CURVE :
				return curve.contains(p, tolerance);
			case REGION :
				return region.contains(p, tolerance);
			default :
				throw new IllegalStateException("Unknown dimension " + dimension);
		}
	}

	@Override
	public String toString() {
		switch (dimension) {
			case POINTS :
				return "Points" + points;
			case CURVE :
				return curve.toString();
			default :
				return region.toString();
		}
	}
}
