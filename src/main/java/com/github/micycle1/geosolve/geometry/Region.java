package com.github.micycle1.geosolve.geometry;

/**
 * A two-dimensional locus. Regions never make a point discrete on their own;
 * they only filter candidates produced by points and curves.
 */
public interface Region {

	boolean contains(Vector p, double tolerance);
}
