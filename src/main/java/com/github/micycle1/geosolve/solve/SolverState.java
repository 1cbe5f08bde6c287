package com.github.micycle1.geosolve.solve;

import java.util.ArrayDeque;
import java.util.Deque;

import com.github.micycle1.geosolve.geometry.Vector;
import com.github.micycle1.geosolve.graph.ConstraintGraph;

/**
 * Partial assignment plus the explicit choice stack. Owned by exactly one
 * in-flight solve attempt and discarded afterwards.
 */
final class SolverState {

	private final Vector[] positions;
	private final Deque<Choice> stack = new ArrayDeque<>();

	SolverState(ConstraintGraph graph) {
		positions = new Vector[graph.getPointCount()];
		for (int o : graph.origins()) {
			positions[o] = graph.point(o).position();
		}
	}

	Vector[] positions() {
		return positions;
	}

	/** Pushes a fresh choice and applies its first candidate. */
	void push(Choice choice) {
		stack.push(choice);
		positions[choice.point] = choice.current();
	}

	Choice top() {
		return stack.peek();
	}

	/** Applies the top choice's current candidate after {@link Choice#advance()}. */
	void reapplyTop() {
		Choice top = stack.peek();
		positions[top.point] = top.current();
	}

	/** Pops the top choice and restores its point's previous position. */
	Choice pop() {
		Choice top = stack.pop();
		positions[top.point] = top.previous;
		return top;
	}
}
