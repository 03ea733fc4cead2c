package com.github.micycle1.kdtree;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterator over a materialized query result. Elements are consumed from the
 * back of the list; the list becoming empty is the end of iteration.
 */
final class ListCursor implements Iterator<Point> {

	static final ListCursor EMPTY = new ListCursor(List.of());

	private final List<Point> points;

	/**
	 * @param points result list; owned (and drained) by the cursor
	 */
	ListCursor(List<Point> points) {
		this.points = points;
	}

	@Override
	public boolean hasNext() {
		return !points.isEmpty();
	}

	@Override
	public Point next() {
		if (points.isEmpty()) {
			throw new NoSuchElementException("iterator exhausted");
		}
		return points.remove(points.size() - 1);
	}
}
