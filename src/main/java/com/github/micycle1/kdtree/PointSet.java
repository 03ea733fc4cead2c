package com.github.micycle1.kdtree;

import org.locationtech.jts.geom.Envelope;

import java.util.Iterator;
import java.util.Optional;

/**
 * A set of unique 2-D points supporting membership, rectangle range and
 * nearest-neighbour queries. Points are unique under the epsilon-tolerant
 * equality of {@link Point}.
 * <p>
 * Query results are returned as iterators; an iterator's own
 * {@link Iterator#hasNext()} marks the end of that query's results. Calling
 * {@link Iterator#next()} on an exhausted iterator throws
 * {@link java.util.NoSuchElementException}. Iterators are invalidated by a
 * subsequent {@link #put(Point)}.
 * <p>
 * Tree-backed implementations route on raw coordinates and only match with the
 * epsilon-tolerant equality. A point within {@link Point#EPS} of a stored point
 * but on the other side of a split coordinate is then neither found by
 * {@link #contains(Point)} nor rejected by {@link #put(Point)}; it is stored as
 * a separate point.
 *
 * @author Michael Carleton
 */
public interface PointSet extends Iterable<Point> {

	boolean isEmpty();

	int size();

	/**
	 * Adds the point. Does nothing if an equal point is already present.
	 */
	void put(Point point);

	boolean contains(Point point);

	/**
	 * Finds the points lying inside the rectangle (boundary inclusive). Result
	 * order is unspecified.
	 */
	Iterator<Point> range(Rect rect);

	default Iterator<Point> range(Envelope envelope) {
		return range(Rect.of(envelope));
	}

	/**
	 * @return a point with the smallest distance to <code>point</code>, or empty
	 *         if the set is empty
	 */
	Optional<Point> nearest(Point point);

	/**
	 * Finds the <code>k</code> points closest to <code>point</code>, in
	 * unspecified order. Ties at the k-th distance are broken arbitrarily.
	 *
	 * @param point the query point
	 * @param k     number of points to find; 0 yields no points, k &ge; size
	 *              yields every point
	 * @throws IllegalArgumentException if k is negative
	 */
	Iterator<Point> nearest(Point point, int k);

	/**
	 * Iterates over every point, in the set's default order.
	 */
	@Override
	Iterator<Point> iterator();

	static String toString(PointSet pointSet) {
		StringBuilder sb = new StringBuilder("PointSet(");
		Iterator<Point> it = pointSet.iterator();
		while (it.hasNext()) {
			sb.append(it.next());
			if (it.hasNext()) {
				sb.append(", ");
			}
		}
		return sb.append(')').toString();
	}
}
