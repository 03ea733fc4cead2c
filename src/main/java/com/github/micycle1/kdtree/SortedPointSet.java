package com.github.micycle1.kdtree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeSet;

/**
 * A point set backed by a sorted set. Every query is a linear scan; the class
 * serves as a drop-in reference for {@link KdTreePointSet}.
 * <p>
 * Iteration is in ascending {@link Point} order.
 *
 * @author Michael Carleton
 */
public class SortedPointSet implements PointSet {

	private final NavigableSet<Point> points;

	public SortedPointSet() {
		this.points = new TreeSet<>();
	}

	/**
	 * Points equal to an earlier point of the collection are dropped.
	 */
	public SortedPointSet(Collection<Point> points) {
		this();
		for (Point p : points) {
			this.points.add(Objects.requireNonNull(p));
		}
	}

	@Override
	public boolean isEmpty() {
		return points.isEmpty();
	}

	@Override
	public int size() {
		return points.size();
	}

	@Override
	public void put(Point point) {
		points.add(Objects.requireNonNull(point));
	}

	@Override
	public boolean contains(Point point) {
		return points.contains(Objects.requireNonNull(point));
	}

	@Override
	public Iterator<Point> range(Rect rect) {
		Objects.requireNonNull(rect);
		List<Point> results = new ArrayList<>();
		for (Point p : points) {
			if (rect.contains(p)) {
				results.add(p);
			}
		}
		return new ListCursor(results);
	}

	@Override
	public Optional<Point> nearest(Point point) {
		Objects.requireNonNull(point);
		Point best = null;
		double bestDistance = Double.POSITIVE_INFINITY;
		for (Point p : points) {
			double d = point.distance(p);
			if (d < bestDistance) {
				bestDistance = d;
				best = p;
			}
		}
		return Optional.ofNullable(best);
	}

	@Override
	public Iterator<Point> nearest(Point point, int k) {
		Objects.requireNonNull(point);
		if (k < 0) {
			throw new IllegalArgumentException("k must be non-negative: " + k);
		}
		if (k == 0) {
			return ListCursor.EMPTY;
		}
		if (k >= points.size()) {
			return iterator();
		}
		PriorityQueue<Point> heap = new PriorityQueue<>(k, Comparator.<Point>comparingDouble(point::distance).reversed());
		for (Point p : points) {
			if (heap.size() < k) {
				heap.add(p);
			} else if (point.distance(p) < point.distance(heap.peek())) {
				heap.poll();
				heap.add(p);
			}
		}
		return new ListCursor(new ArrayList<>(heap));
	}

	@Override
	public Iterator<Point> iterator() {
		return Collections.unmodifiableSet(points).iterator();
	}

	@Override
	public String toString() {
		return PointSet.toString(this);
	}
}
