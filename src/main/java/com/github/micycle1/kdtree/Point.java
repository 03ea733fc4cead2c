package com.github.micycle1.kdtree;

import org.locationtech.jts.geom.Coordinate;

/**
 * An immutable 2-D point.
 * <p>
 * Equality and ordering are tolerant to {@link #EPS}: two coordinates whose
 * absolute difference is below the machine epsilon are considered equal. The
 * ordering is lexicographic on (x, y).
 *
 * @author Michael Carleton
 */
public final class Point implements Comparable<Point> {

	/**
	 * Machine epsilon for doubles.
	 */
	public static final double EPS = Math.ulp(1.0);

	private final double x;
	private final double y;

	public Point(double x, double y) {
		this.x = x;
		this.y = y;
	}

	public static Point of(Coordinate coordinate) {
		return new Point(coordinate.x, coordinate.y);
	}

	public double x() {
		return x;
	}

	public double y() {
		return y;
	}

	/**
	 * @param other another point
	 * @return the Euclidean distance between the two points
	 */
	public double distance(Point other) {
		return Math.hypot(x - other.x, y - other.y);
	}

	/**
	 * Quadrants around a point. Each includes its boundary (within
	 * {@link #EPS}).
	 */
	public enum Quadrant {
		/** x and y not less. */
		FIRST,
		/** x not greater, y not less. */
		SECOND,
		/** x and y not greater. */
		THIRD,
		/** x not less, y not greater. */
		FOURTH
	}

	/**
	 * Tests whether <code>other</code> lies in the given quadrant with this point
	 * as the origin.
	 *
	 * @param other the point to test
	 * @param quad  the quadrant
	 * @return true if other lies in (or on the boundary of) the quadrant
	 */
	public boolean inQuad(Point other, Quadrant quad) {
		switch (quad) {
			case FIRST:
				return other.x > x - EPS && other.y > y - EPS;
			case SECOND:
				return other.x < x + EPS && other.y > y - EPS;
			case THIRD:
				return other.x < x + EPS && other.y < y + EPS;
			case FOURTH:
				return other.x > x - EPS && other.y < y + EPS;
			default:
				return false;
		}
	}

	public boolean less(Point other) {
		return x < other.x || (Math.abs(x - other.x) < EPS && y < other.y);
	}

	public Coordinate toCoordinate() {
		return new Coordinate(x, y);
	}

	@Override
	public int compareTo(Point other) {
		if (equals(other)) {
			return 0;
		}
		return less(other) ? -1 : 1;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Point)) {
			return false;
		}
		Point other = (Point) obj;
		return Math.abs(x - other.x) < EPS && Math.abs(y - other.y) < EPS;
	}

	@Override
	public int hashCode() {
		return 31 * hash(x) + hash(y);
	}

	@Override
	public String toString() {
		return "Point(" + x + "; " + y + ")";
	}

	// distinct doubles outside (-2, 2) are at least EPS apart
	private static int hash(double c) {
		return Math.abs(c) < 2 ? 0 : Double.hashCode(c);
	}
}
