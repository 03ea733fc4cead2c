package com.github.micycle1.kdtree;

import org.locationtech.jts.geom.Envelope;

import com.github.micycle1.kdtree.Point.Quadrant;

/**
 * An immutable axis-aligned rectangle given by its lower-left and upper-right
 * corners.
 *
 * @author Michael Carleton
 */
public final class Rect {

	private final Point lowerLeft;
	private final Point upperRight;

	public Rect(Point lowerLeft, Point upperRight) {
		this.lowerLeft = lowerLeft;
		this.upperRight = upperRight;
	}

	public static Rect of(Envelope envelope) {
		return new Rect(new Point(envelope.getMinX(), envelope.getMinY()), new Point(envelope.getMaxX(), envelope.getMaxY()));
	}

	public Point lowerLeft() {
		return lowerLeft;
	}

	public Point upperRight() {
		return upperRight;
	}

	public double xmin() {
		return lowerLeft.x();
	}

	public double ymin() {
		return lowerLeft.y();
	}

	public double xmax() {
		return upperRight.x();
	}

	public double ymax() {
		return upperRight.y();
	}

	/**
	 * Tests whether the point lies inside the rectangle. All four sides are
	 * inclusive, within {@link Point#EPS}.
	 */
	public boolean contains(Point point) {
		return lowerLeft.inQuad(point, Quadrant.FIRST) && upperRight.inQuad(point, Quadrant.THIRD);
	}

	/**
	 * Computes the Euclidean distance from the point to the closest point of the
	 * rectangle.
	 * <p>
	 * Outside the rectangle the plane splits into four corner regions, measured
	 * against the corner, and four edge regions, measured perpendicular to the
	 * edge.
	 *
	 * @param point the point to measure from
	 * @return 0 if the rectangle contains the point, the distance otherwise
	 */
	public double distance(Point point) {
		if (contains(point)) {
			return 0;
		}
		if (upperRight.inQuad(point, Quadrant.FIRST)) {
			return upperRight.distance(point);
		}
		if (lowerLeft.inQuad(point, Quadrant.THIRD)) {
			return lowerLeft.distance(point);
		}
		if (upperRight.inQuad(point, Quadrant.FOURTH)) {
			return point.y() > ymin() ? point.x() - xmax() : point.distance(new Point(xmax(), ymin()));
		}
		if (lowerLeft.inQuad(point, Quadrant.SECOND)) {
			return point.y() < ymax() ? xmin() - point.x() : point.distance(new Point(xmin(), ymax()));
		}
		return point.y() > ymax() ? point.y() - ymax() : ymin() - point.y();
	}

	/**
	 * @return true unless the two rectangles are fully separated on x or on y
	 */
	public boolean intersects(Rect other) {
		return !(other.ymin() > ymax() || other.ymax() < ymin() || other.xmin() > xmax() || other.xmax() < xmin());
	}

	public Envelope toEnvelope() {
		return new Envelope(xmin(), xmax(), ymin(), ymax());
	}

	@Override
	public String toString() {
		return "Rect(" + lowerLeft + ", " + upperRight + ")";
	}
}
