package com.github.micycle1.kdtree;

import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeSet;

/**
 * A point set backed by a scapegoat-balanced 2-D tree.
 * <p>
 * The discriminator axis alternates by depth: nodes at even depth split on x,
 * nodes at odd depth on y. Every node caches the size of its subtree and the
 * minimal envelope covering all points of its subtree; the envelopes drive the
 * pruning of range and nearest-neighbour searches.
 * <p>
 * Balance is weight based: for every node neither child may hold more than
 * {@link #ALPHA} of the node's subtree. An insertion that breaks this replaces
 * the highest offending subtree with a freshly built, median-split subtree over
 * the same points, which gives amortized logarithmic insertion.
 * <p>
 * Many points sharing a coordinate on a node's axis can leave a freshly built
 * node unbalanced, since equal coordinates never go left. Such a node is not
 * rebuilt again until its subtree has doubled, which bounds the rebuild work
 * spent on it.
 * <p>
 * Not thread-safe. An insertion may replace whole subtrees, so it invalidates
 * all outstanding iterators.
 *
 * @author Michael Carleton
 */
public class KdTreePointSet implements PointSet {

	private static final Logger LOGGER = LoggerFactory.getLogger(KdTreePointSet.class);

	/**
	 * Maximum fraction of a subtree that either child of its root may hold.
	 */
	static final double ALPHA = 0.65;

	Node root;

	/**
	 * Total number of points moved by subtree rebuilds.
	 */
	long rebuiltPoints;

	public KdTreePointSet() {
		this.root = null;
	}

	/**
	 * Builds a balanced tree over the given points. Points equal to an earlier
	 * point of the collection are dropped.
	 *
	 * @param points the initial points
	 */
	public KdTreePointSet(Collection<Point> points) {
		TreeSet<Point> unique = new TreeSet<>();
		for (Point p : points) {
			unique.add(Objects.requireNonNull(p));
		}
		List<Node> nodes = new ArrayList<>(unique.size());
		for (Point p : unique) {
			nodes.add(new Node(p));
		}
		root = build(nodes, 0, nodes.size(), true);
		LOGGER.debug("Built tree over {} points ({} duplicates dropped)", nodes.size(), points.size() - nodes.size());
	}

	/**
	 * Deep copy. The copy shares no nodes with <code>other</code>.
	 */
	public KdTreePointSet(KdTreePointSet other) {
		this.root = other.root == null ? null : other.root.copy();
		setParents(root);
	}

	@Override
	public boolean isEmpty() {
		return root == null;
	}

	@Override
	public int size() {
		return size(root);
	}

	@Override
	public void put(Point point) {
		Objects.requireNonNull(point);
		Insertion insertion = new Insertion();
		root = insert(root, point, true, insertion);
		if (insertion.scapegoat != null) {
			Node scapegoat = insertion.scapegoat;
			Node parent = scapegoat.parent;
			rebuiltPoints += scapegoat.size;
			Node rebuilt = rebuild(scapegoat, insertion.checkX);
			rebuilt.parent = parent;
			if (parent == null) {
				root = rebuilt;
			} else if (parent.left == scapegoat) {
				parent.left = rebuilt;
			} else {
				parent.right = rebuilt;
			}
		}
	}

	@Override
	public boolean contains(Point point) {
		Objects.requireNonNull(point);
		Node current = root;
		boolean checkX = true;
		while (current != null) {
			if (current.point.equals(point)) {
				return true;
			}
			current = less(point, current.point, checkX) ? current.left : current.right;
			checkX = !checkX;
		}
		return false;
	}

	@Override
	public Iterator<Point> range(Rect rect) {
		Objects.requireNonNull(rect);
		List<Point> results = new ArrayList<>();
		Envelope query = rect.toEnvelope();
		// contains() admits points up to EPS outside the rectangle
		query.expandBy(Point.EPS);
		range(root, rect, query, results);
		return new ListCursor(results);
	}

	@Override
	public Optional<Point> nearest(Point point) {
		Objects.requireNonNull(point);
		Nearest best = new Nearest();
		nearest(root, point, best);
		return best.node == null ? Optional.empty() : Optional.of(best.node.point);
	}

	/**
	 * {@inheritDoc}
	 * <p>
	 * Walks the points in order, keeping the k closest seen so far in a max-heap
	 * keyed on distance to <code>point</code>. When k &ge; size the default
	 * iterator is returned.
	 */
	@Override
	public Iterator<Point> nearest(Point point, int k) {
		Objects.requireNonNull(point);
		if (k < 0) {
			throw new IllegalArgumentException("k must be non-negative: " + k);
		}
		if (k == 0) {
			return ListCursor.EMPTY;
		}
		if (k >= size()) {
			return iterator();
		}
		PriorityQueue<Node> heap = new PriorityQueue<>(k, Comparator.comparingDouble((Node n) -> point.distance(n.point)).reversed());
		Node current = leftmost(root);
		for (int i = 0; i < k; i++) {
			heap.add(current);
			current = successor(current);
		}
		for (; current != null; current = successor(current)) {
			if (point.distance(current.point) < point.distance(heap.peek().point)) {
				heap.poll();
				heap.add(current);
			}
		}
		List<Point> results = new ArrayList<>(k);
		for (Node n : heap) {
			results.add(n.point);
		}
		return new ListCursor(results);
	}

	/**
	 * In-order iteration: points are ordered by the tree's discriminators, not by
	 * coordinate.
	 */
	@Override
	public Iterator<Point> iterator() {
		return new NodeCursor(leftmost(root));
	}

	@Override
	public String toString() {
		return PointSet.toString(this);
	}

	/* ====================== Construction ====================== */

	/**
	 * Builds a subtree over nodes[from, to) by recursive median split.
	 * <p>
	 * The median is moved left past every node sharing its coordinate on the
	 * current axis, so the left subtree only holds points strictly less on that
	 * axis.
	 *
	 * @param nodes  fresh single-point nodes; reordered in place
	 * @param checkX whether the subtree root discriminates on x
	 * @return the subtree root (its parent link is left to the caller), or null
	 *         if the range is empty
	 */
	private static Node build(List<Node> nodes, int from, int to, boolean checkX) {
		if (from == to) {
			return null;
		}
		nodes.subList(from, to).sort((a, b) -> Double.compare(coordinate(a.point, checkX), coordinate(b.point, checkX)));
		int median = from + (to - from) / 2;
		while (median != from && !less(nodes.get(median - 1).point, nodes.get(median).point, checkX)) {
			median--;
		}
		Node result = nodes.get(median);
		result.left = build(nodes, from, median, !checkX);
		result.right = build(nodes, median + 1, to, !checkX);
		if (result.left != null) {
			result.left.parent = result;
		}
		if (result.right != null) {
			result.right.parent = result;
		}
		result.update();
		if (!isBalanced(result)) {
			result.rebuildAt = 2 * result.size;
		}
		return result;
	}

	/**
	 * Replaces a subtree with a balanced one over the same points. The old nodes
	 * are discarded.
	 */
	private static Node rebuild(Node subtree, boolean checkX) {
		List<Point> points = new ArrayList<>(subtree.size);
		flatten(subtree, points);
		LOGGER.debug("Rebuilding subtree of {} points ({} axis)", points.size(), checkX ? "x" : "y");
		List<Node> nodes = new ArrayList<>(points.size());
		for (Point p : points) {
			nodes.add(new Node(p));
		}
		return build(nodes, 0, nodes.size(), checkX);
	}

	private static void flatten(Node node, List<Point> points) {
		if (node == null) {
			return;
		}
		flatten(node.left, points);
		points.add(node.point);
		flatten(node.right, points);
	}

	private static void setParents(Node node) {
		if (node == null) {
			return;
		}
		if (node.left != null) {
			node.left.parent = node;
			setParents(node.left);
		}
		if (node.right != null) {
			node.right.parent = node;
			setParents(node.right);
		}
	}

	/* ======================= Insertion ======================== */

	/**
	 * Inserts the point below <code>node</code>, refreshing sizes and envelopes on
	 * the way back up. Each ancestor found out of balance overwrites the
	 * insertion's scapegoat, so after the full unwind it holds the highest one.
	 * Nodes built unbalanced are skipped until they reach their
	 * {@link Node#rebuildAt} size.
	 *
	 * @return the subtree root (a new node if <code>node</code> was null)
	 */
	private static Node insert(Node node, Point point, boolean checkX, Insertion insertion) {
		if (node == null) {
			insertion.inserted = true;
			return new Node(point);
		}
		if (node.point.equals(point)) {
			return node;
		}
		if (less(point, node.point, checkX)) {
			node.left = insert(node.left, point, !checkX, insertion);
			node.left.parent = node;
		} else {
			node.right = insert(node.right, point, !checkX, insertion);
			node.right.parent = node;
		}
		if (!insertion.inserted) {
			return node;
		}
		node.update();
		if (!isBalanced(node) && node.size >= node.rebuildAt) {
			insertion.scapegoat = node;
			insertion.checkX = checkX;
		}
		return node;
	}

	static boolean isBalanced(Node node) {
		return size(node.left) <= ALPHA * node.size && size(node.right) <= ALPHA * node.size;
	}

	/* ========================= Queries ======================== */

	private static void range(Node node, Rect rect, Envelope query, List<Point> results) {
		if (node == null || !node.mbr.intersects(query)) {
			return;
		}
		if (rect.contains(node.point)) {
			results.add(node.point);
		}
		range(node.left, rect, query, results);
		range(node.right, rect, query, results);
	}

	/**
	 * Branch-and-bound search. A subtree is skipped when its envelope is no
	 * closer to the query than the best point found so far.
	 */
	private static void nearest(Node node, Point point, Nearest best) {
		if (node == null || distance(node.mbr, point) >= best.distance) {
			return;
		}
		double d = point.distance(node.point);
		if (d < best.distance) {
			best.distance = d;
			best.node = node;
		}
		Node first = node.left;
		Node second = node.right;
		if (first != null && second != null && distance(second.mbr, point) < distance(first.mbr, point)) {
			first = node.right;
			second = node.left;
		}
		nearest(first, point, best);
		nearest(second, point, best);
	}

	/**
	 * Distance from the point to the closest point of the envelope; a lower bound
	 * of {@link Point#distance(Point)} to any point the envelope covers.
	 */
	static double distance(Envelope mbr, Point point) {
		double dx = Math.max(0, Math.max(mbr.getMinX() - point.x(), point.x() - mbr.getMaxX()));
		double dy = Math.max(0, Math.max(mbr.getMinY() - point.y(), point.y() - mbr.getMaxY()));
		return Math.hypot(dx, dy);
	}

	/* ======================= Traversal ======================== */

	static Node leftmost(Node node) {
		if (node == null) {
			return null;
		}
		while (node.left != null) {
			node = node.left;
		}
		return node;
	}

	/**
	 * Finds the in-order successor using parent links only.
	 *
	 * @return the next node, or null if <code>node</code> is the last one
	 */
	static Node successor(Node node) {
		if (node.right != null) {
			return leftmost(node.right);
		}
		Node current = node;
		while (current.parent != null) {
			Node parent = current.parent;
			if (parent.left == current) {
				return parent;
			}
			current = parent;
		}
		return null;
	}

	private static boolean less(Point a, Point b, boolean checkX) {
		return coordinate(a, checkX) < coordinate(b, checkX);
	}

	private static double coordinate(Point p, boolean checkX) {
		return checkX ? p.x() : p.y();
	}

	static int size(Node node) {
		return node == null ? 0 : node.size;
	}

	/* ===================== Supporting Classes ==================== */

	/**
	 * A tree node. Children are owned by the node; the parent link only serves
	 * upward traversal.
	 */
	static final class Node {
		final Point point;
		/**
		 * The minimal envelope covering this node's point and the envelopes of both
		 * children.
		 */
		Envelope mbr;
		int size;
		/**
		 * Subtree size below which the node is not rebuilt. Non-zero only for nodes
		 * that came out of a build unbalanced because of equal coordinates.
		 */
		int rebuildAt;
		Node left;
		Node right;
		Node parent;

		Node(Point point) {
			this.point = point;
			this.mbr = new Envelope(point.toCoordinate());
			this.size = 1;
		}

		/**
		 * Recomputes size and envelope from the children.
		 */
		void update() {
			size = 1 + size(left) + size(right);
			mbr = new Envelope(point.toCoordinate());
			if (left != null) {
				mbr.expandToInclude(left.mbr);
			}
			if (right != null) {
				mbr.expandToInclude(right.mbr);
			}
		}

		/**
		 * Recursively copies the subtree. Parent links of the copy are not set.
		 */
		Node copy() {
			Node node = new Node(point);
			node.mbr = new Envelope(mbr);
			node.size = size;
			node.rebuildAt = rebuildAt;
			node.left = left == null ? null : left.copy();
			node.right = right == null ? null : right.copy();
			return node;
		}

		@Override
		public String toString() {
			return "Node(" + point + ", size=" + size + "): " + mbr;
		}
	}

	/**
	 * State carried through one insertion.
	 */
	private static final class Insertion {
		boolean inserted;
		Node scapegoat; // highest unbalanced ancestor
		boolean checkX; // discriminator of the scapegoat
	}

	private static final class Nearest {
		double distance = Double.POSITIVE_INFINITY;
		Node node;
	}

	/**
	 * In-order iterator positioned on a node. A null position is the end.
	 */
	private static final class NodeCursor implements Iterator<Point> {
		private Node current;

		NodeCursor(Node start) {
			this.current = start;
		}

		@Override
		public boolean hasNext() {
			return current != null;
		}

		@Override
		public Point next() {
			if (current == null) {
				throw new NoSuchElementException("iterator exhausted");
			}
			Point point = current.point;
			current = successor(current);
			return point;
		}
	}
}
