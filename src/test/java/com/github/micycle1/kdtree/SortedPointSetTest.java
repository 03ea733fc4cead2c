package com.github.micycle1.kdtree;

import static com.github.micycle1.kdtree.KdTreePointSetTest.drain;
import static com.github.micycle1.kdtree.KdTreePointSetTest.sortedDistances;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

/**
 * Checks the sorted-set implementation on its own and against
 * {@link KdTreePointSet}.
 */
public class SortedPointSetTest {

	@Test
	public void testBulkLoadScenario() {
		SortedPointSet set = new SortedPointSet(List.of(new Point(1, 1), new Point(2, 2), new Point(3, 3), new Point(0, 0), new Point(5, 5)));
		assertEquals(5, set.size());
		assertTrue(set.contains(new Point(2, 2)));
		assertFalse(set.contains(new Point(4, 4)));
		assertEquals(Optional.of(new Point(2, 2)), set.nearest(new Point(2.1, 2.1)));
		assertEquals("PointSet(Point(0.0; 0.0), Point(1.0; 1.0), Point(2.0; 2.0), Point(3.0; 3.0), Point(5.0; 5.0))", set.toString());
	}

	@Test
	public void testEmptyAndDuplicates() {
		SortedPointSet set = new SortedPointSet();
		assertTrue(set.isEmpty());
		assertEquals(Optional.empty(), set.nearest(new Point(1, 1)));
		set.put(new Point(1, 1));
		set.put(new Point(1, 1 + 1e-17));
		assertEquals(1, set.size());
		assertFalse(set.nearest(new Point(0, 0), 0).hasNext());
	}

	@RepeatedTest(25)
	public void testParityWithKdTree() {
		Random rnd = new Random();
		KdTreePointSet tree = new KdTreePointSet();
		SortedPointSet sorted = new SortedPointSet();
		List<Point> points = new ArrayList<>();
		int n = 50 + rnd.nextInt(250);
		for (int i = 0; i < n; i++) {
			// small grid so repeated points occur
			Point p = new Point(rnd.nextInt(40) + rnd.nextDouble(), rnd.nextInt(40) + rnd.nextDouble());
			points.add(p);
			tree.put(p);
			sorted.put(p);
			if (i % 10 == 0) {
				tree.put(p);
				sorted.put(p);
			}
		}
		assertEquals(sorted.size(), tree.size());
		assertEquals(drain(sorted.iterator()), drain(tree.iterator()));
		for (Point p : points) {
			assertEquals(sorted.contains(p), tree.contains(p));
		}

		for (int q = 0; q < 10; q++) {
			double x = rnd.nextDouble() * 40;
			double y = rnd.nextDouble() * 40;
			Rect rect = new Rect(new Point(x, y), new Point(x + rnd.nextDouble() * 10, y + rnd.nextDouble() * 10));
			assertEquals(drain(sorted.range(rect)), drain(tree.range(rect)), rect.toString());

			Point query = new Point(rnd.nextDouble() * 50 - 5, rnd.nextDouble() * 50 - 5);
			assertEquals(query.distance(sorted.nearest(query).orElseThrow()), query.distance(tree.nearest(query).orElseThrow()));

			int k = rnd.nextInt(n + 5);
			List<Point> fromSorted = new ArrayList<>();
			sorted.nearest(query, k).forEachRemaining(fromSorted::add);
			List<Point> fromTree = new ArrayList<>();
			tree.nearest(query, k).forEachRemaining(fromTree::add);
			assertEquals(sortedDistances(fromSorted, query), sortedDistances(fromTree, query), "k=" + k);
		}
	}
}
