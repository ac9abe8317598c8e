package edu.tum.cs.sat.arrays;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class SourcesTest {

	private static final int[][] grid = new int[][] {
		{ 1, 2, 3, 4 },
		{ 5, 6, 7, 8 },
		{ 9, 10, 11, 12 }
	};

	private static void assertSameGrid(Int2DSource expected, Int2DSource actual) {
		assertEquals(expected.getWidth(), actual.getWidth());
		assertEquals(expected.getHeight(), actual.getHeight());
		for (int y = 0; y < expected.getHeight(); y++)
			for (int x = 0; x < expected.getWidth(); x++)
				assertEquals(x + "x" + y, expected.get(x, y), actual.get(x, y));
	}

	@Test
	public void testDenseAndFlatAgree() {
		DenseInt2DSource dense = new DenseInt2DSource(grid);
		assertEquals(4, dense.getWidth());
		assertEquals(3, dense.getHeight());
		assertEquals(7, dense.get(2, 1));

		Int2DSource flat = Sources.reshape(new int[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12 }, 4);
		assertSameGrid(dense, flat);
		assertSameGrid(dense, new DenseInt2DSource(flat));
		assertSameGrid(dense, Sources.fromValues(Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12), 4));
	}

	@Test
	public void testColumnVector() {
		Int2DSource source = Sources.columnVector(0, 1, 2, 3, 4, 5);
		assertEquals(1, source.getWidth());
		assertEquals(6, source.getHeight());
		assertEquals(4, source.get(0, 4));
	}

	@Test
	public void testFixed() {
		Int2DSource source = new FixedInt2DSource(7, 3, 42);
		assertEquals(7, source.getWidth());
		assertEquals(3, source.getHeight());
		assertEquals(42, source.get(6, 2));
	}

	@Test
	public void testFlatDouble() {
		Double2DSource source = Sources.reshape(new double[] { 0.5, 1.5, 2.5, 3.5, 4.5, 5.5 }, 2);
		assertEquals(2, source.getWidth());
		assertEquals(3, source.getHeight());
		assertEquals(3.5, source.get(1, 1), 0.0);
		assertEquals(4.5, source.get(0, 2), 0.0);
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testFlatRowOverrun() {
		Sources.reshape(new int[] { 1, 2, 3, 4, 5, 6 }, 3).get(3, 0);
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testFixedOutOfBounds() {
		new FixedInt2DSource(7, 3, 42).get(0, 3);
	}

	@Test(expected = ArrayIndexOutOfBoundsException.class)
	public void testDenseOutOfBounds() {
		new DenseInt2DSource(grid).get(4, 0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRaggedArray() {
		new DenseInt2DSource(new int[][] { { 1, 2 }, { 3 } });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRaggedDoubleArray() {
		new DenseDouble2DSource(new double[][] { { 1.0 }, { 2.0, 3.0 } });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyRow() {
		new DenseInt2DSource(new int[][] { {} });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBufferNotMultipleOfWidth() {
		Sources.reshape(new int[] { 1, 2, 3, 4, 5 }, 2);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyBuffer() {
		Sources.reshape(new double[0], 1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyGrid() {
		new DenseLong2DSource(new long[0][0]);
	}

}
