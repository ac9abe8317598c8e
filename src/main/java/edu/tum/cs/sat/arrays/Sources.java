package edu.tum.cs.sat.arrays;

import java.lang.reflect.Array;
import java.util.Collection;

import com.google.common.primitives.Ints;

/**
 * Shortcuts for turning flat sequences of samples into grids.
 */
public class Sources {

	private Sources() {
	}

	/**
	 * Rejects empty and ragged row-major arrays.
	 */
	static void checkShape(Object[] rows) {
		if ((rows.length == 0) || (Array.getLength(rows[0]) == 0))
			throw new IllegalArgumentException("empty grid");
		int numColumns = Array.getLength(rows[0]);
		for (int y = 1; y < rows.length; y++)
			if (Array.getLength(rows[y]) != numColumns)
				throw new IllegalArgumentException("row " + y + " has " + Array.getLength(rows[y]) + " columns, " +
						"expected " + numColumns);
	}

	/**
	 * @return a grid of width 1 whose rows are the given values
	 */
	public static Int2DSource columnVector(int... values) {
		return new FlatInt2DSource(values, 1);
	}

	public static Int2DSource reshape(int[] values, int width) {
		return new FlatInt2DSource(values, width);
	}

	public static Double2DSource reshape(double[] values, int width) {
		return new FlatDouble2DSource(values, width);
	}

	/**
	 * Lays out the values row by row in a grid of the given width. Values are truncated to int.
	 */
	public static Int2DSource fromValues(Collection<? extends Number> values, int width) {
		return new FlatInt2DSource(Ints.toArray(values), width);
	}

}
