package edu.tum.cs.sat.arrays;

import java.io.Serializable;

/**
 * Read-only view of a 2D grid of integer samples. Coordinates are (x, y), i.e. (column, row), zero-based.
 * Dimensions are positive and do not change over the lifetime of the object.
 */
public interface Int2DSource extends Serializable {

	public int getWidth();

	public int getHeight();

	/**
	 * @return the sample at column x and row y; behavior for coordinates outside the grid is left to the
	 * 	implementation, which should fail with an unchecked exception
	 */
	public int get(int x, int y);

}
