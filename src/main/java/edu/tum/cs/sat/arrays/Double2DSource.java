package edu.tum.cs.sat.arrays;

import java.io.Serializable;

/**
 * Read-only view of a 2D grid of floating point samples. Same coordinate convention as {@link Int2DSource}.
 */
public interface Double2DSource extends Serializable {

	public int getWidth();

	public int getHeight();

	public double get(int x, int y);

}
