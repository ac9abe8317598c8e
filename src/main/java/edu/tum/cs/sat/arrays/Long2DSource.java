package edu.tum.cs.sat.arrays;

import java.io.Serializable;

/**
 * Read-only view of a 2D grid of long samples. Same coordinate convention as {@link Int2DSource}.
 */
public interface Long2DSource extends Serializable {

	public int getWidth();

	public int getHeight();

	public long get(int x, int y);

}
