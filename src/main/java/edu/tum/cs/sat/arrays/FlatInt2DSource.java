package edu.tum.cs.sat.arrays;

/**
 * Grid backed by a flat buffer with an explicit width; element (x, y) is stored at index y * width + x.
 */
public class FlatInt2DSource implements Int2DSource {

	private static final long serialVersionUID = -6531049917233385160L;

	protected final int[] data;
	protected final int width;

	public FlatInt2DSource(int[] data, int width) {
		if (width <= 0)
			throw new IllegalArgumentException("width must be positive, got " + width);
		if ((data.length == 0) || ((data.length % width) != 0))
			throw new IllegalArgumentException("buffer of length " + data.length + " is not a positive multiple of " +
					"width " + width);
		this.data = data;
		this.width = width;
	}

	@Override
	public int getWidth() {
		return width;
	}

	@Override
	public int getHeight() {
		return data.length / width;
	}

	@Override
	public int get(int x, int y) {
		// would otherwise silently read from the neighboring row
		if ((x < 0) || (x >= width))
			throw new IndexOutOfBoundsException("x = " + x + ", width = " + width);
		return data[y * width + x];
	}

}
