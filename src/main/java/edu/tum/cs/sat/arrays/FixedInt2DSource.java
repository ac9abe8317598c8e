package edu.tum.cs.sat.arrays;

public class FixedInt2DSource implements Int2DSource {

	private static final long serialVersionUID = 7714958253407165832L;
	private final int width;
	private final int height;
	private final int value;

	public FixedInt2DSource(int width, int height, int value) {
		if ((width <= 0) || (height <= 0))
			throw new IllegalArgumentException("invalid dimensions " + width + "x" + height);
		this.width = width;
		this.height = height;
		this.value = value;
	}

	@Override
	public int getWidth() {
		return width;
	}

	@Override
	public int getHeight() {
		return height;
	}

	@Override
	public int get(int x, int y) {
		if ((x < 0) || (x >= width) || (y < 0) || (y >= height))
			throw new IndexOutOfBoundsException("(" + x + "/" + y + ") outside of " + width + "x" + height + " grid");
		return value;
	}

}
