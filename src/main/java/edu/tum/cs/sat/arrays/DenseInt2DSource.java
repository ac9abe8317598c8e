package edu.tum.cs.sat.arrays;

/**
 * Boxing class for int[][], stored row-major: data[y][x]. Out-of-range access fails with an
 * ArrayIndexOutOfBoundsException from the backing array.
 */
public class DenseInt2DSource implements Int2DSource {

	private static final long serialVersionUID = 4290813727046313018L;

	protected final int[][] data;

	public DenseInt2DSource(int[][] data) {
		Sources.checkShape(data);
		this.data = data;
	}

	/**
	 * Creates a deep copy of another integer 2D source.
	 */
	public DenseInt2DSource(Int2DSource other) {
		data = new int[other.getHeight()][other.getWidth()];
		for (int y = 0; y < data.length; y++)
			for (int x = 0; x < data[0].length; x++)
				data[y][x] = other.get(x, y);
	}

	@Override
	public int getWidth() {
		return data[0].length;
	}

	@Override
	public int getHeight() {
		return data.length;
	}

	@Override
	public int get(int x, int y) {
		return data[y][x];
	}

}
