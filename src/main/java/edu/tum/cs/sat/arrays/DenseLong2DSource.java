package edu.tum.cs.sat.arrays;

/**
 * Boxing class for long[][], stored row-major: data[y][x].
 */
public class DenseLong2DSource implements Long2DSource {

	private static final long serialVersionUID = -812375013542890148L;

	protected final long[][] data;

	public DenseLong2DSource(long[][] data) {
		Sources.checkShape(data);
		this.data = data;
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
	public long get(int x, int y) {
		return data[y][x];
	}

}
