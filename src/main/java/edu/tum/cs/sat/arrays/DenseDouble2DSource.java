package edu.tum.cs.sat.arrays;

/**
 * Boxing class for double[][], stored row-major: data[y][x].
 */
public class DenseDouble2DSource implements Double2DSource {

	private static final long serialVersionUID = -2206371502881150647L;

	protected final double[][] data;

	public DenseDouble2DSource(double[][] data) {
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
	public double get(int x, int y) {
		return data[y][x];
	}

}
