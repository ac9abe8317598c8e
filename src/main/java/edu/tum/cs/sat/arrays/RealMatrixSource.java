package edu.tum.cs.sat.arrays;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Exposes a RealMatrix as a grid: matrix rows are y, matrix columns are x. The matrix is not copied and must not be
 * modified while a table is built from it.
 */
public class RealMatrixSource implements Double2DSource {

	private static final long serialVersionUID = -1287265504356640153L;

	private final RealMatrix matrix;

	public RealMatrixSource(RealMatrix matrix) {
		this.matrix = matrix;
	}

	@Override
	public int getWidth() {
		return matrix.getColumnDimension();
	}

	@Override
	public int getHeight() {
		return matrix.getRowDimension();
	}

	@Override
	public double get(int x, int y) {
		return matrix.getEntry(y, x);
	}

}
