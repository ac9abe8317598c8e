package edu.tum.cs.sat;

import java.util.logging.Logger;

import edu.tum.cs.sat.arrays.Double2DSource;
import edu.tum.cs.sat.util.TableConfiguration;

/**
 * Summed area table over floating point samples. Sums follow IEEE 754 semantics, so overflow checks do not apply;
 * results of queries over distant corners of large tables are subject to cancellation.
 */
public class DoubleSummedAreaTable extends SummedAreaTable {

	private static final long serialVersionUID = 6409155870224116952L;
	private static final Logger logger = Logger.getLogger(DoubleSummedAreaTable.class.getName());

	private final double[] table;

	private DoubleSummedAreaTable(int width, int height, double[] table, TableConfiguration config) {
		super(width, height, config);
		this.table = table;
	}

	public static DoubleSummedAreaTable buildFull(Double2DSource source) {
		return buildFull(source, getDefaultConfiguration());
	}

	public static DoubleSummedAreaTable buildFull(Double2DSource source, TableConfiguration config) {
		return build(source, 0, 0, source.getWidth() - 1, source.getHeight() - 1, config);
	}

	public static DoubleSummedAreaTable build(Double2DSource source, int fromX, int fromY, int toX, int toY) {
		return build(source, fromX, fromY, toX, toY, getDefaultConfiguration());
	}

	public static DoubleSummedAreaTable build(Double2DSource source, int fromX, int fromY, int toX, int toY,
			TableConfiguration config) {
		if (config.isValidatingCoordinates())
			checkRectangle(fromX, fromY, toX, toY, source.getWidth(), source.getHeight());

		long startTime = System.nanoTime();
		int width = toX - fromX + 1;
		int height = toY - fromY + 1;
		checkSize(width, height);
		double[] table = new double[width * height];
		for (int row = 0, idx = 0; row < height; row++) {
			for (int col = 0; col < width; col++, idx++) {
				double value = source.get(fromX + col, fromY + row);
				if (row > 0)
					value += table[idx - width];
				if (col > 0)
					value += table[idx - 1];
				if ((row > 0) && (col > 0))
					value -= table[idx - width - 1];
				table[idx] = value;
			}
		}
		logger.fine("built " + width + "x" + height + " table in " + ((System.nanoTime() - startTime) / 1000) +
				" us");
		return new DoubleSummedAreaTable(width, height, table, config);
	}

	public double getCumulativeSum(int x, int y) {
		checkRectangle(x, y, x, y);
		return table[index(x, y)];
	}

	public double getSum(int fromX, int fromY, int toX, int toY) {
		checkRectangle(fromX, fromY, toX, toY);

		double sum = table[index(toX, toY)];
		if ((fromX > 0) && (fromY > 0))
			sum += table[index(fromX - 1, fromY - 1)];
		if (fromX > 0)
			sum -= table[index(fromX - 1, toY)];
		if (fromY > 0)
			sum -= table[index(toX, fromY - 1)];
		return sum;
	}

	public double getOverallSum() {
		return getSum(0, 0, width - 1, height - 1);
	}

	@Override
	public double getAverage(int fromX, int fromY, int toX, int toY) {
		return getSum(fromX, fromY, toX, toY) / getDataCount(fromX, fromY, toX, toY);
	}

}
