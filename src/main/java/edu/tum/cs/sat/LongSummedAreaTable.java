package edu.tum.cs.sat;

import java.util.logging.Logger;

import edu.tum.cs.sat.arrays.Int2DSource;
import edu.tum.cs.sat.arrays.Long2DSource;
import edu.tum.cs.sat.util.TableConfiguration;

/**
 * Summed area table over integer samples, accumulated in longs. Int sources are widened on the fly. With overflow
 * checks enabled, every addition and subtraction is exact and every intermediate result is itself the sum of a
 * rectangle of samples, so an overflow means that such a sum does not fit the accumulator. It is reported as an
 * IllegalStateException.
 */
public class LongSummedAreaTable extends SummedAreaTable {

	private static final long serialVersionUID = -4472718006283512154L;
	private static final Logger logger = Logger.getLogger(LongSummedAreaTable.class.getName());

	private static class WideningSource implements Long2DSource {
		private static final long serialVersionUID = 1L;

		private final Int2DSource source;

		public WideningSource(Int2DSource source) {
			this.source = source;
		}

		@Override
		public int getWidth() {
			return source.getWidth();
		}

		@Override
		public int getHeight() {
			return source.getHeight();
		}

		@Override
		public long get(int x, int y) {
			return source.get(x, y);
		}
	}

	private final long[] table;

	private LongSummedAreaTable(int width, int height, long[] table, TableConfiguration config) {
		super(width, height, config);
		this.table = table;
	}

	public static LongSummedAreaTable buildFull(Int2DSource source) {
		return buildFull(new WideningSource(source), getDefaultConfiguration());
	}

	public static LongSummedAreaTable buildFull(Int2DSource source, TableConfiguration config) {
		return buildFull(new WideningSource(source), config);
	}

	public static LongSummedAreaTable build(Int2DSource source, int fromX, int fromY, int toX, int toY) {
		return build(new WideningSource(source), fromX, fromY, toX, toY, getDefaultConfiguration());
	}

	public static LongSummedAreaTable build(Int2DSource source, int fromX, int fromY, int toX, int toY,
			TableConfiguration config) {
		return build(new WideningSource(source), fromX, fromY, toX, toY, config);
	}

	public static LongSummedAreaTable buildFull(Long2DSource source) {
		return buildFull(source, getDefaultConfiguration());
	}

	public static LongSummedAreaTable buildFull(Long2DSource source, TableConfiguration config) {
		return build(source, 0, 0, source.getWidth() - 1, source.getHeight() - 1, config);
	}

	public static LongSummedAreaTable build(Long2DSource source, int fromX, int fromY, int toX, int toY) {
		return build(source, fromX, fromY, toX, toY, getDefaultConfiguration());
	}

	/**
	 * Builds the table over the rectangle (fromX, fromY) - (toX, toY) of the source, both points inclusive. Cell
	 * (x, y) of the result holds the sum of all source samples in (fromX, fromY) - (fromX + x, fromY + y).
	 */
	public static LongSummedAreaTable build(Long2DSource source, int fromX, int fromY, int toX, int toY,
			TableConfiguration config) {
		if (config.isValidatingCoordinates())
			checkRectangle(fromX, fromY, toX, toY, source.getWidth(), source.getHeight());
		boolean exact = config.isCheckingOverflow();

		long startTime = System.nanoTime();
		int width = toX - fromX + 1;
		int height = toY - fromY + 1;
		checkSize(width, height);
		long[] table = new long[width * height];
		// each cell depends on its upper and left neighbors, so scan row by row
		for (int row = 0, idx = 0; row < height; row++) {
			for (int col = 0; col < width; col++, idx++) {
				long value = source.get(fromX + col, fromY + row);
				try {
					if (exact) {
						// column strip above the cell first, then everything to its left
						if ((row > 0) && (col > 0))
							value = Math.addExact(value,
									Math.subtractExact(table[idx - width], table[idx - width - 1]));
						else if (row > 0)
							value = Math.addExact(value, table[idx - width]);
						if (col > 0)
							value = Math.addExact(value, table[idx - 1]);
					} else {
						if (row > 0)
							value += table[idx - width];
						if (col > 0)
							value += table[idx - 1];
						if ((row > 0) && (col > 0))
							value -= table[idx - width - 1];
					}
				} catch (ArithmeticException ex) {
					throw new IllegalStateException("accumulator overflow at (" + col + "/" + row + ")", ex);
				}
				table[idx] = value;
			}
		}
		logger.fine("built " + width + "x" + height + " table in " + ((System.nanoTime() - startTime) / 1000) +
				" us");
		return new LongSummedAreaTable(width, height, table, config);
	}

	/**
	 * @return the sum of all samples in (0, 0) - (x, y)
	 */
	public long getCumulativeSum(int x, int y) {
		checkRectangle(x, y, x, y);
		return table[index(x, y)];
	}

	/**
	 * @return the sum of all samples in the given rectangle
	 */
	public long getSum(int fromX, int fromY, int toX, int toY) {
		checkRectangle(fromX, fromY, toX, toY);

		long sum = table[index(toX, toY)];
		if (!checkOverflow) {
			if ((fromX > 0) && (fromY > 0))
				sum += table[index(fromX - 1, fromY - 1)];
			if (fromX > 0)
				sum -= table[index(fromX - 1, toY)];
			if (fromY > 0)
				sum -= table[index(toX, fromY - 1)];
			return sum;
		}

		// (fromX..toX, 0..toY) minus (fromX..toX, 0..fromY-1)
		try {
			long above = (fromY > 0) ? table[index(toX, fromY - 1)] : 0L;
			if (fromX > 0) {
				sum = Math.subtractExact(sum, table[index(fromX - 1, toY)]);
				if (fromY > 0)
					above = Math.subtractExact(above, table[index(fromX - 1, fromY - 1)]);
			}
			sum = Math.subtractExact(sum, above);
		} catch (ArithmeticException ex) {
			throw new IllegalStateException("accumulator overflow: from (" + fromX + "/" + fromY + ") to (" + toX +
					"/" + toY + ")", ex);
		}
		return sum;
	}

	public long getOverallSum() {
		return getSum(0, 0, width - 1, height - 1);
	}

	@Override
	public double getAverage(int fromX, int fromY, int toX, int toY) {
		return (double) getSum(fromX, fromY, toX, toY) / getDataCount(fromX, fromY, toX, toY);
	}

}
