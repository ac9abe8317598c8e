package edu.tum.cs.sat;

import java.io.Serializable;
import java.util.logging.Logger;

import edu.tum.cs.sat.util.TableConfiguration;

/**
 * Common part of summed area tables (integral images): dimensions, rectangle validation and data counts. A table is
 * immutable once built, so it may be queried from several threads without synchronization.
 * <p>
 * Rectangles are given by their upper left point (fromX, fromY) and lower right point (toX, toY), both inclusive,
 * in the coordinate space of the table. If the table was built over a part of a source grid, (0, 0) is the upper
 * left corner of that part.
 */
public abstract class SummedAreaTable implements Serializable {

	private static final long serialVersionUID = 2537071219591587946L;
	private static final Logger logger = Logger.getLogger(SummedAreaTable.class.getName());

	private static final TableConfiguration defaultConfiguration = new TableConfiguration(SummedAreaTable.class);

	static {
		if (!defaultConfiguration.isValidatingCoordinates())
			logger.warning("coordinate validation is disabled");
		if (!defaultConfiguration.isCheckingOverflow())
			logger.warning("overflow checks are disabled");
	}

	protected final int width;
	protected final int height;
	protected final boolean validateCoordinates;
	protected final boolean checkOverflow;

	protected SummedAreaTable(int width, int height, TableConfiguration config) {
		this.width = width;
		this.height = height;
		this.validateCoordinates = config.isValidatingCoordinates();
		this.checkOverflow = config.isCheckingOverflow();
	}

	/**
	 * @return the configuration used by tables built without an explicit one, read when this class is loaded
	 */
	public static TableConfiguration getDefaultConfiguration() {
		return defaultConfiguration;
	}

	static void checkRectangle(int fromX, int fromY, int toX, int toY, int width, int height) {
		if ((fromX > toX) || (fromY > toY))
			throw new IllegalArgumentException("`from` (" + fromX + "/" + fromY + ") must not be right of or below " +
					"`to` (" + toX + "/" + toY + ")");
		if ((fromX < 0) || (fromY < 0) || (toX >= width) || (toY >= height))
			throw new IndexOutOfBoundsException("`from` (" + fromX + "/" + fromY + ") or `to` (" + toX + "/" + toY +
					") not within bounds [(0/0)..(" + (width - 1) + "/" + (height - 1) + ")]");
	}

	static void checkSize(int width, int height) {
		if (((long) width * height) > Integer.MAX_VALUE)
			throw new IllegalArgumentException("table of " + width + "x" + height + " cells is too large");
	}

	protected void checkRectangle(int fromX, int fromY, int toX, int toY) {
		if (validateCoordinates)
			checkRectangle(fromX, fromY, toX, toY, width, height);
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/**
	 * @return the number of cells in the given rectangle
	 */
	public long getDataCount(int fromX, int fromY, int toX, int toY) {
		checkRectangle(fromX, fromY, toX, toY);
		return (long) (toX - fromX + 1) * (toY - fromY + 1);
	}

	public long getOverallDataCount() {
		return (long) width * height;
	}

	/**
	 * @return the mean of the cells in the given rectangle
	 */
	public abstract double getAverage(int fromX, int fromY, int toX, int toY);

	public double getOverallAverage() {
		return getAverage(0, 0, width - 1, height - 1);
	}

	protected int index(int x, int y) {
		return y * width + x;
	}

}
