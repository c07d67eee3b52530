package com.seamcarve;

import java.util.Arrays;

/**
 * Mutable row-major pixel storage. Each row owns an {@code int[]} buffer of
 * {@code width * channels} samples; seam deletion compacts rows in place and
 * transpose rebuilds the buffers with width and height swapped.
 */
public final class PixelGrid
{

	public enum Mode
	{
		SCALAR(1),
		RGB(3);

		final int channels;

		Mode(int channels)
		{
			this.channels = channels;
		}

		public int channels()
		{
			return channels;
		}
	}

	/** Largest max value a grid accepts, the Netpbm limit of 16 bits per sample. */
	public static final int MAX_SAMPLE = 65535;

	private final Mode mode;
	private final int maxValue;
	private int[][] rows;
	private int width;
	private int height;
	private long revision;

	public PixelGrid(Mode mode, int width, int height, int maxValue)
	{
		if (mode == null) throw new IllegalArgumentException("mode is null");
		if (width <= 0 || height <= 0)
		{
			throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
		}
		if (maxValue <= 0 || maxValue > MAX_SAMPLE)
		{
			throw new IllegalArgumentException("maxValue must be in [1, " + MAX_SAMPLE + "]: " + maxValue);
		}
		if ((long) width * mode.channels > Integer.MAX_VALUE)
		{
			throw new IllegalArgumentException("Grid too wide: " + width);
		}
		this.mode = mode;
		this.maxValue = maxValue;
		this.width = width;
		this.height = height;
		this.rows = new int[height][width * mode.channels];
	}

	/** Builds a single-channel grid from {@code values[row][col]}. */
	public static PixelGrid ofScalar(int[][] values, int maxValue)
	{
		if (values.length == 0 || values[0].length == 0)
		{
			throw new IllegalArgumentException("Grid must have at least one row and one column");
		}
		PixelGrid grid = new PixelGrid(Mode.SCALAR, values[0].length, values.length, maxValue);
		for (int y = 0; y < values.length; y++)
		{
			if (values[y].length != grid.width)
			{
				throw new IllegalArgumentException("Row " + y + " has " + values[y].length
						+ " columns (expected " + grid.width + ")");
			}
			for (int x = 0; x < grid.width; x++)
			{
				grid.set(y, x, 0, values[y][x]);
			}
		}
		return grid;
	}

	public Mode mode()
	{
		return mode;
	}

	public int width()
	{
		return width;
	}

	public int height()
	{
		return height;
	}

	public int maxValue()
	{
		return maxValue;
	}

	/** Number of mutations (sample writes, seam deletions, transposes) since construction. */
	public long revision()
	{
		return revision;
	}

	public int get(int row, int col, int channel)
	{
		checkCell(row, col);
		if (channel < 0 || channel >= mode.channels)
		{
			throw new IndexOutOfBoundsException("channel " + channel + " not in " + mode);
		}
		return rows[row][col * mode.channels + channel];
	}

	public void set(int row, int col, int channel, int value)
	{
		checkCell(row, col);
		if (channel < 0 || channel >= mode.channels)
		{
			throw new IndexOutOfBoundsException("channel " + channel + " not in " + mode);
		}
		if (value < 0 || value > maxValue)
		{
			throw new IllegalArgumentException("Sample " + value + " outside [0, " + maxValue + "]");
		}
		rows[row][col * mode.channels + channel] = value;
		revision++;
	}

	/** Sets R, G and B in one call; only valid for {@link Mode#RGB} grids. */
	public void setRgb(int row, int col, int r, int g, int b)
	{
		if (mode != Mode.RGB) throw new IllegalStateException("Not an RGB grid");
		set(row, col, 0, r);
		set(row, col, 1, g);
		set(row, col, 2, b);
	}

	/**
	 * Intensity used for energy purposes: the stored value for scalar grids,
	 * the truncated mean of R, G and B for RGB grids.
	 */
	public int intensity(int row, int col)
	{
		int[] buf = rows[row];
		if (mode == Mode.SCALAR)
		{
			return buf[col];
		}
		int base = col * 3;
		return (buf[base] + buf[base + 1] + buf[base + 2]) / 3;
	}

	int sample(int row, int col, int channel)
	{
		return rows[row][col * mode.channels + channel];
	}

	/**
	 * Removes the pixel at column {@code seam.column(row)} from every row and
	 * shifts the remainder of the row left. The whole seam is validated first;
	 * on failure the grid is left untouched.
	 *
	 * @throws IllegalArgumentException if the seam length differs from the
	 *         height, an index is out of range, or the grid is one column wide
	 */
	public void deleteSeam(Seam seam)
	{
		if (seam == null) throw new IllegalArgumentException("seam is null");
		if (seam.length() != height)
		{
			throw new IllegalArgumentException("Seam length " + seam.length() + " does not match height " + height);
		}
		if (width == 1)
		{
			throw new IllegalArgumentException("Cannot delete a seam from a grid of width 1");
		}
		for (int y = 0; y < height; y++)
		{
			int col = seam.column(y);
			if (col < 0 || col >= width)
			{
				throw new IllegalArgumentException("Seam column " + col + " at row " + y
						+ " outside [0, " + width + ")");
			}
		}

		int ch = mode.channels;
		int newWidth = width - 1;
		for (int y = 0; y < height; y++)
		{
			int[] src = rows[y];
			int[] dst = new int[newWidth * ch];
			int cut = seam.column(y) * ch;
			System.arraycopy(src, 0, dst, 0, cut);
			System.arraycopy(src, cut + ch, dst, cut, src.length - cut - ch);
			rows[y] = dst;
		}
		width = newWidth;
		revision++;
	}

	/** Moves the pixel at (i, j) to (j, i) and swaps width with height. */
	public void transpose()
	{
		int ch = mode.channels;
		int[][] flipped = new int[width][height * ch];
		for (int y = 0; y < height; y++)
		{
			int[] src = rows[y];
			for (int x = 0; x < width; x++)
			{
				System.arraycopy(src, x * ch, flipped[x], y * ch, ch);
			}
		}
		rows = flipped;
		int t = width;
		width = height;
		height = t;
		revision++;
	}

	public PixelGrid copy()
	{
		PixelGrid c = new PixelGrid(mode, width, height, maxValue);
		for (int y = 0; y < height; y++)
		{
			c.rows[y] = rows[y].clone();
		}
		return c;
	}

	/** True when mode, maxValue, shape and every sample match. */
	public boolean sameContent(PixelGrid other)
	{
		if (other == null) return false;
		if (mode != other.mode || maxValue != other.maxValue
				|| width != other.width || height != other.height)
		{
			return false;
		}
		for (int y = 0; y < height; y++)
		{
			if (!Arrays.equals(rows[y], other.rows[y])) return false;
		}
		return true;
	}

	private void checkCell(int row, int col)
	{
		if (row < 0 || row >= height || col < 0 || col >= width)
		{
			throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + width + "x" + height);
		}
	}

	@Override
	public String toString()
	{
		return "PixelGrid[" + mode + " " + width + "x" + height + " max=" + maxValue + "]";
	}
}
