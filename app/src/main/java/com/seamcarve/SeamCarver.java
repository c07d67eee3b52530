package com.seamcarve;

/**
 * Drives repeated energy / seam / delete cycles over one grid. Each cycle sees
 * the grid exactly as the previous cycle left it. Horizontal seams are removed
 * as vertical seams of the transposed grid, with one transpose before the run
 * and one after.
 * <p>
 * Instances are not thread-safe; a carver owns its grid for the whole session.
 */
public class SeamCarver
{

	public enum Direction
	{
		VERTICAL,
		HORIZONTAL
	}

	public interface ProgressListener
	{
		void onSeamRemoved(Direction direction, int current, int total);
	}

	private final PixelGrid grid;
	private final EnergyComputer energyComputer;
	private final SeamFinder seamFinder;
	private ProgressListener listener;

	public SeamCarver(PixelGrid grid)
	{
		this(grid, new EnergyComputer(), new SeamFinder());
	}

	public SeamCarver(PixelGrid grid, EnergyComputer energyComputer, SeamFinder seamFinder)
	{
		if (grid == null) throw new IllegalArgumentException("grid is null");
		if (energyComputer == null) throw new IllegalArgumentException("energyComputer is null");
		if (seamFinder == null) throw new IllegalArgumentException("seamFinder is null");
		this.grid = grid;
		this.energyComputer = energyComputer;
		this.seamFinder = seamFinder;
	}

	public SeamCarver setProgressListener(ProgressListener listener)
	{
		this.listener = listener;
		return this;
	}

	public PixelGrid grid()
	{
		return grid;
	}

	/**
	 * @throws IllegalArgumentException unless {@code 0 <= count < width};
	 *         checked before the grid is touched
	 */
	public void removeVerticalSeams(int count)
	{
		checkCount(count, grid.width(), "vertical", "width");
		carve(count, Direction.VERTICAL);
	}

	/**
	 * @throws IllegalArgumentException unless {@code 0 <= count < height};
	 *         checked before the grid is touched
	 */
	public void removeHorizontalSeams(int count)
	{
		checkCount(count, grid.height(), "horizontal", "height");
		if (count == 0) return;
		grid.transpose();
		try
		{
			carve(count, Direction.HORIZONTAL);
		}
		finally
		{
			grid.transpose();
		}
	}

	/**
	 * Shrinks width by {@code vertical} and then height by {@code horizontal}.
	 * Both counts are validated before any seam is removed.
	 */
	public void resize(int vertical, int horizontal)
	{
		checkCount(vertical, grid.width(), "vertical", "width");
		checkCount(horizontal, grid.height(), "horizontal", "height");
		removeVerticalSeams(vertical);
		removeHorizontalSeams(horizontal);
	}

	/** One energy / seam / delete cycle against the current orientation. */
	Seam removeOneSeam()
	{
		EnergyMap energy = energyComputer.computeEnergy(grid);
		Seam seam = seamFinder.findVerticalSeam(energy);
		grid.deleteSeam(seam);
		return seam;
	}

	private void carve(int count, Direction direction)
	{
		for (int i = 0; i < count; i++)
		{
			removeOneSeam();
			if (listener != null)
			{
				listener.onSeamRemoved(direction, i + 1, count);
			}
		}
	}

	private static void checkCount(int count, int dimension, String kind, String dimensionName)
	{
		if (count < 0 || count >= dimension)
		{
			throw new IllegalArgumentException("Cannot remove " + count + " " + kind + " seams from "
					+ dimensionName + " " + dimension + " (must be in [0, " + dimension + "))");
		}
	}
}
