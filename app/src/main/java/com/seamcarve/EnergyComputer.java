package com.seamcarve;

/**
 * Sum of absolute intensity differences to each in-bounds 4-neighbour.
 * Pixels on the border simply have fewer neighbours.
 */
public final class EnergyComputer
{

	/** How RGB pixels are reduced to contrast. Scalar grids ignore this. */
	public enum ColorPolicy
	{
		/** One intensity per pixel, (R + G + B) / 3 with truncation. */
		AVERAGE_INTENSITY,
		/** Energy computed per channel, then summed over the three channels. */
		PER_CHANNEL
	}

	private final ColorPolicy policy;

	public EnergyComputer()
	{
		this(ColorPolicy.AVERAGE_INTENSITY);
	}

	public EnergyComputer(ColorPolicy policy)
	{
		if (policy == null) throw new IllegalArgumentException("policy is null");
		this.policy = policy;
	}

	public ColorPolicy policy()
	{
		return policy;
	}

	public EnergyMap computeEnergy(PixelGrid grid)
	{
		int h = grid.height();
		int w = grid.width();
		int[][] energy = new int[h][w];
		if (grid.mode() == PixelGrid.Mode.RGB && policy == ColorPolicy.PER_CHANNEL)
		{
			for (int c = 0; c < 3; c++)
			{
				final int channel = c;
				accumulate(energy, w, h, (y, x) -> grid.sample(y, x, channel));
			}
		}
		else
		{
			accumulate(energy, w, h, grid::intensity);
		}
		return new EnergyMap(energy);
	}

	@FunctionalInterface
	private interface Intensity
	{
		int at(int row, int col);
	}

	private static void accumulate(int[][] energy, int w, int h, Intensity in)
	{
		for (int y = 0; y < h; y++)
		{
			for (int x = 0; x < w; x++)
			{
				int v = in.at(y, x);
				int e = 0;
				if (y > 0) e += Math.abs(v - in.at(y - 1, x));
				if (y < h - 1) e += Math.abs(v - in.at(y + 1, x));
				if (x > 0) e += Math.abs(v - in.at(y, x - 1));
				if (x < w - 1) e += Math.abs(v - in.at(y, x + 1));
				energy[y][x] += e;
			}
		}
	}
}
