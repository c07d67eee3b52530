package com.seamcarve;

/**
 * Finds the minimum-energy top-to-bottom seam by dynamic programming.
 * <p>
 * The cumulative cost matrix is filled top-down, where each cell adds its
 * energy to the cheapest of the (up to) three cells above it. The seam ends at
 * the leftmost minimum of the last row and is traced back upwards, resolving
 * equal-cost candidates with the configured {@link TieBreak}.
 */
public final class SeamFinder
{

	/** Preference among equal-cost predecessors while backtracking. */
	public enum TieBreak
	{
		/** Smallest column index wins. */
		LEFTMOST,
		/** Largest column index wins. */
		RIGHTMOST,
		/** The column directly above wins; otherwise the leftmost. */
		PREFER_CENTER
	}

	private final TieBreak tieBreak;

	public SeamFinder()
	{
		this(TieBreak.LEFTMOST);
	}

	public SeamFinder(TieBreak tieBreak)
	{
		if (tieBreak == null) throw new IllegalArgumentException("tieBreak is null");
		this.tieBreak = tieBreak;
	}

	public TieBreak tieBreak()
	{
		return tieBreak;
	}

	public Seam findVerticalSeam(EnergyMap energy)
	{
		if (energy == null) throw new IllegalArgumentException("energy map is null");
		long[][] m = cumulativeCost(energy);
		int h = m.length;
		int w = m[0].length;

		int[] seam = new int[h];
		long[] last = m[h - 1];
		int minCol = 0;
		for (int x = 1; x < w; x++)
		{
			if (last[x] < last[minCol]) minCol = x;
		}
		seam[h - 1] = minCol;

		for (int y = h - 1; y > 0; y--)
		{
			seam[y - 1] = pickPredecessor(m[y - 1], seam[y], w);
		}
		return new Seam(seam);
	}

	/**
	 * Row 0 copies the energy; row i adds the cheapest in-bounds neighbour of
	 * row i - 1. Costs are summed as longs so tall images cannot overflow.
	 */
	static long[][] cumulativeCost(EnergyMap energy)
	{
		int h = energy.height();
		int w = energy.width();
		long[][] m = new long[h][w];
		for (int x = 0; x < w; x++)
		{
			m[0][x] = energy.get(0, x);
		}
		for (int y = 1; y < h; y++)
		{
			long[] above = m[y - 1];
			for (int x = 0; x < w; x++)
			{
				long best = above[x];
				if (x > 0) best = Math.min(best, above[x - 1]);
				if (x < w - 1) best = Math.min(best, above[x + 1]);
				m[y][x] = energy.get(y, x) + best;
			}
		}
		return m;
	}

	private int pickPredecessor(long[] above, int prev, int w)
	{
		int start = Math.max(0, prev - 1);
		int end = Math.min(w - 1, prev + 1);
		int best;
		switch (tieBreak)
		{
			case RIGHTMOST:
				best = start;
				for (int k = start + 1; k <= end; k++)
				{
					if (above[k] <= above[best]) best = k;
				}
				return best;
			case PREFER_CENTER:
				best = prev;
				for (int k = start; k <= end; k++)
				{
					if (above[k] < above[best]) best = k;
				}
				return best;
			case LEFTMOST:
			default:
				best = start;
				for (int k = start + 1; k <= end; k++)
				{
					if (above[k] < above[best]) best = k;
				}
				return best;
		}
	}
}
