package com.seamcarve;

import java.util.Arrays;

/**
 * One column index per row, top to bottom. Consecutive entries differ by at
 * most one when produced by {@link SeamFinder}.
 */
public record Seam(int[] columns)
{
	public Seam
	{
		if (columns == null || columns.length == 0)
		{
			throw new IllegalArgumentException("Seam must cover at least one row");
		}
		columns = columns.clone();
	}

	public static Seam of(int... columns)
	{
		return new Seam(columns);
	}

	public int length()
	{
		return columns.length;
	}

	public int column(int row)
	{
		return columns[row];
	}

	@Override
	public int[] columns()
	{
		return columns.clone();
	}

	public boolean isConnected()
	{
		for (int i = 1; i < columns.length; i++)
		{
			if (Math.abs(columns[i] - columns[i - 1]) > 1) return false;
		}
		return true;
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof Seam other && Arrays.equals(columns, other.columns);
	}

	@Override
	public int hashCode()
	{
		return Arrays.hashCode(columns);
	}

	@Override
	public String toString()
	{
		return "Seam" + Arrays.toString(columns);
	}
}
