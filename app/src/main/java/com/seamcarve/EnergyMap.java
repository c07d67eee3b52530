package com.seamcarve;

import java.util.Arrays;

/**
 * Per-pixel energy, indexed {@code [row][col]}, shaped like the grid it was
 * computed from. The rows are copied on the way in and on the way out.
 */
public record EnergyMap(int[][] values)
{
	public EnergyMap
	{
		if (values == null || values.length == 0 || values[0].length == 0)
		{
			throw new IllegalArgumentException("Energy map must have at least one row and one column");
		}
		int w = values[0].length;
		for (int y = 1; y < values.length; y++)
		{
			if (values[y].length != w)
			{
				throw new IllegalArgumentException("Ragged energy map at row " + y);
			}
		}
		values = copyOf(values);
	}

	@Override
	public int[][] values()
	{
		return copyOf(values);
	}

	public int width()
	{
		return values[0].length;
	}

	public int height()
	{
		return values.length;
	}

	public int get(int row, int col)
	{
		return values[row][col];
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof EnergyMap other && Arrays.deepEquals(values, other.values);
	}

	@Override
	public int hashCode()
	{
		return Arrays.deepHashCode(values);
	}

	private static int[][] copyOf(int[][] rows)
	{
		int[][] copy = new int[rows.length][];
		for (int y = 0; y < rows.length; y++)
		{
			copy[y] = rows[y].clone();
		}
		return copy;
	}
}
