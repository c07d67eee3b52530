package com.seamcarve;

/**
 * Policy choices for one carve session.
 */
public record CarveSettings(SeamFinder.TieBreak tieBreak, EnergyComputer.ColorPolicy colorPolicy)
{
	public static final CarveSettings DEFAULTS =
			new CarveSettings(SeamFinder.TieBreak.LEFTMOST, EnergyComputer.ColorPolicy.AVERAGE_INTENSITY);

	public CarveSettings
	{
		if (tieBreak == null) tieBreak = SeamFinder.TieBreak.LEFTMOST;
		if (colorPolicy == null) colorPolicy = EnergyComputer.ColorPolicy.AVERAGE_INTENSITY;
	}

	public SeamCarver newCarver(PixelGrid grid)
	{
		return new SeamCarver(grid, new EnergyComputer(colorPolicy), new SeamFinder(tieBreak));
	}
}
