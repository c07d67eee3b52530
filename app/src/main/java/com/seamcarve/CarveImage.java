package com.seamcarve;

import java.util.List;

/**
 * A decoded image: the pixel grid plus what is needed to write it back. The
 * grid's revision at load time is remembered so an untouched image can be
 * saved as its original bytes.
 */
public record CarveImage(PixelGrid grid, ImageFormat format, List<String> comments, byte[] source,
						 long loadedRevision)
{
	public CarveImage
	{
		if (grid == null) throw new IllegalArgumentException("grid is null");
		if (format == null) throw new IllegalArgumentException("format is null");
		comments = comments == null ? List.of() : List.copyOf(comments);
	}

	public CarveImage(PixelGrid grid, ImageFormat format, List<String> comments, byte[] source)
	{
		this(grid, format, comments, source, grid.revision());
	}

	public CarveImage(PixelGrid grid, ImageFormat format)
	{
		this(grid, format, List.of(), null, grid.revision());
	}

	/** True while the grid has had no seam deletions or transposes since load. */
	public boolean isPristine()
	{
		return source != null && grid.revision() == loadedRevision;
	}
}
