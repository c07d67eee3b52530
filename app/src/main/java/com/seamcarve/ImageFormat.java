package com.seamcarve;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

public enum ImageFormat
{
	PGM("pgm", "P2", PixelGrid.Mode.SCALAR),
	PPM("ppm", "P3", PixelGrid.Mode.RGB),
	PNG("png", null, null),
	BMP("bmp", null, null),
	GIF("gif", null, null);

	private final String extension;
	private final String magic;
	private final PixelGrid.Mode mode;

	ImageFormat(String extension, String magic, PixelGrid.Mode mode)
	{
		this.extension = extension;
		this.magic = magic;
		this.mode = mode;
	}

	public String extension()
	{
		return extension;
	}

	/** Plain-PNM magic token, or null for raster formats. */
	String magic()
	{
		return magic;
	}

	/** Channel mode fixed by the format, or null when the file decides. */
	PixelGrid.Mode mode()
	{
		return mode;
	}

	public boolean isPnm()
	{
		return magic != null;
	}

	public static ImageFormat forPath(Path path) throws IOException
	{
		String name = path.getFileName() == null ? "" : path.getFileName().toString();
		int dot = name.lastIndexOf('.');
		if (dot < 0)
		{
			throw new IOException("No file extension, cannot pick an image format: " + path);
		}
		String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
		for (ImageFormat f : values())
		{
			if (f.extension.equals(ext)) return f;
		}
		throw new IOException("Unsupported image format '." + ext + "': " + path);
	}
}
