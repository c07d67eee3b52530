package com.seamcarve;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves {@link CarveImage}s, picking the codec from the file
 * extension.
 */
public class ImageFiles
{

	public static CarveImage load(Path path) throws IOException
	{
		if (!Files.isRegularFile(path))
		{
			throw new IOException("Not a file: " + path);
		}
		ImageFormat format = ImageFormat.forPath(path);
		byte[] data = Files.readAllBytes(path);
		if (data.length == 0)
		{
			throw new IOException("Empty file: " + path);
		}

		CarveImage image;
		try
		{
			image = format.isPnm() ? PnmCodec.decode(data, format) : RasterCodec.decode(data, format);
		}
		catch (IOException e)
		{
			throw new IOException("Failed to load " + path.getFileName() + ": " + e.getMessage(), e);
		}
		Log.debug("Loaded " + path + " as " + image.grid());
		return image;
	}

	/**
	 * Writes the image in the format named by the path's extension. An image
	 * whose grid is unchanged since loading, saved in its own format, is
	 * written as its original bytes so header layout and comments survive
	 * exactly.
	 */
	public static void save(CarveImage image, Path path) throws IOException
	{
		ImageFormat target = ImageFormat.forPath(path);
		if (target != image.format())
		{
			image = new CarveImage(image.grid(), target, target.isPnm() ? image.comments() : null, null);
		}
		byte[] data;
		if (image.isPristine())
		{
			data = image.source();
		}
		else if (image.format().isPnm())
		{
			data = PnmCodec.encode(image);
		}
		else
		{
			data = RasterCodec.encode(image);
		}
		Files.write(path, data);
		Log.debug("Wrote " + data.length + " bytes to " + path);
	}

	/**
	 * {@code <base>_processed_<vertical>_<horizontal><ext>} next to the input;
	 * {@code .pgm} is used when the input has no extension.
	 */
	public static Path outputPath(Path input, int vertical, int horizontal)
	{
		String name = input.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String base = dot < 0 ? name : name.substring(0, dot);
		String ext = dot < 0 ? ".pgm" : name.substring(dot);
		return input.resolveSibling(base + "_processed_" + vertical + "_" + horizontal + ext);
	}
}
