package com.seamcarve;

import org.apache.commons.imaging.ImageInfo;
import org.apache.commons.imaging.Imaging;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * PNG, BMP and GIF through {@link ImageIO}. 8-bit gray images load as
 * {@link PixelGrid.Mode#SCALAR}, everything else as {@link PixelGrid.Mode#RGB};
 * alpha is dropped. Samples are 8 bit.
 */
public class RasterCodec
{

	static final int MAX_VALUE = 255;

	public static CarveImage decode(byte[] data, ImageFormat format) throws IOException
	{
		if (format.isPnm())
		{
			throw new IOException("Not a raster format: " + format);
		}

		BufferedImage image = readImage(data);

		// Metadata is informational only
		try
		{
			ImageInfo info = Imaging.getImageInfo(data);
			if (info.isTransparent())
			{
				Log.warning(format + " image has transparency (" + info.getBitsPerPixel()
						+ " bpp); alpha will be discarded");
			}
			else
			{
				Log.debug(format + " image, " + info.getBitsPerPixel() + " bpp");
			}
		}
		catch (IOException | IllegalArgumentException e)
		{
			Log.debug("No image metadata available: " + e.getMessage());
		}

		int w = image.getWidth();
		int h = image.getHeight();
		PixelGrid grid;
		if (image.getType() == BufferedImage.TYPE_BYTE_GRAY)
		{
			grid = new PixelGrid(PixelGrid.Mode.SCALAR, w, h, MAX_VALUE);
			WritableRaster raster = image.getRaster();
			for (int y = 0; y < h; y++)
			{
				for (int x = 0; x < w; x++)
				{
					grid.set(y, x, 0, raster.getSample(x, y, 0));
				}
			}
		}
		else
		{
			grid = new PixelGrid(PixelGrid.Mode.RGB, w, h, MAX_VALUE);
			for (int y = 0; y < h; y++)
			{
				for (int x = 0; x < w; x++)
				{
					int rgb = image.getRGB(x, y);
					grid.setRgb(y, x, (rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
				}
			}
		}
		return new CarveImage(grid, format, List.of(), data);
	}

	/** ImageIO first; Commons Imaging reads some variants ImageIO has no reader for. */
	static BufferedImage readImage(byte[] data) throws IOException
	{
		BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
		if (image == null)
		{
			try
			{
				image = Imaging.getBufferedImage(data);
			}
			catch (IllegalArgumentException e)
			{
				// unrecognized magic bytes
				throw new IOException("Unreadable image data: " + e.getMessage(), e);
			}
		}
		return image;
	}

	public static byte[] encode(CarveImage image) throws IOException
	{
		ImageFormat format = image.format();
		if (format.isPnm())
		{
			throw new IOException("Not a raster format: " + format);
		}
		BufferedImage out = toBufferedImage(image.grid());
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		if (!ImageIO.write(out, format.extension(), bytes))
		{
			throw new IOException("No ImageIO writer for " + format);
		}
		return bytes.toByteArray();
	}

	static BufferedImage toBufferedImage(PixelGrid grid)
	{
		int w = grid.width();
		int h = grid.height();
		int max = grid.maxValue();
		if (grid.mode() == PixelGrid.Mode.SCALAR)
		{
			BufferedImage dst = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
			WritableRaster raster = dst.getRaster();
			for (int y = 0; y < h; y++)
			{
				for (int x = 0; x < w; x++)
				{
					raster.setSample(x, y, 0, scale(grid.sample(y, x, 0), max));
				}
			}
			return dst;
		}
		BufferedImage dst = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
		for (int y = 0; y < h; y++)
		{
			for (int x = 0; x < w; x++)
			{
				int r = scale(grid.sample(y, x, 0), max);
				int g = scale(grid.sample(y, x, 1), max);
				int b = scale(grid.sample(y, x, 2), max);
				dst.setRGB(x, y, (r << 16) | (g << 8) | b);
			}
		}
		return dst;
	}

	private static int scale(int v, int max)
	{
		return max == MAX_VALUE ? v : Math.round(v * (float) MAX_VALUE / max);
	}
}
