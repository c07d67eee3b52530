package com.seamcarve;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain (ASCII) PGM {@code P2} and PPM {@code P3} reader and writer.
 * <p>
 * Comment lines directly after the magic line are kept verbatim and written
 * back on save. Comments further down the token stream are skipped.
 */
public class PnmCodec
{

	public static CarveImage decode(byte[] data, ImageFormat format) throws IOException
	{
		if (!format.isPnm())
		{
			throw new IOException("Not a plain PNM format: " + format);
		}
		Tokenizer in = new Tokenizer(data);

		String magic = in.word();
		if (magic == null)
		{
			throw new IOException("Empty file, expected '" + format.magic() + "'");
		}
		if (!magic.equals(format.magic()))
		{
			throw new IOException("Invalid " + format + " magic '" + magic + "' (expected '" + format.magic() + "')");
		}
		in.skipLine();

		List<String> comments = new ArrayList<>();
		while (in.peek() == '#')
		{
			comments.add(in.line());
		}

		int width = in.positiveInt("width");
		int height = in.positiveInt("height");
		int maxValue = in.positiveInt("max value");
		if (maxValue > PixelGrid.MAX_SAMPLE)
		{
			throw new IOException("Max value " + maxValue + " exceeds " + PixelGrid.MAX_SAMPLE);
		}

		PixelGrid.Mode mode = format.mode();
		int channels = mode.channels();
		long samples = (long) width * height * channels;
		if (samples > Integer.MAX_VALUE)
		{
			throw new IOException("Image dimensions " + width + "x" + height + " are too large");
		}
		// every sample takes at least one digit and a separator
		if (samples > (in.remaining() + 1L) / 2)
		{
			throw new IOException("Insufficient pixel data: " + width + "x" + height + " needs " + samples
					+ " samples, only " + in.remaining() + " bytes remain");
		}
		PixelGrid grid = new PixelGrid(mode, width, height, maxValue);
		for (int y = 0; y < height; y++)
		{
			for (int x = 0; x < width; x++)
			{
				for (int c = 0; c < channels; c++)
				{
					int v = in.sample(y, x);
					if (v > maxValue)
					{
						throw new IOException("Sample " + v + " at (" + y + ", " + x + ") exceeds max value " + maxValue);
					}
					grid.set(y, x, c, v);
				}
			}
		}
		return new CarveImage(grid, format, comments, data);
	}

	/**
	 * Writes the magic line, the preserved comments, {@code W H}, the max
	 * value and one line per row with every sample followed by a space.
	 */
	public static byte[] encode(CarveImage image) throws IOException
	{
		ImageFormat format = image.format();
		if (!format.isPnm())
		{
			throw new IOException("Not a plain PNM format: " + format);
		}
		PixelGrid grid = image.grid();
		if (grid.mode() != format.mode())
		{
			throw new IOException("Cannot write a " + grid.mode() + " grid as " + format);
		}

		StringBuilder sb = new StringBuilder();
		sb.append(format.magic()).append('\n');
		for (String c : image.comments())
		{
			sb.append(c).append('\n');
		}
		sb.append(grid.width()).append(' ').append(grid.height()).append('\n');
		sb.append(grid.maxValue()).append('\n');

		int channels = grid.mode().channels();
		for (int y = 0; y < grid.height(); y++)
		{
			for (int x = 0; x < grid.width(); x++)
			{
				for (int c = 0; c < channels; c++)
				{
					sb.append(grid.sample(y, x, c)).append(' ');
				}
			}
			sb.append('\n');
		}

		return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
	}

	private static final class Tokenizer
	{
		private final byte[] data;
		private int pos;

		Tokenizer(byte[] data)
		{
			this.data = data;
		}

		int remaining()
		{
			return data.length - pos;
		}

		int peek()
		{
			return pos < data.length ? data[pos] & 0xFF : -1;
		}

		void skipLine()
		{
			while (pos < data.length && data[pos] != '\n') pos++;
			if (pos < data.length) pos++;
		}

		/** The rest of the current line without its terminator. */
		String line()
		{
			int start = pos;
			while (pos < data.length && data[pos] != '\n') pos++;
			int end = pos;
			if (end > start && data[end - 1] == '\r') end--;
			if (pos < data.length) pos++;
			return new String(data, start, end - start, StandardCharsets.ISO_8859_1);
		}

		/** Next whitespace-delimited token, skipping {@code #} comments; null at end of input. */
		String word()
		{
			while (pos < data.length)
			{
				int b = data[pos];
				if (b == '#')
				{
					skipLine();
				}
				else if (isSpace(b))
				{
					pos++;
				}
				else
				{
					break;
				}
			}
			if (pos >= data.length) return null;
			int start = pos;
			while (pos < data.length && !isSpace(data[pos]) && data[pos] != '#') pos++;
			return new String(data, start, pos - start, StandardCharsets.ISO_8859_1);
		}

		int positiveInt(String what) throws IOException
		{
			String w = word();
			if (w == null) throw new IOException("Unexpected end of header, missing " + what);
			int v = parse(w, what);
			if (v <= 0) throw new IOException("Invalid " + what + ": " + v);
			return v;
		}

		int sample(int row, int col) throws IOException
		{
			String w = word();
			if (w == null)
			{
				throw new IOException("Insufficient pixel data at (" + row + ", " + col + ")");
			}
			return parse(w, "sample at (" + row + ", " + col + ")");
		}

		private static int parse(String token, String what) throws IOException
		{
			for (int i = 0; i < token.length(); i++)
			{
				if (!Character.isDigit(token.charAt(i)))
				{
					throw new IOException("Invalid " + what + ": '" + token + "'");
				}
			}
			try
			{
				return Integer.parseInt(token);
			}
			catch (NumberFormatException e)
			{
				throw new IOException("Invalid " + what + ": '" + token + "'", e);
			}
		}

		private static boolean isSpace(int b)
		{
			return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == '\f' || b == 0x0B;
		}
	}
}
