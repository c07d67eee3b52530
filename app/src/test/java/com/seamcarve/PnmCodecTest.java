package com.seamcarve;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PnmCodecTest
{

	// --- Decoding ---

	@Test
	void decodesPlainPgmWithComments() throws IOException
	{
		CarveImage image = decode("P2\n# created by hand\n# second line\n3 2\n15\n0 1 2\n3 4 15\n", ImageFormat.PGM);

		PixelGrid grid = image.grid();
		assertEquals(PixelGrid.Mode.SCALAR, grid.mode());
		assertEquals(3, grid.width());
		assertEquals(2, grid.height());
		assertEquals(15, grid.maxValue());
		assertEquals(List.of("# created by hand", "# second line"), image.comments());
		PixelGridTest.assertGrid(new int[][]{{0, 1, 2}, {3, 4, 15}}, grid);
	}

	@Test
	void decodesPlainPpm() throws IOException
	{
		CarveImage image = decode("P3\n2 1\n255\n255 0 0   0 128 255\n", ImageFormat.PPM);

		PixelGrid grid = image.grid();
		assertEquals(PixelGrid.Mode.RGB, grid.mode());
		assertEquals(2, grid.width());
		assertEquals(1, grid.height());
		assertEquals(255, grid.get(0, 0, 0));
		assertEquals(0, grid.get(0, 0, 1));
		assertEquals(128, grid.get(0, 1, 1));
		assertEquals(255, grid.get(0, 1, 2));
	}

	@Test
	void toleratesIrregularWhitespaceAndLateComments() throws IOException
	{
		CarveImage image = decode("P2\n2   2\n# not a header comment\n9\n1\n2 # trailing\n\t3    4", ImageFormat.PGM);

		assertTrue(image.comments().isEmpty());
		PixelGridTest.assertGrid(new int[][]{{1, 2}, {3, 4}}, image.grid());
	}

	@Test
	void stripsCarriageReturnFromComments() throws IOException
	{
		CarveImage image = decode("P2\r\n# windows\r\n1 1\r\n5\r\n5\r\n", ImageFormat.PGM);
		assertEquals(List.of("# windows"), image.comments());
	}

	@Test
	void freshlyDecodedImageIsPristine() throws IOException
	{
		CarveImage image = decode("P2\n1 1\n5\n3\n", ImageFormat.PGM);
		assertTrue(image.isPristine());
		image.grid().transpose();
		assertFalse(image.isPristine());
	}

	// --- Malformed input ---

	@Test
	void rejectsWrongMagic()
	{
		IOException e = assertThrows(IOException.class, () -> decode("P5\n1 1\n255\n0\n", ImageFormat.PGM));
		assertTrue(e.getMessage().contains("magic"), e.getMessage());
		assertThrows(IOException.class, () -> decode("P2\n1 1\n255\n0\n", ImageFormat.PPM));
	}

	@Test
	void rejectsEmptyInput()
	{
		assertThrows(IOException.class, () -> decode("", ImageFormat.PGM));
		assertThrows(IOException.class, () -> decode("   \n", ImageFormat.PGM));
	}

	@Test
	void rejectsNonPositiveHeaderValues()
	{
		assertThrows(IOException.class, () -> decode("P2\n0 2\n255\n", ImageFormat.PGM));
		assertThrows(IOException.class, () -> decode("P2\n2 2\n0\n0 0 0 0\n", ImageFormat.PGM));
		assertThrows(IOException.class, () -> decode("P2\n2 -2\n255\n", ImageFormat.PGM));
	}

	@Test
	void rejectsMaxValueAboveSixteenBits()
	{
		String checkerboard = "P2\n3 3\n2147483647\n"
				+ "0 2147483647 0\n2147483647 0 2147483647\n0 2147483647 0\n";
		IOException e = assertThrows(IOException.class, () -> decode(checkerboard, ImageFormat.PGM));
		assertTrue(e.getMessage().contains("2147483647"), e.getMessage());
		assertThrows(IOException.class, () -> decode("P2\n1 1\n65536\n0\n", ImageFormat.PGM));
	}

	@Test
	void sixteenBitCheckerboardHasNonNegativeEnergy() throws IOException
	{
		CarveImage image = decode("P2\n3 3\n65535\n"
				+ "0 65535 0\n65535 0 65535\n0 65535 0\n", ImageFormat.PGM);

		EnergyMap energy = new EnergyComputer().computeEnergy(image.grid());

		assertEquals(4 * 65535, energy.get(1, 1));
		assertEquals(3 * 65535, energy.get(0, 1));
		assertEquals(2 * 65535, energy.get(0, 0));
		for (int y = 0; y < 3; y++)
		{
			for (int x = 0; x < 3; x++)
			{
				assertTrue(energy.get(y, x) >= 0);
			}
		}
	}

	@Test
	void rejectsDimensionsThatCannotBeAllocated()
	{
		IOException wide = assertThrows(IOException.class,
				() -> decode("P3\n1000000000 1\n255\n1 2 3\n", ImageFormat.PPM));
		assertTrue(wide.getMessage().contains("1000000000x1"), wide.getMessage());

		IOException huge = assertThrows(IOException.class,
				() -> decode("P2\n20000 20000\n255\n0 0 0\n", ImageFormat.PGM));
		assertTrue(huge.getMessage().contains("Insufficient"), huge.getMessage());
	}

	@Test
	void rejectsTruncatedPixelData()
	{
		IOException e = assertThrows(IOException.class, () -> decode("P2\n2 2\n255\n1 2 3\n", ImageFormat.PGM));
		assertTrue(e.getMessage().contains("Insufficient"), e.getMessage());
	}

	@Test
	void rejectsSampleAboveMax()
	{
		assertThrows(IOException.class, () -> decode("P2\n1 1\n10\n11\n", ImageFormat.PGM));
	}

	@Test
	void rejectsNonNumericSample()
	{
		assertThrows(IOException.class, () -> decode("P2\n2 1\n10\n1 x\n", ImageFormat.PGM));
	}

	@Test
	void rejectsMissingHeaderFields()
	{
		assertThrows(IOException.class, () -> decode("P2\n2 1\n", ImageFormat.PGM));
	}

	// --- Encoding ---

	@Test
	void encodesCanonicalLayout() throws IOException
	{
		PixelGrid grid = PixelGrid.ofScalar(new int[][]{{1, 2}, {3, 4}}, 15);
		CarveImage image = new CarveImage(grid, ImageFormat.PGM, List.of("# hi"), null);

		assertEquals("P2\n# hi\n2 2\n15\n1 2 \n3 4 \n", new String(PnmCodec.encode(image), StandardCharsets.US_ASCII));
	}

	@Test
	void encodesRgbTriplesInRowOrder() throws IOException
	{
		PixelGrid grid = new PixelGrid(PixelGrid.Mode.RGB, 2, 1, 255);
		grid.setRgb(0, 0, 1, 2, 3);
		grid.setRgb(0, 1, 4, 5, 6);

		String text = new String(PnmCodec.encode(new CarveImage(grid, ImageFormat.PPM)), StandardCharsets.US_ASCII);
		assertEquals("P3\n2 1\n255\n1 2 3 4 5 6 \n", text);
	}

	@Test
	void carvedImageKeepsCommentsAndNewShape() throws IOException
	{
		CarveImage image = decode("P2\n# keep me\n3 3\n9\n1 1 1\n1 9 1\n1 1 1\n", ImageFormat.PGM);
		new SeamCarver(image.grid()).removeVerticalSeams(1);

		String text = new String(PnmCodec.encode(image), StandardCharsets.US_ASCII);
		assertEquals("P2\n# keep me\n2 3\n9\n1 1 \n9 1 \n1 1 \n", text);
	}

	@Test
	void refusesModeMismatch()
	{
		PixelGrid grid = new PixelGrid(PixelGrid.Mode.RGB, 1, 1, 255);
		assertThrows(IOException.class, () -> PnmCodec.encode(new CarveImage(grid, ImageFormat.PGM)));
	}

	private static CarveImage decode(String text, ImageFormat format) throws IOException
	{
		return PnmCodec.decode(text.getBytes(StandardCharsets.US_ASCII), format);
	}
}
