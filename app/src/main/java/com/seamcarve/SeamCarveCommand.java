package com.seamcarve;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Shrinks an image by removing low-energy seams: width first, then height.
 */
@Command(
		name = "seamcarve",
		mixinStandardHelpOptions = true,
		version = "seamcarve 1.0",
		description = {
				"Removes VERTICAL seams (narrowing the image), then HORIZONTAL seams",
				"(shortening it), each time taking the connected path of pixels with the",
				"least local contrast.",
				"",
				"Formats by extension: @|bold .pgm|@ (P2), @|bold .ppm|@ (P3), .png, .bmp, .gif",
				"",
		},
		exitCodeOnInvalidInput = 2,
		exitCodeOnExecutionException = 1)
public class SeamCarveCommand implements Callable<Integer>
{

	@Spec
	CommandSpec spec;

	@Parameters(index = "0", paramLabel = "INPUT", description = "Image to carve")
	Path input;

	@Parameters(index = "1", paramLabel = "VERTICAL", description = "Number of vertical seams to remove")
	int vertical;

	@Parameters(index = "2", paramLabel = "HORIZONTAL", arity = "0..1", defaultValue = "0",
			description = "Number of horizontal seams to remove (default: ${DEFAULT-VALUE})")
	int horizontal;

	@Option(names = {"-o", "--output"}, paramLabel = "FILE",
			description = "Output file (default: <input>_processed_<V>_<H>.<ext>)")
	Path output;

	@Option(names = "--tie-break", paramLabel = "POLICY", defaultValue = "LEFTMOST",
			description = "Equal-cost seam step preference: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	SeamFinder.TieBreak tieBreak;

	@Option(names = "--energy", paramLabel = "POLICY", defaultValue = "AVERAGE_INTENSITY",
			description = "Color energy: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	EnergyComputer.ColorPolicy energy;

	@Option(names = {"-v", "--verbose"}, description = "Log every removed seam")
	boolean verbose;

	@Override
	public Integer call()
	{
		if (vertical < 0 || horizontal < 0)
		{
			throw new ParameterException(spec.commandLine(),
					"seam counts must not be negative (got %d, %d)".formatted(vertical, horizontal));
		}

		CarveImage image;
		try
		{
			image = ImageFiles.load(input);
		}
		catch (IOException e)
		{
			Log.debug("Cannot read " + input, e);
			err().println("Fatal: " + e.getMessage());
			return 1;
		}

		PixelGrid grid = image.grid();
		if (vertical >= grid.width() || horizontal >= grid.height())
		{
			throw new ParameterException(spec.commandLine(),
					"requested seams (%d,%d) exceed dimensions (%d,%d)".formatted(
							vertical, horizontal, grid.width(), grid.height()));
		}

		SeamCarver carver = new CarveSettings(tieBreak, energy).newCarver(grid);
		if (verbose)
		{
			carver.setProgressListener((direction, current, total) ->
					Log.info(direction + " seam " + current + "/" + total + " removed, now "
							+ grid.width() + "x" + grid.height()));
		}
		carver.resize(vertical, horizontal);

		Path target = output != null ? output : ImageFiles.outputPath(input, vertical, horizontal);
		try
		{
			ImageFiles.save(image, target);
		}
		catch (IOException e)
		{
			Log.debug("Cannot write " + target, e);
			err().println("Fatal: " + e.getMessage());
			return 1;
		}
		out().println("Saved: " + target);
		return 0;
	}

	private PrintWriter out()
	{
		return spec.commandLine().getOut();
	}

	private PrintWriter err()
	{
		return spec.commandLine().getErr();
	}

	public static void main(String[] args)
	{
		int exitCode = new CommandLine(new SeamCarveCommand()).execute(args);
		System.exit(exitCode);
	}
}
