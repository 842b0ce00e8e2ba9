package org.bella;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.bella.semantic.SemanticException;
import org.bella.util.CompilerArguments;
import org.bella.util.Debug;
import org.bella.util.ErrorHandler;
import org.bella.util.SyntaxException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Command-line entry point: {@code bellac [options] file}.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * Runs the compiler and returns the process exit status.
	 */
	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return arguments.isInvalid() ? 1 : 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("bellac (Bella Compiler) version " + VERSION);
				return 0;
			}
			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input file provided. Use -h for help.");
			}

			Path inputFile = arguments.getInputFiles().get(0);
			if (!Files.exists(inputFile))
			{
				Debug.logError("Input file not found: " + inputFile);
				return 1;
			}

			CharStream input = CharStreams.fromPath(inputFile, StandardCharsets.UTF_8);
			BellaCompiler compiler = new BellaCompiler(new ErrorHandler());

			if (arguments.isCheckOnly())
			{
				compiler.analyze(BellaCompiler.parse(input));
				Debug.logInfo("Semantic check passed. No output generated (-k flag).");
				return 0;
			}

			String output = compiler.compile(input, arguments.getStage());
			writeOutput(output, arguments.getOutputPath());
			return 0;
		}
		catch (SyntaxException e)
		{
			Debug.logError("Compilation failed due to syntax errors.");
		}
		catch (SemanticException e)
		{
			Debug.logError("Compilation failed due to semantic errors.");
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Compiler initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error reading or writing file: " + e.getMessage());
		}
		return 1;
	}

	private static void writeOutput(String output, Path outputPath) throws IOException
	{
		if (outputPath == null)
		{
			System.out.println(output);
			return;
		}

		Path parentDir = outputPath.toAbsolutePath().getParent();
		if (parentDir != null)
		{
			Files.createDirectories(parentDir);
		}
		Files.writeString(outputPath, output, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote output to: " + outputPath);
	}
}
