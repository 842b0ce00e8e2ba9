package org.bella.util;

import org.bella.Stage;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds all command-line arguments for the Bella compiler.
 */
public class CompilerArguments
{
	private static final String EMIT_PREFIX = "--emit=";

	private final List<Path> inputFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean invalid = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean checkOnly = false;
	private Path outputPath = null;
	private Stage stage = Stage.OPTIMIZED;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true;
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.startsWith(EMIT_PREFIX))
				{
					parsedArgs.stage = Stage.fromName(arg.substring(EMIT_PREFIX.length()));
					continue;
				}

				// --- Handle file inputs ---
				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}
				if (!parsedArgs.inputFiles.isEmpty())
				{
					throw new IllegalArgumentException("Only one input file may be given, found another: " + arg);
				}
				parsedArgs.inputFiles.add(Paths.get(arg));
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
			parsedArgs.invalid = true;
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Analyzer and optimizer for the Bella language.");
		System.out.println("\nUSAGE: bellac [options] file");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show compiler version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -k, --check               Run semantic analysis only; do not generate output.");
		System.out.println("  -o, --output <file>       Write the output to <file> instead of standard output.");
		System.out.println("  --emit=<stage>            What to output: parsed, analyzed or optimized (default).");
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	/**
	 * @return true if the arguments could not be parsed and usage is shown instead.
	 */
	public boolean isInvalid()
	{
		return invalid;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public Stage getStage()
	{
		return stage;
	}
}
