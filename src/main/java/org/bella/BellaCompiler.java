package org.bella;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.bella.ast.Program;
import org.bella.optimizer.Optimizer;
import org.bella.parser.BellaLexer;
import org.bella.parser.BellaParser;
import org.bella.semantic.SemanticAnalyzer;
import org.bella.util.Debug;
import org.bella.util.ErrorHandler;
import org.bella.util.SyntaxErrorListener;
import org.bella.util.TreeDTOConverter;

import java.util.Arrays;

/**
 * The compilation pipeline: parse, analyze, optimize.
 */
public class BellaCompiler
{
	private final ErrorHandler errorHandler;

	public BellaCompiler(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	public BellaCompiler()
	{
		this(new ErrorHandler());
	}

	/**
	 * Parses source text, stopping at the first syntax error.
	 *
	 * @throws org.bella.util.SyntaxException on the first lexical or syntax error.
	 */
	public static BellaParser.ProgramContext parse(CharStream input)
	{
		BellaLexer lexer = new BellaLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

		BellaParser parser = new BellaParser(new CommonTokenStream(lexer));
		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(SyntaxErrorListener.INSTANCE);
		return parser.program();
	}

	public static BellaParser.ProgramContext parse(String source)
	{
		return parse(CharStreams.fromString(source));
	}

	public Program analyze(BellaParser.ProgramContext tree)
	{
		return new SemanticAnalyzer(errorHandler).analyze(tree);
	}

	public Program optimize(Program program)
	{
		return new Optimizer().optimize(program);
	}

	/**
	 * Runs the pipeline up to the given stage and renders its result: the parse
	 * tree in LISP form for {@link Stage#PARSED}, otherwise the decorated tree as JSON.
	 */
	public String compile(CharStream input, Stage stage)
	{
		Debug.logDebug("Parsing " + input.getSourceName() + "...");
		BellaParser.ProgramContext tree = parse(input);
		if (stage == Stage.PARSED)
		{
			return tree.toStringTree(Arrays.asList(BellaParser.ruleNames));
		}

		Program program = analyze(tree);
		if (stage == Stage.OPTIMIZED)
		{
			program = optimize(program);
		}
		return TreeDTOConverter.toJson(program);
	}

	public String compile(String source, Stage stage)
	{
		return compile(CharStreams.fromString(source), stage);
	}
}
