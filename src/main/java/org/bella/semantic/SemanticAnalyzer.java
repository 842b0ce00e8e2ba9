package org.bella.semantic;

import org.bella.ast.Program;
import org.bella.parser.BellaParser;
import org.bella.semantic.symbol.Scope;
import org.bella.util.Debug;
import org.bella.util.ErrorHandler;

/**
 * Turns a Bella parse tree into a decorated {@link Program}.
 * <p>
 * Every call to {@link #analyze(BellaParser.ProgramContext)} builds its own root
 * scope, so one analyzer can be reused and separate analyzers can run on
 * different threads.
 */
public class SemanticAnalyzer
{
	private final ErrorHandler errorHandler;

	/**
	 * Creates a new SemanticAnalyzer.
	 *
	 * @param errorHandler The error handler instance used to report the first semantic error.
	 */
	public SemanticAnalyzer(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	public SemanticAnalyzer()
	{
		this(new ErrorHandler());
	}

	/**
	 * Resolves and checks the whole program.
	 *
	 * @param tree The parse tree produced by {@code BellaParser.program()}.
	 * @return The decorated program.
	 * @throws SemanticException on the first semantic error.
	 */
	public Program analyze(BellaParser.ProgramContext tree)
	{
		Scope rootScope = new Scope(null);
		StandardLibraryLoader.defineAll(rootScope);

		Debug.logDebug("Starting semantic analysis of " + tree.statement().size() + " top-level statement(s)...");
		ResolutionVisitor visitor = new ResolutionVisitor(rootScope, errorHandler);
		Program program = (Program) visitor.visit(tree);
		Debug.logDebug("Semantic analysis completed successfully.");
		return program;
	}
}
