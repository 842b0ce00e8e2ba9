package org.bella.util;

import org.antlr.v4.runtime.Token;
import org.bella.semantic.ErrorKind;
import org.bella.semantic.SemanticException;

/**
 * Reports semantic errors. Analysis is fail-fast: callers throw the returned
 * exception right away, e.g. {@code throw errorHandler.logError(...)}.
 */
public class ErrorHandler
{
	private boolean hasErrors = false;

	public SemanticException logError(ErrorKind kind, Token token, String msg)
	{
		int column = token.getCharPositionInLine() + 1;
		String err = String.format("[Semantic Error] %s - line %d:%d - %s", kind, token.getLine(), column, msg);
		Debug.logError(err);
		hasErrors = true;
		return new SemanticException(kind, token.getLine(), column, msg);
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}
}
