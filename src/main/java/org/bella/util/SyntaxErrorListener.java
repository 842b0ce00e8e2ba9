package org.bella.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Routes ANTLR syntax errors through {@link Debug#logError(String)} and stops
 * the parse at the first one.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	public static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		String err = String.format("[Syntax Error] line %d:%d - %s", line, charPositionInLine + 1, msg);
		Debug.logError(err);
		throw new SyntaxException(line, charPositionInLine + 1, msg);
	}
}
