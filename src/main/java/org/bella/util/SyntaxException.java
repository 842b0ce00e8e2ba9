package org.bella.util;

public class SyntaxException extends CompilerException
{
	public SyntaxException(int line, int column, String detail)
	{
		super(line, column, detail);
	}
}
