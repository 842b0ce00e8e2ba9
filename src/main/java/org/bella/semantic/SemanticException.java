package org.bella.semantic;

import org.bella.util.CompilerException;

public class SemanticException extends CompilerException
{
	private final ErrorKind kind;

	public SemanticException(ErrorKind kind, int line, int column, String detail)
	{
		super(line, column, detail);
		this.kind = kind;
	}

	public ErrorKind getKind()
	{
		return kind;
	}
}
