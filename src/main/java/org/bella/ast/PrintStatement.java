package org.bella.ast;

public class PrintStatement implements Statement
{
	private Expression argument;

	public PrintStatement(Expression argument)
	{
		this.argument = argument;
	}

	public Expression getArgument()
	{
		return argument;
	}

	public void setArgument(Expression argument)
	{
		this.argument = argument;
	}
}
