package org.bella.ast;

import java.util.List;

/**
 * Root of the decorated tree: the top-level statements in source order.
 */
public class Program implements Node
{
	private List<Statement> statements;

	public Program(List<Statement> statements)
	{
		this.statements = statements;
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	public void setStatements(List<Statement> statements)
	{
		this.statements = statements;
	}
}
