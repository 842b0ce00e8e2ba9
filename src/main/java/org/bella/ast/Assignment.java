package org.bella.ast;

import org.bella.semantic.symbol.Variable;

public class Assignment implements Statement
{
	private final Variable target;
	private Expression source;

	public Assignment(Variable target, Expression source)
	{
		this.target = target;
		this.source = source;
	}

	public Variable getTarget()
	{
		return target;
	}

	public Expression getSource()
	{
		return source;
	}

	public void setSource(Expression source)
	{
		this.source = source;
	}
}
