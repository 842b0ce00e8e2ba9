package org.bella.ast;

import org.bella.semantic.symbol.Variable;

public class VariableDeclaration implements Statement
{
	private final Variable variable;
	private Expression initializer;

	public VariableDeclaration(Variable variable, Expression initializer)
	{
		this.variable = variable;
		this.initializer = initializer;
	}

	public Variable getVariable()
	{
		return variable;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	public void setInitializer(Expression initializer)
	{
		this.initializer = initializer;
	}
}
