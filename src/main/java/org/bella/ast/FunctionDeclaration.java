package org.bella.ast;

import org.bella.semantic.symbol.Function;
import org.bella.semantic.symbol.Variable;

import java.util.List;

public class FunctionDeclaration implements Statement
{
	private final Function function;
	private final List<Variable> parameters;
	private Expression body;

	public FunctionDeclaration(Function function, List<Variable> parameters, Expression body)
	{
		this.function = function;
		this.parameters = parameters;
		this.body = body;
	}

	public Function getFunction()
	{
		return function;
	}

	public List<Variable> getParameters()
	{
		return parameters;
	}

	public Expression getBody()
	{
		return body;
	}

	public void setBody(Expression body)
	{
		this.body = body;
	}
}
