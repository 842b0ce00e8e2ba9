package org.bella.ast;

import org.bella.semantic.symbol.Function;

import java.util.List;

public class Call implements Expression
{
	private final Function callee;
	private List<Expression> arguments;

	public Call(Function callee, List<Expression> arguments)
	{
		this.callee = callee;
		this.arguments = arguments;
	}

	public Function getCallee()
	{
		return callee;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	public void setArguments(List<Expression> arguments)
	{
		this.arguments = arguments;
	}
}
