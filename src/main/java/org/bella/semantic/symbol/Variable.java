package org.bella.semantic.symbol;

import org.bella.ast.Expression;

public final class Variable implements Entity, Expression
{
	public static final String KIND = "Variable";

	private final String name;
	private final boolean readOnly;

	public Variable(String name, boolean readOnly)
	{
		this.name = name;
		this.readOnly = readOnly;
	}

	@Override
	public String getName()
	{
		return name;
	}

	public boolean isReadOnly()
	{
		return readOnly;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
