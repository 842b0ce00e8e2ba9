package org.bella.ast;

public final class BooleanLiteral implements Literal
{
	public static final BooleanLiteral TRUE = new BooleanLiteral(true);
	public static final BooleanLiteral FALSE = new BooleanLiteral(false);

	private final boolean value;

	private BooleanLiteral(boolean value)
	{
		this.value = value;
	}

	public static BooleanLiteral of(boolean value)
	{
		return value ? TRUE : FALSE;
	}

	@Override
	public Object getValue()
	{
		return value;
	}

	@Override
	public boolean isTruthy()
	{
		return value;
	}

	@Override
	public String toString()
	{
		return String.valueOf(value);
	}
}
