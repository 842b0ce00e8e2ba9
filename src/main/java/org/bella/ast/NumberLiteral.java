package org.bella.ast;

public final class NumberLiteral implements Literal
{
	private final double value;

	public NumberLiteral(double value)
	{
		this.value = value;
	}

	public double getNumber()
	{
		return value;
	}

	@Override
	public Object getValue()
	{
		return value;
	}

	@Override
	public boolean isTruthy()
	{
		return value != 0 && !Double.isNaN(value);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof NumberLiteral other))
		{
			return false;
		}
		return Double.compare(value, other.value) == 0;
	}

	@Override
	public int hashCode()
	{
		return Double.hashCode(value);
	}

	@Override
	public String toString()
	{
		return String.valueOf(value);
	}
}
