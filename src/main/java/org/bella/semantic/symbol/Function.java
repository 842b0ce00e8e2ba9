package org.bella.semantic.symbol;

public final class Function implements Entity
{
	public static final String KIND = "Function";

	private final String name;
	private final int paramCount;
	private final boolean userDefined;

	public Function(String name, int paramCount, boolean userDefined)
	{
		this.name = name;
		this.paramCount = paramCount;
		this.userDefined = userDefined;
	}

	@Override
	public String getName()
	{
		return name;
	}

	public int getParamCount()
	{
		return paramCount;
	}

	/**
	 * @return {@code false} for standard library functions.
	 */
	public boolean isUserDefined()
	{
		return userDefined;
	}

	@Override
	public String toString()
	{
		return name + "/" + paramCount;
	}
}
