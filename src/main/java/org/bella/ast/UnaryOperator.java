package org.bella.ast;

import static org.bella.parser.BellaLexer.MINUS_OP;
import static org.bella.parser.BellaLexer.NOT_OP;

public enum UnaryOperator
{
	NEGATE("-"),
	NOT("!");

	private final String symbol;

	UnaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public static UnaryOperator fromTokenType(int tokenType)
	{
		if (tokenType == MINUS_OP)
		{
			return NEGATE;
		}
		if (tokenType == NOT_OP)
		{
			return NOT;
		}
		throw new IllegalArgumentException("Not a unary operator token: " + tokenType);
	}

	public String getSymbol()
	{
		return symbol;
	}

	@Override
	public String toString()
	{
		return symbol;
	}
}
