package org.bella.ast;

import java.util.HashMap;
import java.util.Map;

import static org.bella.parser.BellaLexer.*;

public enum BinaryOperator
{
	POWER("**", POWER_OP),
	MULTIPLY("*", MUL_OP),
	DIVIDE("/", DIV_OP),
	MODULO("%", MOD_OP),
	ADD("+", ADD_OP),
	SUBTRACT("-", MINUS_OP),
	LESS_EQUAL("<=", LE_OP),
	LESS("<", LT_OP),
	EQUAL("==", EQ_OP),
	NOT_EQUAL("!=", NE_OP),
	GREATER_EQUAL(">=", GE_OP),
	GREATER(">", GT_OP),
	AND("&&", AND_OP),
	OR("||", OR_OP);

	private static final Map<Integer, BinaryOperator> BY_TOKEN_TYPE = new HashMap<>();

	static
	{
		for (BinaryOperator operator : values())
		{
			BY_TOKEN_TYPE.put(operator.tokenType, operator);
		}
	}

	private final String symbol;
	private final int tokenType;

	BinaryOperator(String symbol, int tokenType)
	{
		this.symbol = symbol;
		this.tokenType = tokenType;
	}

	/**
	 * Maps a lexer token type (e.g. {@code BellaLexer.POWER_OP}) to its operator.
	 *
	 * @throws IllegalArgumentException if the token is not a binary operator.
	 */
	public static BinaryOperator fromTokenType(int tokenType)
	{
		BinaryOperator operator = BY_TOKEN_TYPE.get(tokenType);
		if (operator == null)
		{
			throw new IllegalArgumentException("Not a binary operator token: " + tokenType);
		}
		return operator;
	}

	public boolean isEquality()
	{
		return this == EQUAL || this == NOT_EQUAL;
	}

	public boolean isLogical()
	{
		return this == AND || this == OR;
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
