package org.bella.ast;

public class UnaryExpression implements Expression
{
	private final UnaryOperator operator;
	private Expression operand;

	public UnaryExpression(UnaryOperator operator, Expression operand)
	{
		this.operator = operator;
		this.operand = operand;
	}

	public UnaryOperator getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	public void setOperand(Expression operand)
	{
		this.operand = operand;
	}
}
