package org.bella.ast;

public class BinaryExpression implements Expression
{
	private final BinaryOperator operator;
	private Expression left;
	private Expression right;

	public BinaryExpression(BinaryOperator operator, Expression left, Expression right)
	{
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public BinaryOperator getOperator()
	{
		return operator;
	}

	public Expression getLeft()
	{
		return left;
	}

	public void setLeft(Expression left)
	{
		this.left = left;
	}

	public Expression getRight()
	{
		return right;
	}

	public void setRight(Expression right)
	{
		this.right = right;
	}
}
