package org.bella.ast;

/**
 * The ternary {@code test ? consequent : alternate}.
 */
public class Conditional implements Expression
{
	private Expression test;
	private Expression consequent;
	private Expression alternate;

	public Conditional(Expression test, Expression consequent, Expression alternate)
	{
		this.test = test;
		this.consequent = consequent;
		this.alternate = alternate;
	}

	public Expression getTest()
	{
		return test;
	}

	public void setTest(Expression test)
	{
		this.test = test;
	}

	public Expression getConsequent()
	{
		return consequent;
	}

	public void setConsequent(Expression consequent)
	{
		this.consequent = consequent;
	}

	public Expression getAlternate()
	{
		return alternate;
	}

	public void setAlternate(Expression alternate)
	{
		this.alternate = alternate;
	}
}
