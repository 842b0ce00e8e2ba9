package org.bella.ast;

import java.util.List;

public class WhileStatement implements Statement
{
	private Expression test;
	private List<Statement> body;

	public WhileStatement(Expression test, List<Statement> body)
	{
		this.test = test;
		this.body = body;
	}

	public Expression getTest()
	{
		return test;
	}

	public void setTest(Expression test)
	{
		this.test = test;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	public void setBody(List<Statement> body)
	{
		this.body = body;
	}
}
