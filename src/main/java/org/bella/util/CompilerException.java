package org.bella.util;

/**
 * A user-facing compilation failure tied to a position in the source text.
 * Columns are 1-based.
 */
public abstract class CompilerException extends RuntimeException
{
	private final int line;
	private final int column;
	private final String detail;

	protected CompilerException(int line, int column, String detail)
	{
		super(String.format("line %d:%d - %s", line, column, detail));
		this.line = line;
		this.column = column;
		this.detail = detail;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * The message without the position prefix.
	 */
	public String getDetail()
	{
		return detail;
	}
}
