package org.bella.ast;

/**
 * A compile-time constant appearing in expression position.
 */
public interface Literal extends Expression
{
	Object getValue();

	/**
	 * Truthiness as the target language sees it: {@code false}, {@code 0} and NaN are falsy.
	 */
	boolean isTruthy();
}
