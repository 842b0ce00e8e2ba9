package org.bella.semantic;

public enum ErrorKind
{
	/** Name already bound in the innermost scope. */
	DUPLICATE_DECLARATION,
	/** Name not bound in any enclosing scope. */
	UNDECLARED_NAME,
	/** A variable where a function is required, or the reverse. */
	WRONG_ENTITY_KIND,
	/** Assignment to a parameter or a read-only built-in. */
	READ_ONLY_ASSIGNMENT,
	/** Argument count differs from the callee's parameter count. */
	ARITY_MISMATCH
}
