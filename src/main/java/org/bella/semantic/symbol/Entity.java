package org.bella.semantic.symbol;

import org.bella.ast.Node;

/**
 * A declared name. Entities compare by identity: two variables called {@code x}
 * declared in different scopes are different entities.
 */
public interface Entity extends Node
{
	String getName();
}
