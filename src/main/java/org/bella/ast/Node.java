package org.bella.ast;

/**
 * Common supertype of every element of the decorated program tree,
 * including the entities that identifier occurrences resolve to.
 */
public interface Node
{
}
