package org.bella.ast;

public interface Expression extends Node
{
}
