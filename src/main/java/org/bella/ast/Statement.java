package org.bella.ast;

public interface Statement extends Node
{
}
