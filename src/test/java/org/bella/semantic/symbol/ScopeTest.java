package org.bella.semantic.symbol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeTest
{
	@Test
	void resolve_finds_nearest_binding_first()
	{
		var root = new Scope(null);
		var outer = root.define(new Variable("x", false));
		var child = new Scope(root);
		var inner = child.define(new Variable("x", true));

		assertSame(inner, child.resolve("x").orElseThrow());
		assertSame(outer, root.resolve("x").orElseThrow());
	}

	@Test
	void resolve_walks_up_to_the_root()
	{
		var root = new Scope(null);
		var f = root.define(new Function("f", 0, true));
		var grandchild = new Scope(new Scope(root));

		assertSame(f, grandchild.resolve("f").orElseThrow());
		assertTrue(grandchild.resolve("g").isEmpty());
	}

	@Test
	void resolve_locally_ignores_parents()
	{
		var root = new Scope(null);
		root.define(new Variable("x", false));
		var child = new Scope(root);

		assertTrue(child.resolveLocally("x").isEmpty());
		assertTrue(root.resolveLocally("x").isPresent());
	}

	@Test
	void define_rejects_a_second_binding_in_the_same_frame()
	{
		var root = new Scope(null);
		root.define(new Variable("x", false));
		assertThrows(IllegalStateException.class, () -> root.define(new Function("x", 1, true)));
	}

	@Test
	void entities_with_the_same_name_are_distinct()
	{
		var a = new Variable("x", false);
		var b = new Variable("x", false);
		assertNotEquals(a, b);
	}

	@Test
	void root_has_no_enclosing_scope()
	{
		var root = new Scope(null);
		assertTrue(root.isRoot());
		assertNull(root.getEnclosingScope());
		assertFalse(new Scope(root).isRoot());
	}
}
