package org.bella.semantic.symbol;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * One frame of the lexical scope chain. Only the program itself and function
 * bodies open a scope; blocks do not.
 */
public class Scope
{
	private final Scope enclosingScope;
	private final Map<String, Entity> entities = new LinkedHashMap<>();

	public Scope(Scope enclosingScope)
	{
		this.enclosingScope = enclosingScope;
	}

	/**
	 * Binds the entity under its name in this frame. Callers check
	 * {@link #resolveLocally(String)} first; a name may only be bound once per frame.
	 *
	 * @throws IllegalStateException if the name is already bound here.
	 */
	public <T extends Entity> T define(T entity)
	{
		Entity previous = entities.putIfAbsent(entity.getName(), entity);
		if (previous != null)
		{
			throw new IllegalStateException("'" + entity.getName() + "' is already bound in this scope");
		}
		return entity;
	}

	/**
	 * Resolves a name by searching this frame, then each enclosing frame up to the root.
	 */
	public Optional<Entity> resolve(String name)
	{
		for (Scope scope = this; scope != null; scope = scope.enclosingScope)
		{
			Entity entity = scope.entities.get(name);
			if (entity != null)
			{
				return Optional.of(entity);
			}
		}
		return Optional.empty();
	}

	/**
	 * Resolves a name in this frame only, without searching parents.
	 */
	public Optional<Entity> resolveLocally(String name)
	{
		return Optional.ofNullable(entities.get(name));
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}

	public boolean isRoot()
	{
		return enclosingScope == null;
	}

	public void forEachEntity(BiConsumer<String, Entity> visitor)
	{
		entities.forEach(visitor);
	}
}
