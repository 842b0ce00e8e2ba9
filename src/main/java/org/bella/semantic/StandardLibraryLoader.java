package org.bella.semantic;

import org.bella.semantic.symbol.Scope;
import org.bella.semantic.symbol.StandardLibrary;

/**
 * Seeds a root scope with the built-in entities.
 */
public class StandardLibraryLoader
{
	/**
	 * Defines every standard library entity in the given scope, which must be a
	 * fresh root scope.
	 *
	 * @param scope The root scope of one analysis run.
	 */
	public static void defineAll(Scope scope)
	{
		if (!scope.isRoot())
		{
			throw new IllegalArgumentException("The standard library can only be loaded into a root scope.");
		}
		StandardLibrary.getEntities().values().forEach(scope::define);
	}
}
