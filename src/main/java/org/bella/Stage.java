package org.bella;

import java.util.Locale;

/**
 * How far the pipeline runs before its result is emitted.
 */
public enum Stage
{
	PARSED,
	ANALYZED,
	OPTIMIZED;

	public static Stage fromName(String name)
	{
		try
		{
			return valueOf(name.toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e)
		{
			throw new IllegalArgumentException("Unknown stage '" + name + "'. Expected parsed, analyzed or optimized.", e);
		}
	}
}
