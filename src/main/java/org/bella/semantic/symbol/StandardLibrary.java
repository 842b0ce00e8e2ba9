package org.bella.semantic.symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The built-in entities every program can see. The table is immutable and its
 * entities are shared by all analysis runs.
 */
public final class StandardLibrary
{
	public static final Variable PI = new Variable("π", true);
	public static final Function SQRT = new Function("sqrt", 1, false);
	public static final Function SIN = new Function("sin", 1, false);
	public static final Function COS = new Function("cos", 1, false);
	public static final Function EXP = new Function("exp", 1, false);
	public static final Function LN = new Function("ln", 1, false);
	public static final Function HYPOT = new Function("hypot", 2, false);

	private static final Map<String, Entity> ENTITIES;

	static
	{
		Map<String, Entity> map = new LinkedHashMap<>();
		for (Entity entity : new Entity[]{PI, SQRT, SIN, COS, EXP, LN, HYPOT})
		{
			map.put(entity.getName(), entity);
		}
		ENTITIES = Collections.unmodifiableMap(map);
	}

	private StandardLibrary()
	{
	}

	public static Map<String, Entity> getEntities()
	{
		return ENTITIES;
	}
}
