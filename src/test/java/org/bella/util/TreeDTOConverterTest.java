package org.bella.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.bella.BellaCompiler;
import org.bella.dto.NodeDTO;
import org.bella.semantic.SemanticAnalyzer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TreeDTOConverterTest
{
	private static NodeDTO dto(String src)
	{
		return TreeDTOConverter.toDTO(new SemanticAnalyzer().analyze(BellaCompiler.parse(src)));
	}

	@Test
	void declaration_lists_entity_then_initializer()
	{
		NodeDTO program = dto("let x = 1;");
		assertEquals("Program", program.kind);

		NodeDTO declaration = program.children.get(0);
		assertEquals("VariableDeclaration", declaration.kind);
		assertEquals("Variable", declaration.children.get(0).kind);
		assertEquals("x", declaration.children.get(0).name);
		assertEquals(Boolean.FALSE, declaration.children.get(0).readOnly);
		assertEquals("NumberLiteral", declaration.children.get(1).kind);
		assertEquals(1.0, declaration.children.get(1).value);
		assertNull(declaration.children.get(1).children);
	}

	@Test
	void function_declaration_includes_entity_parameters_and_body()
	{
		NodeDTO declaration = dto("function f(a, b) = a - b;").children.get(0);
		assertEquals(4, declaration.children.size());

		NodeDTO function = declaration.children.get(0);
		assertEquals("Function", function.kind);
		assertEquals(2, function.paramCount);
		assertEquals(Boolean.TRUE, function.userDefined);
		assertEquals(Boolean.TRUE, declaration.children.get(1).readOnly);

		NodeDTO body = declaration.children.get(3);
		assertEquals("BinaryExpression", body.kind);
		assertEquals("-", body.op);
	}

	@Test
	void json_output_is_well_formed()
	{
		String json = TreeDTOConverter.toJson(new SemanticAnalyzer().analyze(BellaCompiler.parse("print sqrt(π) > 1 ? (!true) : 1 / 0;")));
		JsonObject root = JsonParser.parseString(json).getAsJsonObject();
		assertEquals("Program", root.get("kind").getAsString());

		JsonArray statements = root.getAsJsonArray("children");
		JsonObject print = statements.get(0).getAsJsonObject();
		assertEquals("PrintStatement", print.get("kind").getAsString());

		JsonObject conditional = print.getAsJsonArray("children").get(0).getAsJsonObject();
		assertEquals("Conditional", conditional.get("kind").getAsString());
		assertFalse(conditional.has("name"));

		JsonObject call = conditional.getAsJsonArray("children").get(0).getAsJsonObject()
				.getAsJsonArray("children").get(0).getAsJsonObject();
		assertEquals("Call", call.get("kind").getAsString());
		JsonObject callee = call.getAsJsonArray("children").get(0).getAsJsonObject();
		assertEquals("sqrt", callee.get("name").getAsString());
		assertFalse(callee.get("userDefined").getAsBoolean());
	}

	@Test
	void special_floating_point_values_are_serialized()
	{
		var program = new SemanticAnalyzer().analyze(BellaCompiler.parse("print 1e400;"));
		String json = TreeDTOConverter.toJson(program);
		assertTrue(json.contains("Infinity"));
	}
}
