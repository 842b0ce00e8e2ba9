package org.bella.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.bella.ast.*;
import org.bella.dto.NodeDTO;
import org.bella.semantic.symbol.Function;
import org.bella.semantic.symbol.Variable;

import java.util.List;

/**
 * Flattens a decorated tree into {@link NodeDTO}s for JSON output. Entities are
 * written out in full at every place they are referenced.
 */
public class TreeDTOConverter
{
	private static final Gson GSON = new GsonBuilder()
			.setPrettyPrinting()
			.disableHtmlEscaping()
			.serializeSpecialFloatingPointValues()
			.create();

	public static String toJson(Program program)
	{
		return GSON.toJson(toDTO(program));
	}

	public static NodeDTO toDTO(Node node)
	{
		NodeDTO dto = new NodeDTO();
		dto.kind = node.getClass().getSimpleName();

		if (node instanceof Program program)
		{
			addAll(dto, program.getStatements());
		}
		else if (node instanceof VariableDeclaration declaration)
		{
			add(dto, declaration.getVariable());
			add(dto, declaration.getInitializer());
		}
		else if (node instanceof FunctionDeclaration declaration)
		{
			add(dto, declaration.getFunction());
			addAll(dto, declaration.getParameters());
			add(dto, declaration.getBody());
		}
		else if (node instanceof Assignment assignment)
		{
			add(dto, assignment.getTarget());
			add(dto, assignment.getSource());
		}
		else if (node instanceof PrintStatement print)
		{
			add(dto, print.getArgument());
		}
		else if (node instanceof WhileStatement loop)
		{
			add(dto, loop.getTest());
			addAll(dto, loop.getBody());
		}
		else if (node instanceof Conditional conditional)
		{
			add(dto, conditional.getTest());
			add(dto, conditional.getConsequent());
			add(dto, conditional.getAlternate());
		}
		else if (node instanceof BinaryExpression binary)
		{
			dto.op = binary.getOperator().getSymbol();
			add(dto, binary.getLeft());
			add(dto, binary.getRight());
		}
		else if (node instanceof UnaryExpression unary)
		{
			dto.op = unary.getOperator().getSymbol();
			add(dto, unary.getOperand());
		}
		else if (node instanceof Call call)
		{
			add(dto, call.getCallee());
			addAll(dto, call.getArguments());
		}
		else if (node instanceof Literal literal)
		{
			dto.value = literal.getValue();
		}
		else if (node instanceof Variable variable)
		{
			dto.name = variable.getName();
			dto.readOnly = variable.isReadOnly();
		}
		else if (node instanceof Function function)
		{
			dto.name = function.getName();
			dto.paramCount = function.getParamCount();
			dto.userDefined = function.isUserDefined();
		}
		else
		{
			throw new IllegalStateException("Unknown node kind: " + node.getClass().getName());
		}

		if (dto.children.isEmpty())
		{
			dto.children = null;
		}
		return dto;
	}

	private static void add(NodeDTO parent, Node child)
	{
		parent.children.add(toDTO(child));
	}

	private static void addAll(NodeDTO parent, List<? extends Node> children)
	{
		children.forEach(child -> add(parent, child));
	}
}
