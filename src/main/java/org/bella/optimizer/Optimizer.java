package org.bella.optimizer;

import org.bella.ast.*;
import org.bella.semantic.symbol.Variable;
import org.bella.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites a decorated program into an equivalent, simpler one: constant
 * folding, algebraic identities, dead-branch and dead-loop removal, and
 * removal of self-assignments.
 * <p>
 * Children are rewritten before their parent, so a single pass reaches a fixed
 * point. Nodes are updated in place and the (possibly replaced) node is
 * returned. The input must already have passed semantic analysis.
 * <p>
 * Declarations are never removed, even if the declared variable is never read.
 */
public class Optimizer
{
	public Program optimize(Program program)
	{
		Debug.logDebug("Optimizing " + program.getStatements().size() + " top-level statement(s)...");
		program.setStatements(optimizeStatements(program.getStatements()));
		return program;
	}

	// --- Statements ---

	private List<Statement> optimizeStatements(List<Statement> statements)
	{
		List<Statement> result = new ArrayList<>(statements.size());
		for (Statement statement : statements)
		{
			optimizeStatement(statement).ifPresent(result::add);
		}
		return result;
	}

	/**
	 * @return the rewritten statement, or empty if it has no effect.
	 */
	private Optional<Statement> optimizeStatement(Statement statement)
	{
		if (statement instanceof VariableDeclaration declaration)
		{
			declaration.setInitializer(optimizeExpression(declaration.getInitializer()));
			return Optional.of(declaration);
		}
		if (statement instanceof FunctionDeclaration declaration)
		{
			declaration.setBody(optimizeExpression(declaration.getBody()));
			return Optional.of(declaration);
		}
		if (statement instanceof Assignment assignment)
		{
			assignment.setSource(optimizeExpression(assignment.getSource()));
			if (assignment.getSource() == assignment.getTarget())
			{
				Debug.logDebug("Removed self-assignment to '" + assignment.getTarget().getName() + "'");
				return Optional.empty();
			}
			return Optional.of(assignment);
		}
		if (statement instanceof PrintStatement print)
		{
			print.setArgument(optimizeExpression(print.getArgument()));
			return Optional.of(print);
		}
		if (statement instanceof WhileStatement loop)
		{
			loop.setTest(optimizeExpression(loop.getTest()));
			if (loop.getTest() instanceof Literal test && !test.isTruthy())
			{
				Debug.logDebug("Removed while loop whose test is always " + test.getValue());
				return Optional.empty();
			}
			loop.setBody(optimizeStatements(loop.getBody()));
			return Optional.of(loop);
		}
		throw new IllegalStateException("Unknown statement kind: " + statement.getClass().getName());
	}

	// --- Expressions ---

	private Expression optimizeExpression(Expression expression)
	{
		if (expression instanceof Literal || expression instanceof Variable)
		{
			return expression;
		}
		if (expression instanceof BinaryExpression binary)
		{
			return optimizeBinary(binary);
		}
		if (expression instanceof UnaryExpression unary)
		{
			unary.setOperand(optimizeExpression(unary.getOperand()));
			if (unary.getOperand() instanceof Literal operand)
			{
				return ConstantFolder.fold(unary.getOperator(), operand).map(Expression.class::cast).orElse(unary);
			}
			return unary;
		}
		if (expression instanceof Conditional conditional)
		{
			conditional.setTest(optimizeExpression(conditional.getTest()));
			conditional.setConsequent(optimizeExpression(conditional.getConsequent()));
			conditional.setAlternate(optimizeExpression(conditional.getAlternate()));
			if (conditional.getTest() instanceof Literal test)
			{
				return test.isTruthy() ? conditional.getConsequent() : conditional.getAlternate();
			}
			return conditional;
		}
		if (expression instanceof Call call)
		{
			List<Expression> arguments = new ArrayList<>(call.getArguments().size());
			for (Expression argument : call.getArguments())
			{
				arguments.add(optimizeExpression(argument));
			}
			call.setArguments(arguments);
			return call;
		}
		throw new IllegalStateException("Unknown expression kind: " + expression.getClass().getName());
	}

	private Expression optimizeBinary(BinaryExpression binary)
	{
		binary.setLeft(optimizeExpression(binary.getLeft()));
		binary.setRight(optimizeExpression(binary.getRight()));
		Expression left = binary.getLeft();
		Expression right = binary.getRight();
		BinaryOperator operator = binary.getOperator();

		if (left instanceof Literal l && right instanceof Literal r)
		{
			Optional<Literal> folded = ConstantFolder.fold(operator, l, r);
			if (folded.isPresent())
			{
				return folded.get();
			}
		}

		if (operator.isLogical() && left instanceof Literal l)
		{
			boolean truthy = l.isTruthy();
			if (operator == BinaryOperator.AND)
			{
				return truthy ? right : left;
			}
			return truthy ? left : right;
		}

		// Arithmetic on a boolean converts it to a number, so an identity would change the printed value.
		if (left instanceof BooleanLiteral || right instanceof BooleanLiteral)
		{
			return binary;
		}

		switch (operator)
		{
			case ADD:
				if (isNumber(right, 0))
				{
					return left;
				}
				if (isNumber(left, 0))
				{
					return right;
				}
				break;
			case SUBTRACT:
				if (isNumber(right, 0))
				{
					return left;
				}
				break;
			case MULTIPLY:
				if (isNumber(right, 1))
				{
					return left;
				}
				if (isNumber(left, 1))
				{
					return right;
				}
				// Dropping the other operand is only safe when evaluating it has no effect.
				if (isNumber(right, 0) && !containsCall(left))
				{
					return right;
				}
				if (isNumber(left, 0) && !containsCall(right))
				{
					return left;
				}
				break;
			case DIVIDE:
			case POWER:
				if (isNumber(right, 1))
				{
					return left;
				}
				break;
			default:
				break;
		}
		return binary;
	}

	private static boolean isNumber(Expression expression, double value)
	{
		return expression instanceof NumberLiteral n && n.getNumber() == value;
	}

	private static boolean containsCall(Expression expression)
	{
		if (expression instanceof Call)
		{
			return true;
		}
		if (expression instanceof BinaryExpression binary)
		{
			return containsCall(binary.getLeft()) || containsCall(binary.getRight());
		}
		if (expression instanceof UnaryExpression unary)
		{
			return containsCall(unary.getOperand());
		}
		if (expression instanceof Conditional conditional)
		{
			return containsCall(conditional.getTest())
					|| containsCall(conditional.getConsequent())
					|| containsCall(conditional.getAlternate());
		}
		return false;
	}
}
