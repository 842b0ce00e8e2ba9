package org.bella.optimizer;

import org.bella.ast.BinaryOperator;
import org.bella.ast.BooleanLiteral;
import org.bella.ast.Literal;
import org.bella.ast.NumberLiteral;
import org.bella.ast.UnaryOperator;

import java.util.Optional;

/**
 * Evaluates operators on literal operands with the target language's semantics.
 * An empty result means the operation must be left for run time.
 */
public final class ConstantFolder
{
	private ConstantFolder()
	{
	}

	public static Optional<Literal> fold(BinaryOperator operator, Literal left, Literal right)
	{
		if (operator.isLogical())
		{
			// && and || yield one of their operands, not a boolean.
			boolean leftTruthy = left.isTruthy();
			if (operator == BinaryOperator.AND)
			{
				return Optional.of(leftTruthy ? right : left);
			}
			return Optional.of(leftTruthy ? left : right);
		}

		if (operator.isEquality())
		{
			if (left.getClass() != right.getClass())
			{
				return Optional.empty();
			}
			boolean equal = left instanceof NumberLiteral l
					? l.getNumber() == ((NumberLiteral) right).getNumber()
					: left.getValue().equals(right.getValue());
			return Optional.of(BooleanLiteral.of(operator == BinaryOperator.EQUAL ? equal : !equal));
		}

		if (!(left instanceof NumberLiteral l) || !(right instanceof NumberLiteral r))
		{
			return Optional.empty();
		}
		double x = l.getNumber();
		double y = r.getNumber();

		switch (operator)
		{
			case ADD:
				return Optional.of(new NumberLiteral(x + y));
			case SUBTRACT:
				return Optional.of(new NumberLiteral(x - y));
			case MULTIPLY:
				return Optional.of(new NumberLiteral(x * y));
			case DIVIDE:
				// x / 0 keeps its run-time Infinity/NaN behavior.
				return y == 0 ? Optional.empty() : Optional.of(new NumberLiteral(x / y));
			case MODULO:
				return y == 0 ? Optional.empty() : Optional.of(new NumberLiteral(x % y));
			case POWER:
				return Optional.of(new NumberLiteral(Math.pow(x, y)));
			case LESS:
				return Optional.of(BooleanLiteral.of(x < y));
			case LESS_EQUAL:
				return Optional.of(BooleanLiteral.of(x <= y));
			case GREATER:
				return Optional.of(BooleanLiteral.of(x > y));
			case GREATER_EQUAL:
				return Optional.of(BooleanLiteral.of(x >= y));
			default:
				throw new IllegalStateException("Unhandled binary operator: " + operator);
		}
	}

	public static Optional<Literal> fold(UnaryOperator operator, Literal operand)
	{
		if (operator == UnaryOperator.NOT)
		{
			return Optional.of(BooleanLiteral.of(!operand.isTruthy()));
		}
		if (operand instanceof NumberLiteral n)
		{
			return Optional.of(new NumberLiteral(-n.getNumber()));
		}
		return Optional.empty();
	}
}
