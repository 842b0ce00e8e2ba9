package org.bella.optimizer;

import org.bella.ast.BinaryOperator;
import org.bella.ast.BooleanLiteral;
import org.bella.ast.NumberLiteral;
import org.bella.ast.UnaryOperator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConstantFolderTest
{
	@Test
	void logical_operators_return_an_operand()
	{
		var zero = new NumberLiteral(0);
		var five = new NumberLiteral(5);
		assertSame(zero, ConstantFolder.fold(BinaryOperator.AND, zero, five).orElseThrow());
		assertSame(five, ConstantFolder.fold(BinaryOperator.AND, BooleanLiteral.TRUE, five).orElseThrow());
		assertSame(five, ConstantFolder.fold(BinaryOperator.OR, five, BooleanLiteral.FALSE).orElseThrow());
		assertSame(BooleanLiteral.TRUE, ConstantFolder.fold(BinaryOperator.OR, zero, BooleanLiteral.TRUE).orElseThrow());
	}

	@Test
	void equality_requires_same_literal_kind()
	{
		assertTrue(ConstantFolder.fold(BinaryOperator.EQUAL, BooleanLiteral.TRUE, new NumberLiteral(1)).isEmpty());
		assertSame(BooleanLiteral.FALSE,
				ConstantFolder.fold(BinaryOperator.EQUAL, BooleanLiteral.TRUE, BooleanLiteral.FALSE).orElseThrow());
	}

	@Test
	void nan_is_not_equal_to_itself()
	{
		var nan = new NumberLiteral(Double.NaN);
		assertSame(BooleanLiteral.FALSE, ConstantFolder.fold(BinaryOperator.EQUAL, nan, nan).orElseThrow());
		assertSame(BooleanLiteral.TRUE, ConstantFolder.fold(BinaryOperator.NOT_EQUAL, nan, nan).orElseThrow());
	}

	@Test
	void zero_divisor_is_not_folded()
	{
		assertTrue(ConstantFolder.fold(BinaryOperator.DIVIDE, new NumberLiteral(1), new NumberLiteral(0)).isEmpty());
		assertTrue(ConstantFolder.fold(BinaryOperator.MODULO, new NumberLiteral(1), new NumberLiteral(-0.0)).isEmpty());
	}

	@Test
	void remainder_keeps_sign_of_dividend()
	{
		assertEquals(new NumberLiteral(-1), ConstantFolder.fold(BinaryOperator.MODULO, new NumberLiteral(-7), new NumberLiteral(3)).orElseThrow());
	}

	@Test
	void unary_folding()
	{
		assertEquals(new NumberLiteral(-2.5), ConstantFolder.fold(UnaryOperator.NEGATE, new NumberLiteral(2.5)).orElseThrow());
		assertSame(BooleanLiteral.TRUE, ConstantFolder.fold(UnaryOperator.NOT, new NumberLiteral(Double.NaN)).orElseThrow());
		assertTrue(ConstantFolder.fold(UnaryOperator.NEGATE, BooleanLiteral.TRUE).isEmpty());
	}
}
