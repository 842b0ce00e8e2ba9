package org.bella.semantic;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.bella.ast.*;
import org.bella.parser.BellaBaseVisitor;
import org.bella.parser.BellaParser;
import org.bella.semantic.symbol.Entity;
import org.bella.semantic.symbol.Function;
import org.bella.semantic.symbol.Scope;
import org.bella.semantic.symbol.Variable;
import org.bella.util.Debug;
import org.bella.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Single pass over the parse tree that binds every identifier to its entity and
 * builds the decorated tree. The first violated rule aborts the walk.
 */
public class ResolutionVisitor extends BellaBaseVisitor<Node>
{
	private final ErrorHandler errorHandler;
	private Scope currentScope;

	public ResolutionVisitor(Scope rootScope, ErrorHandler errorHandler)
	{
		this.currentScope = rootScope;
		this.errorHandler = errorHandler;
	}

	// --- Helpers ---

	private Statement statement(BellaParser.StatementContext ctx)
	{
		return (Statement) visit(ctx);
	}

	private Expression expression(ParseTree ctx)
	{
		return (Expression) visit(ctx);
	}

	private List<Statement> statements(List<BellaParser.StatementContext> contexts)
	{
		List<Statement> result = new ArrayList<>(contexts.size());
		for (BellaParser.StatementContext ctx : contexts)
		{
			result.add(statement(ctx));
		}
		return result;
	}

	private <T extends Entity> T declare(Token nameToken, T entity)
	{
		if (currentScope.resolveLocally(entity.getName()).isPresent())
		{
			throw errorHandler.logError(ErrorKind.DUPLICATE_DECLARATION, nameToken, entity.getName() + " has already been declared");
		}
		return currentScope.define(entity);
	}

	private <T extends Entity> T lookup(Token nameToken, Class<T> expected, String expectedKind)
	{
		String name = nameToken.getText();
		Entity entity = currentScope.resolve(name)
				.orElseThrow(() -> errorHandler.logError(ErrorKind.UNDECLARED_NAME, nameToken, name + " has not been declared"));
		if (!expected.isInstance(entity))
		{
			throw errorHandler.logError(ErrorKind.WRONG_ENTITY_KIND, nameToken, name + " was expected to be a " + expectedKind);
		}
		return expected.cast(entity);
	}

	private Variable lookupVariable(TerminalNode id)
	{
		return lookup(id.getSymbol(), Variable.class, Variable.KIND);
	}

	private Function lookupFunction(TerminalNode id)
	{
		return lookup(id.getSymbol(), Function.class, Function.KIND);
	}

	// --- Statements ---

	@Override
	public Node visitProgram(BellaParser.ProgramContext ctx)
	{
		return new Program(statements(ctx.statement()));
	}

	@Override
	public Node visitVariableDeclaration(BellaParser.VariableDeclarationContext ctx)
	{
		// The variable comes into scope only after its initializer, so "let x = x;"
		// refers to an outer x or fails.
		Expression initializer = expression(ctx.expression());
		Variable variable = declare(ctx.ID().getSymbol(), new Variable(ctx.ID().getText(), false));
		return new VariableDeclaration(variable, initializer);
	}

	@Override
	public Node visitFunctionDeclaration(BellaParser.FunctionDeclarationContext ctx)
	{
		List<TerminalNode> ids = ctx.parameters().ID();
		// Declared before the body is analyzed so the function can call itself.
		Function function = declare(ctx.ID().getSymbol(), new Function(ctx.ID().getText(), ids.size(), true));

		currentScope = new Scope(currentScope);
		Debug.logDebug("Entering scope of function '" + function.getName() + "'");

		List<Variable> parameters = new ArrayList<>(ids.size());
		for (TerminalNode id : ids)
		{
			parameters.add(declare(id.getSymbol(), new Variable(id.getText(), true)));
		}
		Expression body = expression(ctx.expression());

		currentScope = currentScope.getEnclosingScope();
		Debug.logDebug("Leaving scope of function '" + function.getName() + "'");
		return new FunctionDeclaration(function, parameters, body);
	}

	@Override
	public Node visitAssignment(BellaParser.AssignmentContext ctx)
	{
		Variable target = lookupVariable(ctx.ID());
		if (target.isReadOnly())
		{
			throw errorHandler.logError(ErrorKind.READ_ONLY_ASSIGNMENT, ctx.ID().getSymbol(), target.getName() + " is read only");
		}
		return new Assignment(target, expression(ctx.expression()));
	}

	@Override
	public Node visitPrintStatement(BellaParser.PrintStatementContext ctx)
	{
		return new PrintStatement(expression(ctx.expression()));
	}

	@Override
	public Node visitWhileStatement(BellaParser.WhileStatementContext ctx)
	{
		Expression test = expression(ctx.expression());
		// Blocks do not open a scope.
		List<Statement> body = statements(ctx.block().statement());
		return new WhileStatement(test, body);
	}

	// --- Expressions ---

	@Override
	public Node visitUnaryExpression(BellaParser.UnaryExpressionContext ctx)
	{
		return new UnaryExpression(UnaryOperator.fromTokenType(ctx.op.getType()), expression(ctx.primary()));
	}

	@Override
	public Node visitConditionalExpression(BellaParser.ConditionalExpressionContext ctx)
	{
		Expression test = expression(ctx.operation(0));
		Expression consequent = expression(ctx.operation(1));
		Expression alternate = expression(ctx.expression());
		return new Conditional(test, consequent, alternate);
	}

	@Override
	public Node visitPlainExpression(BellaParser.PlainExpressionContext ctx)
	{
		return visit(ctx.operation());
	}

	@Override
	public Node visitLogicalOperation(BellaParser.LogicalOperationContext ctx)
	{
		return binary(ctx.op, ctx.operation(0), ctx.operation(1));
	}

	@Override
	public Node visitComparisonOperation(BellaParser.ComparisonOperationContext ctx)
	{
		return visit(ctx.comparison());
	}

	@Override
	public Node visitRelationalComparison(BellaParser.RelationalComparisonContext ctx)
	{
		return binary(ctx.op, ctx.arithmetic(0), ctx.arithmetic(1));
	}

	@Override
	public Node visitPlainComparison(BellaParser.PlainComparisonContext ctx)
	{
		return visit(ctx.arithmetic());
	}

	@Override
	public Node visitBinaryArithmetic(BellaParser.BinaryArithmeticContext ctx)
	{
		return binary(ctx.op, ctx.arithmetic(0), ctx.arithmetic(1));
	}

	@Override
	public Node visitPrimaryArithmetic(BellaParser.PrimaryArithmeticContext ctx)
	{
		return visit(ctx.primary());
	}

	private BinaryExpression binary(Token op, ParseTree leftCtx, ParseTree rightCtx)
	{
		BinaryOperator operator = BinaryOperator.fromTokenType(op.getType());
		Expression left = expression(leftCtx);
		Expression right = expression(rightCtx);
		return new BinaryExpression(operator, left, right);
	}

	@Override
	public Node visitNumberLiteral(BellaParser.NumberLiteralContext ctx)
	{
		return new NumberLiteral(Double.parseDouble(ctx.NUMBER_LITERAL().getText()));
	}

	@Override
	public Node visitTrueLiteral(BellaParser.TrueLiteralContext ctx)
	{
		return BooleanLiteral.TRUE;
	}

	@Override
	public Node visitFalseLiteral(BellaParser.FalseLiteralContext ctx)
	{
		return BooleanLiteral.FALSE;
	}

	@Override
	public Node visitCallPrimary(BellaParser.CallPrimaryContext ctx)
	{
		return visit(ctx.call());
	}

	@Override
	public Node visitCall(BellaParser.CallContext ctx)
	{
		Function callee = lookupFunction(ctx.ID());
		List<BellaParser.ExpressionContext> argumentContexts = ctx.expression();
		if (argumentContexts.size() != callee.getParamCount())
		{
			throw errorHandler.logError(ErrorKind.ARITY_MISMATCH, ctx.L_PAREN_SYM().getSymbol(),
					"Expected " + callee.getParamCount() + " arg(s), found " + argumentContexts.size());
		}

		List<Expression> arguments = new ArrayList<>(argumentContexts.size());
		for (BellaParser.ExpressionContext argument : argumentContexts)
		{
			arguments.add(expression(argument));
		}
		return new Call(callee, arguments);
	}

	@Override
	public Node visitIdentifier(BellaParser.IdentifierContext ctx)
	{
		return lookupVariable(ctx.ID());
	}

	@Override
	public Node visitParenthesized(BellaParser.ParenthesizedContext ctx)
	{
		return visit(ctx.expression());
	}
}
