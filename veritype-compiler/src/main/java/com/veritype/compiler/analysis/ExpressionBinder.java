package com.veritype.compiler.analysis;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.ast.expr.BinaryExpressionSyntax;
import com.veritype.compiler.ast.expr.ExpressionSyntax;
import com.veritype.compiler.ast.expr.IntegerLiteralSyntax;
import com.veritype.compiler.ast.expr.NameExpressionSyntax;
import com.veritype.compiler.ast.expr.RealLiteralSyntax;
import com.veritype.compiler.ast.expr.StringLiteralSyntax;
import com.veritype.compiler.ast.expr.UnaryExpressionSyntax;
import com.veritype.compiler.ast.type.TypeKeyword;
import com.veritype.compiler.analysis.types.EnumValueSymbol;
import com.veritype.compiler.analysis.types.IntegralFlag;
import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.value.ConstantValue;
import com.veritype.compiler.value.SvInt;

import java.util.EnumSet;

/**
 * 表达式绑定器：为维度、枚举初始值和参数计算类型与常量值。
 * 只覆盖常量表达式所需的字面量、名字引用与算术运算。
 */
public final class ExpressionBinder {

    private final BindContext context;
    private final Compilation compilation;

    public ExpressionBinder(BindContext context) {
        this.context = context;
        this.compilation = context.getCompilation();
    }

    public BoundExpression bind(ExpressionSyntax syntax) {
        if (syntax instanceof IntegerLiteralSyntax) {
            return bindIntegerLiteral((IntegerLiteralSyntax) syntax);
        } else if (syntax instanceof RealLiteralSyntax) {
            RealLiteralSyntax lit = (RealLiteralSyntax) syntax;
            return BoundExpression.constant(lit, compilation.getType(TypeKeyword.REAL),
                    ConstantValue.of(lit.getValue()));
        } else if (syntax instanceof StringLiteralSyntax) {
            StringLiteralSyntax lit = (StringLiteralSyntax) syntax;
            return BoundExpression.constant(lit, compilation.getType(TypeKeyword.STRING),
                    ConstantValue.of(lit.getValue()));
        } else if (syntax instanceof NameExpressionSyntax) {
            return bindName((NameExpressionSyntax) syntax);
        } else if (syntax instanceof UnaryExpressionSyntax) {
            return bindUnary((UnaryExpressionSyntax) syntax);
        } else if (syntax instanceof BinaryExpressionSyntax) {
            return bindBinary((BinaryExpressionSyntax) syntax);
        }
        throw InternalCompilerError.unreachable(syntax.getClass().getSimpleName());
    }

    // ============ 字面量与名字 ============

    private BoundExpression bindIntegerLiteral(IntegerLiteralSyntax lit) {
        // 无位宽字面量按 32 位有符号处理
        int width = lit.isSized() ? lit.getWidth() : 32;
        boolean signed = !lit.isSized() || lit.isSigned();
        SvType type = compilation.getType(width, signed
                ? EnumSet.of(IntegralFlag.SIGNED) : EnumSet.noneOf(IntegralFlag.class));
        return BoundExpression.constant(lit, type, ConstantValue.of(SvInt.of(width, lit.getValue(), signed)));
    }

    private BoundExpression bindName(NameExpressionSyntax syntax) {
        LookupResult result = new LookupResult();
        context.getScope().lookupName(syntax.getName(), context.getLookupLocation(), result);
        compilation.addDiagnostics(result.getDiagnostics());

        Symbol symbol = result.getFound();
        if (symbol == null) return BoundExpression.bad(syntax);

        switch (symbol.getKind()) {
            case ENUM_VALUE: {
                EnumValueSymbol value = (EnumValueSymbol) symbol;
                ConstantValue cv = value.getValue();
                if (cv.isBad()) return BoundExpression.bad(syntax);
                return BoundExpression.constant(syntax, value.getType(), cv);
            }
            case PARAMETER: {
                ParameterSymbol param = (ParameterSymbol) symbol;
                ConstantValue cv = param.getValue();
                if (cv.isBad()) return BoundExpression.bad(syntax);
                return BoundExpression.constant(syntax, param.getType(), cv);
            }
            case VARIABLE:
                return BoundExpression.nonConstant(syntax, ((VariableSymbol) symbol).getType());
            default:
                context.addDiag(DiagCode.NOT_A_VALUE, syntax.getLocation()).addArg(symbol.getName());
                return BoundExpression.bad(syntax);
        }
    }

    // ============ 运算 ============

    private BoundExpression bindUnary(UnaryExpressionSyntax syntax) {
        BoundExpression operand = bind(syntax.getOperand());
        if (operand.isBad()) return BoundExpression.bad(syntax);

        SvType type = operand.getType();
        UnaryExpressionSyntax.UnaryOp op = syntax.getOperator();
        if (!type.isNumeric() || (op == UnaryExpressionSyntax.UnaryOp.BITWISE_NOT && !type.isIntegral())) {
            context.addDiag(DiagCode.BAD_UNARY_EXPRESSION, syntax.getLocation())
                    .addArg(op.getSymbol()).addArg(type);
            return BoundExpression.bad(syntax);
        }
        if (!operand.isConstant()) return BoundExpression.nonConstant(syntax, type);

        ConstantValue value = operand.getConstant();
        switch (op) {
            case PLUS:
                return BoundExpression.constant(syntax, type, value);
            case MINUS:
                if (value.isReal()) {
                    return BoundExpression.constant(syntax, type, ConstantValue.of(-value.real()));
                }
                return BoundExpression.constant(syntax, type, ConstantValue.of(value.integer().negate()));
            case BITWISE_NOT:
                return BoundExpression.constant(syntax, type, ConstantValue.of(value.integer().not()));
            default:
                throw InternalCompilerError.unreachable(op);
        }
    }

    private BoundExpression bindBinary(BinaryExpressionSyntax syntax) {
        BoundExpression lhs = bind(syntax.getLeft());
        BoundExpression rhs = bind(syntax.getRight());
        if (lhs.isBad() || rhs.isBad()) return BoundExpression.bad(syntax);

        BinaryExpressionSyntax.BinaryOp op = syntax.getOperator();
        SvType lt = lhs.getType();
        SvType rt = rhs.getType();
        boolean shift = op == BinaryExpressionSyntax.BinaryOp.SHIFT_LEFT
                || op == BinaryExpressionSyntax.BinaryOp.SHIFT_RIGHT;
        boolean floating = lt.isFloating() || rt.isFloating();

        boolean valid = lt.isNumeric() && rt.isNumeric();
        if (shift || op == BinaryExpressionSyntax.BinaryOp.MOD) {
            valid = valid && lt.isIntegral() && rt.isIntegral();
        }
        if (!valid) {
            context.addDiag(DiagCode.BAD_BINARY_EXPRESSION, syntax.getLocation())
                    .addArg(op.getSymbol()).addArg(lt).addArg(rt);
            return BoundExpression.bad(syntax);
        }

        SvType resultType;
        if (shift) {
            resultType = lt;
        } else if (floating) {
            resultType = compilation.getType(TypeKeyword.REAL);
        } else {
            int width = Math.max(lt.getBitWidth(), rt.getBitWidth());
            EnumSet<IntegralFlag> flags = EnumSet.noneOf(IntegralFlag.class);
            if (lt.isSigned() && rt.isSigned()) flags.add(IntegralFlag.SIGNED);
            if (lt.isFourState() || rt.isFourState()) flags.add(IntegralFlag.FOUR_STATE);
            resultType = compilation.getType(width, flags);
        }

        if (!lhs.isConstant() || !rhs.isConstant()) {
            return BoundExpression.nonConstant(syntax, resultType);
        }

        ConstantValue result;
        if (shift) {
            result = ConstantValue.of(evalShift(op, lhs.getConstant().integer(), rhs.getConstant().integer()));
        } else if (floating) {
            result = ConstantValue.of(evalReal(op,
                    ConstantConversions.toDouble(lhs.getConstant()),
                    ConstantConversions.toDouble(rhs.getConstant())));
        } else {
            int width = resultType.getBitWidth();
            boolean signed = resultType.isSigned();
            SvInt l = lhs.getConstant().integer().resize(width, signed);
            SvInt r = rhs.getConstant().integer().resize(width, signed);
            result = ConstantValue.of(evalInteger(op, l, r));
        }
        return BoundExpression.constant(syntax, resultType, result);
    }

    private static SvInt evalShift(BinaryExpressionSyntax.BinaryOp op, SvInt value, SvInt amount) {
        Integer count = amount.asInt();
        if (count == null || count < 0) {
            return SvInt.createFillX(value.getWidth(), value.isSigned());
        }
        return op == BinaryExpressionSyntax.BinaryOp.SHIFT_LEFT
                ? value.shiftLeft(count) : value.shiftRight(count);
    }

    private static SvInt evalInteger(BinaryExpressionSyntax.BinaryOp op, SvInt l, SvInt r) {
        switch (op) {
            case ADD: return l.add(r);
            case SUB: return l.subtract(r);
            case MUL: return l.multiply(r);
            case DIV: return l.divide(r);
            case MOD: return l.remainder(r);
            default:
                throw InternalCompilerError.unreachable(op);
        }
    }

    private static double evalReal(BinaryExpressionSyntax.BinaryOp op, double l, double r) {
        switch (op) {
            case ADD: return l + r;
            case SUB: return l - r;
            case MUL: return l * r;
            case DIV: return l / r;
            default:
                throw InternalCompilerError.unreachable(op);
        }
    }
}
