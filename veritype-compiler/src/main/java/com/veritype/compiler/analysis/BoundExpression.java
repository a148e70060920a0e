package com.veritype.compiler.analysis;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;
import com.veritype.compiler.analysis.types.ErrorType;
import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.value.ConstantValue;

/**
 * 绑定后的表达式：结果类型、编译期常量值（非常量为 null）以及是否有错
 */
public final class BoundExpression {
    private final ExpressionSyntax syntax;
    private final SvType type;
    private final ConstantValue constant;
    private final boolean bad;

    private BoundExpression(ExpressionSyntax syntax, SvType type, ConstantValue constant, boolean bad) {
        this.syntax = syntax;
        this.type = type;
        this.constant = constant;
        this.bad = bad;
    }

    public static BoundExpression bad(ExpressionSyntax syntax) {
        return new BoundExpression(syntax, ErrorType.INSTANCE, null, true);
    }

    public static BoundExpression constant(ExpressionSyntax syntax, SvType type, ConstantValue value) {
        return new BoundExpression(syntax, type, value, false);
    }

    public static BoundExpression nonConstant(ExpressionSyntax syntax, SvType type) {
        return new BoundExpression(syntax, type, null, false);
    }

    public ExpressionSyntax getSyntax() { return syntax; }
    public SvType getType() { return type; }
    public ConstantValue getConstant() { return constant; }
    public boolean isBad() { return bad; }
    public boolean isConstant() { return constant != null; }

    public SourceLocation getLocation() {
        return syntax.getLocation();
    }
}
