package com.veritype.compiler.ast.expr;

import com.veritype.compiler.ast.SourceLocation;

/**
 * 实数字面量
 */
public final class RealLiteralSyntax extends ExpressionSyntax {
    private final double value;

    public RealLiteralSyntax(SourceLocation location, double value) {
        super(location);
        this.value = value;
    }

    public double getValue() {
        return value;
    }
}
