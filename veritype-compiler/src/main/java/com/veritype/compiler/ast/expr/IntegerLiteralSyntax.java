package com.veritype.compiler.ast.expr;

import com.veritype.compiler.ast.SourceLocation;

import java.math.BigInteger;

/**
 * 整数字面量。width 为 0 表示未指定位宽（如 10），否则为 8'd10 形式
 */
public final class IntegerLiteralSyntax extends ExpressionSyntax {
    private final BigInteger value;
    private final int width;
    private final boolean signed;

    public IntegerLiteralSyntax(SourceLocation location, BigInteger value, int width, boolean signed) {
        super(location);
        this.value = value;
        this.width = width;
        this.signed = signed;
    }

    public BigInteger getValue() {
        return value;
    }

    public int getWidth() {
        return width;
    }

    public boolean isSized() {
        return width > 0;
    }

    public boolean isSigned() {
        return signed;
    }
}
