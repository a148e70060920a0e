package com.veritype.compiler.ast.expr;

import com.veritype.compiler.ast.SourceLocation;

/**
 * 字符串字面量
 */
public final class StringLiteralSyntax extends ExpressionSyntax {
    private final String value;

    public StringLiteralSyntax(SourceLocation location, String value) {
        super(location);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
