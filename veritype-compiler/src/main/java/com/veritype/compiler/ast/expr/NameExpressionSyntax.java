package com.veritype.compiler.ast.expr;

import com.veritype.compiler.ast.NameSyntax;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 标识符引用
 */
public final class NameExpressionSyntax extends ExpressionSyntax {
    private final NameSyntax name;

    public NameExpressionSyntax(SourceLocation location, NameSyntax name) {
        super(location);
        this.name = name;
    }

    public NameSyntax getName() {
        return name;
    }
}
