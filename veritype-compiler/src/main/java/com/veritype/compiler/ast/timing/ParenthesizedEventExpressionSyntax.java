package com.veritype.compiler.ast.timing;

import com.veritype.compiler.ast.SourceLocation;

/**
 * ( event_expression )
 */
public final class ParenthesizedEventExpressionSyntax extends EventExpressionSyntax {
    private final EventExpressionSyntax expr;

    public ParenthesizedEventExpressionSyntax(SourceLocation location, EventExpressionSyntax expr) {
        super(location);
        this.expr = expr;
    }

    public EventExpressionSyntax getExpr() {
        return expr;
    }
}
