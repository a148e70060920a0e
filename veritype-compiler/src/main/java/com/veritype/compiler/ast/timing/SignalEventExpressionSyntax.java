package com.veritype.compiler.ast.timing;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;

/**
 * [posedge|negedge|edge] expr
 */
public final class SignalEventExpressionSyntax extends EventExpressionSyntax {

    public enum Edge {
        NONE, POSEDGE, NEGEDGE, EDGE
    }

    private final Edge edge;
    private final ExpressionSyntax expr;

    public SignalEventExpressionSyntax(SourceLocation location, Edge edge, ExpressionSyntax expr) {
        super(location);
        this.edge = edge != null ? edge : Edge.NONE;
        this.expr = expr;
    }

    public Edge getEdge() {
        return edge;
    }

    public ExpressionSyntax getExpr() {
        return expr;
    }
}
