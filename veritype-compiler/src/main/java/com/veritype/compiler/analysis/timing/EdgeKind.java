package com.veritype.compiler.analysis.timing;

import com.veritype.compiler.ast.timing.SignalEventExpressionSyntax;

public enum EdgeKind {
    NONE,
    POS_EDGE,
    NEG_EDGE,
    BOTH_EDGES;

    public static EdgeKind fromSyntax(SignalEventExpressionSyntax.Edge edge) {
        switch (edge) {
            case POSEDGE: return POS_EDGE;
            case NEGEDGE: return NEG_EDGE;
            case EDGE: return BOTH_EDGES;
            default: return NONE;
        }
    }
}
