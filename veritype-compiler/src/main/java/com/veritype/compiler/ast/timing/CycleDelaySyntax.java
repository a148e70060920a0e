package com.veritype.compiler.ast.timing;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;

/**
 * ##cycles
 */
public final class CycleDelaySyntax extends TimingControlSyntax {
    private final ExpressionSyntax cycles;

    public CycleDelaySyntax(SourceLocation location, ExpressionSyntax cycles) {
        super(location);
        this.cycles = cycles;
    }

    public ExpressionSyntax getCycles() {
        return cycles;
    }
}
