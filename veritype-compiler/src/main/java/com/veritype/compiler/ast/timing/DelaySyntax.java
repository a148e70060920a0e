package com.veritype.compiler.ast.timing;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;

/**
 * #delay
 */
public final class DelaySyntax extends TimingControlSyntax {
    private final ExpressionSyntax delayValue;

    public DelaySyntax(SourceLocation location, ExpressionSyntax delayValue) {
        super(location);
        this.delayValue = delayValue;
    }

    public ExpressionSyntax getDelayValue() {
        return delayValue;
    }
}
