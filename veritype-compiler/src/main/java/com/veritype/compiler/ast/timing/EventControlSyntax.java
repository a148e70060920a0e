package com.veritype.compiler.ast.timing;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;

/**
 * @name
 */
public final class EventControlSyntax extends TimingControlSyntax {
    private final ExpressionSyntax eventName;

    public EventControlSyntax(SourceLocation location, ExpressionSyntax eventName) {
        super(location);
        this.eventName = eventName;
    }

    public ExpressionSyntax getEventName() {
        return eventName;
    }
}
