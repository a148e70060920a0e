package com.veritype.compiler.ast.timing;

import com.veritype.compiler.ast.SourceLocation;

/**
 * a or b / a, b
 */
public final class BinaryEventExpressionSyntax extends EventExpressionSyntax {
    private final EventExpressionSyntax left;
    private final EventExpressionSyntax right;

    public BinaryEventExpressionSyntax(SourceLocation location, EventExpressionSyntax left,
                                       EventExpressionSyntax right) {
        super(location);
        this.left = left;
        this.right = right;
    }

    public EventExpressionSyntax getLeft() {
        return left;
    }

    public EventExpressionSyntax getRight() {
        return right;
    }
}
