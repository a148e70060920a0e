package com.veritype.compiler.ast.type;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;

/**
 * 维度：[msb:lsb]、[size] 或 []
 */
public final class VariableDimensionSyntax extends AstNode {

    public enum Kind {
        RANGE,
        SIZE,
        UNSIZED
    }

    private final Kind kind;
    private final ExpressionSyntax left;
    private final ExpressionSyntax right;

    private VariableDimensionSyntax(SourceLocation location, Kind kind, ExpressionSyntax left, ExpressionSyntax right) {
        super(location);
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    public static VariableDimensionSyntax range(SourceLocation location, ExpressionSyntax left, ExpressionSyntax right) {
        return new VariableDimensionSyntax(location, Kind.RANGE, left, right);
    }

    public static VariableDimensionSyntax size(SourceLocation location, ExpressionSyntax size) {
        return new VariableDimensionSyntax(location, Kind.SIZE, size, null);
    }

    public static VariableDimensionSyntax unsized(SourceLocation location) {
        return new VariableDimensionSyntax(location, Kind.UNSIZED, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    /** RANGE 的 msb，或 SIZE 的大小表达式 */
    public ExpressionSyntax getLeft() {
        return left;
    }

    public ExpressionSyntax getRight() {
        return right;
    }
}
