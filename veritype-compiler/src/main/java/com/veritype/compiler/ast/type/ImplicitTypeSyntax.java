package com.veritype.compiler.ast.type;

import com.veritype.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 隐式类型（省略关键字，如 parameter signed [3:0] P），按 logic 处理
 */
public final class ImplicitTypeSyntax extends DataTypeSyntax {
    private final Signing signing;
    private final List<VariableDimensionSyntax> dimensions;

    public ImplicitTypeSyntax(SourceLocation location, Signing signing,
                              List<VariableDimensionSyntax> dimensions) {
        super(location);
        this.signing = signing != null ? signing : Signing.NONE;
        this.dimensions = dimensions != null ? dimensions : Collections.<VariableDimensionSyntax>emptyList();
    }

    public Signing getSigning() {
        return signing;
    }

    public List<VariableDimensionSyntax> getDimensions() {
        return dimensions;
    }

    @Override
    public <R> R accept(TypeSyntaxVisitor<R> visitor) {
        return visitor.visitImplicitType(this);
    }
}
