package com.veritype.compiler.ast.type;

import com.veritype.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 整数类型：bit/logic/reg 向量与 byte/int 等原子类型，可带 signing 与 packed 维度
 */
public final class IntegerTypeSyntax extends DataTypeSyntax {
    private final TypeKeyword keyword;
    private final Signing signing;
    private final List<VariableDimensionSyntax> dimensions;

    public IntegerTypeSyntax(SourceLocation location, TypeKeyword keyword, Signing signing,
                             List<VariableDimensionSyntax> dimensions) {
        super(location);
        if (!keyword.isIntegerVector() && !keyword.isIntegerAtom()) {
            throw new IllegalArgumentException("not an integer keyword: " + keyword);
        }
        this.keyword = keyword;
        this.signing = signing != null ? signing : Signing.NONE;
        this.dimensions = dimensions != null ? dimensions : Collections.<VariableDimensionSyntax>emptyList();
    }

    public TypeKeyword getKeyword() {
        return keyword;
    }

    public Signing getSigning() {
        return signing;
    }

    public List<VariableDimensionSyntax> getDimensions() {
        return dimensions;
    }

    @Override
    public <R> R accept(TypeSyntaxVisitor<R> visitor) {
        return visitor.visitIntegerType(this);
    }
}
