package com.veritype.compiler.ast.type;

import com.veritype.compiler.ast.SourceLocation;

/**
 * 无维度的关键字类型：real/realtime/shortreal/string/chandle/event/void
 */
public final class KeywordTypeSyntax extends DataTypeSyntax {
    private final TypeKeyword keyword;

    public KeywordTypeSyntax(SourceLocation location, TypeKeyword keyword) {
        super(location);
        if (keyword.isIntegerVector() || keyword.isIntegerAtom()) {
            throw new IllegalArgumentException("integer keyword needs IntegerTypeSyntax: " + keyword);
        }
        this.keyword = keyword;
    }

    public TypeKeyword getKeyword() {
        return keyword;
    }

    @Override
    public <R> R accept(TypeSyntaxVisitor<R> visitor) {
        return visitor.visitKeywordType(this);
    }
}
