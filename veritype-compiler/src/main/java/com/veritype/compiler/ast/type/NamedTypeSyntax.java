package com.veritype.compiler.ast.type;

import com.veritype.compiler.ast.NameSyntax;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 按名字引用的类型（typedef / nettype）
 */
public final class NamedTypeSyntax extends DataTypeSyntax {
    private final NameSyntax name;

    public NamedTypeSyntax(SourceLocation location, NameSyntax name) {
        super(location);
        this.name = name;
    }

    public NameSyntax getName() {
        return name;
    }

    @Override
    public <R> R accept(TypeSyntaxVisitor<R> visitor) {
        return visitor.visitNamedType(this);
    }
}
