package com.veritype.compiler.ast.decl;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.DataTypeSyntax;

/**
 * nettype 声明：nettype T name [with func];
 */
public final class NetTypeDeclarationSyntax extends MemberSyntax {
    private final String name;
    private final DataTypeSyntax type;
    private final String withFunction;

    public NetTypeDeclarationSyntax(SourceLocation location, String name, DataTypeSyntax type, String withFunction) {
        super(location);
        this.name = name;
        this.type = type;
        this.withFunction = withFunction;
    }

    public String getName() {
        return name;
    }

    public DataTypeSyntax getType() {
        return type;
    }

    /** 解析函数名，未指定时为 null */
    public String getWithFunction() {
        return withFunction;
    }
}
