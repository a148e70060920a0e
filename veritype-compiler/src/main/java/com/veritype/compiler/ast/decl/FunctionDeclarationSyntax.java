package com.veritype.compiler.ast.decl;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.DataTypeSyntax;

/**
 * 函数声明（仅签名，函数体不参与类型分析）
 */
public final class FunctionDeclarationSyntax extends MemberSyntax {
    private final String name;
    private final DataTypeSyntax returnType;

    public FunctionDeclarationSyntax(SourceLocation location, String name, DataTypeSyntax returnType) {
        super(location);
        this.name = name;
        this.returnType = returnType;
    }

    public String getName() {
        return name;
    }

    public DataTypeSyntax getReturnType() {
        return returnType;
    }
}
