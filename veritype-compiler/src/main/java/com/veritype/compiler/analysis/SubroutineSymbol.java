package com.veritype.compiler.analysis;

import com.veritype.compiler.ast.decl.FunctionDeclarationSyntax;
import com.veritype.compiler.analysis.types.SvType;

/**
 * 函数符号，仅记录返回类型（nettype 的解析函数）
 */
public final class SubroutineSymbol extends Symbol {
    private final DeclaredType returnType = new DeclaredType(this);

    public SubroutineSymbol(FunctionDeclarationSyntax syntax) {
        super(SymbolKind.SUBROUTINE, syntax.getName(), syntax.getLocation());
        returnType.setTypeSyntax(syntax.getReturnType());
        setSyntax(syntax);
    }

    @Override
    public DeclaredType getDeclaredType() {
        return returnType;
    }

    public SvType getReturnType() {
        return returnType.getType();
    }
}
