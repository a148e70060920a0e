package com.veritype.compiler.analysis;

import com.veritype.compiler.ast.expr.ExpressionSyntax;
import com.veritype.compiler.ast.type.DataTypeSyntax;
import com.veritype.compiler.ast.type.DeclaratorSyntax;
import com.veritype.compiler.analysis.types.SvType;

/**
 * 变量声明
 */
public final class VariableSymbol extends Symbol {
    private final DeclaredType declaredType = new DeclaredType(this);
    private final ExpressionSyntax initializer;

    public VariableSymbol(DataTypeSyntax type, DeclaratorSyntax declarator) {
        super(SymbolKind.VARIABLE, declarator.getName(), declarator.getLocation());
        declaredType.setTypeSyntax(type);
        declaredType.setDimensions(declarator.getDimensions());
        this.initializer = declarator.getInitializer();
        setSyntax(declarator);
    }

    @Override
    public DeclaredType getDeclaredType() {
        return declaredType;
    }

    public SvType getType() {
        return declaredType.getType();
    }

    public ExpressionSyntax getInitializer() {
        return initializer;
    }
}
