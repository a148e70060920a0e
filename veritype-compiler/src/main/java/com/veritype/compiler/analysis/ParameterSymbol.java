package com.veritype.compiler.analysis;

import com.veritype.compiler.ast.decl.ParameterDeclarationSyntax;
import com.veritype.compiler.ast.expr.ExpressionSyntax;
import com.veritype.compiler.analysis.types.ErrorType;
import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.value.ConstantValue;

/**
 * parameter / localparam：常量值在首次使用时求值并缓存
 */
public final class ParameterSymbol extends Symbol {
    private final DeclaredType declaredType = new DeclaredType(this);
    private final ExpressionSyntax initializer;

    private BoundExpression boundInitializer;
    private ConstantValue value;

    public ParameterSymbol(String name, ParameterDeclarationSyntax syntax) {
        super(SymbolKind.PARAMETER, name, syntax.getLocation());
        this.initializer = syntax.getInitializer();
        if (syntax.getType() != null) {
            declaredType.setTypeSyntax(syntax.getType());
        }
        setSyntax(syntax);
    }

    public static ParameterSymbol fromSyntax(ParameterDeclarationSyntax syntax) {
        return new ParameterSymbol(syntax.getName(), syntax);
    }

    @Override
    public DeclaredType getDeclaredType() {
        return declaredType.getTypeSyntax() != null ? declaredType : null;
    }

    public ExpressionSyntax getInitializer() {
        return initializer;
    }

    /** 有显式类型时取声明类型，否则取初始值表达式的类型 */
    public SvType getType() {
        if (declaredType.getTypeSyntax() != null) {
            return declaredType.getType();
        }
        BoundExpression bound = bindInitializer();
        return bound.isBad() ? ErrorType.INSTANCE : bound.getType();
    }

    public ConstantValue getValue() {
        if (value != null) return value;

        BoundExpression bound = bindInitializer();
        if (bound.isBad()) {
            value = ConstantValue.BAD;
        } else if (!bound.isConstant()) {
            getParentScope().addDiag(DiagCode.EXPRESSION_NOT_CONSTANT, initializer.getLocation());
            value = ConstantValue.BAD;
        } else {
            value = ConstantConversions.convert(bound.getConstant(), getType());
        }
        return value;
    }

    private BoundExpression bindInitializer() {
        if (boundInitializer == null) {
            BindContext context = new BindContext(getParentScope(), LookupLocation.before(this));
            boundInitializer = context.bind(initializer);
        }
        return boundInitializer;
    }
}
