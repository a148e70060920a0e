package com.veritype.compiler.ast.decl;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;
import com.veritype.compiler.ast.type.DataTypeSyntax;

/**
 * parameter / localparam 声明
 */
public final class ParameterDeclarationSyntax extends MemberSyntax {
    private final String name;
    private final DataTypeSyntax type;
    private final ExpressionSyntax initializer;

    public ParameterDeclarationSyntax(SourceLocation location, String name, DataTypeSyntax type,
                                      ExpressionSyntax initializer) {
        super(location);
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    /** 省略类型时为 null，参数取初始值的类型 */
    public DataTypeSyntax getType() {
        return type;
    }

    public ExpressionSyntax getInitializer() {
        return initializer;
    }
}
