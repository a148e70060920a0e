package com.veritype.compiler.ast.type;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;

import java.util.Collections;
import java.util.List;

/**
 * 声明符：名字 + unpacked 维度 + 可选初始值
 */
public final class DeclaratorSyntax extends AstNode {
    private final String name;
    private final List<VariableDimensionSyntax> dimensions;
    private final ExpressionSyntax initializer;

    public DeclaratorSyntax(SourceLocation location, String name, List<VariableDimensionSyntax> dimensions,
                            ExpressionSyntax initializer) {
        super(location);
        this.name = name;
        this.dimensions = dimensions != null ? dimensions : Collections.<VariableDimensionSyntax>emptyList();
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public List<VariableDimensionSyntax> getDimensions() {
        return dimensions;
    }

    public ExpressionSyntax getInitializer() {
        return initializer;
    }
}
