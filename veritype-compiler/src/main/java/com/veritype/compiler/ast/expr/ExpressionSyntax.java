package com.veritype.compiler.ast.expr;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 表达式语法基类
 */
public abstract class ExpressionSyntax extends AstNode {

    protected ExpressionSyntax(SourceLocation location) {
        super(location);
    }
}
