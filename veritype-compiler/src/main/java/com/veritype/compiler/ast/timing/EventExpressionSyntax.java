package com.veritype.compiler.ast.timing;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 事件表达式基类
 */
public abstract class EventExpressionSyntax extends AstNode {

    protected EventExpressionSyntax(SourceLocation location) {
        super(location);
    }
}
