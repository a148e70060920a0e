package com.veritype.compiler.ast.type;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 数据类型语法基类
 */
public abstract class DataTypeSyntax extends AstNode {

    protected DataTypeSyntax(SourceLocation location) {
        super(location);
    }

    /** 接受 TypeSyntaxVisitor 进行类型语法分派 */
    public abstract <R> R accept(TypeSyntaxVisitor<R> visitor);
}
