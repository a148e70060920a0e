package com.veritype.compiler.ast.decl;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 作用域成员声明基类
 */
public abstract class MemberSyntax extends AstNode {

    protected MemberSyntax(SourceLocation location) {
        super(location);
    }
}
