package com.veritype.compiler.ast.decl;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 编译单元：按源码顺序排列的成员声明
 */
public final class CompilationUnitSyntax extends AstNode {
    private final List<MemberSyntax> members;

    public CompilationUnitSyntax(SourceLocation location, List<MemberSyntax> members) {
        super(location);
        this.members = members;
    }

    public List<MemberSyntax> getMembers() {
        return members;
    }
}
