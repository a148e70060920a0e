package com.veritype.compiler.ast.decl;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.DataTypeSyntax;
import com.veritype.compiler.ast.type.DeclaratorSyntax;

import java.util.List;

/**
 * 变量声明：logic [7:0] a, b[4];
 */
public final class DataDeclarationSyntax extends MemberSyntax {
    private final DataTypeSyntax type;
    private final List<DeclaratorSyntax> declarators;

    public DataDeclarationSyntax(SourceLocation location, DataTypeSyntax type, List<DeclaratorSyntax> declarators) {
        super(location);
        this.type = type;
        this.declarators = declarators;
    }

    public DataTypeSyntax getType() {
        return type;
    }

    public List<DeclaratorSyntax> getDeclarators() {
        return declarators;
    }
}
