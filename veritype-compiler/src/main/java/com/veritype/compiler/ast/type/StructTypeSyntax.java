package com.veritype.compiler.ast.type;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * struct 类型，packed 与 unpacked 共用
 */
public final class StructTypeSyntax extends DataTypeSyntax {
    private final boolean packed;
    private final Signing signing;
    private final List<StructMemberSyntax> members;
    private final List<VariableDimensionSyntax> dimensions;

    public StructTypeSyntax(SourceLocation location, boolean packed, Signing signing,
                            List<StructMemberSyntax> members, List<VariableDimensionSyntax> dimensions) {
        super(location);
        this.packed = packed;
        this.signing = signing != null ? signing : Signing.NONE;
        this.members = members;
        this.dimensions = dimensions != null ? dimensions : Collections.<VariableDimensionSyntax>emptyList();
    }

    public boolean isPacked() {
        return packed;
    }

    public Signing getSigning() {
        return signing;
    }

    public List<StructMemberSyntax> getMembers() {
        return members;
    }

    /** struct 之后的 packed 维度 */
    public List<VariableDimensionSyntax> getDimensions() {
        return dimensions;
    }

    @Override
    public <R> R accept(TypeSyntaxVisitor<R> visitor) {
        return visitor.visitStructType(this);
    }

    /**
     * 一条成员声明：一个类型，一个或多个声明符
     */
    public static final class StructMemberSyntax extends AstNode {
        private final DataTypeSyntax type;
        private final List<DeclaratorSyntax> declarators;

        public StructMemberSyntax(SourceLocation location, DataTypeSyntax type, List<DeclaratorSyntax> declarators) {
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
}
