package com.veritype.compiler.ast.type;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;

import java.util.Collections;
import java.util.List;

/**
 * 枚举类型
 */
public final class EnumTypeSyntax extends DataTypeSyntax {
    private final DataTypeSyntax baseType;
    private final List<EnumMemberSyntax> members;
    private final List<VariableDimensionSyntax> dimensions;

    public EnumTypeSyntax(SourceLocation location, DataTypeSyntax baseType, List<EnumMemberSyntax> members,
                          List<VariableDimensionSyntax> dimensions) {
        super(location);
        this.baseType = baseType;
        this.members = members;
        this.dimensions = dimensions != null ? dimensions : Collections.<VariableDimensionSyntax>emptyList();
    }

    /** 未指定基类型时为 null */
    public DataTypeSyntax getBaseType() {
        return baseType;
    }

    public List<EnumMemberSyntax> getMembers() {
        return members;
    }

    public List<VariableDimensionSyntax> getDimensions() {
        return dimensions;
    }

    @Override
    public <R> R accept(TypeSyntaxVisitor<R> visitor) {
        return visitor.visitEnumType(this);
    }

    /**
     * 枚举成员
     */
    public static final class EnumMemberSyntax extends AstNode {
        private final String name;
        private final ExpressionSyntax initializer;

        public EnumMemberSyntax(SourceLocation location, String name, ExpressionSyntax initializer) {
            super(location);
            this.name = name;
            this.initializer = initializer;
        }

        public String getName() {
            return name;
        }

        public ExpressionSyntax getInitializer() {
            return initializer;
        }
    }
}
