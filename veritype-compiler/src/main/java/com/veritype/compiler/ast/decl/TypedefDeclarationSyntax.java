package com.veritype.compiler.ast.decl;

import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.DataTypeSyntax;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.util.Collections;
import java.util.List;

/**
 * typedef 声明
 */
public final class TypedefDeclarationSyntax extends MemberSyntax {
    private final String name;
    private final DataTypeSyntax type;
    private final List<VariableDimensionSyntax> dimensions;

    public TypedefDeclarationSyntax(SourceLocation location, String name, DataTypeSyntax type,
                                    List<VariableDimensionSyntax> dimensions) {
        super(location);
        this.name = name;
        this.type = type;
        this.dimensions = dimensions != null ? dimensions : Collections.<VariableDimensionSyntax>emptyList();
    }

    public String getName() {
        return name;
    }

    public DataTypeSyntax getType() {
        return type;
    }

    /** 名字之后的 unpacked 维度（typedef int arr_t[4];） */
    public List<VariableDimensionSyntax> getDimensions() {
        return dimensions;
    }
}
