package com.veritype.compiler.analysis;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.analysis.types.ErrorType;
import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.ast.type.DataTypeSyntax;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.util.Collections;
import java.util.List;

/**
 * 符号的声明类型：保存类型语法，首次 getType() 时在符号所在位置解析并缓存。
 */
public final class DeclaredType {
    private final Symbol parent;
    private DataTypeSyntax typeSyntax;
    private List<VariableDimensionSyntax> dimensions = Collections.emptyList();
    private boolean forceSigned;

    private SvType type;
    private boolean resolving;

    public DeclaredType(Symbol parent) {
        this.parent = parent;
    }

    public DataTypeSyntax getTypeSyntax() {
        return typeSyntax;
    }

    public void setTypeSyntax(DataTypeSyntax typeSyntax) {
        this.typeSyntax = typeSyntax;
        this.type = null;
    }

    public List<VariableDimensionSyntax> getDimensions() {
        return dimensions;
    }

    /** 声明符上的 unpacked 维度 */
    public void setDimensions(List<VariableDimensionSyntax> dimensions) {
        this.dimensions = dimensions != null ? dimensions : Collections.<VariableDimensionSyntax>emptyList();
        this.type = null;
    }

    public void setForceSigned(boolean forceSigned) {
        this.forceSigned = forceSigned;
    }

    /** 直接指定已构建好的类型（内置 nettype、测试构造等） */
    public void setType(SvType type) {
        this.type = type;
    }

    public boolean isResolved() {
        return type != null;
    }

    public SvType getType() {
        if (type != null) return type;

        Scope scope = parent.getParentScope();
        if (typeSyntax == null) {
            throw new InternalCompilerError("symbol '" + parent.getName() + "' has no declared type");
        }
        if (scope == null) {
            throw new InternalCompilerError("symbol '" + parent.getName() + "' is not in a scope");
        }
        if (resolving) {
            scope.addDiag(DiagCode.RECURSIVE_DEFINITION, parent.getLocation()).addArg(parent.getName());
            return ErrorType.INSTANCE;
        }

        resolving = true;
        try {
            Compilation compilation = scope.getCompilation();
            LookupLocation location = LookupLocation.before(parent);
            SvType result = compilation.getType(typeSyntax, location, scope, forceSigned);
            if (!dimensions.isEmpty()) {
                result = compilation.getType(result, dimensions, location, scope);
            }
            type = result;
        } finally {
            resolving = false;
        }
        return type;
    }

    /** 复制另一个声明类型（nettype 别名），源类型会先被解析 */
    public void copyTypeFrom(DeclaredType source) {
        this.typeSyntax = source.typeSyntax;
        this.dimensions = source.dimensions;
        this.forceSigned = source.forceSigned;
        this.type = source.getType();
    }
}
