package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.DeclaredType;
import com.veritype.compiler.analysis.Symbol;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;

/**
 * 结构体字段。packed struct 中 offset 为位偏移，unpacked struct 中为字段序号。
 */
public final class FieldSymbol extends Symbol {

    private final int offset;
    private final SvType owner;
    private final DeclaredType declaredType = new DeclaredType(this);
    private ExpressionSyntax initializer;

    FieldSymbol(String name, SourceLocation location, int offset, SvType owner) {
        super(SymbolKind.FIELD, name, location);
        this.offset = offset;
        this.owner = owner;
    }

    public int getOffset() {
        return offset;
    }

    /** 所属的结构体类型 */
    public SvType getOwner() {
        return owner;
    }

    public boolean isPacked() {
        return owner.getKind() == SymbolKind.PACKED_STRUCT_TYPE;
    }

    @Override
    public DeclaredType getDeclaredType() {
        return declaredType;
    }

    public SvType getType() {
        return declaredType.getType();
    }

    public ExpressionSyntax getInitializer() {
        return initializer;
    }

    void setInitializer(ExpressionSyntax initializer) {
        this.initializer = initializer;
    }
}
