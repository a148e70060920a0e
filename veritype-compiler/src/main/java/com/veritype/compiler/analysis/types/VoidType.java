package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 无返回值类型
 */
public final class VoidType extends SvType {

    public VoidType() {
        super(SymbolKind.VOID_TYPE, "", SourceLocation.UNKNOWN);
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitVoid(this);
    }

    @Override
    public String toDisplayString() {
        return "void";
    }
}
