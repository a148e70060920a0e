package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;

/**
 * C 句柄
 */
public final class CHandleType extends SvType {

    public CHandleType() {
        super(SymbolKind.CHANDLE_TYPE, "", SourceLocation.UNKNOWN);
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitCHandle(this);
    }

    @Override
    public String toDisplayString() {
        return "chandle";
    }
}
