package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;

/**
 * null 字面量的类型
 */
public final class NullType extends SvType {

    public NullType() {
        super(SymbolKind.NULL_TYPE, "", SourceLocation.UNKNOWN);
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitNull(this);
    }

    @Override
    public String toDisplayString() {
        return "null";
    }
}
