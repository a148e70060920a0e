package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 动态字符串
 */
public final class StringType extends SvType {

    public StringType() {
        super(SymbolKind.STRING_TYPE, "", SourceLocation.UNKNOWN);
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String toDisplayString() {
        return "string";
    }
}
