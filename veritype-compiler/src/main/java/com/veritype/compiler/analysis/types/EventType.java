package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 命名事件
 */
public final class EventType extends SvType {

    public EventType() {
        super(SymbolKind.EVENT_TYPE, "", SourceLocation.UNKNOWN);
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitEvent(this);
    }

    @Override
    public String toDisplayString() {
        return "event";
    }
}
