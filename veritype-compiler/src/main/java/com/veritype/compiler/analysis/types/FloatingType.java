package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;

/**
 * real / realtime / shortreal
 */
public final class FloatingType extends SvType {

    public enum FloatKind {
        REAL("real", 64),
        REAL_TIME("realtime", 64),
        SHORT_REAL("shortreal", 32);

        private final String text;
        private final int width;

        FloatKind(String text, int width) {
            this.text = text;
            this.width = width;
        }

        public String getText() { return text; }
        public int getWidth() { return width; }
    }

    private final FloatKind floatKind;

    public FloatingType(FloatKind floatKind) {
        super(SymbolKind.FLOATING_TYPE, "", SourceLocation.UNKNOWN);
        this.floatKind = floatKind;
    }

    public FloatKind getFloatKind() {
        return floatKind;
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitFloating(this);
    }

    @Override
    public String toDisplayString() {
        return floatKind.getText();
    }
}
