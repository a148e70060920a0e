package com.veritype.compiler.analysis.types;

import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.TypeKeyword;

/**
 * byte / shortint / int / longint / integer / time
 */
public final class PredefinedIntegerType extends IntegralType {

    public enum IntegerKind {
        SHORT_INT("shortint", 16, true, false),
        INT("int", 32, true, false),
        LONG_INT("longint", 64, true, false),
        BYTE("byte", 8, true, false),
        INTEGER("integer", 32, true, true),
        TIME("time", 64, false, true);

        private final String text;
        private final int width;
        private final boolean signed;
        private final boolean fourState;

        IntegerKind(String text, int width, boolean signed, boolean fourState) {
            this.text = text;
            this.width = width;
            this.signed = signed;
            this.fourState = fourState;
        }

        public String getText() { return text; }
        public int getWidth() { return width; }
        public boolean isDefaultSigned() { return signed; }
        public boolean isFourState() { return fourState; }

        public static IntegerKind fromKeyword(TypeKeyword keyword) {
            switch (keyword) {
                case SHORTINT: return SHORT_INT;
                case INT: return INT;
                case LONGINT: return LONG_INT;
                case BYTE: return BYTE;
                case INTEGER: return INTEGER;
                case TIME: return TIME;
                default:
                    throw InternalCompilerError.unreachable(keyword);
            }
        }
    }

    private final IntegerKind integerKind;

    public PredefinedIntegerType(IntegerKind integerKind) {
        this(integerKind, integerKind.isDefaultSigned());
    }

    public PredefinedIntegerType(IntegerKind integerKind, boolean signed) {
        super(SymbolKind.PREDEFINED_INTEGER_TYPE, "", SourceLocation.UNKNOWN,
                integerKind.getWidth(), signed, integerKind.isFourState());
        this.integerKind = integerKind;
    }

    public IntegerKind getIntegerKind() {
        return integerKind;
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitPredefinedInteger(this);
    }

    @Override
    public String toDisplayString() {
        if (isIntegralSigned() != integerKind.isDefaultSigned()) {
            return integerKind.getText() + (isIntegralSigned() ? " signed" : " unsigned");
        }
        return integerKind.getText();
    }
}
