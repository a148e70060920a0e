package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 单比特标量 bit / logic / reg
 */
public final class ScalarType extends IntegralType {

    public enum ScalarKind {
        BIT("bit"),
        LOGIC("logic"),
        REG("reg");

        private final String text;

        ScalarKind(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }
    }

    private final ScalarKind scalarKind;

    public ScalarType(ScalarKind scalarKind) {
        this(scalarKind, false);
    }

    public ScalarType(ScalarKind scalarKind, boolean signed) {
        super(SymbolKind.SCALAR_TYPE, "", SourceLocation.UNKNOWN, 1, signed, scalarKind != ScalarKind.BIT);
        this.scalarKind = scalarKind;
    }

    public ScalarKind getScalarKind() {
        return scalarKind;
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    public String toDisplayString() {
        return isIntegralSigned() ? scalarKind.getText() + " signed" : scalarKind.getText();
    }
}
