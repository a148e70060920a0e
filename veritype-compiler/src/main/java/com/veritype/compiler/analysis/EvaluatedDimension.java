package com.veritype.compiler.analysis;

import com.veritype.compiler.analysis.types.ConstantRange;

/**
 * 维度求值结果
 */
public final class EvaluatedDimension {

    public enum Kind {
        INVALID, RANGE, DYNAMIC
    }

    private static final EvaluatedDimension INVALID = new EvaluatedDimension(Kind.INVALID, null);
    private static final EvaluatedDimension DYNAMIC = new EvaluatedDimension(Kind.DYNAMIC, null);

    private final Kind kind;
    private final ConstantRange range;

    private EvaluatedDimension(Kind kind, ConstantRange range) {
        this.kind = kind;
        this.range = range;
    }

    public static EvaluatedDimension invalid() { return INVALID; }
    public static EvaluatedDimension dynamic() { return DYNAMIC; }

    public static EvaluatedDimension range(ConstantRange range) {
        return new EvaluatedDimension(Kind.RANGE, range);
    }

    public Kind getKind() { return kind; }
    public boolean isRange() { return kind == Kind.RANGE; }
    public ConstantRange getRange() { return range; }
}
