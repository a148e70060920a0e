package com.veritype.compiler.value;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 编译期常量值：整数、实数、字符串、null 占位、元素列表或无效值
 */
public final class ConstantValue {

    public enum Kind {
        BAD, INTEGER, REAL, STRING, NULL_PLACEHOLDER, ELEMENTS
    }

    public static final ConstantValue BAD = new ConstantValue(Kind.BAD, null);
    public static final ConstantValue NULL_PLACEHOLDER = new ConstantValue(Kind.NULL_PLACEHOLDER, null);

    private final Kind kind;
    private final Object payload;

    private ConstantValue(Kind kind, Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static ConstantValue of(SvInt value) {
        return new ConstantValue(Kind.INTEGER, Objects.requireNonNull(value));
    }

    public static ConstantValue of(double value) {
        return new ConstantValue(Kind.REAL, value);
    }

    public static ConstantValue of(String value) {
        return new ConstantValue(Kind.STRING, Objects.requireNonNull(value));
    }

    public static ConstantValue elements(List<ConstantValue> elements) {
        return new ConstantValue(Kind.ELEMENTS, Collections.unmodifiableList(elements));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isBad() {
        return kind == Kind.BAD;
    }

    public boolean isInteger() {
        return kind == Kind.INTEGER;
    }

    public boolean isReal() {
        return kind == Kind.REAL;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isNullPlaceholder() {
        return kind == Kind.NULL_PLACEHOLDER;
    }

    public boolean isElements() {
        return kind == Kind.ELEMENTS;
    }

    public SvInt integer() {
        checkKind(Kind.INTEGER);
        return (SvInt) payload;
    }

    public double real() {
        checkKind(Kind.REAL);
        return (Double) payload;
    }

    public String str() {
        checkKind(Kind.STRING);
        return (String) payload;
    }

    @SuppressWarnings("unchecked")
    public List<ConstantValue> elements() {
        checkKind(Kind.ELEMENTS);
        return (List<ConstantValue>) payload;
    }

    private void checkKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("constant is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstantValue)) return false;
        ConstantValue that = (ConstantValue) o;
        return kind == that.kind && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        switch (kind) {
            case BAD: return "<bad>";
            case NULL_PLACEHOLDER: return "null";
            case STRING: return "\"" + payload + "\"";
            case ELEMENTS: return payload.toString().replace('[', '{').replace(']', '}');
            default: return String.valueOf(payload);
        }
    }
}
