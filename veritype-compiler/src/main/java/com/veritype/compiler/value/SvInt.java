package com.veritype.compiler.value;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 任意位宽的四态整数值。
 * value 以无符号补码形式保存在 [0, 2^width) 中；unknown 中置位的比特为 X。
 */
public final class SvInt {

    private final int width;
    private final boolean signed;
    private final BigInteger value;
    private final BigInteger unknown;

    private SvInt(int width, boolean signed, BigInteger value, BigInteger unknown) {
        if (width <= 0) {
            throw new IllegalArgumentException("bit width must be positive: " + width);
        }
        this.width = width;
        this.signed = signed;
        this.unknown = unknown.and(mask(width));
        // X 比特的数值位统一清零，保证 equals 只看可观测状态
        this.value = value.and(mask(width)).andNot(this.unknown);
    }

    public static SvInt of(int width, long value, boolean signed) {
        return of(width, BigInteger.valueOf(value), signed);
    }

    public static SvInt of(int width, BigInteger value, boolean signed) {
        return new SvInt(width, signed, value, BigInteger.ZERO);
    }

    /** 全 X 填充 */
    public static SvInt createFillX(int width, boolean signed) {
        return new SvInt(width, signed, BigInteger.ZERO, mask(width));
    }

    private static BigInteger mask(int width) {
        return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    }

    public int getWidth() {
        return width;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean hasUnknown() {
        return unknown.signum() != 0;
    }

    /** 按有符号性解释的数值；含 X 时抛出 IllegalStateException */
    public BigInteger toBigInteger() {
        if (hasUnknown()) {
            throw new IllegalStateException("value has unknown bits: " + this);
        }
        if (signed && value.testBit(width - 1)) {
            return value.subtract(BigInteger.ONE.shiftLeft(width));
        }
        return value;
    }

    /** 适合作为维度边界的 int 值；含 X 或超出 int 范围时返回 null */
    public Integer asInt() {
        if (hasUnknown()) return null;
        BigInteger v = toBigInteger();
        if (v.bitLength() > 31) return null;
        return v.intValue();
    }

    /** 截断或扩展到新位宽；扩展时按原有符号性做符号扩展 */
    public SvInt resize(int newWidth, boolean newSigned) {
        if (newWidth == width) {
            return new SvInt(width, newSigned, value, unknown);
        }
        if (newWidth < width) {
            return new SvInt(newWidth, newSigned, value, unknown);
        }
        BigInteger newValue = value;
        BigInteger newUnknown = unknown;
        if (signed) {
            BigInteger ext = mask(newWidth).subtract(mask(width));
            if (unknown.testBit(width - 1)) {
                newUnknown = newUnknown.or(ext);
            } else if (value.testBit(width - 1)) {
                newValue = newValue.or(ext);
            }
        }
        return new SvInt(newWidth, newSigned, newValue, newUnknown);
    }

    public SvInt add(SvInt rhs) {
        return arithmetic(rhs, Op.ADD);
    }

    public SvInt subtract(SvInt rhs) {
        return arithmetic(rhs, Op.SUB);
    }

    public SvInt multiply(SvInt rhs) {
        return arithmetic(rhs, Op.MUL);
    }

    /** 除数为 0 时结果为全 X */
    public SvInt divide(SvInt rhs) {
        return arithmetic(rhs, Op.DIV);
    }

    public SvInt remainder(SvInt rhs) {
        return arithmetic(rhs, Op.MOD);
    }

    public SvInt negate() {
        if (hasUnknown()) return createFillX(width, signed);
        return new SvInt(width, signed, value.negate(), BigInteger.ZERO);
    }

    public SvInt not() {
        return new SvInt(width, signed, value.not(), unknown);
    }

    public SvInt shiftLeft(int amount) {
        if (amount >= width) return of(width, BigInteger.ZERO, signed);
        return new SvInt(width, signed, value.shiftLeft(amount), unknown.shiftLeft(amount));
    }

    /** 逻辑右移 */
    public SvInt shiftRight(int amount) {
        if (amount >= width) return of(width, BigInteger.ZERO, signed);
        return new SvInt(width, signed, value.shiftRight(amount), unknown.shiftRight(amount));
    }

    private enum Op { ADD, SUB, MUL, DIV, MOD }

    private SvInt arithmetic(SvInt rhs, Op op) {
        int w = Math.max(width, rhs.width);
        boolean s = signed && rhs.signed;
        if (hasUnknown() || rhs.hasUnknown()) {
            return createFillX(w, s);
        }
        BigInteger l = resize(w, s).toBigInteger();
        BigInteger r = rhs.resize(w, s).toBigInteger();
        BigInteger result;
        switch (op) {
            case ADD: result = l.add(r); break;
            case SUB: result = l.subtract(r); break;
            case MUL: result = l.multiply(r); break;
            case DIV:
                if (r.signum() == 0) return createFillX(w, s);
                result = l.divide(r);
                break;
            case MOD:
                if (r.signum() == 0) return createFillX(w, s);
                result = l.remainder(r);
                break;
            default:
                throw new IllegalStateException("unknown op " + op);
        }
        return new SvInt(w, s, result, BigInteger.ZERO);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SvInt)) return false;
        SvInt that = (SvInt) o;
        return width == that.width && signed == that.signed
                && value.equals(that.value) && unknown.equals(that.unknown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, signed, value, unknown);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(width).append('\'');
        if (signed) sb.append('s');
        if (!hasUnknown()) {
            sb.append('d').append(toBigInteger());
            return sb.toString();
        }
        sb.append('b');
        for (int i = width - 1; i >= 0; i--) {
            if (unknown.testBit(i)) sb.append('x');
            else sb.append(value.testBit(i) ? '1' : '0');
        }
        return sb.toString();
    }
}
