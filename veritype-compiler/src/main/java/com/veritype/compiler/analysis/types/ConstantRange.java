package com.veritype.compiler.analysis.types;

/**
 * 常量索引范围 [left:right]，left 可大于或小于 right
 */
public final class ConstantRange {
    private final int left;
    private final int right;

    public ConstantRange(int left, int right) {
        this.left = left;
        this.right = right;
    }

    public int getLeft() { return left; }
    public int getRight() { return right; }

    /** 经 BindContext 求值得到的范围保证 getFullWidth 不超过 int */
    public int getWidth() {
        return (int) getFullWidth();
    }

    /** 元素个数；[2147483647:-2147483648] 这样的范围超出 int */
    public long getFullWidth() {
        return Math.abs((long) left - right) + 1;
    }

    public int getLower() {
        return Math.min(left, right);
    }

    public int getUpper() {
        return Math.max(left, right);
    }

    /** [msb:lsb] 形式，即 left >= right */
    public boolean isLittleEndian() {
        return left >= right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstantRange)) return false;
        ConstantRange that = (ConstantRange) o;
        return left == that.left && right == that.right;
    }

    @Override
    public int hashCode() {
        return 31 * left + right;
    }

    @Override
    public String toString() {
        return "[" + left + ":" + right + "]";
    }
}
