package com.veritype.compiler.analysis;

/**
 * 查找位置：某作用域内的声明序号。只有序号更小的成员可见。
 */
public final class LookupLocation {

    /** 不受声明顺序限制 */
    public static final LookupLocation MAX = new LookupLocation(null, Integer.MAX_VALUE);

    private final Scope scope;
    private final int index;

    public LookupLocation(Scope scope, int index) {
        this.scope = scope;
        this.index = index;
    }

    /** 紧挨 symbol 之前的位置 */
    public static LookupLocation before(Symbol symbol) {
        return new LookupLocation(symbol.getParentScope(), symbol.getIndexInScope());
    }

    public static LookupLocation after(Symbol symbol) {
        return new LookupLocation(symbol.getParentScope(), symbol.getIndexInScope() + 1);
    }

    public Scope getScope() {
        return scope;
    }

    public int getIndex() {
        return index;
    }
}
