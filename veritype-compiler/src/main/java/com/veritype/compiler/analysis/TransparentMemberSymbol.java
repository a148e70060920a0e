package com.veritype.compiler.analysis;

/**
 * 把枚举值等“透明”成员挂进外层作用域；查找命中时解包为原符号
 */
public final class TransparentMemberSymbol extends Symbol {
    private final Symbol wrapped;

    public TransparentMemberSymbol(Symbol wrapped) {
        super(SymbolKind.TRANSPARENT_MEMBER, wrapped.getName(), wrapped.getLocation());
        this.wrapped = wrapped;
    }

    public Symbol getWrapped() {
        return wrapped;
    }
}
