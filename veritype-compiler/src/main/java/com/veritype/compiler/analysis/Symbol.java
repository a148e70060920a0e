package com.veritype.compiler.analysis;

import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 符号基类。加入作用域后记录所属作用域与声明序号，用于按声明顺序查找。
 */
public abstract class Symbol {
    private final SymbolKind kind;
    private final String name;
    private final SourceLocation location;

    private Scope parentScope;
    private int indexInScope = -1;
    private AstNode syntax;

    protected Symbol(SymbolKind kind, String name, SourceLocation location) {
        this.kind = kind;
        this.name = name != null ? name : "";
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SymbolKind getKind() { return kind; }
    public String getName() { return name; }
    public SourceLocation getLocation() { return location; }
    public Scope getParentScope() { return parentScope; }
    public int getIndexInScope() { return indexInScope; }

    /** 产生该符号的语法节点，内置符号为 null */
    public AstNode getSyntax() { return syntax; }
    public void setSyntax(AstNode syntax) { this.syntax = syntax; }

    public boolean isType() {
        return kind.isType();
    }

    /** 带声明类型的符号返回其 DeclaredType，否则 null */
    public DeclaredType getDeclaredType() {
        return null;
    }

    void setParent(Scope scope, int index) {
        this.parentScope = scope;
        this.indexInScope = index;
    }

    @Override
    public String toString() {
        return name.isEmpty() ? kind.name().toLowerCase() : name;
    }
}
