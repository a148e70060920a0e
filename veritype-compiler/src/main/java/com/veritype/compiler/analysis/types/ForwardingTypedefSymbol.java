package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.Symbol;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.decl.ForwardTypedefDeclarationSyntax;

/**
 * 前向 typedef（typedef struct foo;）。同名的多个前向声明串成一条链，
 * 由最终的完整 typedef 统一检查类别是否一致。
 */
public final class ForwardingTypedefSymbol extends Symbol {

    public enum Category {
        NONE(""),
        ENUM("enum"),
        STRUCT("struct"),
        UNION("union"),
        CLASS("class"),
        INTERFACE_CLASS("interface class");

        private final String text;

        Category(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }
    }

    private final Category category;
    private ForwardingTypedefSymbol next;

    public ForwardingTypedefSymbol(String name, SourceLocation location, Category category) {
        super(SymbolKind.FORWARDING_TYPEDEF, name, location);
        this.category = category;
    }

    public static ForwardingTypedefSymbol fromSyntax(ForwardTypedefDeclarationSyntax syntax) {
        Category category;
        switch (syntax.getKeyword()) {
            case ENUM: category = Category.ENUM; break;
            case STRUCT: category = Category.STRUCT; break;
            case UNION: category = Category.UNION; break;
            case CLASS: category = Category.CLASS; break;
            case INTERFACE_CLASS: category = Category.INTERFACE_CLASS; break;
            default: category = Category.NONE; break;
        }
        ForwardingTypedefSymbol result = new ForwardingTypedefSymbol(syntax.getName(), syntax.getLocation(), category);
        result.setSyntax(syntax);
        return result;
    }

    public Category getCategory() {
        return category;
    }

    public ForwardingTypedefSymbol getNextForwardDecl() {
        return next;
    }

    /** 追加到链尾 */
    public void addForwardDecl(ForwardingTypedefSymbol decl) {
        ForwardingTypedefSymbol tail = this;
        while (tail.next != null) {
            tail = tail.next;
        }
        tail.next = decl;
    }
}
