package com.veritype.compiler.ast.decl;

import com.veritype.compiler.ast.SourceLocation;

/**
 * 前向 typedef 声明（typedef struct foo_t;）
 */
public final class ForwardTypedefDeclarationSyntax extends MemberSyntax {

    /** typedef 之后的关键字 */
    public enum Keyword {
        NONE, ENUM, STRUCT, UNION, CLASS, INTERFACE_CLASS
    }

    private final String name;
    private final Keyword keyword;

    public ForwardTypedefDeclarationSyntax(SourceLocation location, String name, Keyword keyword) {
        super(location);
        this.name = name;
        this.keyword = keyword != null ? keyword : Keyword.NONE;
    }

    public String getName() {
        return name;
    }

    public Keyword getKeyword() {
        return keyword;
    }
}
