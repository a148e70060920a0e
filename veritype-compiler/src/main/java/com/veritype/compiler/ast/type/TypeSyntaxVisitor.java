package com.veritype.compiler.ast.type;

/**
 * 数据类型语法访问者
 */
public interface TypeSyntaxVisitor<R> {
    R visitIntegerType(IntegerTypeSyntax type);
    R visitKeywordType(KeywordTypeSyntax type);
    R visitImplicitType(ImplicitTypeSyntax type);
    R visitNamedType(NamedTypeSyntax type);
    R visitEnumType(EnumTypeSyntax type);
    R visitStructType(StructTypeSyntax type);
}
