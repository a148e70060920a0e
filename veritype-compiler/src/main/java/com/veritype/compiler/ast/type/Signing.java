package com.veritype.compiler.ast.type;

/**
 * signed / unsigned 修饰；NONE 表示未显式指定
 */
public enum Signing {
    NONE, SIGNED, UNSIGNED
}
