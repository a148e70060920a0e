package com.veritype.compiler.analysis.types;

/**
 * 整数类型标志，用于在缓存中请求结构相同的类型
 */
public enum IntegralFlag {
    SIGNED,
    FOUR_STATE,
    /** 以 reg 关键字声明；隐含 FOUR_STATE */
    REG
}
