package com.veritype.compiler.analysis;

/**
 * 符号种类；类型本身也是符号
 */
public enum SymbolKind {
    // 类型
    PREDEFINED_INTEGER_TYPE,
    SCALAR_TYPE,
    FLOATING_TYPE,
    ENUM_TYPE,
    PACKED_ARRAY_TYPE,
    UNPACKED_ARRAY_TYPE,
    PACKED_STRUCT_TYPE,
    UNPACKED_STRUCT_TYPE,
    VOID_TYPE,
    NULL_TYPE,
    CHANDLE_TYPE,
    STRING_TYPE,
    EVENT_TYPE,
    TYPE_ALIAS,
    ERROR_TYPE,

    // 其他符号
    ENUM_VALUE,
    FIELD,
    NET_TYPE,
    FORWARDING_TYPEDEF,
    PARAMETER,
    VARIABLE,
    SUBROUTINE,
    TRANSPARENT_MEMBER;

    public boolean isType() {
        return ordinal() <= ERROR_TYPE.ordinal();
    }

    /** packed 整数类型：内置整数、标量、枚举、packed 数组与 packed struct */
    public boolean isIntegral() {
        switch (this) {
            case PREDEFINED_INTEGER_TYPE:
            case SCALAR_TYPE:
            case ENUM_TYPE:
            case PACKED_ARRAY_TYPE:
            case PACKED_STRUCT_TYPE:
                return true;
            default:
                return false;
        }
    }
}
