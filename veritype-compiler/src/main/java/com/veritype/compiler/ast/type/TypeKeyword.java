package com.veritype.compiler.ast.type;

/**
 * 内置数据类型关键字
 */
public enum TypeKeyword {
    BIT("bit"),
    LOGIC("logic"),
    REG("reg"),
    BYTE("byte"),
    SHORTINT("shortint"),
    INT("int"),
    LONGINT("longint"),
    INTEGER("integer"),
    TIME("time"),
    REAL("real"),
    REALTIME("realtime"),
    SHORTREAL("shortreal"),
    STRING("string"),
    CHANDLE("chandle"),
    EVENT("event"),
    VOID("void");

    private final String text;

    TypeKeyword(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /** bit/logic/reg 向量关键字 */
    public boolean isIntegerVector() {
        return this == BIT || this == LOGIC || this == REG;
    }

    /** byte/shortint/int/longint/integer/time */
    public boolean isIntegerAtom() {
        switch (this) {
            case BYTE:
            case SHORTINT:
            case INT:
            case LONGINT:
            case INTEGER:
            case TIME:
                return true;
            default:
                return false;
        }
    }

    public static TypeKeyword fromText(String text) {
        for (TypeKeyword k : values()) {
            if (k.text.equals(text)) return k;
        }
        return null;
    }
}
