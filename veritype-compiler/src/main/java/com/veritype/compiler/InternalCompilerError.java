package com.veritype.compiler;

/**
 * 编译器内部缺陷（不可达分支、别名环路等），不是用户源码错误。
 * 一旦抛出即终止本次 elaboration，内部不捕获。
 */
public class InternalCompilerError extends RuntimeException {

    public InternalCompilerError(String message) {
        super(message);
    }

    public InternalCompilerError(String message, Throwable cause) {
        super(message, cause);
    }

    /** 对闭合枚举做 switch 时的 default 分支 */
    public static InternalCompilerError unreachable(Object value) {
        return new InternalCompilerError("unreachable: " + value);
    }
}
