package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;

/**
 * 错误类型单例：表示已经报告过诊断的失败。
 * 任何以它为输入的构建都直接返回它，不再重复报错。
 */
public final class ErrorType extends SvType {

    public static final ErrorType INSTANCE = new ErrorType();

    private ErrorType() {
        super(SymbolKind.ERROR_TYPE, "", SourceLocation.UNKNOWN);
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitError(this);
    }

    @Override
    public String toDisplayString() {
        return "<error>";
    }
}
