package com.veritype.compiler.analysis.types;

import com.veritype.compiler.analysis.BindContext;
import com.veritype.compiler.analysis.ConstantConversions;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.Symbol;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;
import com.veritype.compiler.value.ConstantValue;

/**
 * 枚举成员。无初始值的成员在构建枚举时直接赋值；
 * 有初始值的成员在首次取值时于枚举作用域内求值，并转换到基类型的位宽与符号。
 */
public final class EnumValueSymbol extends Symbol {

    private final EnumType type;
    private ExpressionSyntax initializer;
    private ConstantValue value;
    private boolean evaluating;

    public EnumValueSymbol(String name, SourceLocation location, EnumType type) {
        super(SymbolKind.ENUM_VALUE, name, location);
        this.type = type;
    }

    public EnumType getType() {
        return type;
    }

    public ExpressionSyntax getInitializer() {
        return initializer;
    }

    void setInitializer(ExpressionSyntax initializer) {
        this.initializer = initializer;
    }

    void setValue(ConstantValue value) {
        this.value = value;
    }

    public ConstantValue getValue() {
        if (value != null) return value;
        if (initializer == null || evaluating) return ConstantValue.BAD;

        evaluating = true;
        try {
            BindContext context = new BindContext(getParentScope(), LookupLocation.before(this));
            ConstantValue cv = context.evalConstant(initializer);
            value = ConstantConversions.convert(cv, type.getBaseType());
        } finally {
            evaluating = false;
        }
        return value;
    }
}
