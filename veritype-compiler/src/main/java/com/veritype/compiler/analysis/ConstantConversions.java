package com.veritype.compiler.analysis;

import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.value.ConstantValue;
import com.veritype.compiler.value.SvInt;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 常量到目标类型的隐式转换
 */
public final class ConstantConversions {

    private ConstantConversions() {}

    /**
     * 整数目标：截断/扩展到目标位宽与有符号性，实数四舍五入；
     * 实数目标：整数转为 double（X 视为 0）。其他组合原样返回。
     */
    public static ConstantValue convert(ConstantValue value, SvType target) {
        if (value.isBad()) return value;

        SvType ct = target.getCanonicalType();
        if (ct.isIntegral()) {
            int width = ct.getBitWidth();
            boolean signed = ct.isSigned();
            if (value.isInteger()) {
                return ConstantValue.of(value.integer().resize(width, signed));
            }
            if (value.isReal()) {
                BigDecimal rounded = BigDecimal.valueOf(value.real()).setScale(0, RoundingMode.HALF_UP);
                return ConstantValue.of(SvInt.of(width, rounded.toBigInteger(), signed));
            }
            return value;
        }

        if (ct.isFloating() && value.isInteger()) {
            SvInt v = value.integer();
            double d = v.hasUnknown() ? 0.0 : v.toBigInteger().doubleValue();
            if (ct.getBitWidth() == 32) d = (float) d;
            return ConstantValue.of(d);
        }
        return value;
    }

    /** 数值常量转 double，X 视为 0 */
    public static double toDouble(ConstantValue value) {
        if (value.isReal()) return value.real();
        SvInt v = value.integer();
        return v.hasUnknown() ? 0.0 : v.toBigInteger().doubleValue();
    }
}
