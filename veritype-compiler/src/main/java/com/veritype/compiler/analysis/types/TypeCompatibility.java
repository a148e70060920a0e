package com.veritype.compiler.analysis.types;

/**
 * 四级类型兼容关系：匹配 ⊆ 等价 ⊆ 赋值兼容 ⊆ 强制转换兼容。
 * 每一级先判断上一级，全部在规范类型上进行。
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    /**
     * 匹配类型。同一实例或来自同一语法节点；logic/reg 同义；real/realtime 同义；
     * 简单位向量与内置整数之间比较符号、四态与范围；数组比较范围与元素。
     */
    public static boolean isMatching(SvType lhs, SvType rhs) {
        SvType l = lhs.getCanonicalType();
        SvType r = rhs.getCanonicalType();

        // 内置类型与缓存的向量类型都只分配一次，引用相同即匹配
        if (l == r || (l.getSyntax() != null && l.getSyntax() == r.getSyntax())) return true;

        if (l.isScalar() && r.isScalar()) {
            return isLogicOrReg((ScalarType) l) && isLogicOrReg((ScalarType) r);
        }

        if (l.isFloating() && r.isFloating()) {
            return isRealOrRealTime((FloatingType) l) && isRealOrRealTime((FloatingType) r);
        }

        if (l.isSimpleBitVector() && r.isSimpleBitVector() && l.isPredefinedInteger() != r.isPredefinedInteger()) {
            IntegralType li = (IntegralType) l;
            IntegralType ri = (IntegralType) r;
            return li.isIntegralSigned() == ri.isIntegralSigned()
                    && li.isIntegralFourState() == ri.isIntegralFourState()
                    && li.getBitVectorRange().equals(ri.getBitVectorRange());
        }

        if (l.isPackedArray() && r.isPackedArray()) {
            PackedArrayType la = (PackedArrayType) l;
            PackedArrayType ra = (PackedArrayType) r;
            return la.getRange().equals(ra.getRange()) && isMatching(la.getElementType(), ra.getElementType());
        }

        if (l.isUnpackedArray() && r.isUnpackedArray()) {
            UnpackedArrayType la = (UnpackedArrayType) l;
            UnpackedArrayType ra = (UnpackedArrayType) r;
            return la.getRange().equals(ra.getRange()) && isMatching(la.getElementType(), ra.getElementType());
        }

        return false;
    }

    /** 等价类型：非枚举整数只比较位宽、符号与四态；unpacked 数组比较元素个数 */
    public static boolean isEquivalent(SvType lhs, SvType rhs) {
        SvType l = lhs.getCanonicalType();
        SvType r = rhs.getCanonicalType();
        if (isMatching(l, r)) return true;

        if (l.isIntegral() && r.isIntegral() && !l.isEnum() && !r.isEnum()) {
            IntegralType li = (IntegralType) l;
            IntegralType ri = (IntegralType) r;
            return li.isIntegralSigned() == ri.isIntegralSigned()
                    && li.isIntegralFourState() == ri.isIntegralFourState()
                    && li.getIntegralWidth() == ri.getIntegralWidth();
        }

        if (l.isUnpackedArray() && r.isUnpackedArray()) {
            UnpackedArrayType la = (UnpackedArrayType) l;
            UnpackedArrayType ra = (UnpackedArrayType) r;
            return la.getRange().getWidth() == ra.getRange().getWidth()
                    && isEquivalent(la.getElementType(), ra.getElementType());
        }

        return false;
    }

    /** 赋值兼容：任何整数或浮点值都可隐式转换到非枚举整数或浮点目标 */
    public static boolean isAssignmentCompatible(SvType lhs, SvType rhs) {
        SvType l = lhs.getCanonicalType();
        SvType r = rhs.getCanonicalType();
        if (isEquivalent(l, r)) return true;

        if ((l.isIntegral() && !l.isEnum()) || l.isFloating()) {
            return r.isIntegral() || r.isFloating();
        }
        return false;
    }

    /** 强制转换兼容：额外允许数值转换到枚举 */
    public static boolean isCastCompatible(SvType lhs, SvType rhs) {
        SvType l = lhs.getCanonicalType();
        SvType r = rhs.getCanonicalType();
        if (isAssignmentCompatible(l, r)) return true;

        if (l.isEnum()) {
            return r.isIntegral() || r.isFloating();
        }
        return false;
    }

    private static boolean isLogicOrReg(ScalarType type) {
        return type.getScalarKind() == ScalarType.ScalarKind.LOGIC
                || type.getScalarKind() == ScalarType.ScalarKind.REG;
    }

    private static boolean isRealOrRealTime(FloatingType type) {
        return type.getFloatKind() == FloatingType.FloatKind.REAL
                || type.getFloatKind() == FloatingType.FloatKind.REAL_TIME;
    }
}
