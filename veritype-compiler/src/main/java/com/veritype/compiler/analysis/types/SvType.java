package com.veritype.compiler.analysis.types;

import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.analysis.Symbol;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.value.ConstantValue;

import java.util.EnumSet;

/**
 * 类型基类。类型也是符号：typedef 产生的别名可以被名字查找找到。
 *
 * <p>所有查询都先取规范类型（解开别名链）再判断。类型节点由 Compilation 统一分配，
 * 生命周期与编译相同；除规范类型与默认值两个缓存字段外不可变。</p>
 */
public abstract class SvType extends Symbol {

    private SvType canonical;
    private ConstantValue defaultValue;
    private int id = -1;

    protected SvType(SymbolKind kind, String name, SourceLocation location) {
        super(kind, name, location);
    }

    /** 在编译的类型表中的序号；内置单例（ErrorType）为 -1 */
    public int getId() {
        return id;
    }

    public void assignId(int id) {
        if (this.id >= 0) {
            throw new InternalCompilerError("type already registered with id " + this.id);
        }
        this.id = id;
    }

    // ============ 规范类型 ============

    public final SvType getCanonicalType() {
        if (canonical == null) {
            canonical = resolveCanonical();
        }
        return canonical;
    }

    /** 非别名类型的规范形式就是自身 */
    protected SvType resolveCanonical() {
        return this;
    }

    // ============ 种类判断 ============

    private SymbolKind canonicalKind() {
        return getCanonicalType().getKind();
    }

    public boolean isAlias() { return getKind() == SymbolKind.TYPE_ALIAS; }
    public boolean isError() { return canonicalKind() == SymbolKind.ERROR_TYPE; }
    public boolean isIntegral() { return canonicalKind().isIntegral(); }
    public boolean isPredefinedInteger() { return canonicalKind() == SymbolKind.PREDEFINED_INTEGER_TYPE; }
    public boolean isScalar() { return canonicalKind() == SymbolKind.SCALAR_TYPE; }
    public boolean isFloating() { return canonicalKind() == SymbolKind.FLOATING_TYPE; }
    public boolean isEnum() { return canonicalKind() == SymbolKind.ENUM_TYPE; }
    public boolean isPackedArray() { return canonicalKind() == SymbolKind.PACKED_ARRAY_TYPE; }
    public boolean isUnpackedArray() { return canonicalKind() == SymbolKind.UNPACKED_ARRAY_TYPE; }
    public boolean isVoid() { return canonicalKind() == SymbolKind.VOID_TYPE; }
    public boolean isNull() { return canonicalKind() == SymbolKind.NULL_TYPE; }
    public boolean isCHandle() { return canonicalKind() == SymbolKind.CHANDLE_TYPE; }
    public boolean isString() { return canonicalKind() == SymbolKind.STRING_TYPE; }
    public boolean isEvent() { return canonicalKind() == SymbolKind.EVENT_TYPE; }

    public boolean isNumeric() {
        return isIntegral() || isFloating();
    }

    /** unpacked 数组与 unpacked struct */
    public boolean isAggregate() {
        switch (canonicalKind()) {
            case UNPACKED_ARRAY_TYPE:
            case UNPACKED_STRUCT_TYPE:
                return true;
            default:
                return false;
        }
    }

    /** 内置整数、标量，或元素为标量的 packed 数组 */
    public boolean isSimpleBitVector() {
        SvType ct = getCanonicalType();
        if (ct.isPredefinedInteger() || ct.isScalar()) return true;
        return ct.getKind() == SymbolKind.PACKED_ARRAY_TYPE
                && ((PackedArrayType) ct).getElementType().isScalar();
    }

    public boolean isBooleanConvertible() {
        switch (canonicalKind()) {
            case NULL_TYPE:
            case CHANDLE_TYPE:
            case STRING_TYPE:
            case EVENT_TYPE:
                return true;
            default:
                return isNumeric();
        }
    }

    public boolean isStructUnion() {
        switch (canonicalKind()) {
            case PACKED_STRUCT_TYPE:
            case UNPACKED_STRUCT_TYPE:
                return true;
            default:
                return false;
        }
    }

    // ============ 位宽与标志 ============

    /** 整数类型的位宽；浮点按种类为 32/64；其他为 0 */
    public int getBitWidth() {
        SvType ct = getCanonicalType();
        if (ct.isIntegral()) return ((IntegralType) ct).getIntegralWidth();
        if (ct.isFloating()) return ((FloatingType) ct).getFloatKind().getWidth();
        return 0;
    }

    public boolean isSigned() {
        SvType ct = getCanonicalType();
        return ct.isIntegral() && ((IntegralType) ct).isIntegralSigned();
    }

    /** packed 类型取自身标志；unpacked 数组看元素；unpacked struct 任一字段为四态即为四态 */
    public boolean isFourState() {
        SvType ct = getCanonicalType();
        if (ct.isIntegral()) return ((IntegralType) ct).isIntegralFourState();

        if (ct.getKind() == SymbolKind.UNPACKED_ARRAY_TYPE) {
            return ((UnpackedArrayType) ct).getElementType().isFourState();
        }
        if (ct.getKind() == SymbolKind.UNPACKED_STRUCT_TYPE) {
            for (FieldSymbol field : ((UnpackedStructType) ct).getFields()) {
                if (field.getType().isFourState()) return true;
            }
        }
        return false;
    }

    /** 非整数类型返回空集 */
    public EnumSet<IntegralFlag> getIntegralFlags() {
        EnumSet<IntegralFlag> flags = EnumSet.noneOf(IntegralFlag.class);
        SvType ct = getCanonicalType();
        if (!ct.isIntegral()) return flags;

        IntegralType it = (IntegralType) ct;
        if (it.isIntegralSigned()) flags.add(IntegralFlag.SIGNED);
        if (it.isIntegralFourState()) flags.add(IntegralFlag.FOUR_STATE);
        if (it.isDeclaredReg()) flags.add(IntegralFlag.REG);
        return flags;
    }

    /** 整数类型的位向量范围或 unpacked 数组的范围；其他类型为 null */
    public ConstantRange getArrayRange() {
        SvType ct = getCanonicalType();
        if (ct.isIntegral()) return ((IntegralType) ct).getBitVectorRange();
        if (ct.isUnpackedArray()) return ((UnpackedArrayType) ct).getRange();
        return null;
    }

    // ============ 兼容性 ============

    public boolean isMatching(SvType rhs) {
        return TypeCompatibility.isMatching(this, rhs);
    }

    public boolean isEquivalent(SvType rhs) {
        return TypeCompatibility.isEquivalent(this, rhs);
    }

    /** rhs 的值能否隐式赋给本类型 */
    public boolean isAssignmentCompatible(SvType rhs) {
        return TypeCompatibility.isAssignmentCompatible(this, rhs);
    }

    public boolean isCastCompatible(SvType rhs) {
        return TypeCompatibility.isCastCompatible(this, rhs);
    }

    // ============ 默认值 ============

    public ConstantValue getDefaultValue() {
        if (defaultValue == null) {
            defaultValue = accept(DefaultValueVisitor.INSTANCE);
        }
        return defaultValue;
    }

    public abstract <R> R accept(SvTypeVisitor<R> visitor);

    /** 类 SystemVerilog 写法的类型名，用于诊断与输出 */
    public abstract String toDisplayString();

    @Override
    public String toString() {
        return toDisplayString();
    }
}
