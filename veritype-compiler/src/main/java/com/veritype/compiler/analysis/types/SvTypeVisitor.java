package com.veritype.compiler.analysis.types;

/**
 * 类型访问者，覆盖全部类型变体；新增变体时由编译器检查各访问者是否处理
 */
public interface SvTypeVisitor<R> {
    R visitPredefinedInteger(PredefinedIntegerType type);
    R visitScalar(ScalarType type);
    R visitFloating(FloatingType type);
    R visitEnum(EnumType type);
    R visitPackedArray(PackedArrayType type);
    R visitUnpackedArray(UnpackedArrayType type);
    R visitPackedStruct(PackedStructType type);
    R visitUnpackedStruct(UnpackedStructType type);
    R visitVoid(VoidType type);
    R visitNull(NullType type);
    R visitCHandle(CHandleType type);
    R visitString(StringType type);
    R visitEvent(EventType type);
    R visitTypeAlias(TypeAliasType type);
    R visitError(ErrorType type);
}
