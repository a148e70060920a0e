package com.veritype.compiler.analysis.types;

import com.veritype.compiler.value.ConstantValue;
import com.veritype.compiler.value.SvInt;

import java.util.ArrayList;
import java.util.List;

/**
 * 各类型变体的默认值
 */
final class DefaultValueVisitor implements SvTypeVisitor<ConstantValue> {

    static final DefaultValueVisitor INSTANCE = new DefaultValueVisitor();

    private DefaultValueVisitor() {}

    /** 四态为全 X，两态为 0 */
    private static ConstantValue integral(IntegralType type) {
        if (type.isIntegralFourState()) {
            return ConstantValue.of(SvInt.createFillX(type.getIntegralWidth(), type.isIntegralSigned()));
        }
        return ConstantValue.of(SvInt.of(type.getIntegralWidth(), 0, type.isIntegralSigned()));
    }

    @Override
    public ConstantValue visitPredefinedInteger(PredefinedIntegerType type) {
        return integral(type);
    }

    @Override
    public ConstantValue visitScalar(ScalarType type) {
        return integral(type);
    }

    @Override
    public ConstantValue visitFloating(FloatingType type) {
        return ConstantValue.of(0.0);
    }

    @Override
    public ConstantValue visitEnum(EnumType type) {
        return type.getBaseType().getDefaultValue();
    }

    @Override
    public ConstantValue visitPackedArray(PackedArrayType type) {
        return integral(type);
    }

    @Override
    public ConstantValue visitUnpackedArray(UnpackedArrayType type) {
        ConstantValue element = type.getElementType().getDefaultValue();
        int count = type.getRange().getWidth();
        List<ConstantValue> elements = new ArrayList<ConstantValue>(count);
        for (int i = 0; i < count; i++) {
            elements.add(element);
        }
        return ConstantValue.elements(elements);
    }

    @Override
    public ConstantValue visitPackedStruct(PackedStructType type) {
        return integral(type);
    }

    @Override
    public ConstantValue visitUnpackedStruct(UnpackedStructType type) {
        List<FieldSymbol> fields = type.getFields();
        List<ConstantValue> elements = new ArrayList<ConstantValue>(fields.size());
        for (FieldSymbol field : fields) {
            elements.add(field.getType().getDefaultValue());
        }
        return ConstantValue.elements(elements);
    }

    @Override
    public ConstantValue visitVoid(VoidType type) {
        return ConstantValue.BAD;
    }

    @Override
    public ConstantValue visitNull(NullType type) {
        return ConstantValue.NULL_PLACEHOLDER;
    }

    @Override
    public ConstantValue visitCHandle(CHandleType type) {
        return ConstantValue.NULL_PLACEHOLDER;
    }

    @Override
    public ConstantValue visitString(StringType type) {
        return ConstantValue.of("");
    }

    @Override
    public ConstantValue visitEvent(EventType type) {
        return ConstantValue.NULL_PLACEHOLDER;
    }

    @Override
    public ConstantValue visitTypeAlias(TypeAliasType type) {
        return type.getTargetType().getDefaultValue();
    }

    @Override
    public ConstantValue visitError(ErrorType type) {
        return ConstantValue.BAD;
    }
}
