package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.BindContext;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.IntegerTypeSyntax;
import com.veritype.compiler.ast.type.Signing;
import com.veritype.compiler.ast.type.TypeKeyword;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * packed 整数类型公共基类：位宽、有符号性与四态性在构造时确定
 */
public abstract class IntegralType extends SvType {

    /** packed 类型允许的最大位宽 */
    public static final int MAX_BIT_WIDTH = (1 << 24) - 1;

    private final int bitWidth;
    private final boolean signed;
    private final boolean fourState;

    protected IntegralType(SymbolKind kind, String name, SourceLocation location,
                           int bitWidth, boolean signed, boolean fourState) {
        super(kind, name, location);
        this.bitWidth = bitWidth;
        this.signed = signed;
        this.fourState = fourState;
    }

    int getIntegralWidth() { return bitWidth; }
    boolean isIntegralSigned() { return signed; }
    boolean isIntegralFourState() { return fourState; }

    /** packed 数组返回声明的范围，其余为 [width-1:0] */
    public ConstantRange getBitVectorRange() {
        if (getKind() == SymbolKind.PACKED_ARRAY_TYPE) {
            return ((PackedArrayType) this).getRange();
        }
        return new ConstantRange(bitWidth - 1, 0);
    }

    /** 以 reg 关键字声明（穿过 packed 数组看元素） */
    public boolean isDeclaredReg() {
        SvType type = this;
        while (type.getKind() == SymbolKind.PACKED_ARRAY_TYPE) {
            type = ((PackedArrayType) type).getElementType().getCanonicalType();
        }
        if (type.getKind() == SymbolKind.SCALAR_TYPE) {
            return ((ScalarType) type).getScalarKind() == ScalarType.ScalarKind.REG;
        }
        return false;
    }

    /**
     * bit/logic/reg 向量。无维度时返回内置标量；单个 [n:0] 维度走共享缓存；
     * 其余按维度从内到外逐层构建 packed 数组。
     */
    public static SvType fromSyntax(Compilation compilation, TypeKeyword keyword,
                                    List<VariableDimensionSyntax> dimensions, boolean isSigned,
                                    LookupLocation location, Scope scope) {
        BindContext context = new BindContext(scope, location);
        List<ConstantRange> ranges = new ArrayList<ConstantRange>();
        for (VariableDimensionSyntax dim : dimensions) {
            ConstantRange range = context.evalPackedDimension(dim);
            if (range == null) return compilation.getErrorType();
            ranges.add(range);
        }

        if (ranges.isEmpty()) {
            return compilation.getPredefinedType(keyword, isSigned);
        }

        EnumSet<IntegralFlag> flags = EnumSet.noneOf(IntegralFlag.class);
        if (keyword == TypeKeyword.REG) flags.add(IntegralFlag.REG);
        if (isSigned) flags.add(IntegralFlag.SIGNED);
        if (keyword != TypeKeyword.BIT) flags.add(IntegralFlag.FOUR_STATE);

        if (ranges.size() == 1 && ranges.get(0).getRight() == 0) {
            return compilation.getType(ranges.get(0).getWidth(), flags);
        }

        SvType result = compilation.getScalarType(flags);
        for (int i = ranges.size() - 1; i >= 0; i--) {
            result = PackedArrayType.fromSyntax(compilation, result, ranges.get(i), dimensions.get(i));
        }
        return result;
    }

    public static SvType fromSyntax(Compilation compilation, IntegerTypeSyntax syntax,
                                    LookupLocation location, Scope scope, boolean forceSigned) {
        return fromSyntax(compilation, syntax.getKeyword(), syntax.getDimensions(),
                syntax.getSigning() == Signing.SIGNED || forceSigned, location, scope);
    }
}
