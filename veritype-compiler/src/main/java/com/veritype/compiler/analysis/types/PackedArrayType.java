package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.BindContext;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.AstNode;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.util.List;

/**
 * packed 数组：位宽 = 元素位宽 × 范围宽度，符号与四态性取自元素
 */
public final class PackedArrayType extends IntegralType {

    private final SvType elementType;
    private final ConstantRange range;

    public PackedArrayType(SvType elementType, ConstantRange range) {
        super(SymbolKind.PACKED_ARRAY_TYPE, "", SourceLocation.UNKNOWN,
                elementType.getBitWidth() * range.getWidth(), elementType.isSigned(), elementType.isFourState());
        this.elementType = elementType;
        this.range = range;
    }

    public SvType getElementType() {
        return elementType;
    }

    public ConstantRange getRange() {
        return range;
    }

    public static SvType fromSyntax(Compilation compilation, SvType elementType, ConstantRange range,
                                    AstNode syntax) {
        if (elementType.isError()) return elementType;

        if (!elementType.isIntegral()) {
            compilation.addDiag(DiagCode.PACKED_ARRAY_NOT_INTEGRAL, syntax.getLocation()).addArg(elementType);
            return compilation.getErrorType();
        }

        long width = (long) elementType.getBitWidth() * range.getWidth();
        if (width > MAX_BIT_WIDTH) {
            compilation.addDiag(DiagCode.PACKED_TYPE_TOO_LARGE, syntax.getLocation())
                    .addArg(width).addArg(MAX_BIT_WIDTH);
            return compilation.getErrorType();
        }

        PackedArrayType result = compilation.emplace(new PackedArrayType(elementType, range));
        result.setSyntax(syntax);
        return result;
    }

    /** struct/enum 语法上附带的 packed 维度，从内到外包装 */
    static SvType applyDimensions(Compilation compilation, SvType type,
                                        List<VariableDimensionSyntax> dimensions,
                                        LookupLocation location, Scope scope) {
        BindContext context = new BindContext(scope, location);
        SvType result = type;
        for (int i = dimensions.size() - 1; i >= 0; i--) {
            VariableDimensionSyntax dimSyntax = dimensions.get(i);
            ConstantRange range = context.evalPackedDimension(dimSyntax);
            if (range == null) return compilation.getErrorType();
            result = PackedArrayType.fromSyntax(compilation, result, range, dimSyntax);
        }
        return result;
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitPackedArray(this);
    }

    @Override
    public String toDisplayString() {
        // 多维 packed 数组按声明顺序输出各维：logic[3:0][7:0]
        StringBuilder dims = new StringBuilder();
        SvType current = this;
        while (current instanceof PackedArrayType) {
            PackedArrayType array = (PackedArrayType) current;
            dims.append(array.range);
            current = array.elementType;
        }
        return current.toDisplayString() + dims;
    }
}
