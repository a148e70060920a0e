package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.BindContext;
import com.veritype.compiler.analysis.EvaluatedDimension;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.util.List;

/**
 * 定长 unpacked 数组，元素可以是任意类型
 */
public final class UnpackedArrayType extends SvType {

    private final SvType elementType;
    private final ConstantRange range;

    public UnpackedArrayType(SvType elementType, ConstantRange range) {
        super(SymbolKind.UNPACKED_ARRAY_TYPE, "", SourceLocation.UNKNOWN);
        this.elementType = elementType;
        this.range = range;
    }

    public SvType getElementType() {
        return elementType;
    }

    public ConstantRange getRange() {
        return range;
    }

    /** 维度从最右侧（最内层）开始逐层包装；动态维度暂不支持 */
    public static SvType fromSyntax(Compilation compilation, SvType elementType, LookupLocation location,
                                    Scope scope, List<VariableDimensionSyntax> dimensions) {
        if (elementType.isError()) return elementType;

        BindContext context = new BindContext(scope, location);
        SvType result = elementType;
        for (int i = dimensions.size() - 1; i >= 0; i--) {
            VariableDimensionSyntax dimSyntax = dimensions.get(i);
            EvaluatedDimension dim = context.evalDimension(dimSyntax, true);
            if (!dim.isRange()) return compilation.getErrorType();

            UnpackedArrayType unpacked = compilation.emplace(new UnpackedArrayType(result, dim.getRange()));
            unpacked.setSyntax(dimSyntax);
            result = unpacked;
        }
        return result;
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitUnpackedArray(this);
    }

    @Override
    public String toDisplayString() {
        StringBuilder dims = new StringBuilder();
        SvType current = this;
        while (current instanceof UnpackedArrayType) {
            UnpackedArrayType array = (UnpackedArrayType) current;
            dims.append(array.range);
            current = array.elementType;
        }
        return current.toDisplayString() + "$" + dims;
    }
}
