package com.veritype.compiler.analysis;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.expr.ExpressionSyntax;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;
import com.veritype.compiler.analysis.types.ConstantRange;
import com.veritype.compiler.analysis.types.IntegralType;
import com.veritype.compiler.value.ConstantValue;
import com.veritype.compiler.value.SvInt;

/**
 * 表达式绑定上下文：作用域 + 查找位置，并提供常量与维度求值
 */
public final class BindContext {
    private final Scope scope;
    private final LookupLocation lookupLocation;

    public BindContext(Scope scope, LookupLocation lookupLocation) {
        this.scope = scope;
        this.lookupLocation = lookupLocation;
    }

    public Scope getScope() {
        return scope;
    }

    public LookupLocation getLookupLocation() {
        return lookupLocation;
    }

    public Compilation getCompilation() {
        return scope.getCompilation();
    }

    public SemanticDiagnostic addDiag(DiagCode code, SourceLocation location) {
        return scope.addDiag(code, location);
    }

    public BoundExpression bind(ExpressionSyntax syntax) {
        return new ExpressionBinder(this).bind(syntax);
    }

    /** 绑定并要求编译期常量；失败返回 ConstantValue.BAD（已报告诊断） */
    public ConstantValue evalConstant(ExpressionSyntax syntax) {
        BoundExpression bound = bind(syntax);
        if (bound.isBad()) return ConstantValue.BAD;
        if (!bound.isConstant()) {
            addDiag(DiagCode.EXPRESSION_NOT_CONSTANT, syntax.getLocation());
            return ConstantValue.BAD;
        }
        return bound.getConstant();
    }

    /** 求值为 int；非整数、含 X 或超出 int 范围时报告并返回 null */
    public Integer evalInteger(ExpressionSyntax syntax) {
        ConstantValue value = evalConstant(syntax);
        if (value.isBad()) return null;

        if (value.isInteger()) {
            SvInt v = value.integer();
            if (!v.hasUnknown()) {
                int bits = v.toBigInteger().bitLength();
                if (bits < 32) return v.toBigInteger().intValue();
            }
        }
        addDiag(DiagCode.VALUE_MUST_BE_INTEGRAL, syntax.getLocation());
        return null;
    }

    /** packed 维度只接受 [msb:lsb]；失败返回 null */
    public ConstantRange evalPackedDimension(VariableDimensionSyntax syntax) {
        switch (syntax.getKind()) {
            case RANGE: {
                Integer left = evalInteger(syntax.getLeft());
                Integer right = evalInteger(syntax.getRight());
                if (left == null || right == null) return null;
                ConstantRange range = new ConstantRange(left, right);
                if (range.getFullWidth() > IntegralType.MAX_BIT_WIDTH) {
                    addDiag(DiagCode.PACKED_TYPE_TOO_LARGE, syntax.getLocation())
                            .addArg(range.getFullWidth()).addArg(IntegralType.MAX_BIT_WIDTH);
                    return null;
                }
                return range;
            }
            case SIZE:
            case UNSIZED:
                addDiag(DiagCode.PACKED_DIM_REQUIRES_RANGE, syntax.getLocation());
                return null;
            default:
                throw InternalCompilerError.unreachable(syntax.getKind());
        }
    }

    /**
     * unpacked 维度：[l:r] 原样，[n] 视为 [0:n-1]，[] 在 requireRange 时报错，否则为动态维度
     */
    public EvaluatedDimension evalDimension(VariableDimensionSyntax syntax, boolean requireRange) {
        switch (syntax.getKind()) {
            case RANGE: {
                Integer left = evalInteger(syntax.getLeft());
                Integer right = evalInteger(syntax.getRight());
                if (left == null || right == null) return EvaluatedDimension.invalid();
                ConstantRange range = new ConstantRange(left, right);
                if (range.getFullWidth() > Integer.MAX_VALUE) {
                    addDiag(DiagCode.ARRAY_DIMENSION_TOO_LARGE, syntax.getLocation())
                            .addArg(range.getFullWidth()).addArg(Integer.MAX_VALUE);
                    return EvaluatedDimension.invalid();
                }
                return EvaluatedDimension.range(range);
            }
            case SIZE: {
                Integer size = evalInteger(syntax.getLeft());
                if (size == null) return EvaluatedDimension.invalid();
                if (size <= 0) {
                    addDiag(DiagCode.INVALID_DIMENSION_SIZE, syntax.getLocation()).addArg(size);
                    return EvaluatedDimension.invalid();
                }
                return EvaluatedDimension.range(new ConstantRange(0, size - 1));
            }
            case UNSIZED:
                if (requireRange) {
                    addDiag(DiagCode.DIMENSION_REQUIRES_CONST_RANGE, syntax.getLocation());
                    return EvaluatedDimension.invalid();
                }
                return EvaluatedDimension.dynamic();
            default:
                throw InternalCompilerError.unreachable(syntax.getKind());
        }
    }
}
