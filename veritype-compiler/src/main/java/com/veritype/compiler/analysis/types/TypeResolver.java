package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.BindContext;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.LookupResult;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.Symbol;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.NameSyntax;
import com.veritype.compiler.ast.type.EnumTypeSyntax;
import com.veritype.compiler.ast.type.ImplicitTypeSyntax;
import com.veritype.compiler.ast.type.IntegerTypeSyntax;
import com.veritype.compiler.ast.type.KeywordTypeSyntax;
import com.veritype.compiler.ast.type.NamedTypeSyntax;
import com.veritype.compiler.ast.type.Signing;
import com.veritype.compiler.ast.type.StructTypeSyntax;
import com.veritype.compiler.ast.type.TypeKeyword;
import com.veritype.compiler.ast.type.TypeSyntaxVisitor;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.util.List;

/**
 * 数据类型语法 → SvType。在给定作用域与查找位置上解析，失败时报告诊断并返回 ErrorType。
 */
public final class TypeResolver implements TypeSyntaxVisitor<SvType> {

    private final Compilation compilation;
    private final LookupLocation location;
    private final Scope scope;
    private final boolean forceSigned;

    public TypeResolver(Compilation compilation, LookupLocation location, Scope scope, boolean forceSigned) {
        this.compilation = compilation;
        this.location = location;
        this.scope = scope;
        this.forceSigned = forceSigned;
    }

    @Override
    public SvType visitIntegerType(IntegerTypeSyntax type) {
        if (type.getKeyword().isIntegerVector()) {
            return IntegralType.fromSyntax(compilation, type, location, scope, forceSigned);
        }

        if (!type.getDimensions().isEmpty()) {
            // 报错但不失败：丢弃维度继续
            scope.addDiag(DiagCode.PACKED_DIMS_ON_PREDEFINED_TYPE, type.getDimensions().get(0).getLocation())
                    .addArg(type.getKeyword().getText());
        }

        if (type.getSigning() == Signing.NONE) {
            return compilation.getType(type.getKeyword());
        }
        return compilation.getPredefinedType(type.getKeyword(), type.getSigning() == Signing.SIGNED);
    }

    @Override
    public SvType visitKeywordType(KeywordTypeSyntax type) {
        return compilation.getType(type.getKeyword());
    }

    @Override
    public SvType visitImplicitType(ImplicitTypeSyntax type) {
        return IntegralType.fromSyntax(compilation, TypeKeyword.LOGIC, type.getDimensions(),
                type.getSigning() == Signing.SIGNED || forceSigned, location, scope);
    }

    @Override
    public SvType visitNamedType(NamedTypeSyntax type) {
        NameSyntax name = type.getName();
        LookupResult result = new LookupResult();
        scope.lookupName(name, location, result);
        if (result.hasError()) {
            compilation.addDiagnostics(result.getDiagnostics());
        }
        return fromLookupResult(result, name);
    }

    private SvType fromLookupResult(LookupResult result, NameSyntax name) {
        Symbol symbol = result.getFound();
        if (symbol == null) return compilation.getErrorType();

        // 只有前向声明、没有完整定义：在全局检查时统一报告
        if (symbol.getKind() == SymbolKind.FORWARDING_TYPEDEF) return compilation.getErrorType();

        if (!symbol.isType()) {
            scope.addDiag(DiagCode.NOT_A_TYPE, name.getLocation()).addArg(symbol.getName());
            return compilation.getErrorType();
        }

        SvType finalType = (SvType) symbol;
        if (finalType.isAlias() && ((TypeAliasType) finalType).getTargetType().isError()) {
            // 目标解析失败（包括递归引用）时直接吸收为错误类型
            return compilation.getErrorType();
        }

        List<VariableDimensionSyntax> selectors = result.getSelectors();
        BindContext context = new BindContext(scope, location);
        for (int i = selectors.size() - 1; i >= 0; i--) {
            VariableDimensionSyntax selector = selectors.get(i);
            ConstantRange range = context.evalPackedDimension(selector);
            if (range == null) return compilation.getErrorType();

            finalType = PackedArrayType.fromSyntax(compilation, finalType, range, selector);
        }
        return finalType;
    }

    @Override
    public SvType visitEnumType(EnumTypeSyntax type) {
        return EnumType.fromSyntax(compilation, type, location, scope, forceSigned);
    }

    @Override
    public SvType visitStructType(StructTypeSyntax type) {
        return type.isPacked()
                ? PackedStructType.fromSyntax(compilation, type, location, scope, forceSigned)
                : UnpackedStructType.fromSyntax(compilation, type, location, scope);
    }
}
