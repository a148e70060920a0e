package com.veritype.compiler.ast;

import com.veritype.compiler.ast.decl.CompilationUnitSyntax;
import com.veritype.compiler.ast.decl.DataDeclarationSyntax;
import com.veritype.compiler.ast.decl.ForwardTypedefDeclarationSyntax;
import com.veritype.compiler.ast.decl.FunctionDeclarationSyntax;
import com.veritype.compiler.ast.decl.MemberSyntax;
import com.veritype.compiler.ast.decl.NetTypeDeclarationSyntax;
import com.veritype.compiler.ast.decl.ParameterDeclarationSyntax;
import com.veritype.compiler.ast.decl.TypedefDeclarationSyntax;
import com.veritype.compiler.ast.expr.BinaryExpressionSyntax;
import com.veritype.compiler.ast.expr.ExpressionSyntax;
import com.veritype.compiler.ast.expr.IntegerLiteralSyntax;
import com.veritype.compiler.ast.expr.NameExpressionSyntax;
import com.veritype.compiler.ast.expr.RealLiteralSyntax;
import com.veritype.compiler.ast.expr.StringLiteralSyntax;
import com.veritype.compiler.ast.expr.UnaryExpressionSyntax;
import com.veritype.compiler.ast.type.DataTypeSyntax;
import com.veritype.compiler.ast.type.DeclaratorSyntax;
import com.veritype.compiler.ast.type.EnumTypeSyntax;
import com.veritype.compiler.ast.type.ImplicitTypeSyntax;
import com.veritype.compiler.ast.type.IntegerTypeSyntax;
import com.veritype.compiler.ast.type.KeywordTypeSyntax;
import com.veritype.compiler.ast.type.NamedTypeSyntax;
import com.veritype.compiler.ast.type.Signing;
import com.veritype.compiler.ast.type.StructTypeSyntax;
import com.veritype.compiler.ast.type.TypeKeyword;
import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 语法节点的简便构造方法，不带源码位置。每次调用都产生新的节点。
 */
public final class SyntaxFactory {

    private static final SourceLocation NO_LOCATION = SourceLocation.UNKNOWN;

    private SyntaxFactory() {}

    // ============ 类型 ============

    /** 内置关键字类型；整数关键字生成 IntegerTypeSyntax */
    public static DataTypeSyntax keyword(TypeKeyword keyword) {
        if (keyword.isIntegerVector() || keyword.isIntegerAtom()) {
            return new IntegerTypeSyntax(NO_LOCATION, keyword, Signing.NONE, Collections.<VariableDimensionSyntax>emptyList());
        }
        return new KeywordTypeSyntax(NO_LOCATION, keyword);
    }

    public static IntegerTypeSyntax integer(TypeKeyword keyword, Signing signing, VariableDimensionSyntax... dims) {
        return new IntegerTypeSyntax(NO_LOCATION, keyword, signing, Arrays.asList(dims));
    }

    public static IntegerTypeSyntax integer(TypeKeyword keyword, VariableDimensionSyntax... dims) {
        return integer(keyword, Signing.NONE, dims);
    }

    public static ImplicitTypeSyntax implicit(Signing signing, VariableDimensionSyntax... dims) {
        return new ImplicitTypeSyntax(NO_LOCATION, signing, Arrays.asList(dims));
    }

    public static NamedTypeSyntax named(String name, VariableDimensionSyntax... selectors) {
        return new NamedTypeSyntax(NO_LOCATION, new NameSyntax(NO_LOCATION, name, Arrays.asList(selectors)));
    }

    /** base 为 null 时使用默认的 int */
    public static EnumTypeSyntax enumType(DataTypeSyntax base, EnumTypeSyntax.EnumMemberSyntax... members) {
        return new EnumTypeSyntax(NO_LOCATION, base, Arrays.asList(members),
                Collections.<VariableDimensionSyntax>emptyList());
    }

    public static EnumTypeSyntax.EnumMemberSyntax enumMember(String name) {
        return new EnumTypeSyntax.EnumMemberSyntax(NO_LOCATION, name, null);
    }

    public static EnumTypeSyntax.EnumMemberSyntax enumMember(String name, ExpressionSyntax initializer) {
        return new EnumTypeSyntax.EnumMemberSyntax(NO_LOCATION, name, initializer);
    }

    public static StructTypeSyntax packedStruct(StructTypeSyntax.StructMemberSyntax... members) {
        return new StructTypeSyntax(NO_LOCATION, true, Signing.NONE, Arrays.asList(members), null);
    }

    public static StructTypeSyntax packedStruct(Signing signing, List<VariableDimensionSyntax> dims,
                                                StructTypeSyntax.StructMemberSyntax... members) {
        return new StructTypeSyntax(NO_LOCATION, true, signing, Arrays.asList(members), dims);
    }

    public static StructTypeSyntax unpackedStruct(StructTypeSyntax.StructMemberSyntax... members) {
        return new StructTypeSyntax(NO_LOCATION, false, Signing.NONE, Arrays.asList(members), null);
    }

    public static StructTypeSyntax.StructMemberSyntax member(DataTypeSyntax type, String... names) {
        List<DeclaratorSyntax> declarators = new ArrayList<DeclaratorSyntax>();
        for (String name : names) {
            declarators.add(declarator(name));
        }
        return new StructTypeSyntax.StructMemberSyntax(NO_LOCATION, type, declarators);
    }

    public static StructTypeSyntax.StructMemberSyntax member(DataTypeSyntax type, DeclaratorSyntax... declarators) {
        return new StructTypeSyntax.StructMemberSyntax(NO_LOCATION, type, Arrays.asList(declarators));
    }

    public static DeclaratorSyntax declarator(String name, VariableDimensionSyntax... dims) {
        return new DeclaratorSyntax(NO_LOCATION, name, Arrays.asList(dims), null);
    }

    public static DeclaratorSyntax declarator(String name, ExpressionSyntax initializer) {
        return new DeclaratorSyntax(NO_LOCATION, name, Collections.<VariableDimensionSyntax>emptyList(), initializer);
    }

    // ============ 维度 ============

    public static VariableDimensionSyntax range(int left, int right) {
        return VariableDimensionSyntax.range(NO_LOCATION, literal(left), literal(right));
    }

    public static VariableDimensionSyntax range(ExpressionSyntax left, ExpressionSyntax right) {
        return VariableDimensionSyntax.range(NO_LOCATION, left, right);
    }

    public static VariableDimensionSyntax size(int size) {
        return VariableDimensionSyntax.size(NO_LOCATION, literal(size));
    }

    public static VariableDimensionSyntax size(ExpressionSyntax size) {
        return VariableDimensionSyntax.size(NO_LOCATION, size);
    }

    public static VariableDimensionSyntax unsized() {
        return VariableDimensionSyntax.unsized(NO_LOCATION);
    }

    // ============ 表达式 ============

    /** 无位宽的十进制字面量 */
    public static IntegerLiteralSyntax literal(long value) {
        return new IntegerLiteralSyntax(NO_LOCATION, BigInteger.valueOf(value), 0, true);
    }

    public static IntegerLiteralSyntax literal(int width, long value, boolean signed) {
        return new IntegerLiteralSyntax(NO_LOCATION, BigInteger.valueOf(value), width, signed);
    }

    public static RealLiteralSyntax real(double value) {
        return new RealLiteralSyntax(NO_LOCATION, value);
    }

    public static StringLiteralSyntax string(String value) {
        return new StringLiteralSyntax(NO_LOCATION, value);
    }

    public static NameExpressionSyntax name(String identifier) {
        return new NameExpressionSyntax(NO_LOCATION, new NameSyntax(NO_LOCATION, identifier));
    }

    public static UnaryExpressionSyntax unary(UnaryExpressionSyntax.UnaryOp op, ExpressionSyntax operand) {
        return new UnaryExpressionSyntax(NO_LOCATION, op, operand);
    }

    public static BinaryExpressionSyntax binary(BinaryExpressionSyntax.BinaryOp op,
                                                ExpressionSyntax left, ExpressionSyntax right) {
        return new BinaryExpressionSyntax(NO_LOCATION, op, left, right);
    }

    // ============ 声明 ============

    public static TypedefDeclarationSyntax typedef(String name, DataTypeSyntax type, VariableDimensionSyntax... dims) {
        return new TypedefDeclarationSyntax(NO_LOCATION, name, type, Arrays.asList(dims));
    }

    public static ForwardTypedefDeclarationSyntax forwardTypedef(String name,
                                                                 ForwardTypedefDeclarationSyntax.Keyword keyword) {
        return new ForwardTypedefDeclarationSyntax(NO_LOCATION, name, keyword);
    }

    public static NetTypeDeclarationSyntax nettype(String name, DataTypeSyntax type) {
        return new NetTypeDeclarationSyntax(NO_LOCATION, name, type, null);
    }

    public static NetTypeDeclarationSyntax nettype(String name, DataTypeSyntax type, String withFunction) {
        return new NetTypeDeclarationSyntax(NO_LOCATION, name, type, withFunction);
    }

    /** type 为 null 时参数类型取自初始值 */
    public static ParameterDeclarationSyntax parameter(String name, DataTypeSyntax type, ExpressionSyntax initializer) {
        return new ParameterDeclarationSyntax(NO_LOCATION, name, type, initializer);
    }

    public static DataDeclarationSyntax variable(DataTypeSyntax type, String... names) {
        List<DeclaratorSyntax> declarators = new ArrayList<DeclaratorSyntax>();
        for (String name : names) {
            declarators.add(declarator(name));
        }
        return new DataDeclarationSyntax(NO_LOCATION, type, declarators);
    }

    public static DataDeclarationSyntax variable(DataTypeSyntax type, DeclaratorSyntax... declarators) {
        return new DataDeclarationSyntax(NO_LOCATION, type, Arrays.asList(declarators));
    }

    public static FunctionDeclarationSyntax function(String name, DataTypeSyntax returnType) {
        return new FunctionDeclarationSyntax(NO_LOCATION, name, returnType);
    }

    public static CompilationUnitSyntax unit(MemberSyntax... members) {
        return new CompilationUnitSyntax(NO_LOCATION, Arrays.asList(members));
    }
}
