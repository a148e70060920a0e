package com.veritype.compiler.analysis;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.types.ConstantRange;
import com.veritype.compiler.analysis.types.IntegralType;
import com.veritype.compiler.ast.expr.BinaryExpressionSyntax.BinaryOp;
import com.veritype.compiler.ast.expr.UnaryExpressionSyntax.UnaryOp;
import com.veritype.compiler.ast.type.TypeKeyword;
import com.veritype.compiler.value.ConstantValue;
import com.veritype.compiler.value.SvInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.veritype.compiler.CompilationFixture.*;
import static com.veritype.compiler.ast.SyntaxFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class ExpressionBinderTest {

    private Compilation compilation;
    private BindContext context;

    @BeforeEach
    void setUp() {
        compilation = compile(
                parameter("WIDTH", null, literal(8)),
                parameter("NARROW", keyword(TypeKeyword.BYTE), literal(300)),
                parameter("HALF", keyword(TypeKeyword.REAL), literal(1)),
                variable(keyword(TypeKeyword.INT), "counter"),
                typedef("word_t", integer(TypeKeyword.LOGIC, range(15, 0))),
                typedef("state_t", enumType(null, enumMember("IDLE"), enumMember("BUSY", literal(5)))));
        context = new BindContext(compilation.getRoot(), LookupLocation.MAX);
    }

    @Nested
    @DisplayName("字面量")
    class Literals {

        @Test
        @DisplayName("无位宽整数为 32 位有符号")
        void unsizedLiteral() {
            BoundExpression e = context.bind(literal(42));

            assertThat(e.isConstant()).isTrue();
            assertThat(e.getType().getBitWidth()).isEqualTo(32);
            assertThat(e.getType().isSigned()).isTrue();
            assertThat(e.getType().isFourState()).isFalse();
            assertThat(e.getConstant()).isEqualTo(ConstantValue.of(SvInt.of(32, 42, true)));
        }

        @Test
        @DisplayName("带位宽整数保留位宽与符号")
        void sizedLiteral() {
            BoundExpression e = context.bind(literal(8, 255, false));

            assertThat(e.getType().getBitWidth()).isEqualTo(8);
            assertThat(e.getType().isSigned()).isFalse();
            assertThat(e.getConstant().toString()).isEqualTo("8'd255");
        }

        @Test
        @DisplayName("实数与字符串")
        void realAndString() {
            BoundExpression r = context.bind(real(2.5));
            assertThat(r.getType().isFloating()).isTrue();
            assertThat(r.getConstant().real()).isEqualTo(2.5);

            BoundExpression s = context.bind(string("hi"));
            assertThat(s.getType().isString()).isTrue();
            assertThat(s.getConstant().str()).isEqualTo("hi");
        }
    }

    @Nested
    @DisplayName("名字")
    class Names {

        @Test
        @DisplayName("参数按声明类型转换")
        void parameters() {
            assertThat(context.bind(name("WIDTH")).getConstant().integer().asInt()).isEqualTo(8);
            assertThat(context.bind(name("NARROW")).getConstant()).isEqualTo(ConstantValue.of(SvInt.of(8, 44, true)));

            BoundExpression half = context.bind(name("HALF"));
            assertThat(half.getType().isFloating()).isTrue();
            assertThat(half.getConstant().real()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("枚举值的类型是枚举本身")
        void enumValues() {
            BoundExpression e = context.bind(name("BUSY"));

            assertThat(e.getType().isEnum()).isTrue();
            assertThat(e.getConstant().integer().asInt()).isEqualTo(5);
        }

        @Test
        @DisplayName("变量不是常量")
        void variableIsNotConstant() {
            BoundExpression e = context.bind(name("counter"));
            assertThat(e.isBad()).isFalse();
            assertThat(e.isConstant()).isFalse();

            assertThat(context.evalConstant(name("counter")).isBad()).isTrue();
            assertThat(codes(compilation.getDiagnostics())).containsExactly(DiagCode.EXPRESSION_NOT_CONSTANT);
        }

        @Test
        @DisplayName("类型名不是值")
        void typeIsNotAValue() {
            assertThat(context.bind(name("word_t")).isBad()).isTrue();
            assertThat(codes(compilation.getDiagnostics())).containsExactly(DiagCode.NOT_A_VALUE);
        }

        @Test
        @DisplayName("未声明的名字")
        void undeclared() {
            assertThat(context.bind(name("ghost")).isBad()).isTrue();
            assertThat(codes(compilation.getDiagnostics())).containsExactly(DiagCode.UNDECLARED_IDENTIFIER);
        }
    }

    @Nested
    @DisplayName("运算")
    class Operators {

        @Test
        @DisplayName("整数运算取两侧最大位宽")
        void integerArithmetic() {
            BoundExpression e = context.bind(binary(BinaryOp.ADD, literal(8, 255, false), literal(8, 1, false)));
            assertThat(e.getConstant()).isEqualTo(ConstantValue.of(SvInt.of(8, 0, false)));

            BoundExpression mixed = context.bind(binary(BinaryOp.MUL, name("WIDTH"), literal(4, 3, false)));
            assertThat(mixed.getType().getBitWidth()).isEqualTo(32);
            assertThat(mixed.getType().isSigned()).isFalse();
            assertThat(mixed.getConstant().integer().asInt()).isEqualTo(24);
        }

        @Test
        @DisplayName("有符号运算与一元运算")
        void signedAndUnary() {
            BoundExpression neg = context.bind(unary(UnaryOp.MINUS, literal(3)));
            assertThat(neg.getConstant().toString()).isEqualTo("32'sd-3");

            BoundExpression sub = context.bind(binary(BinaryOp.SUB, literal(2), literal(5)));
            assertThat(sub.getConstant().integer().asInt()).isEqualTo(-3);

            BoundExpression not = context.bind(unary(UnaryOp.BITWISE_NOT, literal(4, 5, false)));
            assertThat(not.getConstant().toString()).isEqualTo("4'd10");
        }

        @Test
        @DisplayName("含实数的运算结果为 real")
        void realArithmetic() {
            BoundExpression e = context.bind(binary(BinaryOp.ADD, real(1.5), literal(2)));

            assertThat(e.getType().isFloating()).isTrue();
            assertThat(e.getConstant().real()).isEqualTo(3.5);
        }

        @Test
        @DisplayName("移位保留左操作数类型")
        void shifts() {
            BoundExpression left = context.bind(binary(BinaryOp.SHIFT_LEFT, literal(8, 1, false), literal(3)));
            assertThat(left.getType().getBitWidth()).isEqualTo(8);
            assertThat(left.getConstant().integer().asInt()).isEqualTo(8);

            BoundExpression right = context.bind(binary(BinaryOp.SHIFT_RIGHT, literal(64), literal(2)));
            assertThat(right.getConstant().integer().asInt()).isEqualTo(16);
        }

        @Test
        @DisplayName("移位量不小于位宽时结果为 0")
        void shiftPastWidth() {
            BoundExpression left = context.bind(binary(BinaryOp.SHIFT_LEFT, literal(1), literal(Integer.MAX_VALUE)));
            assertThat(left.getConstant().integer().asInt()).isEqualTo(0);

            BoundExpression right = context.bind(binary(BinaryOp.SHIFT_RIGHT, literal(-1), literal(32)));
            assertThat(right.getConstant().integer().asInt()).isEqualTo(0);
            assertThat(compilation.getDiagnostics()).isEmpty();
        }

        @Test
        @DisplayName("除以 0 得到全 X")
        void divideByZero() {
            BoundExpression e = context.bind(binary(BinaryOp.DIV, literal(4), literal(0)));

            assertThat(e.getConstant().integer().hasUnknown()).isTrue();
        }

        @Test
        @DisplayName("含变量的运算不是常量")
        void nonConstantOperand() {
            BoundExpression e = context.bind(binary(BinaryOp.ADD, name("counter"), literal(1)));

            assertThat(e.isBad()).isFalse();
            assertThat(e.isConstant()).isFalse();
            assertThat(e.getType().getBitWidth()).isEqualTo(32);
        }

        @Test
        @DisplayName("非法操作数类型")
        void badOperands() {
            assertThat(context.bind(unary(UnaryOp.BITWISE_NOT, real(1.0))).isBad()).isTrue();
            assertThat(context.bind(binary(BinaryOp.MOD, real(1.0), literal(2))).isBad()).isTrue();
            assertThat(context.bind(binary(BinaryOp.ADD, string("a"), literal(1))).isBad()).isTrue();

            assertThat(codes(compilation.getDiagnostics())).containsExactly(
                    DiagCode.BAD_UNARY_EXPRESSION, DiagCode.BAD_BINARY_EXPRESSION, DiagCode.BAD_BINARY_EXPRESSION);
        }

        @Test
        @DisplayName("错误不会在外层表达式重复报告")
        void errorsDoNotCascade() {
            assertThat(context.bind(binary(BinaryOp.ADD, unary(UnaryOp.MINUS, name("ghost")), literal(1))).isBad())
                    .isTrue();
            assertThat(codes(compilation.getDiagnostics())).containsExactly(DiagCode.UNDECLARED_IDENTIFIER);
        }
    }

    @Nested
    @DisplayName("维度求值")
    class Dimensions {

        @Test
        @DisplayName("packed 维度只接受范围")
        void packedDimension() {
            assertThat(context.evalPackedDimension(range(binary(BinaryOp.SUB, name("WIDTH"), literal(1)), literal(0))))
                    .isEqualTo(new ConstantRange(7, 0));
            assertThat(context.evalPackedDimension(size(4))).isNull();
            assertThat(codes(compilation.getDiagnostics())).containsExactly(DiagCode.PACKED_DIM_REQUIRES_RANGE);
        }

        @Test
        @DisplayName("常量移位得到的维度边界")
        void dimensionFromHugeShift() {
            ConstantRange bounds = context.evalPackedDimension(
                    range(binary(BinaryOp.SHIFT_LEFT, literal(1), literal(Integer.MAX_VALUE)), literal(0)));
            assertThat(bounds).isEqualTo(new ConstantRange(0, 0));
            assertThat(compilation.getDiagnostics()).isEmpty();
        }

        @Test
        @DisplayName("超过上限的 packed 范围报 PackedTypeTooLarge")
        void packedRangeTooWide() {
            assertThat(context.evalPackedDimension(range(IntegralType.MAX_BIT_WIDTH, 0))).isNull();
            assertThat(context.evalPackedDimension(range(IntegralType.MAX_BIT_WIDTH - 1, 0)))
                    .isEqualTo(new ConstantRange(IntegralType.MAX_BIT_WIDTH - 1, 0));
            assertThat(codes(compilation.getDiagnostics())).containsExactly(DiagCode.PACKED_TYPE_TOO_LARGE);
        }

        @Test
        @DisplayName("元素个数超出 int 的 unpacked 范围报 ArrayDimensionTooLarge")
        void unpackedRangeTooWide() {
            EvaluatedDimension dim = context.evalDimension(range(Integer.MAX_VALUE, Integer.MIN_VALUE), true);
            assertThat(dim.getKind()).isEqualTo(EvaluatedDimension.Kind.INVALID);
            assertThat(codes(compilation.getDiagnostics())).containsExactly(DiagCode.ARRAY_DIMENSION_TOO_LARGE);
        }

        @Test
        @DisplayName("[n] 视为 [0:n-1]，[] 为动态维度")
        void unpackedDimension() {
            EvaluatedDimension sized = context.evalDimension(size(name("WIDTH")), false);
            assertThat(sized.isRange()).isTrue();
            assertThat(sized.getRange()).isEqualTo(new ConstantRange(0, 7));

            EvaluatedDimension dynamic = context.evalDimension(unsized(), false);
            assertThat(dynamic.getKind()).isEqualTo(EvaluatedDimension.Kind.DYNAMIC);
            assertThat(compilation.getDiagnostics()).isEmpty();
        }

        @Test
        @DisplayName("要求常量范围时 [] 报错")
        void unsizedRequiresRange() {
            assertThat(context.evalDimension(unsized(), true).getKind()).isEqualTo(EvaluatedDimension.Kind.INVALID);
            assertThat(codes(compilation.getDiagnostics())).containsExactly(DiagCode.DIMENSION_REQUIRES_CONST_RANGE);
        }

        @Test
        @DisplayName("非正的大小报 InvalidDimensionSize")
        void nonPositiveSize() {
            assertThat(context.evalDimension(size(0), false).isRange()).isFalse();
            assertThat(context.evalDimension(size(unary(UnaryOp.MINUS, literal(2))), false).isRange()).isFalse();
            assertThat(codes(compilation.getDiagnostics()))
                    .containsExactly(DiagCode.INVALID_DIMENSION_SIZE, DiagCode.INVALID_DIMENSION_SIZE);
        }

        @Test
        @DisplayName("维度边界必须是不含 X 的整数")
        void boundsMustBeIntegral() {
            assertThat(context.evalInteger(real(1.5))).isNull();
            assertThat(context.evalInteger(binary(BinaryOp.DIV, literal(1), literal(0)))).isNull();
            assertThat(context.evalInteger(literal(3))).isEqualTo(3);
            assertThat(codes(compilation.getDiagnostics()))
                    .containsExactly(DiagCode.VALUE_MUST_BE_INTEGRAL, DiagCode.VALUE_MUST_BE_INTEGRAL);
        }
    }
}
