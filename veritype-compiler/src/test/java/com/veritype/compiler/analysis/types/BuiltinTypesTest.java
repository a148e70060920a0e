package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.ast.type.Signing;
import com.veritype.compiler.ast.type.TypeKeyword;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import static com.veritype.compiler.CompilationFixture.allCodes;
import static com.veritype.compiler.CompilationFixture.resolve;
import static com.veritype.compiler.ast.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 内置类型表与共享向量缓存
 */
class BuiltinTypesTest {

    private final Compilation compilation = new Compilation();

    @ParameterizedTest(name = "{0}: {1} 位, signed={2}, fourState={3}")
    @CsvSource({
            "BIT,       1,  false, false",
            "LOGIC,     1,  false, true",
            "REG,       1,  false, true",
            "BYTE,      8,  true,  false",
            "SHORTINT,  16, true,  false",
            "INT,       32, true,  false",
            "LONGINT,   64, true,  false",
            "INTEGER,   32, true,  true",
            "TIME,      64, false, true"
    })
    @DisplayName("内置整数类型的位宽与标志")
    void integralBuiltins(TypeKeyword keyword, int width, boolean signed, boolean fourState) {
        SvType type = compilation.getType(keyword);
        assertTrue(type.isIntegral());
        assertEquals(width, type.getBitWidth());
        assertEquals(signed, type.isSigned());
        assertEquals(fourState, type.isFourState());
        assertTrue(type.isSimpleBitVector());
    }

    @ParameterizedTest
    @CsvSource({"REAL, 64", "REALTIME, 64", "SHORTREAL, 32"})
    void floatingBuiltins(TypeKeyword keyword, int width) {
        SvType type = compilation.getType(keyword);
        assertTrue(type.isFloating());
        assertTrue(type.isNumeric());
        assertFalse(type.isIntegral());
        assertEquals(width, type.getBitWidth());
        assertFalse(type.isSigned());
    }

    @Test
    @DisplayName("非数值内置类型")
    void otherBuiltins() {
        assertTrue(compilation.getType(TypeKeyword.STRING).isString());
        assertTrue(compilation.getType(TypeKeyword.CHANDLE).isCHandle());
        assertTrue(compilation.getType(TypeKeyword.EVENT).isEvent());
        assertTrue(compilation.getType(TypeKeyword.VOID).isVoid());
        assertTrue(compilation.getNullType().isNull());
        assertEquals(0, compilation.getType(TypeKeyword.STRING).getBitWidth());
        assertTrue(compilation.getType(TypeKeyword.STRING).isBooleanConvertible());
        assertFalse(compilation.getType(TypeKeyword.VOID).isBooleanConvertible());
    }

    @Test
    @DisplayName("错误类型是单例，且不属于任何类别")
    void errorType() {
        SvType error = compilation.getErrorType();
        assertSame(ErrorType.INSTANCE, error);
        assertTrue(error.isError());
        assertFalse(error.isIntegral());
        assertFalse(error.isAggregate());
        assertEquals("<error>", error.toDisplayString());
    }

    @Nested
    @DisplayName("标量与共享向量")
    class Vectors {

        @Test
        @DisplayName("reg 标志隐含四态")
        void regImpliesFourState() {
            ScalarType reg = compilation.getScalarType(EnumSet.of(IntegralFlag.REG));
            assertSame(reg, compilation.getScalarType(EnumSet.of(IntegralFlag.REG, IntegralFlag.FOUR_STATE)));
            assertTrue(reg.isFourState());
            assertEquals("reg", reg.toDisplayString());
            assertSame(reg, compilation.getType(TypeKeyword.REG));
        }

        @Test
        @DisplayName("同样的位宽与标志只分配一次")
        void vectorsAreUnique() {
            SvType a = compilation.getType(8, EnumSet.of(IntegralFlag.FOUR_STATE));
            SvType b = compilation.getType(8, EnumSet.of(IntegralFlag.FOUR_STATE));
            assertSame(a, b);
            assertNotSame(a, compilation.getType(8, EnumSet.noneOf(IntegralFlag.class)));
            assertEquals("logic[7:0]", a.toDisplayString());
            assertEquals(2, compilation.getTypeCache().size());
        }

        @Test
        @DisplayName("位宽 1 的向量仍是 [0:0] packed 数组")
        void widthOneVector() {
            SvType v = compilation.getType(1, EnumSet.noneOf(IntegralFlag.class));
            assertTrue(v.isPackedArray());
            assertEquals("bit[0:0]", v.toDisplayString());
            assertNotSame(compilation.getType(TypeKeyword.BIT), v);
        }

        @Test
        @DisplayName("位宽必须为正")
        void zeroWidthRejected() {
            assertThrows(RuntimeException.class,
                    () -> compilation.getType(0, EnumSet.noneOf(IntegralFlag.class)));
        }

        @Test
        @DisplayName("非默认有符号性的内置整数映射到共享向量")
        void predefinedWithSigning() {
            assertSame(compilation.getType(TypeKeyword.INT), compilation.getPredefinedType(TypeKeyword.INT, true));

            SvType unsignedInt = compilation.getPredefinedType(TypeKeyword.INT, false);
            assertTrue(unsignedInt.isPackedArray());
            assertEquals(32, unsignedInt.getBitWidth());
            assertFalse(unsignedInt.isSigned());
            assertFalse(unsignedInt.isFourState());
            assertSame(compilation.getType(32, EnumSet.noneOf(IntegralFlag.class)), unsignedInt);
        }
    }

    @Nested
    @DisplayName("从语法解析整数类型")
    class FromSyntax {

        @Test
        @DisplayName("logic [7:0] 走共享缓存")
        void cachedVector() {
            SvType a = resolve(compilation, integer(TypeKeyword.LOGIC, range(7, 0)));
            SvType b = resolve(compilation, integer(TypeKeyword.LOGIC, range(7, 0)));
            assertSame(a, b);
            assertSame(compilation.getType(8, EnumSet.of(IntegralFlag.FOUR_STATE)), a);
        }

        @Test
        @DisplayName("右边界非 0 时构建独立的 packed 数组")
        void nonZeroBasedRange() {
            SvType t = resolve(compilation, integer(TypeKeyword.BIT, range(8, 1)));
            assertTrue(t.isPackedArray());
            assertEquals(8, t.getBitWidth());
            assertEquals(new ConstantRange(8, 1), t.getArrayRange());
            assertEquals("bit[8:1]", t.toDisplayString());
        }

        @Test
        @DisplayName("多维 packed 数组从内到外构建")
        void multiDimensional() {
            SvType t = resolve(compilation, integer(TypeKeyword.LOGIC, range(3, 0), range(7, 0)));
            assertEquals(32, t.getBitWidth());
            assertEquals("logic[3:0][7:0]", t.toDisplayString());
            PackedArrayType outer = (PackedArrayType) t;
            assertEquals(new ConstantRange(3, 0), outer.getRange());
            assertEquals(8, outer.getElementType().getBitWidth());
        }

        @Test
        @DisplayName("reg 向量保留 reg 标志")
        void regVector() {
            SvType t = resolve(compilation, integer(TypeKeyword.REG, Signing.SIGNED, range(3, 0)));
            assertEquals(EnumSet.of(IntegralFlag.SIGNED, IntegralFlag.FOUR_STATE, IntegralFlag.REG),
                    t.getIntegralFlags());
            assertEquals("reg signed[3:0]", t.toDisplayString());
        }

        @Test
        @DisplayName("int unsigned 显示有符号性修饰")
        void predefinedSigningFromSyntax() {
            SvType t = resolve(compilation, integer(TypeKeyword.BYTE, Signing.UNSIGNED));
            assertEquals(8, t.getBitWidth());
            assertFalse(t.isSigned());
        }

        @Test
        @DisplayName("隐式类型按 logic 处理")
        void implicitType() {
            assertSame(compilation.getLogicType(), resolve(compilation, implicit(Signing.NONE)));
            SvType signed = resolve(compilation, implicit(Signing.SIGNED, range(3, 0)));
            assertTrue(signed.isSigned());
            assertTrue(signed.isFourState());
            assertEquals(4, signed.getBitWidth());
        }

        @Test
        @DisplayName("内置整数上的 packed 维度报错但保留类型")
        void packedDimsOnPredefined() {
            SvType t = resolve(compilation, integer(TypeKeyword.INT, range(3, 0)));
            assertSame(compilation.getIntType(), t);
            assertTrue(allCodes(compilation).contains(
                    DiagCode.PACKED_DIMS_ON_PREDEFINED_TYPE));
        }

        @Test
        @DisplayName("packed 维度不接受 [n] 形式")
        void packedSizeDimension() {
            SvType t = resolve(compilation, integer(TypeKeyword.LOGIC, size(4)));
            assertTrue(t.isError());
            assertTrue(allCodes(compilation).contains(
                    DiagCode.PACKED_DIM_REQUIRES_RANGE));
        }

        @Test
        @DisplayName("位宽上限以内的向量正常构建")
        void widestVector() {
            SvType t = resolve(compilation, integer(TypeKeyword.LOGIC, range(IntegralType.MAX_BIT_WIDTH - 1, 0)));
            assertEquals(IntegralType.MAX_BIT_WIDTH, t.getBitWidth());
            assertTrue(allCodes(compilation).isEmpty());
        }

        @Test
        @DisplayName("超大的单个范围报 PackedTypeTooLarge")
        void rangeTooWide() {
            SvType t = resolve(compilation, integer(TypeKeyword.LOGIC, range(Integer.MAX_VALUE, 0)));
            assertTrue(t.isError());
            assertEquals(Collections.singletonList(DiagCode.PACKED_TYPE_TOO_LARGE), allCodes(compilation));
        }

        @Test
        @DisplayName("多维位宽之积溢出时报错而不是回绕")
        void nestedWidthOverflow() {
            SvType t = resolve(compilation, integer(TypeKeyword.LOGIC, range(65535, 0), range(65535, 0)));
            assertTrue(t.isError());
            assertTrue(allCodes(compilation).contains(DiagCode.PACKED_TYPE_TOO_LARGE));
        }

        @Test
        @DisplayName("packed struct 的总位宽同样受限")
        void packedStructTooWide() {
            SvType t = resolve(compilation, packedStruct(
                    member(integer(TypeKeyword.LOGIC, range(IntegralType.MAX_BIT_WIDTH - 1, 0)), "a", "b")));
            assertTrue(t.isError());
            assertTrue(allCodes(compilation).contains(DiagCode.PACKED_TYPE_TOO_LARGE));
        }
    }

    @Test
    @DisplayName("每个类型节点获得递增的序号")
    void typeIdsAreSequential() {
        List<SvType> types = compilation.getTypes();
        for (int i = 0; i < types.size(); i++) {
            assertEquals(i, types.get(i).getId());
        }
    }
}
