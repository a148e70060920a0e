package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.CompilationOptions;
import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.SemanticDiagnostic;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.decl.ForwardTypedefDeclarationSyntax.Keyword;
import com.veritype.compiler.ast.decl.MemberSyntax;
import com.veritype.compiler.ast.type.TypeKeyword;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.veritype.compiler.CompilationFixture.*;
import static com.veritype.compiler.ast.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class TypeAliasTest {

    @Nested
    @DisplayName("别名链")
    class Chains {

        @Test
        @DisplayName("规范类型沿链找到第一个非别名类型")
        void canonicalFollowsChain() {
            Compilation c = compile(
                    typedef("a_t", keyword(TypeKeyword.INT)),
                    typedef("b_t", named("a_t")),
                    typedef("c_t", named("b_t")));

            SvType cType = type(c, "c_t");
            assertTrue(cType.isAlias());
            assertSame(c.getType(TypeKeyword.INT), cType.getCanonicalType());
            assertSame(type(c, "b_t"), ((TypeAliasType) cType).getTargetType());
            assertEquals(32, cType.getBitWidth());
            assertTrue(cType.isSigned());
            assertEquals("c_t", cType.toDisplayString());
            assertTrue(cType.isMatching(c.getType(TypeKeyword.INT)));
            assertTrue(c.getAllDiagnostics().isEmpty());
        }

        @Test
        @DisplayName("typedef 上的 unpacked 维度")
        void unpackedDimsOnTypedef() {
            Compilation c = compile(typedef("mem_t", keyword(TypeKeyword.BYTE), size(16)));

            SvType t = type(c, "mem_t");
            assertTrue(t.isUnpackedArray());
            assertEquals(new ConstantRange(0, 15), t.getArrayRange());
        }

        @Test
        @DisplayName("名字后的 packed 维度包装别名")
        void packedSelectorsOnName() {
            Compilation c = compile(
                    typedef("nib", integer(TypeKeyword.LOGIC, range(3, 0))),
                    variable(named("nib", range(1, 0)), "pair"));

            SvType t = type(c, "pair");
            assertTrue(t.isPackedArray());
            assertEquals(8, t.getBitWidth());
            assertTrue(t.isFourState());
            assertSame(type(c, "nib"), ((PackedArrayType) t).getElementType());
            assertEquals("nib[1:0]", t.toDisplayString());
        }

        @Test
        @DisplayName("名字后的 [n] 报 PackedDimRequiresRange")
        void sizedSelectorOnName() {
            Compilation c = compile(
                    typedef("nib", integer(TypeKeyword.LOGIC, range(3, 0))),
                    variable(named("nib", size(2)), "pair"));

            assertTrue(type(c, "pair").isError());
            assertEquals(Collections.singletonList(DiagCode.PACKED_DIM_REQUIRES_RANGE), allCodes(c));
        }

        @Test
        @DisplayName("别名链长度超过 alias.maxDepth 时中止")
        void chainDepthLimit() {
            CompilationOptions options = new CompilationOptions();
            options.setMaxAliasChainDepth(2);
            Compilation c = new Compilation(options);
            c.addSyntaxTree(unit(
                    typedef("a_t", keyword(TypeKeyword.INT)),
                    typedef("b_t", named("a_t")),
                    typedef("c_t", named("b_t"))));

            assertSame(c.getType(TypeKeyword.INT), type(c, "b_t").getCanonicalType());
            InternalCompilerError error = assertThrows(InternalCompilerError.class,
                    () -> type(c, "c_t").getCanonicalType());
            assertTrue(error.getMessage().contains("c_t"));
        }

        @Test
        @DisplayName("默认上限下 64 层的链可以规范化")
        void defaultDepthAllowsLongChains() {
            MemberSyntax[] members = new MemberSyntax[64];
            members[0] = typedef("t0", keyword(TypeKeyword.BYTE));
            for (int i = 1; i < members.length; i++) {
                members[i] = typedef("t" + i, named("t" + (i - 1)));
            }
            Compilation c = compile(members);

            assertSame(c.getType(TypeKeyword.BYTE), type(c, "t63").getCanonicalType());
        }
    }

    @Nested
    @DisplayName("前向 typedef")
    class Forward {

        @Test
        @DisplayName("前向声明后给出完整定义不报错")
        void forwardThenFull() {
            Compilation c = compile(
                    forwardTypedef("s_t", Keyword.STRUCT),
                    typedef("s_t", unpackedStruct(member(keyword(TypeKeyword.INT), "a"))));

            TypeAliasType alias = (TypeAliasType) symbol(c, "s_t");
            assertNotNull(alias.getFirstForwardDecl());
            assertEquals(ForwardingTypedefSymbol.Category.STRUCT, alias.getFirstForwardDecl().getCategory());
            assertTrue(c.getAllDiagnostics().isEmpty());
        }

        @Test
        @DisplayName("前向声明之后即可使用该类型名")
        void usableAfterForwardDecl() {
            Compilation c = compile(
                    forwardTypedef("s_t", Keyword.NONE),
                    variable(named("s_t"), "v"),
                    typedef("s_t", packedStruct(member(keyword(TypeKeyword.SHORTINT), "a"))));

            SvType t = type(c, "v");
            assertEquals(SymbolKind.PACKED_STRUCT_TYPE, t.getCanonicalType().getKind());
            assertEquals(16, t.getBitWidth());
            assertTrue(c.getAllDiagnostics().isEmpty());
        }

        @Test
        @DisplayName("没有前向声明时不能先使用")
        void noUseBeforeDeclaration() {
            Compilation c = compile(
                    variable(named("later_t"), "v"),
                    typedef("later_t", keyword(TypeKeyword.INT)));

            assertTrue(type(c, "v").isError());
            assertEquals(Collections.singletonList(DiagCode.UNDECLARED_IDENTIFIER), allCodes(c));
        }

        @Test
        @DisplayName("类别不一致报 ForwardTypedefDoesNotMatch")
        void categoryMismatch() {
            Compilation c = compile(
                    forwardTypedef("e_t", Keyword.STRUCT),
                    typedef("e_t", enumType(null, enumMember("A"))));

            List<SemanticDiagnostic> diags = c.getAllDiagnostics();
            assertEquals(Collections.singletonList(DiagCode.FORWARD_TYPEDEF_DOES_NOT_MATCH), codes(diags));
            assertEquals(1, diags.get(0).getNotes().size());
        }

        @Test
        @DisplayName("多个前向声明只报告第一处不一致")
        void multipleForwardDecls() {
            Compilation c = compile(
                    forwardTypedef("e_t", Keyword.NONE),
                    forwardTypedef("e_t", Keyword.ENUM),
                    forwardTypedef("e_t", Keyword.STRUCT),
                    forwardTypedef("e_t", Keyword.UNION),
                    typedef("e_t", enumType(null, enumMember("A"))));

            assertEquals(Collections.singletonList(DiagCode.FORWARD_TYPEDEF_DOES_NOT_MATCH), allCodes(c));
        }

        @Test
        @DisplayName("完整定义之后的前向声明同样参与检查")
        void forwardAfterFull() {
            Compilation c = compile(
                    typedef("s_t", packedStruct(member(keyword(TypeKeyword.INT), "a"))),
                    forwardTypedef("s_t", Keyword.ENUM));

            assertEquals(Collections.singletonList(DiagCode.FORWARD_TYPEDEF_DOES_NOT_MATCH), allCodes(c));
        }

        @Test
        @DisplayName("非 struct/enum 目标不检查类别")
        void otherTargetsNotChecked() {
            Compilation c = compile(
                    forwardTypedef("t", Keyword.CLASS),
                    typedef("t", keyword(TypeKeyword.INT)));

            assertTrue(c.getAllDiagnostics().isEmpty());
        }

        @Test
        @DisplayName("只有前向声明报 UnresolvedForwardTypedef")
        void unresolvedForward() {
            Compilation c = compile(
                    forwardTypedef("lonely_t", Keyword.STRUCT),
                    variable(named("lonely_t"), "v"));

            assertTrue(type(c, "v").isError());
            assertEquals(Collections.singletonList(DiagCode.UNRESOLVED_FORWARD_TYPEDEF), allCodes(c));
        }

        @Test
        @DisplayName("typedef 引用自身报 RecursiveDefinition")
        void recursiveAlias() {
            Compilation c = compile(
                    forwardTypedef("t", Keyword.NONE),
                    typedef("t", named("t")));

            assertTrue(type(c, "t").isError());
            assertEquals(Collections.singletonList(DiagCode.RECURSIVE_DEFINITION), allCodes(c));
        }
    }

    @Nested
    @DisplayName("名字解析错误")
    class NameErrors {

        @Test
        @DisplayName("同名声明报 Redefinition 并指向先前声明")
        void redefinition() {
            Compilation c = compile(
                    typedef("dup_t", keyword(TypeKeyword.INT)),
                    typedef("dup_t", keyword(TypeKeyword.BYTE)));

            List<SemanticDiagnostic> diags = c.getAllDiagnostics();
            assertEquals(Collections.singletonList(DiagCode.REDEFINITION), codes(diags));
            assertEquals(DiagCode.NOTE_DECLARATION_HERE, diags.get(0).getNotes().get(0).getCode());
            // 名字表保留第一个声明
            assertEquals(32, type(c, "dup_t").getBitWidth());
        }

        @Test
        @DisplayName("非类型的名字报 NotAType")
        void notAType() {
            Compilation c = compile(
                    variable(keyword(TypeKeyword.INT), "x"),
                    variable(named("x"), "y"));

            assertTrue(type(c, "y").isError());
            assertEquals(Collections.singletonList(DiagCode.NOT_A_TYPE), allCodes(c));
        }

        @Test
        @DisplayName("未声明的名字报 UndeclaredIdentifier")
        void undeclared() {
            Compilation c = compile(typedef("t", named("missing_t")));

            assertTrue(type(c, "t").isError());
            assertEquals(Collections.singletonList(DiagCode.UNDECLARED_IDENTIFIER), allCodes(c));
        }

        @Test
        @DisplayName("错误类型沿别名传播且不再重复报告")
        void errorsPropagateSilently() {
            Compilation c = compile(
                    typedef("bad_t", named("missing_t")),
                    typedef("also_bad_t", named("bad_t")),
                    variable(named("also_bad_t"), "v"));

            assertTrue(type(c, "v").isError());
            assertEquals(Collections.singletonList(DiagCode.UNDECLARED_IDENTIFIER), allCodes(c));
        }
    }
}
