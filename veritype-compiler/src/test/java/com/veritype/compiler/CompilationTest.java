package com.veritype.compiler;

import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.SemanticDiagnostic;
import com.veritype.compiler.analysis.types.NetType;
import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.decl.ForwardTypedefDeclarationSyntax.Keyword;
import com.veritype.compiler.ast.type.TypeKeyword;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.veritype.compiler.CompilationFixture.*;
import static com.veritype.compiler.ast.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class CompilationTest {

    @Test
    @DisplayName("多个编译单元共享根作用域")
    void multipleSyntaxTrees() {
        Compilation c = new Compilation();
        c.addSyntaxTree(unit(typedef("a_t", keyword(TypeKeyword.INT))));
        c.addSyntaxTree(unit(variable(named("a_t"), "x")));

        assertSame(type(c, "a_t"), type(c, "x"));
        assertFalse(c.hasErrors());
    }

    @Test
    @DisplayName("全局检查之后不能再添加编译单元")
    void noTreesAfterElaboration() {
        Compilation c = compile(typedef("a_t", keyword(TypeKeyword.INT)));
        c.getAllDiagnostics();

        assertThrows(InternalCompilerError.class,
                () -> c.addSyntaxTree(unit(typedef("b_t", keyword(TypeKeyword.INT)))));
    }

    @Test
    @DisplayName("getDiagnostics 不触发全局检查，getAllDiagnostics 只检查一次")
    void lazyElaboration() {
        Compilation c = compile(
                typedef("bad_t", named("nope")),
                forwardTypedef("fwd_t", Keyword.NONE));

        assertTrue(c.getDiagnostics().isEmpty());

        List<SemanticDiagnostic> all = c.getAllDiagnostics();
        assertEquals(2, all.size());
        assertEquals(2, c.getAllDiagnostics().size());
        assertTrue(c.hasErrors());
    }

    @Test
    @DisplayName("错误上限之外的错误被丢弃")
    void errorLimit() {
        CompilationOptions options = new CompilationOptions();
        options.setErrorLimit(2);
        Compilation c = new Compilation(options);
        c.addSyntaxTree(unit(
                typedef("a_t", named("missing_a")),
                typedef("b_t", named("missing_b")),
                typedef("c_t", named("missing_c"))));

        assertEquals(2, c.getAllDiagnostics().size());
        // 超出上限的诊断仍可追加参数，只是不会被记录
        SemanticDiagnostic dropped = c.addDiag(DiagCode.NOT_A_TYPE, SourceLocation.UNKNOWN).addArg("x");
        assertEquals("'x' 不是类型", dropped.getMessage());
        assertEquals(2, c.getDiagnostics().size());
    }

    @Test
    @DisplayName("警告不计入错误，可整体抑制")
    void warnings() {
        Compilation c = new Compilation();
        c.addDiag(DiagCode.EVENT_EXPRESSION_CONSTANT, SourceLocation.UNKNOWN);
        assertEquals(1, c.getDiagnostics().size());
        assertFalse(c.getDiagnostics().get(0).isError());
        assertFalse(c.hasErrors());

        CompilationOptions options = new CompilationOptions();
        options.setSuppressWarnings(true);
        Compilation quiet = new Compilation(options);
        quiet.addDiag(DiagCode.EVENT_EXPRESSION_CONSTANT, SourceLocation.UNKNOWN);
        quiet.addDiag(DiagCode.NOT_A_TYPE, SourceLocation.UNKNOWN);
        assertEquals(1, quiet.getDiagnostics().size());
        assertEquals(DiagCode.NOT_A_TYPE, quiet.getDiagnostics().get(0).getCode());
    }

    @Test
    @DisplayName("类型节点按登记顺序编号")
    void typeIds() {
        Compilation c = compile(
                typedef("a_t", integer(TypeKeyword.BIT, range(3, 0))),
                typedef("b_t", enumType(null, enumMember("X"))));
        c.getAllDiagnostics();

        List<SvType> types = c.getTypes();
        for (int i = 0; i < types.size(); i++) {
            assertEquals(i, types.get(i).getId());
        }
        assertTrue(types.contains(type(c, "a_t")));
    }

    @Test
    @DisplayName("用户 nettype 不在内置表中")
    void builtinNetTypes() {
        Compilation c = new Compilation();

        assertEquals("wire", c.getNetType(NetType.NetKind.WIRE).getName());
        assertThrows(InternalCompilerError.class, () -> c.getNetType(NetType.NetKind.USER_DEFINED));
    }

    @Test
    @DisplayName("诊断文本包含位置、严重性与代码名")
    void diagnosticText() {
        Compilation c = new Compilation();
        SemanticDiagnostic diag = c.addDiag(DiagCode.UNDECLARED_IDENTIFIER, new SourceLocation("top.sv", 4, 2))
                .addArg("foo");

        assertEquals("top.sv:4:2: error: 未声明的标识符 'foo' [UndeclaredIdentifier]", diag.toString());
    }
}
