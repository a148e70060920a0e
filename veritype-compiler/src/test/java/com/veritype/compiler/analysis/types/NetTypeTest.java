package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.type.TypeKeyword;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Collections;

import static com.veritype.compiler.CompilationFixture.*;
import static com.veritype.compiler.ast.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class NetTypeTest {

    @ParameterizedTest
    @EnumSource(value = NetType.NetKind.class, names = {"UNKNOWN", "USER_DEFINED"}, mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("内置线网的数据类型都是 logic")
    void builtinNetsAreLogic(NetType.NetKind kind) {
        Compilation c = new Compilation();
        NetType net = c.getNetType(kind);

        assertTrue(net.isBuiltIn());
        assertTrue(net.isResolved());
        assertEquals(kind.getText(), net.getName());
        assertSame(c.getLogicType(), net.getDataType());
        assertNull(net.getAliasTarget());
        assertNull(net.getResolutionFunction());
    }

    @Test
    @DisplayName("用户 nettype 在首次访问时解析")
    void userNetTypeIsLazy() {
        Compilation c = compile(nettype("byte_net", integer(TypeKeyword.LOGIC, range(7, 0))));

        NetType net = (NetType) symbol(c, "byte_net");
        assertEquals(NetType.NetKind.USER_DEFINED, net.getNetKind());
        assertFalse(net.isBuiltIn());
        assertFalse(net.isResolved());

        SvType dataType = net.getDataType();
        assertTrue(net.isResolved());
        assertEquals(8, dataType.getBitWidth());
        assertTrue(dataType.isFourState());
        assertNull(net.getAliasTarget());
        assertSame(net, net.getCanonical());
        assertTrue(c.getAllDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("以 typedef 名字为类型的 nettype")
    void namedDataType() {
        Compilation c = compile(
                typedef("word_t", integer(TypeKeyword.BIT, range(15, 0))),
                nettype("word_net", named("word_t")));

        NetType net = (NetType) symbol(c, "word_net");
        assertSame(type(c, "word_t"), net.getDataType());
        assertNull(net.getAliasTarget());
    }

    @Test
    @DisplayName("指向另一个 nettype 的名字构成别名")
    void aliasOfNetType() {
        Compilation c = compile(
                nettype("real_net", keyword(TypeKeyword.REAL)),
                nettype("alias_net", named("real_net")),
                nettype("alias2_net", named("alias_net")));

        NetType base = (NetType) symbol(c, "real_net");
        NetType alias = (NetType) symbol(c, "alias_net");
        NetType alias2 = (NetType) symbol(c, "alias2_net");

        assertSame(base, alias.getAliasTarget());
        assertSame(alias, alias2.getAliasTarget());
        assertSame(base, alias2.getCanonical());
        assertTrue(alias2.getDataType().isFloating());
        assertSame(base.getDataType(), alias2.getDataType());
        assertTrue(c.getAllDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("with 子句解析到之前声明的函数")
    void resolutionFunction() {
        Compilation c = compile(
                function("resolve_real", keyword(TypeKeyword.REAL)),
                nettype("real_net", keyword(TypeKeyword.REAL), "resolve_real"));

        NetType net = (NetType) symbol(c, "real_net");
        assertNotNull(net.getResolutionFunction());
        assertEquals("resolve_real", net.getResolutionFunction().getName());
        assertTrue(c.getAllDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("with 子句的函数未声明报 UndeclaredIdentifier")
    void missingResolutionFunction() {
        Compilation c = compile(
                nettype("real_net", keyword(TypeKeyword.REAL), "resolve_real"),
                function("resolve_real", keyword(TypeKeyword.REAL)));

        assertNull(((NetType) symbol(c, "real_net")).getResolutionFunction());
        assertEquals(Collections.singletonList(DiagCode.UNDECLARED_IDENTIFIER), allCodes(c));
    }

    @Test
    @DisplayName("with 子句指向非函数报 NotASubroutine")
    void resolutionFunctionNotSubroutine() {
        Compilation c = compile(
                variable(keyword(TypeKeyword.INT), "resolve_real"),
                nettype("real_net", keyword(TypeKeyword.REAL), "resolve_real"));

        assertNull(((NetType) symbol(c, "real_net")).getResolutionFunction());
        assertEquals(Collections.singletonList(DiagCode.NOT_A_SUBROUTINE), allCodes(c));
    }

    @Test
    @DisplayName("枚举 nettype 的成员值立即对外可见")
    void enumNetTypeExportsValues() {
        Compilation c = compile(
                nettype("state_net", enumType(null, enumMember("OFF"), enumMember("ON"))),
                variable(keyword(TypeKeyword.INT), "after"));

        assertEquals(SymbolKind.ENUM_VALUE, symbol(c, "ON").getKind());
        assertEquals(SymbolKind.ENUM_VALUE, symbol(c, "OFF").getKind());

        NetType net = (NetType) symbol(c, "state_net");
        assertTrue(net.getDataType().isEnum());
        assertTrue(c.getAllDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("nettype 名字不能当作数据类型使用")
    void netTypeIsNotADataType() {
        Compilation c = compile(
                nettype("n", keyword(TypeKeyword.LOGIC)),
                variable(named("n"), "v"));

        assertTrue(type(c, "v").isError());
        assertEquals(Collections.singletonList(DiagCode.NOT_A_TYPE), allCodes(c));
    }
}
