package com.veritype.compiler.analysis.types;

import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.analysis.DeclaredType;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.LookupResult;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.SubroutineSymbol;
import com.veritype.compiler.analysis.Symbol;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.decl.NetTypeDeclarationSyntax;
import com.veritype.compiler.ast.type.EnumTypeSyntax;
import com.veritype.compiler.ast.type.NamedTypeSyntax;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 线网类型：内置线网（wire、tri 等）或用户 nettype 声明。
 *
 * <p>用户声明在首次访问时才解析：类型语法若指向另一个 nettype，则成为它的别名；
 * 否则按普通数据类型解析。枚举类型在构造时就设好语法，加入作用域时成员即可见。</p>
 */
public final class NetType extends Symbol {

    private static final Logger LOG = Logger.getLogger(NetType.class.getName());

    public enum NetKind {
        UNKNOWN("<unknown>"),
        WIRE("wire"),
        WAND("wand"),
        WOR("wor"),
        TRI("tri"),
        TRIAND("triand"),
        TRIOR("trior"),
        TRIREG("trireg"),
        TRI0("tri0"),
        TRI1("tri1"),
        UWIRE("uwire"),
        SUPPLY0("supply0"),
        SUPPLY1("supply1"),
        USER_DEFINED("nettype");

        private final String text;

        NetKind(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }
    }

    private final NetKind netKind;
    private final DeclaredType declaredType = new DeclaredType(this);
    private NetType alias;
    private SubroutineSymbol resolver;
    private boolean resolved;

    /** 内置线网，构造时即已解析 */
    public NetType(NetKind netKind, String name, SvType dataType) {
        super(SymbolKind.NET_TYPE, name, SourceLocation.UNKNOWN);
        this.netKind = netKind;
        this.declaredType.setType(dataType);
        this.resolved = true;
    }

    public NetType(String name, SourceLocation location) {
        super(SymbolKind.NET_TYPE, name, location);
        this.netKind = NetKind.USER_DEFINED;
    }

    public static NetType fromSyntax(NetTypeDeclarationSyntax syntax) {
        NetType result = new NetType(syntax.getName(), syntax.getLocation());
        result.setSyntax(syntax);

        if (syntax.getType() instanceof EnumTypeSyntax) {
            result.declaredType.setTypeSyntax(syntax.getType());
        }
        return result;
    }

    public NetKind getNetKind() {
        return netKind;
    }

    public boolean isBuiltIn() {
        return netKind != NetKind.USER_DEFINED;
    }

    public boolean isResolved() {
        return resolved;
    }

    @Override
    public DeclaredType getDeclaredType() {
        return declaredType;
    }

    public NetType getAliasTarget() {
        if (!resolved) resolve();
        return alias;
    }

    /** 沿别名链找到最终的 nettype */
    public NetType getCanonical() {
        Set<NetType> visited = Collections.newSetFromMap(new IdentityHashMap<NetType, Boolean>());
        NetType current = this;
        for (NetType target = current.getAliasTarget(); target != null; target = current.getAliasTarget()) {
            if (!visited.add(current)) {
                throw new InternalCompilerError("nettype alias chain through '" + getName() + "' is cyclic");
            }
            current = target;
        }
        return current;
    }

    public SvType getDataType() {
        if (!resolved) resolve();
        return declaredType.getType();
    }

    public SubroutineSymbol getResolutionFunction() {
        if (!resolved) resolve();
        return resolver;
    }

    private void resolve() {
        resolved = true;

        NetTypeDeclarationSyntax syntax = (NetTypeDeclarationSyntax) getSyntax();
        Scope scope = getParentScope();
        if (syntax == null || scope == null) {
            throw new InternalCompilerError("nettype '" + getName() + "' resolved outside of a scope");
        }

        LookupLocation location = LookupLocation.before(this);
        if (syntax.getWithFunction() != null) {
            resolveFunction(scope, syntax, location);
        }

        if (syntax.getType() instanceof EnumTypeSyntax) {
            LOG.fine("nettype " + getName() + " uses enum type");
            return;
        }

        // 类型语法要么是另一个 nettype 的名字，要么是作为基础的数据类型
        if (syntax.getType() instanceof NamedTypeSyntax) {
            LookupResult result = new LookupResult();
            scope.lookupName(((NamedTypeSyntax) syntax.getType()).getName(), location, result);

            if (result.getFound() != null && result.getFound().getKind() == SymbolKind.NET_TYPE) {
                alias = (NetType) result.getFound();
                declaredType.copyTypeFrom(alias.getCanonical().declaredType);
                LOG.fine("nettype " + getName() + " aliases " + alias.getName());
                return;
            }
        }

        declaredType.setTypeSyntax(syntax.getType());
        LOG.fine("nettype " + getName() + " resolved to a data type");
    }

    private void resolveFunction(Scope scope, NetTypeDeclarationSyntax syntax, LookupLocation location) {
        Symbol symbol = scope.lookup(syntax.getWithFunction(), location);
        if (symbol == null) {
            scope.addDiag(DiagCode.UNDECLARED_IDENTIFIER, syntax.getLocation()).addArg(syntax.getWithFunction());
        } else if (symbol.getKind() != SymbolKind.SUBROUTINE) {
            scope.addDiag(DiagCode.NOT_A_SUBROUTINE, syntax.getLocation()).addArg(symbol.getName());
        } else {
            resolver = (SubroutineSymbol) symbol;
        }
    }
}
