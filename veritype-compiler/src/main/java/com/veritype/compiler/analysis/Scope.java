package com.veritype.compiler.analysis;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.ast.NameSyntax;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.decl.DataDeclarationSyntax;
import com.veritype.compiler.ast.decl.ForwardTypedefDeclarationSyntax;
import com.veritype.compiler.ast.decl.FunctionDeclarationSyntax;
import com.veritype.compiler.ast.decl.MemberSyntax;
import com.veritype.compiler.ast.decl.NetTypeDeclarationSyntax;
import com.veritype.compiler.ast.decl.ParameterDeclarationSyntax;
import com.veritype.compiler.ast.decl.TypedefDeclarationSyntax;
import com.veritype.compiler.ast.type.DeclaratorSyntax;
import com.veritype.compiler.ast.type.EnumTypeSyntax;
import com.veritype.compiler.analysis.types.EnumType;
import com.veritype.compiler.analysis.types.EnumValueSymbol;
import com.veritype.compiler.analysis.types.ForwardingTypedefSymbol;
import com.veritype.compiler.analysis.types.NetType;
import com.veritype.compiler.analysis.types.PackedArrayType;
import com.veritype.compiler.analysis.types.SvType;
import com.veritype.compiler.analysis.types.TypeAliasType;
import com.veritype.compiler.analysis.types.UnpackedArrayType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域：按声明顺序保存成员，名字查找遵守“先声明后使用”。
 *
 * <p>编译单元、枚举、结构体各自拥有一个作用域；子作用域记录自己在父作用域中的位置，
 * 向外查找时以该位置为界。</p>
 */
public class Scope {

    private final Compilation compilation;
    private final Symbol owner;
    private final Scope parent;
    private final LookupLocation parentLocation;

    private final List<Symbol> members = new ArrayList<Symbol>();
    private final Map<String, Symbol> nameMap = new HashMap<String, Symbol>();

    public Scope(Compilation compilation, Symbol owner, Scope parent, LookupLocation parentLocation) {
        this.compilation = compilation;
        this.owner = owner;
        this.parent = parent;
        this.parentLocation = parentLocation != null ? parentLocation : LookupLocation.MAX;
    }

    public Compilation getCompilation() { return compilation; }

    /** 拥有此作用域的符号；编译单元根作用域为 null */
    public Symbol getOwner() { return owner; }

    public Scope getParent() { return parent; }

    public LookupLocation getParentLocation() { return parentLocation; }

    public List<Symbol> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public <T extends Symbol> List<T> membersOfType(Class<T> type) {
        List<T> result = new ArrayList<T>();
        for (Symbol member : members) {
            if (type.isInstance(member)) {
                result.add(type.cast(member));
            }
        }
        return result;
    }

    public SemanticDiagnostic addDiag(DiagCode code, SourceLocation location) {
        return compilation.addDiag(code, location);
    }

    // ============ 成员 ============

    public void addMember(Symbol symbol) {
        symbol.setParent(this, members.size());
        members.add(symbol);

        String name = symbol.getName();
        if (!name.isEmpty()) {
            Symbol existing = nameMap.get(name);
            if (existing == null) {
                nameMap.put(name, symbol);
            } else if (!linkForwardTypedef(existing, symbol)) {
                addDiag(DiagCode.REDEFINITION, symbol.getLocation())
                        .addArg(name)
                        .addNote(DiagCode.NOTE_DECLARATION_HERE, existing.getLocation());
            }
        }

        // 枚举类型的成员值对外层作用域可见，必须在声明处立即解析
        DeclaredType declared = symbol.getDeclaredType();
        if (declared != null && declared.getTypeSyntax() instanceof EnumTypeSyntax) {
            exportEnumValues(declared.getType());
        }
    }

    /**
     * 前向 typedef 与完整 typedef 同名时不算重定义：
     * 前向声明挂到别名的链上，别名最终占据名字表中的位置。
     */
    private boolean linkForwardTypedef(Symbol existing, Symbol added) {
        if (added instanceof ForwardingTypedefSymbol) {
            ForwardingTypedefSymbol fwd = (ForwardingTypedefSymbol) added;
            if (existing instanceof TypeAliasType) {
                ((TypeAliasType) existing).addForwardDecl(fwd);
                return true;
            }
            if (existing instanceof ForwardingTypedefSymbol) {
                ((ForwardingTypedefSymbol) existing).addForwardDecl(fwd);
                return true;
            }
            return false;
        }
        if (added instanceof TypeAliasType && existing instanceof ForwardingTypedefSymbol) {
            ((TypeAliasType) added).addForwardDecl((ForwardingTypedefSymbol) existing);
            nameMap.put(added.getName(), added);
            return true;
        }
        return false;
    }

    private void exportEnumValues(SvType type) {
        SvType ct = type.getCanonicalType();
        while (ct instanceof PackedArrayType || ct instanceof UnpackedArrayType) {
            ct = ct instanceof PackedArrayType
                    ? ((PackedArrayType) ct).getElementType().getCanonicalType()
                    : ((UnpackedArrayType) ct).getElementType().getCanonicalType();
        }
        if (!(ct instanceof EnumType)) return;

        for (EnumValueSymbol value : ((EnumType) ct).getValues()) {
            addMember(new TransparentMemberSymbol(value));
        }
    }

    /** 为一个声明语法创建符号并加入本作用域 */
    public void addMembers(MemberSyntax syntax) {
        if (syntax instanceof TypedefDeclarationSyntax) {
            addMember(TypeAliasType.fromSyntax(compilation, (TypedefDeclarationSyntax) syntax));
        } else if (syntax instanceof ForwardTypedefDeclarationSyntax) {
            addMember(ForwardingTypedefSymbol.fromSyntax((ForwardTypedefDeclarationSyntax) syntax));
        } else if (syntax instanceof NetTypeDeclarationSyntax) {
            addMember(NetType.fromSyntax((NetTypeDeclarationSyntax) syntax));
        } else if (syntax instanceof ParameterDeclarationSyntax) {
            addMember(ParameterSymbol.fromSyntax((ParameterDeclarationSyntax) syntax));
        } else if (syntax instanceof DataDeclarationSyntax) {
            DataDeclarationSyntax data = (DataDeclarationSyntax) syntax;
            for (DeclaratorSyntax declarator : data.getDeclarators()) {
                addMember(new VariableSymbol(data.getType(), declarator));
            }
        } else if (syntax instanceof FunctionDeclarationSyntax) {
            addMember(new SubroutineSymbol((FunctionDeclarationSyntax) syntax));
        } else {
            throw InternalCompilerError.unreachable(syntax.getClass().getSimpleName());
        }
    }

    // ============ 查找 ============

    /** 仅查本作用域，不考虑声明顺序 */
    public Symbol find(String name) {
        return unwrap(nameMap.get(name));
    }

    /** 由内向外查找在 location 处可见的符号 */
    public Symbol lookup(String name, LookupLocation location) {
        Scope scope = this;
        LookupLocation current = location;
        while (scope != null) {
            Symbol symbol = scope.nameMap.get(name);
            if (symbol != null && scope.isVisible(symbol, current)) {
                return unwrap(symbol);
            }
            current = scope.parentLocation;
            scope = scope.parent;
        }
        return null;
    }

    public void lookupName(NameSyntax name, LookupLocation location, LookupResult result) {
        Symbol symbol = lookup(name.getIdentifier(), location);
        if (symbol == null) {
            result.addDiagnostic(new SemanticDiagnostic(DiagCode.UNDECLARED_IDENTIFIER, name.getLocation())
                    .addArg(name.getIdentifier()));
            return;
        }
        result.setFound(symbol);
        result.setSelectors(name.getSelectors());
    }

    private boolean isVisible(Symbol symbol, LookupLocation location) {
        if (location.getScope() != this) return true;

        int index = symbol.getIndexInScope();
        if (symbol instanceof TypeAliasType) {
            // 前向声明之后即可引用该类型名
            ForwardingTypedefSymbol fwd = ((TypeAliasType) symbol).getFirstForwardDecl();
            if (fwd != null && fwd.getParentScope() == this) {
                index = Math.min(index, fwd.getIndexInScope());
            }
        }
        return index < location.getIndex();
    }

    private static Symbol unwrap(Symbol symbol) {
        if (symbol instanceof TransparentMemberSymbol) {
            return ((TransparentMemberSymbol) symbol).getWrapped();
        }
        return symbol;
    }

    @Override
    public String toString() {
        return owner != null ? "scope(" + owner.getName() + ")" : "scope(root)";
    }
}
