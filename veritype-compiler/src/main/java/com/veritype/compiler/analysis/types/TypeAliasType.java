package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.analysis.DeclaredType;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.decl.TypedefDeclarationSyntax;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * typedef 声明的类型别名。目标类型在首次使用时解析；
 * 规范类型沿别名链找到第一个非别名类型。
 */
public final class TypeAliasType extends SvType {

    private final DeclaredType targetType = new DeclaredType(this);
    private final int maxChainDepth;
    private ForwardingTypedefSymbol firstForward;

    public TypeAliasType(String name, SourceLocation location, int maxChainDepth) {
        super(SymbolKind.TYPE_ALIAS, name, location);
        this.maxChainDepth = maxChainDepth;
    }

    public static TypeAliasType fromSyntax(Compilation compilation, TypedefDeclarationSyntax syntax) {
        TypeAliasType result = compilation.emplace(new TypeAliasType(syntax.getName(), syntax.getLocation(),
                compilation.getOptions().getMaxAliasChainDepth()));
        result.targetType.setTypeSyntax(syntax.getType());
        result.targetType.setDimensions(syntax.getDimensions());
        result.setSyntax(syntax);
        return result;
    }

    @Override
    public DeclaredType getDeclaredType() {
        return targetType;
    }

    public SvType getTargetType() {
        return targetType.getType();
    }

    public ForwardingTypedefSymbol getFirstForwardDecl() {
        return firstForward;
    }

    public void addForwardDecl(ForwardingTypedefSymbol decl) {
        if (firstForward == null) {
            firstForward = decl;
        } else {
            firstForward.addForwardDecl(decl);
        }
    }

    /**
     * 检查前向声明的类别与实际目标是否一致；只核对 struct 与 enum，
     * 发现第一处不一致即报告并停止。
     */
    public void checkForwardDecls() {
        ForwardingTypedefSymbol.Category category;
        switch (targetType.getType().getKind()) {
            case PACKED_STRUCT_TYPE:
            case UNPACKED_STRUCT_TYPE:
                category = ForwardingTypedefSymbol.Category.STRUCT;
                break;
            case ENUM_TYPE:
                category = ForwardingTypedefSymbol.Category.ENUM;
                break;
            default:
                return;
        }

        for (ForwardingTypedefSymbol forward = firstForward; forward != null; forward = forward.getNextForwardDecl()) {
            if (forward.getCategory() != ForwardingTypedefSymbol.Category.NONE && forward.getCategory() != category) {
                getParentScope().addDiag(DiagCode.FORWARD_TYPEDEF_DOES_NOT_MATCH, forward.getLocation())
                        .addArg(forward.getCategory().getText())
                        .addNote(DiagCode.NOTE_DECLARATION_HERE, getLocation());
                return;
            }
        }
    }

    @Override
    protected SvType resolveCanonical() {
        Set<SvType> visited = Collections.newSetFromMap(new IdentityHashMap<SvType, Boolean>());
        SvType current = this;
        while (current.isAlias()) {
            if (!visited.add(current) || visited.size() > maxChainDepth) {
                throw new InternalCompilerError("type alias chain through '" + getName()
                        + "' does not terminate after " + visited.size() + " links");
            }
            current = ((TypeAliasType) current).getTargetType();
        }
        return current;
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitTypeAlias(this);
    }

    @Override
    public String toDisplayString() {
        return getName();
    }
}
