package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.DeclaratorSyntax;
import com.veritype.compiler.ast.type.StructTypeSyntax;

import java.util.List;

/**
 * unpacked struct：字段按声明顺序编号，字段类型在首次使用时才解析。
 * 位宽为 0，四态性由字段汇总。
 */
public final class UnpackedStructType extends SvType {

    private final Scope memberScope;

    public UnpackedStructType(Compilation compilation, SourceLocation location, Scope parent,
                              LookupLocation parentLocation) {
        super(SymbolKind.UNPACKED_STRUCT_TYPE, "", location);
        this.memberScope = new Scope(compilation, this, parent, parentLocation);
    }

    public Scope getMemberScope() {
        return memberScope;
    }

    public List<FieldSymbol> getFields() {
        return memberScope.membersOfType(FieldSymbol.class);
    }

    public static SvType fromSyntax(Compilation compilation, StructTypeSyntax syntax,
                                    LookupLocation location, Scope scope) {
        UnpackedStructType result = compilation.emplace(
                new UnpackedStructType(compilation, syntax.getLocation(), scope, location));

        int fieldIndex = 0;
        for (StructTypeSyntax.StructMemberSyntax member : syntax.getMembers()) {
            for (DeclaratorSyntax decl : member.getDeclarators()) {
                FieldSymbol field = new FieldSymbol(decl.getName(), decl.getLocation(), fieldIndex, result);
                field.getDeclaredType().setTypeSyntax(member.getType());
                field.getDeclaredType().setDimensions(decl.getDimensions());
                field.setInitializer(decl.getInitializer());
                field.setSyntax(decl);
                result.memberScope.addMember(field);
                fieldIndex++;
            }
        }
        result.setSyntax(syntax);

        // unpacked struct 上的 packed 维度会在这里报 PackedArrayNotIntegral
        return PackedArrayType.applyDimensions(compilation, result, syntax.getDimensions(), location, scope);
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitUnpackedStruct(this);
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("struct{");
        for (FieldSymbol field : getFields()) {
            sb.append(field.getType().toDisplayString()).append(' ').append(field.getName()).append(';');
        }
        return sb.append('}').toString();
    }
}
