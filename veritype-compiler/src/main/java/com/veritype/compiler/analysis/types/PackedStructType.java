package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.DeclaratorSyntax;
import com.veritype.compiler.ast.type.Signing;
import com.veritype.compiler.ast.type.StructTypeSyntax;

import java.util.ArrayList;
import java.util.List;

/**
 * packed struct：成员按 MSB 在前布局，第一个成员占据最高位
 */
public final class PackedStructType extends IntegralType {

    private final Scope memberScope;

    public PackedStructType(Compilation compilation, SourceLocation location, int bitWidth,
                            boolean signed, boolean fourState, Scope parent, LookupLocation parentLocation) {
        super(SymbolKind.PACKED_STRUCT_TYPE, "", location, bitWidth, signed, fourState);
        this.memberScope = new Scope(compilation, this, parent, parentLocation);
    }

    public Scope getMemberScope() {
        return memberScope;
    }

    public List<FieldSymbol> getFields() {
        return memberScope.membersOfType(FieldSymbol.class);
    }

    public static SvType fromSyntax(Compilation compilation, StructTypeSyntax syntax,
                                    LookupLocation location, Scope scope, boolean forceSigned) {
        boolean isSigned = syntax.getSigning() == Signing.SIGNED || forceSigned;
        boolean isFourState = false;
        long bitWidth = 0;

        // 必须先看完所有成员才能知道总位宽与四态性；成员从 MSB 到 LSB 书写，所以倒序处理
        List<PendingField> pending = new ArrayList<PendingField>();
        List<StructTypeSyntax.StructMemberSyntax> members = syntax.getMembers();
        for (int m = members.size() - 1; m >= 0; m--) {
            StructTypeSyntax.StructMemberSyntax member = members.get(m);
            SvType type = compilation.getType(member.getType(), location, scope, false);
            isFourState |= type.isFourState();

            boolean issuedError = false;
            if (!type.isIntegral() && !type.isError()) {
                issuedError = true;
                scope.addDiag(DiagCode.PACKED_MEMBER_NOT_INTEGRAL, member.getType().getLocation()).addArg(type);
            }

            List<DeclaratorSyntax> declarators = member.getDeclarators();
            for (int d = declarators.size() - 1; d >= 0; d--) {
                DeclaratorSyntax decl = declarators.get(d);
                pending.add(new PendingField(decl, type, (int) bitWidth));

                // packed struct 中不允许 unpacked 数组
                if (!decl.getDimensions().isEmpty()) {
                    SvType dimType = compilation.getType(type, decl.getDimensions(), location, scope);
                    if (dimType.isUnpackedArray() && !issuedError) {
                        scope.addDiag(DiagCode.PACKED_MEMBER_NOT_INTEGRAL, decl.getLocation()).addArg(dimType);
                    }
                }

                if (type.isIntegral()) {
                    bitWidth += type.getBitWidth();
                }

                if (decl.getInitializer() != null) {
                    scope.addDiag(DiagCode.PACKED_MEMBER_HAS_INITIALIZER, decl.getInitializer().getLocation());
                }
            }
        }

        // 没有任何合法成员时诊断已经报告过
        if (bitWidth == 0) return compilation.getErrorType();
        if (bitWidth > MAX_BIT_WIDTH) {
            scope.addDiag(DiagCode.PACKED_TYPE_TOO_LARGE, syntax.getLocation())
                    .addArg(bitWidth).addArg(MAX_BIT_WIDTH);
            return compilation.getErrorType();
        }

        PackedStructType structType = compilation.emplace(new PackedStructType(compilation, syntax.getLocation(),
                (int) bitWidth, isSigned, isFourState, scope, location));
        for (int i = pending.size() - 1; i >= 0; i--) {
            PendingField p = pending.get(i);
            FieldSymbol field = new FieldSymbol(p.declarator.getName(), p.declarator.getLocation(), p.offset, structType);
            field.getDeclaredType().setType(p.type);
            field.setSyntax(p.declarator);
            structType.memberScope.addMember(field);
        }
        structType.setSyntax(syntax);

        return PackedArrayType.applyDimensions(compilation, structType, syntax.getDimensions(), location, scope);
    }

    private static final class PendingField {
        final DeclaratorSyntax declarator;
        final SvType type;
        final int offset;

        PendingField(DeclaratorSyntax declarator, SvType type, int offset) {
            this.declarator = declarator;
            this.type = type;
            this.offset = offset;
        }
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitPackedStruct(this);
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder(isIntegralSigned() ? "struct packed signed{" : "struct packed{");
        for (FieldSymbol field : getFields()) {
            sb.append(field.getType().toDisplayString()).append(' ').append(field.getName()).append(';');
        }
        return sb.append('}').toString();
    }
}
