package com.veritype.compiler.analysis.types;

import com.veritype.compiler.Compilation;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.analysis.LookupLocation;
import com.veritype.compiler.analysis.Scope;
import com.veritype.compiler.analysis.SymbolKind;
import com.veritype.compiler.ast.SourceLocation;
import com.veritype.compiler.ast.type.EnumTypeSyntax;
import com.veritype.compiler.value.ConstantValue;
import com.veritype.compiler.value.SvInt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 枚举类型。成员值放在枚举自己的作用域中，该作用域挂在声明处的外层作用域下，
 * 因此初始值表达式可以引用之前的成员和外层的参数。
 */
public final class EnumType extends IntegralType {

    private final SvType baseType;
    private final Scope memberScope;
    private final List<EnumValueSymbol> values = new ArrayList<EnumValueSymbol>();

    public EnumType(Compilation compilation, SourceLocation location, SvType baseType,
                    Scope parent, LookupLocation parentLocation) {
        super(SymbolKind.ENUM_TYPE, "", location, baseType.getBitWidth(), baseType.isSigned(),
                baseType.isFourState());
        this.baseType = baseType;
        this.memberScope = new Scope(compilation, this, parent, parentLocation);
    }

    public SvType getBaseType() {
        return baseType;
    }

    public Scope getMemberScope() {
        return memberScope;
    }

    public List<EnumValueSymbol> getValues() {
        return Collections.unmodifiableList(values);
    }

    /**
     * 无基类型时默认为 int；基类型必须是简单位向量。
     * 成员值依次递增：首个为 0，无初始值的成员取前一个值加一。
     */
    public static SvType fromSyntax(Compilation compilation, EnumTypeSyntax syntax,
                                    LookupLocation location, Scope scope, boolean forceSigned) {
        SvType base;
        SvType canonicalBase;
        if (syntax.getBaseType() == null) {
            base = compilation.getIntType();
            canonicalBase = base;
        } else {
            base = compilation.getType(syntax.getBaseType(), location, scope, forceSigned);
            canonicalBase = base.getCanonicalType();
            if (canonicalBase.isError()) return canonicalBase;

            if (!canonicalBase.isSimpleBitVector()) {
                scope.addDiag(DiagCode.INVALID_ENUM_BASE, syntax.getBaseType().getLocation()).addArg(base);
                return compilation.getErrorType();
            }
        }

        EnumType result = compilation.emplace(new EnumType(compilation, syntax.getLocation(), base, scope, location));
        result.setSyntax(syntax);

        int width = canonicalBase.getBitWidth();
        boolean signed = canonicalBase.isSigned();
        SvInt one = SvInt.of(width, 1, signed);
        SvInt current = SvInt.of(width, 0, signed);

        for (EnumTypeSyntax.EnumMemberSyntax member : syntax.getMembers()) {
            EnumValueSymbol ev = new EnumValueSymbol(member.getName(), member.getLocation(), result);
            ev.setSyntax(member);
            result.memberScope.addMember(ev);
            result.values.add(ev);

            if (member.getInitializer() == null) {
                ev.setValue(ConstantValue.of(current));
                current = current.add(one);
            } else {
                ev.setInitializer(member.getInitializer());
                ConstantValue cv = ev.getValue();
                current = cv.isInteger() ? cv.integer().add(one) : current.add(one);
            }
        }

        return PackedArrayType.applyDimensions(compilation, result, syntax.getDimensions(), location, scope);
    }

    @Override
    public <R> R accept(SvTypeVisitor<R> visitor) {
        return visitor.visitEnum(this);
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("enum{");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(values.get(i).getName());
        }
        return sb.append('}').toString();
    }
}
