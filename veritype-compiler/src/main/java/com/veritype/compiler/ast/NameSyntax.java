package com.veritype.compiler.ast;

import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.util.Collections;
import java.util.List;

/**
 * 名字引用（如 word_t 或 word_t[3:0]），选择器按源码顺序保存
 */
public final class NameSyntax extends AstNode {
    private final String identifier;
    private final List<VariableDimensionSyntax> selectors;

    public NameSyntax(SourceLocation location, String identifier) {
        this(location, identifier, Collections.<VariableDimensionSyntax>emptyList());
    }

    public NameSyntax(SourceLocation location, String identifier, List<VariableDimensionSyntax> selectors) {
        super(location);
        this.identifier = identifier;
        this.selectors = selectors;
    }

    public String getIdentifier() {
        return identifier;
    }

    public List<VariableDimensionSyntax> getSelectors() {
        return selectors;
    }

    @Override
    public String toString() {
        return identifier;
    }
}
