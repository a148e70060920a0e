package com.veritype.compiler.analysis;

import com.veritype.compiler.ast.type.VariableDimensionSyntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 名字查找结果：找到的符号、名字上的选择器、查找过程中产生的诊断（尚未提交）
 */
public final class LookupResult {
    private Symbol found;
    private List<VariableDimensionSyntax> selectors = Collections.emptyList();
    private final List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();

    public Symbol getFound() { return found; }
    void setFound(Symbol found) { this.found = found; }

    public List<VariableDimensionSyntax> getSelectors() { return selectors; }
    void setSelectors(List<VariableDimensionSyntax> selectors) { this.selectors = selectors; }

    public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }

    void addDiagnostic(SemanticDiagnostic diag) {
        diagnostics.add(diag);
    }

    public boolean hasError() {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }
}
