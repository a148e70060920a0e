package com.veritype.compiler.analysis;

import com.veritype.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 语义诊断条目。创建后可继续追加参数与附注：
 * <pre>scope.addDiag(DiagCode.NOT_A_TYPE, loc).addArg(name);</pre>
 */
public final class SemanticDiagnostic {

    private final DiagCode code;
    private final SourceLocation location;
    private final List<Object> args = new ArrayList<Object>();
    private final List<SemanticDiagnostic> notes = new ArrayList<SemanticDiagnostic>();

    public SemanticDiagnostic(DiagCode code, SourceLocation location) {
        this.code = code;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public DiagCode getCode() { return code; }
    public DiagCode.Severity getSeverity() { return code.getSeverity(); }
    public SourceLocation getLocation() { return location; }
    public List<Object> getArgs() { return Collections.unmodifiableList(args); }
    public List<SemanticDiagnostic> getNotes() { return Collections.unmodifiableList(notes); }

    public boolean isError() {
        return code.getSeverity() == DiagCode.Severity.ERROR;
    }

    /** 追加一个消息参数；类型参数以其 toString（即展示名）插入 */
    public SemanticDiagnostic addArg(Object arg) {
        args.add(arg);
        return this;
    }

    public SemanticDiagnostic addNote(DiagCode noteCode, SourceLocation noteLocation) {
        SemanticDiagnostic note = new SemanticDiagnostic(noteCode, noteLocation);
        notes.add(note);
        return note;
    }

    public String getMessage() {
        String template = code.getTemplate();
        int placeholders = 0;
        for (int i = template.indexOf("%s"); i >= 0; i = template.indexOf("%s", i + 2)) {
            placeholders++;
        }
        Object[] values = new Object[placeholders];
        for (int i = 0; i < placeholders; i++) {
            values[i] = i < args.size() ? args.get(i) : "?";
        }
        return String.format(template, values);
    }

    @Override
    public String toString() {
        return location + ": " + code.getSeverity().name().toLowerCase() + ": " + getMessage()
                + " [" + code.getCodeName() + "]";
    }
}
