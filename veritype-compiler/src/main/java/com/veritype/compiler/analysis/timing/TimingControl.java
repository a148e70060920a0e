package com.veritype.compiler.analysis.timing;

import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.analysis.BindContext;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.ast.timing.CycleDelaySyntax;
import com.veritype.compiler.ast.timing.DelaySyntax;
import com.veritype.compiler.ast.timing.EventControlSyntax;
import com.veritype.compiler.ast.timing.EventControlWithExpressionSyntax;
import com.veritype.compiler.ast.timing.TimingControlSyntax;

/**
 * 绑定后的时序控制：#延迟、@信号、@(事件列表)。
 * 绑定失败时返回 InvalidTimingControl，诊断已经报告。
 */
public abstract class TimingControl {

    public enum Kind {
        INVALID,
        DELAY,
        SIGNAL_EVENT,
        EVENT_LIST
    }

    private final Kind kind;
    private TimingControlSyntax syntax;

    protected TimingControl(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public TimingControlSyntax getSyntax() {
        return syntax;
    }

    public boolean isBad() {
        return kind == Kind.INVALID;
    }

    public static TimingControl bind(TimingControlSyntax syntax, BindContext context) {
        TimingControl result;
        if (syntax instanceof DelaySyntax) {
            result = DelayControl.fromSyntax((DelaySyntax) syntax, context);
        } else if (syntax instanceof EventControlSyntax) {
            result = SignalEventControl.fromSyntax((EventControlSyntax) syntax, context);
        } else if (syntax instanceof EventControlWithExpressionSyntax) {
            result = EventListControl.fromSyntax(((EventControlWithExpressionSyntax) syntax).getExpr(), context);
        } else if (syntax instanceof CycleDelaySyntax) {
            context.addDiag(DiagCode.NOT_YET_SUPPORTED, syntax.getLocation());
            result = new InvalidTimingControl(null);
        } else {
            throw InternalCompilerError.unreachable(syntax.getClass().getSimpleName());
        }

        result.syntax = syntax;
        return result;
    }
}
