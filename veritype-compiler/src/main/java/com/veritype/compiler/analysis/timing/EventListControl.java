package com.veritype.compiler.analysis.timing;

import com.veritype.compiler.InternalCompilerError;
import com.veritype.compiler.analysis.BindContext;
import com.veritype.compiler.ast.timing.BinaryEventExpressionSyntax;
import com.veritype.compiler.ast.timing.EventExpressionSyntax;
import com.veritype.compiler.ast.timing.ParenthesizedEventExpressionSyntax;
import com.veritype.compiler.ast.timing.SignalEventExpressionSyntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @(a or posedge b ...)：括号与 or 被展开成扁平的事件列表；只有一个事件时直接返回该事件
 */
public final class EventListControl extends TimingControl {

    private final List<TimingControl> events;

    public EventListControl(List<TimingControl> events) {
        super(Kind.EVENT_LIST);
        this.events = Collections.unmodifiableList(new ArrayList<TimingControl>(events));
    }

    public List<TimingControl> getEvents() {
        return events;
    }

    public static TimingControl fromSyntax(EventExpressionSyntax syntax, BindContext context) {
        List<TimingControl> events = new ArrayList<TimingControl>();
        collectEvents(context, syntax, events);

        if (events.size() == 1) return events.get(0);

        EventListControl result = new EventListControl(events);
        for (TimingControl event : events) {
            if (event.isBad()) return new InvalidTimingControl(result);
        }
        return result;
    }

    private static void collectEvents(BindContext context, EventExpressionSyntax expr, List<TimingControl> results) {
        if (expr instanceof ParenthesizedEventExpressionSyntax) {
            collectEvents(context, ((ParenthesizedEventExpressionSyntax) expr).getExpr(), results);
        } else if (expr instanceof SignalEventExpressionSyntax) {
            results.add(SignalEventControl.fromSyntax((SignalEventExpressionSyntax) expr, context));
        } else if (expr instanceof BinaryEventExpressionSyntax) {
            BinaryEventExpressionSyntax bin = (BinaryEventExpressionSyntax) expr;
            collectEvents(context, bin.getLeft(), results);
            collectEvents(context, bin.getRight(), results);
        } else {
            throw InternalCompilerError.unreachable(expr.getClass().getSimpleName());
        }
    }
}
