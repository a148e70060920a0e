package com.veritype.compiler.analysis.timing;

import com.veritype.compiler.analysis.BindContext;
import com.veritype.compiler.analysis.BoundExpression;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.ast.timing.EventControlSyntax;
import com.veritype.compiler.ast.timing.SignalEventExpressionSyntax;

/**
 * @signal 或 @(posedge signal)。
 * 无边沿时不接受 unpacked 聚合类型；有边沿时必须是整数类型；常量表达式给出警告。
 */
public final class SignalEventControl extends TimingControl {

    private final EdgeKind edge;
    private final BoundExpression expr;

    public SignalEventControl(EdgeKind edge, BoundExpression expr) {
        super(Kind.SIGNAL_EVENT);
        this.edge = edge;
        this.expr = expr;
    }

    public EdgeKind getEdge() {
        return edge;
    }

    public BoundExpression getExpr() {
        return expr;
    }

    public static TimingControl fromSyntax(SignalEventExpressionSyntax syntax, BindContext context) {
        return fromExpr(EdgeKind.fromSyntax(syntax.getEdge()), context.bind(syntax.getExpr()), context);
    }

    public static TimingControl fromSyntax(EventControlSyntax syntax, BindContext context) {
        return fromExpr(EdgeKind.NONE, context.bind(syntax.getEventName()), context);
    }

    static TimingControl fromExpr(EdgeKind edge, BoundExpression expr, BindContext context) {
        SignalEventControl result = new SignalEventControl(edge, expr);
        if (expr.isBad()) return new InvalidTimingControl(result);

        if (edge == EdgeKind.NONE) {
            if (expr.getType().isAggregate()) {
                context.addDiag(DiagCode.INVALID_EVENT_EXPRESSION, expr.getLocation()).addArg(expr.getType());
                return new InvalidTimingControl(result);
            }
        } else if (!expr.getType().isIntegral()) {
            context.addDiag(DiagCode.INVALID_EDGE_EVENT_EXPRESSION, expr.getLocation());
            return new InvalidTimingControl(result);
        }

        // 常量永远不会变化，事件不会触发
        if (expr.isConstant()) {
            context.addDiag(DiagCode.EVENT_EXPRESSION_CONSTANT, expr.getLocation());
        }
        return result;
    }
}
