package com.veritype.compiler.analysis.timing;

import com.veritype.compiler.analysis.BindContext;
import com.veritype.compiler.analysis.BoundExpression;
import com.veritype.compiler.analysis.DiagCode;
import com.veritype.compiler.ast.timing.DelaySyntax;

/**
 * #delay，延迟值必须是数值
 */
public final class DelayControl extends TimingControl {

    private final BoundExpression expr;

    public DelayControl(BoundExpression expr) {
        super(Kind.DELAY);
        this.expr = expr;
    }

    public BoundExpression getExpr() {
        return expr;
    }

    public static TimingControl fromSyntax(DelaySyntax syntax, BindContext context) {
        BoundExpression expr = context.bind(syntax.getDelayValue());
        DelayControl result = new DelayControl(expr);
        if (expr.isBad()) return new InvalidTimingControl(result);

        if (!expr.getType().isNumeric()) {
            context.addDiag(DiagCode.DELAY_NOT_NUMERIC, expr.getLocation()).addArg(expr.getType());
            return new InvalidTimingControl(result);
        }
        return result;
    }
}
