package com.veritype.compiler.ast.expr;

import com.veritype.compiler.ast.SourceLocation;

/**
 * 一元表达式
 */
public final class UnaryExpressionSyntax extends ExpressionSyntax {

    public enum UnaryOp {
        PLUS("+"), MINUS("-"), BITWISE_NOT("~");

        private final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public static UnaryOp fromSymbol(String symbol) {
            for (UnaryOp op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            return null;
        }
    }

    private final UnaryOp operator;
    private final ExpressionSyntax operand;

    public UnaryExpressionSyntax(SourceLocation location, UnaryOp operator, ExpressionSyntax operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public ExpressionSyntax getOperand() {
        return operand;
    }
}
