package com.veritype.compiler.ast.expr;

import com.veritype.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public final class BinaryExpressionSyntax extends ExpressionSyntax {

    public enum BinaryOp {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
        SHIFT_LEFT("<<"), SHIFT_RIGHT(">>");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public static BinaryOp fromSymbol(String symbol) {
            for (BinaryOp op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            return null;
        }
    }

    private final BinaryOp operator;
    private final ExpressionSyntax left;
    private final ExpressionSyntax right;

    public BinaryExpressionSyntax(SourceLocation location, BinaryOp operator,
                                  ExpressionSyntax left, ExpressionSyntax right) {
        super(location);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public ExpressionSyntax getLeft() {
        return left;
    }

    public ExpressionSyntax getRight() {
        return right;
    }
}
