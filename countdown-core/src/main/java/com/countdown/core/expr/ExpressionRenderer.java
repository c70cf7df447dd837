package com.countdown.core.expr;

/**
 * Minimal infix rendering. A child is bracketed when its operator binds more loosely than its
 * parent's, and a right child of equal precedence is bracketed unless both operators are
 * commutative, so {@code 5 - (3 + 7)} and {@code 5 - 3 + 7} stay distinct while
 * {@code 1 + (2 + 3)} and {@code (1 + 2) + 3} share the rendering {@code 1 + 2 + 3}.
 */
final class ExpressionRenderer {

    private ExpressionRenderer() {
    }

    static String render(Node node) {
        StringBuilder builder = new StringBuilder();
        append(builder, node);
        return builder.toString();
    }

    private static void append(StringBuilder builder, Node node) {
        if (node instanceof NumberLeaf leaf) {
            builder.append(leaf.value());
            return;
        }
        BinaryOp op = (BinaryOp) node;
        appendChild(builder, op.left(), op.operator(), false);
        builder.append(' ').append(op.operator().symbol()).append(' ');
        appendChild(builder, op.right(), op.operator(), true);
    }

    private static void appendChild(StringBuilder builder, Node child, Operator parent, boolean rightOperand) {
        boolean bracket = child instanceof BinaryOp op && needsBrackets(op.operator(), parent, rightOperand);
        if (bracket) {
            builder.append('(');
        }
        append(builder, child);
        if (bracket) {
            builder.append(')');
        }
    }

    private static boolean needsBrackets(Operator child, Operator parent, boolean rightOperand) {
        if (child.precedence() != parent.precedence()) {
            return child.precedence() < parent.precedence();
        }
        return rightOperand && !(parent.isCommutative() && child.isCommutative());
    }
}
