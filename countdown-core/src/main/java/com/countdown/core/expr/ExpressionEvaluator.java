package com.countdown.core.expr;

/**
 * Integer evaluation under Countdown rules: every intermediate result must be a positive whole
 * number.
 */
final class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    static Evaluation evaluate(Node node) {
        if (node instanceof NumberLeaf leaf) {
            return Evaluation.of(leaf.value());
        }
        BinaryOp op = (BinaryOp) node;
        Evaluation left = evaluate(op.left());
        if (!left.isValid()) {
            return left;
        }
        Evaluation right = evaluate(op.right());
        if (!right.isValid()) {
            return right;
        }
        return apply(op.operator(), left.orElseThrow(), right.orElseThrow());
    }

    private static Evaluation apply(Operator operator, int a, int b) {
        return switch (operator) {
            case ADD -> exact((long) a + b, operator);
            case SUBTRACT -> a <= b
                    ? Evaluation.failure(EvaluationError.NON_POSITIVE_RESULT, operator)
                    : Evaluation.of(a - b);
            case MULTIPLY -> exact((long) a * b, operator);
            case DIVIDE -> {
                if (b == 0) {
                    yield Evaluation.failure(EvaluationError.DIVISION_BY_ZERO, operator);
                }
                if (a % b != 0) {
                    yield Evaluation.failure(EvaluationError.DIVISION_REMAINDER, operator);
                }
                yield Evaluation.of(a / b);
            }
        };
    }

    private static Evaluation exact(long result, Operator operator) {
        if (result > Integer.MAX_VALUE) {
            return Evaluation.failure(EvaluationError.OVERFLOW, operator);
        }
        return Evaluation.of((int) result);
    }
}
