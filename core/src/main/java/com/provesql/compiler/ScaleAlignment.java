package com.provesql.compiler;

import com.provesql.column.ColumnType;
import com.provesql.column.ColumnTypeArithmetic;
import com.provesql.expression.BinaryExpression;
import com.provesql.provable.expr.ProvableExpression;
import com.provesql.provable.expr.ScalingCastExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the operands of a comparison or an addition to a common scale.
 *
 * <p>When both operands are numeric (Scalar excluded) and their scales differ,
 * the lower-scale operand is wrapped in a {@link ScalingCastExpr} to
 * {@code DECIMAL75(p + (maxScale - s), maxScale)}, where {@code p} and
 * {@code s} are its own precision and scale. Multiplication and the Boolean
 * connectives are never aligned.
 */
public final class ScaleAlignment {

    private static final Logger logger = LoggerFactory.getLogger(ScaleAlignment.class);

    private ScaleAlignment() {
        // Utility class - prevent instantiation
    }

    /**
     * Operands after alignment.
     *
     * @param lhs the left operand
     * @param rhs the right operand
     * @param scaled true if a scaling cast was inserted
     */
    public record Aligned(ProvableExpression lhs, ProvableExpression rhs, boolean scaled) {
    }

    /**
     * Returns true if the operator takes part in scale alignment.
     *
     * @param operator the source operator
     * @return true for = != &lt; &gt; &lt;= &gt;= + -
     */
    public static boolean appliesTo(BinaryExpression.Operator operator) {
        switch (operator) {
            case EQUAL:
            case NOT_EQUAL:
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
            case ADD:
            case SUBTRACT:
                return true;
            default:
                return false;
        }
    }

    /**
     * Aligns the scales of two compiled operands.
     *
     * @param operator the source operator
     * @param lhs the compiled left operand
     * @param rhs the compiled right operand
     * @return the aligned operands, unchanged if no cast is needed
     * @throws com.provesql.exception.ColumnOperationException if the operands cannot be
     *         combined even after scaling, or the widened type exceeds the precision limit
     */
    public static Aligned align(BinaryExpression.Operator operator, ProvableExpression lhs, ProvableExpression rhs) {
        ColumnType left = lhs.dataType();
        ColumnType right = rhs.dataType();

        if (!appliesTo(operator) || !isScalable(left) || !isScalable(right) || left.scale() == right.scale()) {
            return new Aligned(lhs, rhs, false);
        }

        checkWithScaling(operator, left, right);

        int maxScale = Math.max(left.scale(), right.scale());
        if (left.scale() < maxScale) {
            ColumnType target = widenedType(left, maxScale);
            logger.debug("Scaling left operand {} to {}", lhs, target);
            return new Aligned(ScalingCastExpr.tryNew(lhs, target), rhs, true);
        }
        ColumnType target = widenedType(right, maxScale);
        logger.debug("Scaling right operand {} to {}", rhs, target);
        return new Aligned(lhs, ScalingCastExpr.tryNew(rhs, target), true);
    }

    private static void checkWithScaling(BinaryExpression.Operator operator, ColumnType left, ColumnType right) {
        switch (operator) {
            case EQUAL:
            case NOT_EQUAL:
                ColumnTypeArithmetic.checkEqualsWithScaling(left, right);
                break;
            case ADD:
            case SUBTRACT:
                ColumnTypeArithmetic.addSubtractCapped(left, right);
                break;
            default:
                ColumnTypeArithmetic.checkInequalityWithScaling(left, right);
                break;
        }
    }

    private static ColumnType widenedType(ColumnType type, int scale) {
        return ColumnType.decimal75(type.precision() + (scale - type.scale()), scale);
    }

    private static boolean isScalable(ColumnType type) {
        return type.isNumeric() && type.kind() != ColumnType.Kind.SCALAR;
    }
}
