package org.psfront.syntax.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Numeric literal: 42, 3.14, 1e10
 *
 * @param value A BigInteger for integral literals, a BigDecimal otherwise
 */
public record NumericLiteral(Number value) implements Value {

    public NumericLiteral {
        Objects.requireNonNull(value, "Value cannot be null");
        if (!(value instanceof BigInteger) && !(value instanceof BigDecimal)) {
            throw new IllegalArgumentException("Numeric literal must be BigInteger or BigDecimal, got: "
                    + value.getClass().getSimpleName());
        }
    }

    public static NumericLiteral integer(long value) {
        return new NumericLiteral(BigInteger.valueOf(value));
    }

    public static NumericLiteral decimal(String text) {
        return new NumericLiteral(new BigDecimal(text));
    }
}
