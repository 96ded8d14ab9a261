package org.psfront.syntax;

import org.psfront.syntax.Token.TokenType;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Token-to-value conversions shared by the value and binder parsers.
 */
final class Literals {

    private Literals() {
    }

    /**
     * Consumes a numeric token. Integral text becomes a BigInteger, anything
     * with a fraction or exponent a BigDecimal, so no digits are lost.
     */
    static Number number(ParseContext ctx, String label) {
        if (ctx.check(TokenType.INTEGER_LITERAL)) {
            return new BigInteger(ctx.advance().value());
        }
        return new BigDecimal(ctx.expect(TokenType.FLOAT_LITERAL, label, "Expected number").value());
    }
}
