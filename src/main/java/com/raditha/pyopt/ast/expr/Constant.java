package com.raditha.pyopt.ast.expr;

import com.raditha.pyopt.ast.Expr;
import com.raditha.pyopt.ast.Node;
import com.raditha.pyopt.ast.NodeKind;
import com.raditha.pyopt.ast.NodeVisitor;
import com.raditha.pyopt.ast.Position;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A literal value. The literal is kept exactly as written in the source.
 */
public record Constant(Position position, ConstantKind constantKind, String literal) implements Expr {

    public static Constant integer(Position position, long value) {
        return new Constant(position, ConstantKind.INTEGER, Long.toString(value));
    }

    /**
     * Value of an integer literal. Handles underscores and the
     * {@code 0x}, {@code 0o} and {@code 0b} prefixes; arbitrary precision.
     *
     * @return the value, or empty if this is not an integer literal
     */
    public Optional<BigInteger> integerValue() {
        if (constantKind != ConstantKind.INTEGER) {
            return Optional.empty();
        }
        String digits = literal.replace("_", "").toLowerCase(Locale.ROOT);
        int radix = 10;
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            switch (digits.charAt(1)) {
                case 'x' -> radix = 16;
                case 'o' -> radix = 8;
                case 'b' -> radix = 2;
                default -> radix = 10;
            }
            if (radix != 10) {
                digits = digits.substring(2);
            }
        }
        try {
            return Optional.of(new BigInteger(digits, radix));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public boolean isNumeric() {
        return constantKind.isNumeric();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
