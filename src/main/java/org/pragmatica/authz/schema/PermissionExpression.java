package org.pragmatica.authz.schema;

/**
 * Permission body built from identifiers, {@code +} (union) and {@code ->} (tupleset traversal).
 */
public sealed interface PermissionExpression {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitIdentifier(Identifier identifier);

        R visitBinary(BinaryOp binary);
    }

    enum Operator {
        UNION("+"),
        ARROW("->");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * Reference to a relation or permission of the same definition.
     */
    record Identifier(String name) implements PermissionExpression {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    record BinaryOp(Operator operator, PermissionExpression left, PermissionExpression right)
        implements PermissionExpression {

        public static BinaryOp union(PermissionExpression left, PermissionExpression right) {
            return new BinaryOp(Operator.UNION, left, right);
        }

        public static BinaryOp arrow(PermissionExpression left, PermissionExpression right) {
            return new BinaryOp(Operator.ARROW, left, right);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }
}
