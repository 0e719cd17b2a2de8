package org.pragmatica.authz.schema;

import io.vavr.control.Option;

/**
 * Allowed subject types of a relation.
 *
 * <p>Consumers go through {@link Visitor}, so adding a variant breaks every consumer at compile time.
 */
public sealed interface RelationExpression {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitSingle(SingleRelation single);

        R visitUnion(UnionRelation union);
    }

    /**
     * One subject type: {@code user}, {@code tenant/user} or {@code group#member}.
     */
    record SingleRelation(String typeValue, Option<String> subjectFragment) implements RelationExpression {

        public static SingleRelation of(String typeValue) {
            return new SingleRelation(typeValue, Option.none());
        }

        public static SingleRelation of(String typeValue, String fragment) {
            return new SingleRelation(typeValue, Option.some(fragment));
        }

        /**
         * {@code type} or {@code type#fragment}.
         */
        public String render() {
            return subjectFragment.map(fragment -> typeValue + "#" + fragment)
                                  .getOrElse(typeValue);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSingle(this);
        }
    }

    /**
     * {@code left | right}. Chains nest to the left.
     */
    record UnionRelation(RelationExpression left, RelationExpression right) implements RelationExpression {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnion(this);
        }
    }
}
