package org.pragmatica.authz.model;

import io.vavr.control.Either;
import org.pragmatica.authz.error.CompileError;
import org.pragmatica.authz.schema.DefinitionNode;
import org.pragmatica.authz.schema.PermissionExpression;
import org.pragmatica.authz.schema.RelationExpression;
import org.pragmatica.authz.tree.SourceLocation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;

/**
 * Turns parsed definitions into the flat {@link Schema} consumed by the generator.
 *
 * <p>The package of the whole document is taken from the first definition only. Definitions with
 * other prefixes still land in that package.
 */
public final class SchemaExtractor {
    public static final String DEFAULT_PACKAGE = "authz";

    private SchemaExtractor() {}

    public static Either<CompileError, Schema> extract(List<DefinitionNode> nodes) {
        return extract(nodes, DEFAULT_PACKAGE);
    }

    public static Either<CompileError, Schema> extract(List<DefinitionNode> nodes, String defaultPackage) {
        var seen = new HashMap<String, SourceLocation>();
        var definitions = new ArrayList<Definition>();

        for (var node : nodes) {
            var objectType = node.objectType().qualifiedName();
            var first = seen.putIfAbsent(objectType, node.location());
            if (first != null) {
                return Either.left(new CompileError.DuplicateDefinition(node.location(), objectType, first));
            }
            var definition = extractDefinition(node, defaultPackage);
            if (definition.isLeft()) {
                return Either.left(definition.getLeft());
            }
            definitions.add(definition.get());
        }

        var packageName = definitions.isEmpty()
                          ? defaultPackage
                          : definitions.get(0).packageName();
        return Either.right(new Schema(packageName, definitions));
    }

    private static Either<CompileError, Definition> extractDefinition(DefinitionNode node, String defaultPackage) {
        var objectType = node.objectType();
        var members = new HashSet<String>();
        var relations = new ArrayList<Relation>();
        var permissions = new ArrayList<Permission>();

        for (var relation : node.relations()) {
            if (!members.add(relation.name())) {
                return Either.left(new CompileError.DuplicateMember(relation.location(),
                                                                   objectType.qualifiedName(),
                                                                   relation.name()));
            }
            relations.add(Relation.of(relation.name(), flatten(relation.expression())));
        }
        for (var permission : node.permissions()) {
            if (!members.add(permission.name())) {
                return Either.left(new CompileError.DuplicateMember(permission.location(),
                                                                   objectType.qualifiedName(),
                                                                   permission.name()));
            }
            permissions.add(new Permission(permission.name(), render(permission.expression())));
        }

        relations.sort(Comparator.comparing(Relation::name));
        permissions.sort(Comparator.comparing(Permission::name));

        var packageName = objectType.isPrefixed() ? objectType.prefix() : defaultPackage;
        return Either.right(new Definition(objectType.name(),
                                           packageName,
                                           objectType.qualifiedName(),
                                           relations,
                                           permissions));
    }

    /**
     * Subject types of a relation expression in left-to-right order.
     */
    public static List<String> flatten(RelationExpression expression) {
        var types = new ArrayList<String>();
        expression.accept(new RelationExpression.Visitor<Void>() {
            @Override
            public Void visitSingle(RelationExpression.SingleRelation single) {
                types.add(single.render());
                return null;
            }

            @Override
            public Void visitUnion(RelationExpression.UnionRelation union) {
                union.left().accept(this);
                union.right().accept(this);
                return null;
            }
        });
        return List.copyOf(types);
    }

    /**
     * Canonical text of a permission expression. No simplification is applied.
     */
    public static String render(PermissionExpression expression) {
        return expression.accept(new PermissionExpression.Visitor<String>() {
            @Override
            public String visitIdentifier(PermissionExpression.Identifier identifier) {
                return identifier.name();
            }

            @Override
            public String visitBinary(PermissionExpression.BinaryOp binary) {
                return binary.left().accept(this) + " " + binary.operator().symbol() + " "
                       + binary.right().accept(this);
            }
        });
    }
}
