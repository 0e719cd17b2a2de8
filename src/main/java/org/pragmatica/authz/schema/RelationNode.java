package org.pragmatica.authz.schema;

import org.pragmatica.authz.tree.SourceLocation;

/**
 * {@code relation name: expression}
 */
public record RelationNode(SourceLocation location, String name, RelationExpression expression) {}
