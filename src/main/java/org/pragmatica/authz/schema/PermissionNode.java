package org.pragmatica.authz.schema;

import org.pragmatica.authz.tree.SourceLocation;

/**
 * {@code permission name = expression}
 */
public record PermissionNode(SourceLocation location, String name, PermissionExpression expression) {}
