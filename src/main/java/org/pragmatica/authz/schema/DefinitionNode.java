package org.pragmatica.authz.schema;

import org.pragmatica.authz.tree.SourceLocation;

import java.util.List;

/**
 * A {@code definition} block. Relations and permissions keep their source order.
 */
public record DefinitionNode(
    SourceLocation location,
    ObjectTypeRef objectType,
    List<RelationNode> relations,
    List<PermissionNode> permissions) {

    public DefinitionNode {
        relations = List.copyOf(relations);
        permissions = List.copyOf(permissions);
    }
}
