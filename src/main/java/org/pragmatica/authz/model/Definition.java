package org.pragmatica.authz.model;

import java.util.List;

/**
 * @param name        bare type name, without prefix
 * @param packageName object type prefix, or the default package for unprefixed types
 * @param objectType  full type as written in the schema, e.g. {@code tenant/document}
 */
public record Definition(
    String name,
    String packageName,
    String objectType,
    List<Relation> relations,
    List<Permission> permissions) {

    public Definition {
        relations = List.copyOf(relations);
        permissions = List.copyOf(permissions);
    }
}
