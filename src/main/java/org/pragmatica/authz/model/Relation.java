package org.pragmatica.authz.model;

import java.util.List;

/**
 * @param types allowed subject types, left to right, each {@code type} or {@code type#fragment}
 * @param union true when more than one subject type is allowed
 */
public record Relation(String name, List<String> types, boolean union) {

    public Relation {
        types = List.copyOf(types);
    }

    public static Relation of(String name, List<String> types) {
        return new Relation(name, types, types.size() > 1);
    }
}
