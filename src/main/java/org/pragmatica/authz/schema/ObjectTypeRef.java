package org.pragmatica.authz.schema;

/**
 * Object type named by a definition: {@code user} (standard form) or {@code tenant/user}.
 * The prefix is empty for the standard form.
 */
public record ObjectTypeRef(String name, String prefix) {

    public static ObjectTypeRef standard(String name) {
        return new ObjectTypeRef(name, "");
    }

    public static ObjectTypeRef prefixed(String prefix, String name) {
        return new ObjectTypeRef(name, prefix);
    }

    public boolean isPrefixed() {
        return !prefix.isEmpty();
    }

    public String qualifiedName() {
        return isPrefixed() ? prefix + "/" + name : name;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
