package org.pragmatica.authz.generator;

import io.vavr.control.Option;

import javax.lang.model.SourceVersion;
import java.util.Locale;

/**
 * Naming functions available to {@link SchemaTemplate}.
 */
public final class TemplateHelpers {

    private TemplateHelpers() {}

    /**
     * Split on {@code -}, {@code _} and spaces, title-case each word and concatenate:
     * {@code can_view} becomes {@code CanView}.
     */
    public static String camelCase(String value) {
        var sb = new StringBuilder(value.length());
        for (var word : value.trim().split("[-_ ]+")) {
            if (word.isEmpty()) {
                continue;
            }
            sb.append(Character.toUpperCase(word.charAt(0)))
              .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /**
     * {@link #camelCase(String)} with a lower-case first letter.
     */
    public static String lowerCamelCase(String value) {
        var camel = camelCase(value);
        if (camel.isEmpty()) {
            return camel;
        }
        return Character.toLowerCase(camel.charAt(0)) + camel.substring(1);
    }

    /**
     * Bare type name of a subject type entry: {@code tenant/user#member} becomes {@code user}.
     */
    public static String typeName(String subjectType) {
        var typeName = objectType(subjectType);
        var slash = typeName.indexOf('/');
        return slash < 0 ? typeName : typeName.substring(slash + 1);
    }

    /**
     * Subject type entry without its relation fragment: {@code tenant/user#member} becomes {@code tenant/user}.
     */
    public static String objectType(String subjectType) {
        var hash = subjectType.indexOf('#');
        return hash < 0 ? subjectType : subjectType.substring(0, hash);
    }

    public static Option<String> fragment(String subjectType) {
        var hash = subjectType.indexOf('#');
        return hash < 0 ? Option.none() : Option.some(subjectType.substring(hash + 1));
    }

    public static String constantName(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    public static boolean isValidPackageName(String packageName) {
        return SourceVersion.isName(packageName);
    }

    /**
     * Escape a value for use inside a Java string literal.
     */
    public static String literal(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
