package org.pragmatica.authz.generator;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out distinct Java names within one scope. The first claim of a candidate gets it unchanged,
 * later claims get a numeric suffix starting at {@code 2}: {@code Owner}, {@code Owner2}, {@code Owner3}.
 *
 * <p>Not thread-safe; one instance lives for the rendering of one scope.
 */
final class UniqueNames {
    private final Set<String> used = new HashSet<>();

    String claim(String candidate) {
        var name = candidate;
        for (int n = 2; !used.add(name); n++) {
            name = candidate + n;
        }
        return name;
    }
}
