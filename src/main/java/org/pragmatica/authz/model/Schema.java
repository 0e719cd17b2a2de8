package org.pragmatica.authz.model;

import java.util.Comparator;
import java.util.List;

/**
 * Generator-facing view of one compiled schema document.
 *
 * @param packageName package shared by every definition of the document
 * @param definitions definitions in source order
 */
public record Schema(String packageName, List<Definition> definitions) {

    public Schema {
        definitions = List.copyOf(definitions);
    }

    /**
     * Same schema with definitions ordered by name, for output that does not depend on source order.
     */
    public Schema sortedByName() {
        var sorted = definitions.stream()
                                .sorted(Comparator.comparing(Definition::name)
                                                  .thenComparing(Definition::objectType))
                                .toList();
        return new Schema(packageName, sorted);
    }
}
