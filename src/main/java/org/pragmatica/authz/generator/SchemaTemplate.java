package org.pragmatica.authz.generator;

import io.vavr.control.Either;
import org.pragmatica.authz.error.CompileError;
import org.pragmatica.authz.model.Definition;
import org.pragmatica.authz.model.Permission;
import org.pragmatica.authz.model.Relation;
import org.pragmatica.authz.model.Schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.pragmatica.authz.generator.TemplateHelpers.camelCase;
import static org.pragmatica.authz.generator.TemplateHelpers.constantName;
import static org.pragmatica.authz.generator.TemplateHelpers.fragment;
import static org.pragmatica.authz.generator.TemplateHelpers.literal;
import static org.pragmatica.authz.generator.TemplateHelpers.lowerCamelCase;
import static org.pragmatica.authz.generator.TemplateHelpers.objectType;
import static org.pragmatica.authz.generator.TemplateHelpers.typeName;

/**
 * Renders a whole {@link Schema} into one Java compilation unit.
 *
 * <p>Output is not indented carefully; {@link SourceFormatter} takes care of layout.
 */
public final class SchemaTemplate {
    public static final String HEADER_COMMENT = "// Code generated by authz-codegen. DO NOT EDIT.";

    // Simple type names the unit refers to; a nested class with one of these names would hide it
    private static final Set<String> RESERVED_TYPES = Set.of(
        "ObjectReference", "SubjectReference", "RelationshipTuple", "AuthzClient",
        "List", "Objects", "Collectors",
        "String", "Object", "Override", "Record", "Enum", "Deprecated", "SuppressWarnings");

    private static final String UNIT_START = """
        %1$s

        package %2$s;

        import java.util.List;
        import java.util.Objects;
        import java.util.stream.Collectors;

        /**
         * Typed bindings for the authorization schema in package {@code %2$s}.
         */
        public final class %3$s {

        private %3$s() {}

        """;

    private static final String SHARED_TYPES_BLOCK = """
        /**
         * Object in the permission system, identified by type and id.
         */
        public record ObjectReference(String type, String id) {
        public ObjectReference {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        }
        }

        /**
         * Subject of a relationship: an object, optionally narrowed to one of its relations.
         */
        public record SubjectReference(ObjectReference object, String relation) {
        public static SubjectReference of(String type, String id) {
        return new SubjectReference(new ObjectReference(type, id), null);
        }

        public static SubjectReference of(String type, String id, String relation) {
        return new SubjectReference(new ObjectReference(type, id), relation);
        }
        }

        public record RelationshipTuple(ObjectReference resource, String relation, SubjectReference subject) {}

        /**
         * Permission system operations the generated bindings delegate to.
         */
        public interface AuthzClient {
        void writeRelationship(RelationshipTuple tuple);

        void deleteRelationship(RelationshipTuple tuple);

        List<RelationshipTuple> readRelationships(ObjectReference resource, String relation);

        boolean checkPermission(ObjectReference resource, String permission, SubjectReference subject);

        List<String> lookupResources(String resourceType, String permission, SubjectReference subject);
        }

        """;

    private static final String DEFINITION_START = """
        /**
         * Definition {@code %1$s}.
         */
        public static final class %2$s {
        public static final String TYPE = %3$s;
        """;

    private static final String CONSTANT = """
        public static final String %s = %s;
        """;

    private static final String IDENTITY = """

        private final ObjectReference reference;

        private %1$s(String id) {
        this.reference = new ObjectReference(TYPE, id);
        }

        public static %1$s of(String id) {
        return new %1$s(id);
        }

        public String id() {
        return reference.id();
        }

        public ObjectReference reference() {
        return reference;
        }

        public SubjectReference asSubject() {
        return new SubjectReference(reference, null);
        }

        public SubjectReference asSubject(String relation) {
        return new SubjectReference(reference, relation);
        }
        """;

    private static final String RELATION_SUBJECT = """

        /**
         * Relation {@code %1$s: %2$s}, subject {@code %3$s}.
         */
        public void add%4$s(AuthzClient client, String %5$s) {
        client.writeRelationship(new RelationshipTuple(reference, %6$s, %7$s));
        }

        public void remove%4$s(AuthzClient client, String %5$s) {
        client.deleteRelationship(new RelationshipTuple(reference, %6$s, %7$s));
        }

        public boolean check%4$s(AuthzClient client, String %5$s) {
        return client.checkPermission(reference, %6$s, %7$s);
        }
        """;

    private static final String RELATION_READ = """

        public List<RelationshipTuple> read%1$s(AuthzClient client) {
        return client.readRelationships(reference, %2$s);
        }
        """;

    private static final String PERMISSION = """

        /**
         * Checks {@code %1$s = %2$s}.
         */
        public boolean check%3$s(AuthzClient client, SubjectReference subject) {
        return client.checkPermission(reference, %4$s, subject);
        }

        /**
         * Resources of this type on which {@code subject} holds {@code %1$s}.
         */
        public static List<%5$s> lookup%3$sResources(AuthzClient client, SubjectReference subject) {
        return client.lookupResources(TYPE, %4$s, subject).stream()
        .map(%5$s::of)
        .collect(Collectors.toList());
        }
        """;

    private static final String BLOCK_END = """
        }

        """;

    /**
     * Render the schema. Definitions are emitted in the order given; callers sort beforehand.
     */
    public Either<CompileError, String> render(Schema schema) {
        var packageName = schema.packageName();
        if (!TemplateHelpers.isValidPackageName(packageName)) {
            return Either.left(new CompileError.TemplateError(
                "package name '" + packageName + "' is not a valid Java package name"));
        }
        var className = unitClassName(packageName);

        var sb = new StringBuilder();
        sb.append(UNIT_START.formatted(HEADER_COMMENT, packageName, className));
        sb.append(SHARED_TYPES_BLOCK);

        var classNames = definitionClassNames(schema.definitions(), className);
        for (var definition : schema.definitions()) {
            renderDefinition(sb, definition, classNames.get(definition.objectType()));
        }

        sb.append("}\n");
        return Either.right(sb.toString());
    }

    /**
     * Name of the generated top-level class: {@code tenant_acl} becomes {@code TenantAcl}. A segment
     * camel-casing to a type name the unit refers to gets an {@code Authz} suffix, one not starting with a
     * letter after camel-casing gets an {@code Authz} prefix.
     */
    public static String unitClassName(String packageName) {
        var lastDot = packageName.lastIndexOf('.');
        var name = typeIdentifier(camelCase(packageName.substring(lastDot + 1)), "Authz");
        return RESERVED_TYPES.contains(name) ? name + "Authz" : name;
    }

    /**
     * Nested class name per object type. Names shared by several definitions get the prefix prepended,
     * names clashing with a type the unit refers to or with the enclosing class get a {@code Definition}
     * suffix. Whatever still collides is numbered.
     */
    static Map<String, String> definitionClassNames(List<Definition> definitions, String unitClassName) {
        var counts = new HashMap<String, Integer>();
        for (var definition : definitions) {
            counts.merge(camelCase(definition.name()), 1, Integer::sum);
        }

        var used = new UniqueNames();
        used.claim(unitClassName);
        var names = new LinkedHashMap<String, String>();
        for (var definition : definitions) {
            var name = camelCase(definition.name());
            if (counts.get(name) > 1) {
                name = camelCase(definition.packageName()) + name;
            }
            name = typeIdentifier(name, "Definition");
            if (RESERVED_TYPES.contains(name) || name.equals(unitClassName)) {
                name = name + "Definition";
            }
            names.put(definition.objectType(), used.claim(name));
        }
        return names;
    }

    // Camel-cased names may be empty or start with a digit: "_" and "_1st"
    private static String typeIdentifier(String name, String prefix) {
        return name.isEmpty() || !Character.isLetter(name.charAt(0)) ? prefix + name : name;
    }

    private static void renderDefinition(StringBuilder sb, Definition definition, String className) {
        sb.append(DEFINITION_START.formatted(definition.objectType(), className, literal(definition.objectType())));

        var constants = new UniqueNames();
        var relationConstants = new ArrayList<String>();
        for (var relation : definition.relations()) {
            var constant = constants.claim("RELATION_" + constantName(relation.name()));
            relationConstants.add(constant);
            sb.append(CONSTANT.formatted(constant, literal(relation.name())));
        }
        var permissionConstants = new ArrayList<String>();
        for (var permission : definition.permissions()) {
            var constant = constants.claim("PERMISSION_" + constantName(permission.name()));
            permissionConstants.add(constant);
            sb.append(CONSTANT.formatted(constant, literal(permission.name())));
        }
        sb.append(IDENTITY.formatted(className));

        var relationStems = new UniqueNames();
        var subjectStems = new UniqueNames();
        for (int i = 0; i < definition.relations().size(); i++) {
            var relation = definition.relations().get(i);
            renderRelation(sb,
                           relation,
                           relationConstants.get(i),
                           relationStems.claim(camelCase(relation.name())),
                           subjectStems);
        }
        var permissionStems = new UniqueNames();
        for (int i = 0; i < definition.permissions().size(); i++) {
            var permission = definition.permissions().get(i);
            renderPermission(sb,
                             permission,
                             permissionConstants.get(i),
                             permissionStems.claim(camelCase(permission.name())),
                             className);
        }
        sb.append(BLOCK_END);
    }

    private static void renderRelation(StringBuilder sb,
                                       Relation relation,
                                       String constant,
                                       String relationStem,
                                       UniqueNames subjectStems) {
        var declaration = String.join(" | ", relation.types());
        var subjectTypes = relation.types().stream().distinct().collect(Collectors.toList());

        // Subject types differing only in their prefix keep the prefix in the method name
        var bareCounts = new HashMap<String, Integer>();
        for (var subjectType : subjectTypes) {
            bareCounts.merge(bareSubjectName(subjectType), 1, Integer::sum);
        }

        for (var subjectType : subjectTypes) {
            var bareName = bareSubjectName(subjectType);
            var prefix = bareCounts.get(bareName) > 1 ? camelCase(subjectPrefix(subjectType)) : "";
            var stem = subjectStems.claim(relationStem + prefix + bareName);
            var parameter = parameterName(typeName(subjectType));
            sb.append(RELATION_SUBJECT.formatted(relation.name(),
                                                 declaration,
                                                 subjectType,
                                                 stem,
                                                 parameter,
                                                 constant,
                                                 subjectReference(subjectType, parameter)));
        }
        sb.append(RELATION_READ.formatted(relationStem, constant));
    }

    private static String bareSubjectName(String subjectType) {
        return camelCase(typeName(subjectType)) + fragment(subjectType).map(TemplateHelpers::camelCase).getOrElse("");
    }

    private static String subjectPrefix(String subjectType) {
        var objectType = objectType(subjectType);
        var slash = objectType.indexOf('/');
        return slash < 0 ? "" : objectType.substring(0, slash);
    }

    private static String parameterName(String subjectName) {
        var name = lowerCamelCase(subjectName);
        return name.isEmpty() || !Character.isLetter(name.charAt(0)) ? "subjectId" : name + "Id";
    }

    private static String subjectReference(String subjectType, String parameter) {
        var type = literal(objectType(subjectType));
        return fragment(subjectType)
            .map(relation -> "SubjectReference.of(" + type + ", " + parameter + ", " + literal(relation) + ")")
            .getOrElse(() -> "SubjectReference.of(" + type + ", " + parameter + ")");
    }

    private static void renderPermission(StringBuilder sb,
                                         Permission permission,
                                         String constant,
                                         String stem,
                                         String className) {
        sb.append(PERMISSION.formatted(permission.name(),
                                       permission.expressionText(),
                                       stem,
                                       constant,
                                       className));
    }
}
