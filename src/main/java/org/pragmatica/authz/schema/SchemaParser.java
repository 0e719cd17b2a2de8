package org.pragmatica.authz.schema;

import io.vavr.control.Either;
import org.pragmatica.authz.error.CompileError;
import org.pragmatica.authz.schema.PermissionExpression.BinaryOp;
import org.pragmatica.authz.schema.PermissionExpression.Identifier;
import org.pragmatica.authz.schema.RelationExpression.SingleRelation;
import org.pragmatica.authz.schema.RelationExpression.UnionRelation;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the authorization schema language.
 *
 * <pre>
 * document    := definition* EOF
 * definition  := "definition" objectType "{" (relation | permission)* "}"
 * objectType  := IDENT ("/" IDENT)?
 * relation    := "relation" IDENT ":" relExpr
 * relExpr     := singleRel ("|" singleRel)*
 * singleRel   := IDENT ("/" IDENT)? ("#" IDENT)?
 * permission  := "permission" IDENT "=" permExpr
 * permExpr    := primary ("+" primary)*
 * primary     := IDENT ("->" IDENT)*
 * </pre>
 *
 * <p>The first error aborts parsing; no partial tree is returned.
 */
public final class SchemaParser {

    private final List<Token> tokens;
    private int pos;

    private SchemaParser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse schema text into definitions.
     */
    public static Either<CompileError, List<DefinitionNode>> parse(String schemaText) {
        return parse(SchemaLexer.tokenize(schemaText));
    }

    /**
     * Parse a token sequence into definitions. One node is produced per top-level {@code definition}.
     */
    public static Either<CompileError, List<DefinitionNode>> parse(List<Token> tokens) {
        return new SchemaParser(tokens).parseDocument();
    }

    /**
     * Parse a standalone permission expression such as {@code viewer + parent->view}.
     */
    public static Either<CompileError, PermissionExpression> parsePermissionExpression(String expressionText) {
        var parser = new SchemaParser(SchemaLexer.tokenize(expressionText));
        var expression = parser.parseAdditive();
        if (expression.isLeft()) {
            return expression;
        }
        var end = parser.consume(TokenKind.EOF, "expected end of permission expression");
        if (end.isLeft()) {
            return fail(end);
        }
        return expression;
    }

    private Either<CompileError, List<DefinitionNode>> parseDocument() {
        var definitions = new ArrayList<DefinitionNode>();

        while (!peek().is(TokenKind.EOF)) {
            var definition = parseDefinition();
            if (definition.isLeft()) {
                return fail(definition);
            }
            definitions.add(definition.get());
        }

        return Either.right(List.copyOf(definitions));
    }

    private Either<CompileError, DefinitionNode> parseDefinition() {
        var keyword = consume(TokenKind.DEFINITION, "expected 'definition' keyword");
        if (keyword.isLeft()) {
            return fail(keyword);
        }

        var objectType = parseObjectType();
        if (objectType.isLeft()) {
            return fail(objectType);
        }
        var typeName = objectType.get().qualifiedName();

        var open = consume(TokenKind.LBRACE, "expected '{' after object type '" + typeName + "'");
        if (open.isLeft()) {
            return fail(open);
        }

        var relations = new ArrayList<RelationNode>();
        var permissions = new ArrayList<PermissionNode>();

        while (peek().is(TokenKind.RELATION) || peek().is(TokenKind.PERMISSION)) {
            if (peek().is(TokenKind.RELATION)) {
                var relation = parseRelation();
                if (relation.isLeft()) {
                    return fail(relation);
                }
                relations.add(relation.get());
            } else {
                var permission = parsePermission();
                if (permission.isLeft()) {
                    return fail(permission);
                }
                permissions.add(permission.get());
            }
        }

        var close = consume(TokenKind.RBRACE, "expected '}' to close definition '" + typeName + "'");
        if (close.isLeft()) {
            return fail(close);
        }

        return Either.right(new DefinitionNode(keyword.get().location(), objectType.get(), relations, permissions));
    }

    // One token of lookahead after the first identifier picks the form
    private Either<CompileError, ObjectTypeRef> parseObjectType() {
        var first = consume(TokenKind.IDENTIFIER, "expected object type identifier after 'definition'");
        if (first.isLeft()) {
            return fail(first);
        }
        var identifier = first.get().text();

        if (peek().is(TokenKind.SLASH)) {
            advance();
            var name = consume(TokenKind.IDENTIFIER, "expected object type name after '" + identifier + "/'");
            if (name.isLeft()) {
                return fail(name);
            }
            return Either.right(ObjectTypeRef.prefixed(identifier, name.get().text()));
        }

        if (peek().is(TokenKind.LBRACE)) {
            return Either.right(ObjectTypeRef.standard(identifier));
        }

        return Either.left(new CompileError.MalformedObjectType(identifier, peek()));
    }

    private Either<CompileError, RelationNode> parseRelation() {
        var keyword = consume(TokenKind.RELATION, "failed to parse relation declaration");
        if (keyword.isLeft()) {
            return fail(keyword);
        }

        var name = consume(TokenKind.IDENTIFIER, "expected relation name after 'relation' keyword");
        if (name.isLeft()) {
            return fail(name);
        }
        var relationName = name.get().text();

        var colon = consume(TokenKind.COLON, "expected ':' after relation name '" + relationName + "'");
        if (colon.isLeft()) {
            return fail(colon);
        }

        var expression = parseRelationExpression();
        if (expression.isLeft()) {
            return fail(expression);
        }

        return Either.right(new RelationNode(keyword.get().location(), relationName, expression.get()));
    }

    private Either<CompileError, RelationExpression> parseRelationExpression() {
        var first = parseSingleRelation();
        if (first.isLeft()) {
            return fail(first);
        }
        RelationExpression left = first.get();

        while (peek().is(TokenKind.PIPE)) {
            advance();
            var right = parseSingleRelation();
            if (right.isLeft()) {
                return fail(right);
            }
            left = new UnionRelation(left, right.get());
        }

        return Either.right(left);
    }

    private Either<CompileError, SingleRelation> parseSingleRelation() {
        var type = consume(TokenKind.IDENTIFIER, "expected subject type in relation expression");
        if (type.isLeft()) {
            return fail(type);
        }
        var typeValue = type.get().text();

        if (peek().is(TokenKind.SLASH)) {
            advance();
            var name = consume(TokenKind.IDENTIFIER, "expected subject type name after '" + typeValue + "/'");
            if (name.isLeft()) {
                return fail(name);
            }
            typeValue = typeValue + "/" + name.get().text();
        }

        if (peek().is(TokenKind.HASH)) {
            advance();
            var fragment = consume(TokenKind.IDENTIFIER, "expected subject relation after '" + typeValue + "#'");
            if (fragment.isLeft()) {
                return fail(fragment);
            }
            return Either.right(SingleRelation.of(typeValue, fragment.get().text()));
        }

        return Either.right(SingleRelation.of(typeValue));
    }

    private Either<CompileError, PermissionNode> parsePermission() {
        var keyword = consume(TokenKind.PERMISSION, "failed to parse permission declaration");
        if (keyword.isLeft()) {
            return fail(keyword);
        }

        var name = consume(TokenKind.IDENTIFIER, "expected permission name after 'permission' keyword");
        if (name.isLeft()) {
            return fail(name);
        }
        var permissionName = name.get().text();

        var equal = consume(TokenKind.EQUAL, "expected '=' after permission name '" + permissionName + "'");
        if (equal.isLeft()) {
            return fail(equal);
        }

        var expression = parseAdditive();
        if (expression.isLeft()) {
            return fail(expression);
        }

        return Either.right(new PermissionNode(keyword.get().location(), permissionName, expression.get()));
    }

    private Either<CompileError, PermissionExpression> parseAdditive() {
        var first = parseArrowChain();
        if (first.isLeft()) {
            return first;
        }
        var left = first.get();

        while (peek().is(TokenKind.PLUS)) {
            advance();
            var right = parseArrowChain();
            if (right.isLeft()) {
                return right;
            }
            left = BinaryOp.union(left, right.get());
        }

        return Either.right(left);
    }

    private Either<CompileError, PermissionExpression> parseArrowChain() {
        var first = consume(TokenKind.IDENTIFIER, "expected identifier in permission expression");
        if (first.isLeft()) {
            return fail(first);
        }
        PermissionExpression left = new Identifier(first.get().text());

        while (peek().is(TokenKind.ARROW)) {
            advance();
            var target = consume(TokenKind.IDENTIFIER, "expected relation or permission name after '->'");
            if (target.isLeft()) {
                return fail(target);
            }
            left = BinaryOp.arrow(left, new Identifier(target.get().text()));
        }

        return Either.right(left);
    }

    // Token lists not produced by SchemaLexer may lack the trailing EOF
    private Token peek() {
        if (pos < tokens.size()) {
            return tokens.get(pos);
        }
        var last = tokens.isEmpty() ? Token.of(TokenKind.EOF, "", 1, 1) : tokens.get(tokens.size() - 1);
        return new Token(TokenKind.EOF, "", last.location());
    }

    private void advance() {
        if (pos < tokens.size() && !peek().is(TokenKind.EOF)) {
            pos++;
        }
    }

    private Either<CompileError, Token> consume(TokenKind expected, String production) {
        var token = peek();
        if (token.is(expected)) {
            advance();
            return Either.right(token);
        }
        if (token.is(TokenKind.EOF)) {
            return Either.left(new CompileError.UnexpectedEof(production, expected, token));
        }
        if (token.is(TokenKind.ILLEGAL)) {
            return Either.left(new CompileError.IllegalCharacter(production, expected, token));
        }
        return Either.left(new CompileError.UnexpectedToken(production,
                                                            expected,
                                                            token,
                                                            CompileError.Mismatch.classify(expected, token.kind())));
    }

    private static <T> Either<CompileError, T> fail(Either<CompileError, ?> failed) {
        return Either.left(failed.getLeft());
    }
}
