package org.pragmatica.authz.schema;

import org.junit.jupiter.api.Test;
import org.pragmatica.authz.tree.SourceLocation;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.*;

class SchemaLexerTest {

    private static List<TokenKind> kinds(String input) {
        return SchemaLexer.tokenize(input)
                          .stream()
                          .map(Token::kind)
                          .collect(Collectors.toList());
    }

    // === Basic tokens ===

    @Test
    void tokenize_emptyInput_producesSingleEof() {
        var tokens = SchemaLexer.tokenize("");

        assertEquals(1, tokens.size());
        assertTrue(tokens.get(0).is(TokenKind.EOF));
        assertEquals(SourceLocation.START, tokens.get(0).location());
    }

    @Test
    void tokenize_definition_producesKeywordIdentifierAndBraces() {
        var tokens = SchemaLexer.tokenize("definition user {}");

        assertThat(tokens).extracting(Token::kind)
                          .containsExactly(TokenKind.DEFINITION,
                                           TokenKind.IDENTIFIER,
                                           TokenKind.LBRACE,
                                           TokenKind.RBRACE,
                                           TokenKind.EOF);
        assertEquals("user", tokens.get(1).text());
        assertEquals(12, tokens.get(1).column());
        assertEquals(17, tokens.get(2).column());
        assertEquals(19, tokens.get(4).column());
    }

    @Test
    void tokenize_keywords_areRecognizedByExactMatch() {
        assertThat(kinds("definition relation permission definitions relation_x Permission"))
            .containsExactly(TokenKind.DEFINITION,
                             TokenKind.RELATION,
                             TokenKind.PERMISSION,
                             TokenKind.IDENTIFIER,
                             TokenKind.IDENTIFIER,
                             TokenKind.IDENTIFIER,
                             TokenKind.EOF);
    }

    @Test
    void tokenize_allPunctuation_mapsToKinds() {
        assertThat(kinds("= + - | * { } : / #"))
            .containsExactly(TokenKind.EQUAL,
                             TokenKind.PLUS,
                             TokenKind.MINUS,
                             TokenKind.PIPE,
                             TokenKind.WILDCARD,
                             TokenKind.LBRACE,
                             TokenKind.RBRACE,
                             TokenKind.COLON,
                             TokenKind.SLASH,
                             TokenKind.HASH,
                             TokenKind.EOF);
    }

    @Test
    void tokenize_identifier_allowsDigitsAndUnderscore() {
        var tokens = SchemaLexer.tokenize("_team2_member x9");

        assertEquals("_team2_member", tokens.get(0).text());
        assertEquals("x9", tokens.get(1).text());
    }

    @Test
    void tokenize_leadingDigit_isIllegal() {
        var tokens = SchemaLexer.tokenize("9abc");

        assertTrue(tokens.get(0).is(TokenKind.ILLEGAL));
        assertEquals("9", tokens.get(0).text());
        assertTrue(tokens.get(1).is(TokenKind.IDENTIFIER));
        assertEquals("abc", tokens.get(1).text());
    }

    // === Arrow lookahead ===

    @Test
    void tokenize_arrow_isSingleTokenAtColumnOfMinus() {
        var tokens = SchemaLexer.tokenize("parent->view");

        assertThat(tokens).extracting(Token::kind)
                          .containsExactly(TokenKind.IDENTIFIER, TokenKind.ARROW, TokenKind.IDENTIFIER, TokenKind.EOF);
        assertEquals("->", tokens.get(1).text());
        assertEquals(7, tokens.get(1).column());
        assertEquals(9, tokens.get(2).column());
    }

    @Test
    void tokenize_minusWithoutGreater_fallsBackToMinus() {
        assertThat(kinds("a - > b")).containsExactly(TokenKind.IDENTIFIER,
                                                     TokenKind.MINUS,
                                                     TokenKind.ILLEGAL,
                                                     TokenKind.IDENTIFIER,
                                                     TokenKind.EOF);
        assertThat(kinds("-")).containsExactly(TokenKind.MINUS, TokenKind.EOF);
    }

    // === Comments and whitespace ===

    @Test
    void tokenize_lineComments_areSkipped() {
        var tokens = SchemaLexer.tokenize("""
            // first
            // second
               // indented third
            definition user {} // trailing""");

        assertTrue(tokens.get(0).is(TokenKind.DEFINITION));
        assertEquals(4, tokens.get(0).line());
        assertEquals(1, tokens.get(0).column());
        assertEquals(5, tokens.size());
    }

    @Test
    void tokenize_commentAtEndOfInput_producesOnlyEof() {
        assertThat(kinds("// nothing here")).containsExactly(TokenKind.EOF);
    }

    @Test
    void tokenize_singleSlash_isDivider() {
        assertThat(kinds("tenant/user")).containsExactly(TokenKind.IDENTIFIER,
                                                         TokenKind.SLASH,
                                                         TokenKind.IDENTIFIER,
                                                         TokenKind.EOF);
        assertThat(kinds("tenant//user")).containsExactly(TokenKind.IDENTIFIER, TokenKind.EOF);
    }

    @Test
    void tokenize_newline_resetsColumn() {
        var tokens = SchemaLexer.tokenize("a\n\tb\r\n  c");

        assertEquals(SourceLocation.at(1, 1), tokens.get(0).location());
        assertEquals(SourceLocation.at(2, 2), tokens.get(1).location());
        assertEquals(SourceLocation.at(3, 3), tokens.get(2).location());
    }

    // === Illegal characters ===

    @Test
    void tokenize_unknownCharacter_producesIllegalTokenAndContinues() {
        var tokens = SchemaLexer.tokenize("a @ b");

        assertThat(tokens).extracting(Token::kind)
                          .containsExactly(TokenKind.IDENTIFIER, TokenKind.ILLEGAL, TokenKind.IDENTIFIER, TokenKind.EOF);
        assertEquals("@", tokens.get(1).text());
        assertEquals(3, tokens.get(1).column());
    }

    @Test
    void tokenize_nonAsciiLetter_isIllegal() {
        var tokens = SchemaLexer.tokenize("é");

        assertTrue(tokens.get(0).is(TokenKind.ILLEGAL));
        assertEquals("é", tokens.get(0).text());
    }

    // === Stability ===

    @Test
    void tokenize_alwaysEndsWithExactlyOneEof() {
        var inputs = List.of("", " ", "definition", "a->", "// c\n", "}{", "@@@");
        for (var input : inputs) {
            var tokens = SchemaLexer.tokenize(input);
            assertThat(tokens).filteredOn(token -> token.is(TokenKind.EOF)).hasSize(1);
            assertTrue(tokens.get(tokens.size() - 1).is(TokenKind.EOF), input);
        }
    }

    @Test
    void tokenize_repeatedCalls_areIdentical() {
        var schema = """
            definition tenant/document {
                relation viewer: tenant/user | tenant/group#member
                permission view = viewer + parent->view
            }
            """;

        assertEquals(SchemaLexer.tokenize(schema), SchemaLexer.tokenize(schema));
    }

    @Test
    void tokenize_canonicalForm_retokenizesIdentically() {
        var schema = """
            // documents
            definition document {
                relation owner: user   // owners
                permission edit = owner+parent->edit
            }
            """;
        var tokens = SchemaLexer.tokenize(schema);
        var canonical = tokens.stream()
                              .filter(token -> !token.is(TokenKind.EOF))
                              .map(Token::text)
                              .collect(Collectors.joining(" "));

        assertThat(SchemaLexer.tokenize(canonical))
            .extracting(Token::kind, Token::text)
            .containsExactlyElementsOf(tokens.stream()
                                             .map(token -> tuple(token.kind(), token.text()))
                                             .collect(Collectors.toList()));
    }

    @Test
    void tokenKind_keywords_areFlagged() {
        assertTrue(TokenKind.DEFINITION.isKeyword());
        assertTrue(TokenKind.PERMISSION.isKeyword());
        assertFalse(TokenKind.IDENTIFIER.isKeyword());
        assertEquals("'->'", TokenKind.ARROW.display());
    }
}
