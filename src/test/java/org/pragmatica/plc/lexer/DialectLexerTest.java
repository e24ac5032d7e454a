package org.pragmatica.plc.lexer;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.ast.DirectAddress;
import org.pragmatica.plc.error.ParseError;
import org.pragmatica.plc.parser.ParserLimits;

import static org.junit.jupiter.api.Assertions.*;

class DialectLexerTest {

    // === SCL ===

    @Test
    void sclQuotedName_isQuotedIdentifier() {
        var token = (Token.Identifier) SclLexer.tokenize("\"Motor Data\"").get(0);

        assertEquals("Motor Data", token.name());
        assertTrue(token.quoted());
        assertFalse(token.local());
    }

    @Test
    void sclHashPrefix_isLocalIdentifier() {
        var tokens = SclLexer.tokenize("#count := #count + 1;");

        var local = (Token.Identifier) tokens.get(0);
        assertEquals("count", local.name());
        assertTrue(local.local());
        assertTrue(tokens.get(1).is(Symbol.ASSIGN));
    }

    @Test
    void sclHashBeforeQuotedName_isQuotedLocal() {
        var token = (Token.Identifier) SclLexer.tokenize("#\"my var\"").get(0);

        assertEquals("my var", token.name());
        assertTrue(token.quoted());
        assertTrue(token.local());
    }

    @Test
    void sclUnclosedQuotedName_isInvalid() {
        var token = SclLexer.tokenize("\"broken\nx").get(0);

        var invalid = assertInstanceOf(Token.Invalid.class, token);
        assertInstanceOf(ParseError.UnclosedString.class, invalid.error());
    }

    @Test
    void sclPragma_keepsTrimmedContent() {
        var token = (Token.Pragma) SclLexer.tokenize("{ S7_Optimized_Access := 'TRUE' }").get(0);

        assertEquals("S7_Optimized_Access := 'TRUE'", token.content());
    }

    @Test
    void sclCompoundAssignment_isSingleToken() {
        var tokens = SclLexer.tokenize("x += 1; y -= 2; z *= 3; w /= 4;");

        assertTrue(tokens.get(1).is(Symbol.ADD_ASSIGN));
        assertTrue(tokens.get(5).is(Symbol.SUB_ASSIGN));
        assertTrue(tokens.get(9).is(Symbol.MUL_ASSIGN));
        assertTrue(tokens.get(13).is(Symbol.DIV_ASSIGN));
    }

    @Test
    void sclBlockKeywords_areReserved() {
        var tokens = SclLexer.tokenize("REGION Init END_REGION GOTO");

        assertTrue(tokens.get(0).is(Keyword.REGION));
        assertInstanceOf(Token.Identifier.class, tokens.get(1));
        assertTrue(tokens.get(2).is(Keyword.END_REGION));
        assertTrue(tokens.get(3).is(Keyword.GOTO));
    }

    @Test
    void sclPeripheralAddress_isAccepted() {
        var token = (Token.Address) SclLexer.tokenize("%PIW256").get(0);

        assertEquals(DirectAddress.Area.PERIPHERAL, token.address().area());
        assertEquals(256, token.address().byteOffset());
    }

    @Test
    void sclLexer_reportsItsDialect() {
        assertEquals(Dialect.SCL, SclLexer.create("").dialect());
        assertInstanceOf(SclLexer.class, Dialect.SCL.lexer("", ParserLimits.DEFAULT));
    }

    // === Rockwell ===

    @Test
    void rockwellNonRetentiveAssign_isSingleToken() {
        var tokens = RockwellLexer.tokenize("Out [:=] Input;");

        assertTrue(tokens.get(1).is(Symbol.NON_RETENTIVE_ASSIGN));
        assertEquals(5, tokens.size());
    }

    @Test
    void rockwellModuleTag_isSingleIdentifier() {
        var tokens = RockwellLexer.tokenize("Local:1:I.Data");

        assertEquals("Local:1:I", ((Token.Identifier) tokens.get(0)).name());
        assertTrue(tokens.get(1).is(Symbol.DOT));
        assertEquals("Data", ((Token.Identifier) tokens.get(2)).name());
    }

    @Test
    void rockwellSlotOnly_keepsNumber() {
        var token = (Token.Identifier) RockwellLexer.tokenize("Rack:3").get(0);

        assertEquals("Rack:3", token.name());
    }

    @Test
    void genericLexer_splitsModuleTagAtColon() {
        var tokens = StLexer.tokenize("Local:1");

        assertEquals("Local", ((Token.Identifier) tokens.get(0)).name());
        assertTrue(tokens.get(1).is(Symbol.COLON));
    }
}
