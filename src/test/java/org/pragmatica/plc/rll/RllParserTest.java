package org.pragmatica.plc.rll;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RllParserTest {

    // === Successful parsing ===

    @Test
    void seriesInstructions_parseInOrder() {
        var rung = RllParser.parseRung("XIC(Start)XIO(Stop)OTE(Motor);");

        assertTrue(rung.isParsed());
        assertThat(rung.instructions()).extracting(RungElement.Instruction::mnemonic)
                                       .containsExactly("XIC", "XIO", "OTE");
    }

    @Test
    void parallelBranches_areGrouped() {
        var rung = RllParser.parseRung("[XIC(A),XIO(B)]OTE(C);");

        var elements = rung.elements().orElseThrow();
        assertThat(elements).hasSize(2);
        var parallel = assertInstanceOf(RungElement.Parallel.class, elements.get(0));
        assertThat(parallel.branches()).hasSize(2);
        assertThat(rung.instructions()).extracting(RungElement.Instruction::mnemonic)
                                       .containsExactly("XIC", "XIO", "OTE");
    }

    @Test
    void nestedBranches_areFlattenedLeftToRight() {
        var rung = RllParser.parseRung("[XIC(A) [XIC(B), XIC(C)], XIC(D)] OTE(E);");

        assertThat(rung.tagReferences()).extracting(TagReference::name)
                                        .containsExactly("A", "B", "C", "D", "E");
    }

    @Test
    void inferredOperands_areMarked() {
        var rung = RllParser.parseRung("TON(Timer1,?,?);");

        var operands = rung.instructions().get(0).operands();
        assertThat(operands).hasSize(3);
        assertFalse(operands.get(0).isInferred());
        assertTrue(operands.get(1).isInferred());
        assertTrue(operands.get(2).isInferred());
    }

    @Test
    void emptyOperandList_isAllowed() {
        var rung = RllParser.parseRung("NOP();");

        assertThat(rung.instructions().get(0).operands()).isEmpty();
    }

    @Test
    void operandsWithNestedBrackets_areKeptWhole() {
        var rung = RllParser.parseRung("MOV(Source[Idx[2]], Dest.Value);");

        var operands = rung.instructions().get(0).operands();
        assertEquals("Source[Idx[2]]", operands.get(0).asValue().orElseThrow());
        assertEquals("Dest.Value", operands.get(1).asValue().orElseThrow());
    }

    @Test
    void blankRung_isParsedEmpty() {
        var rung = RllParser.parseRung("   ");

        assertTrue(rung.isParsed());
        assertThat(rung.instructions()).isEmpty();
    }

    @Test
    void textAfterTerminator_isIgnored() {
        var rung = RllParser.parseRung("XIC(A); garbage (");

        assertTrue(rung.isParsed());
        assertThat(rung.instructions()).hasSize(1);
    }

    @Test
    void parseRungs_parsesEachText() {
        var rungs = RllParser.parseRungs(List.of("XIC(A)OTE(B);", "OTE(C)"));

        assertTrue(rungs.get(0).isParsed());
        assertFalse(rungs.get(1).isParsed());
    }

    // === Tag references ===

    @Test
    void tagReferences_carryInstructionAndOperandIndex() {
        var rung = RllParser.parseRung("MOV(100,Dest);");

        assertThat(rung.tagReferences()).singleElement().satisfies(reference -> {
            assertEquals("Dest", reference.name());
            assertEquals("MOV", reference.instruction());
            assertEquals(1, reference.operandIndex());
        });
    }

    @Test
    void indexTags_areReferencedToo() {
        var rung = RllParser.parseRung("MOV(Source[Idx],Dest.Value);");

        assertThat(rung.tagReferences()).extracting(TagReference::name).containsExactly("Source", "Idx", "Dest");
        assertEquals("Dest.Value", rung.tagReferences().get(2).fullOperand());
    }

    @Test
    void expressionOperand_referencesEachTag() {
        var rung = RllParser.parseRung("CMP(Temp * 2 > Limit);");

        assertThat(rung.tagReferences()).extracting(TagReference::name).containsExactly("Temp", "Limit");
    }

    // === Errors ===

    @Test
    void missingSemicolon_isMissingTerminator() {
        var rung = RllParser.parseRung("OTE(Motor)");

        assertFalse(rung.isParsed());
        assertInstanceOf(RllError.MissingTerminator.class, rung.error().orElseThrow());
        assertThat(rung.instructions()).isEmpty();
    }

    @Test
    void unclosedParen_pointsAtOpening() {
        var error = RllParser.parseRung("XIC(Start").error().orElseThrow();

        var unclosed = assertInstanceOf(RllError.UnclosedParen.class, error);
        assertEquals(3, unclosed.at());
    }

    @Test
    void unclosedBracket_pointsAtOpening() {
        var error = RllParser.parseRung("XIC(A)[XIC(B),XIC(C)OTE(D);").error().orElseThrow();

        var unclosed = assertInstanceOf(RllError.UnclosedBracket.class, error);
        assertEquals(6, unclosed.at());
    }

    @Test
    void strayCharacter_isUnexpectedChar() {
        var error = RllParser.parseRung("XIC(A) 5;").error().orElseThrow();

        var unexpected = assertInstanceOf(RllError.UnexpectedChar.class, error);
        assertEquals('5', unexpected.character());
        assertEquals(7, unexpected.at());
    }

    @Test
    void mnemonicWithoutParen_expectsParen() {
        var error = RllParser.parseRung("XIC;").error().orElseThrow();

        var expected = assertInstanceOf(RllError.Expected.class, error);
        assertEquals("'('", expected.expected());
    }

    @Test
    void emptyOperand_isExpectedOperand() {
        var error = RllParser.parseRung("XIC(A,);").error().orElseThrow();

        var expected = assertInstanceOf(RllError.Expected.class, error);
        assertEquals("operand", expected.expected());
        assertEquals(6, expected.at());
    }

    @Test
    void emptyBranch_isRejected() {
        var error = RllParser.parseRung("[XIC(A),]OTE(B);").error().orElseThrow();

        assertInstanceOf(RllError.Expected.class, error);
    }

    // === Error formatting ===

    @Test
    void formatWithContext_pointsAtColumn() {
        var formatted = RllParser.parseRung("XIC(A) 5;").parseError().orElseThrow().format();

        assertThat(formatted).startsWith("error: unexpected character '5' at position 7");
        assertThat(formatted).contains(" --> position 1:7");
        assertThat(formatted).contains("1 | XIC(A) 5;");
        assertThat(formatted).endsWith(" ".repeat(4 + 7) + "^ here");
    }

    @Test
    void formatWithContext_longLine_isWindowed() {
        var text = "XIC(A)".repeat(30) + " 5;";
        var formatted = RllParser.parseRung(text).parseError().orElseThrow().format();

        assertThat(formatted).contains("...");
        assertThat(formatted).doesNotContain(text);
    }

    @Test
    void errorContext_prefixesLocation() {
        var error = RllParser.parseRung("OTE(Motor)").parseError().orElseThrow()
                             .withContext(new ErrorContext("MainProgram", "MainRoutine", 5));

        assertEquals("MainProgram/MainRoutine/Rung#5", error.context().orElseThrow().path());
        assertThat(error.format()).startsWith("in MainProgram/MainRoutine/Rung#5\nerror: missing rung terminator ';'");
    }
}
