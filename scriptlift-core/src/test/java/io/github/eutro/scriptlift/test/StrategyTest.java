package io.github.eutro.scriptlift.test;

import io.github.eutro.scriptlift.core.extract.PatternTagging;
import io.github.eutro.scriptlift.core.extract.SignatureScan;
import io.github.eutro.scriptlift.core.extract.TokenSynthesis;
import io.github.eutro.scriptlift.core.extract.Tokenizer;
import io.github.eutro.scriptlift.core.insn.InsnMetadata;
import io.github.eutro.scriptlift.core.insn.Instruction;
import io.github.eutro.scriptlift.core.insn.Opcode;
import io.github.eutro.scriptlift.core.script.ScriptObject;
import io.github.eutro.scriptlift.core.script.SimpleScriptObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StrategyTest {
    static final ScriptObject SCRIPT = SimpleScriptObject.ofSource("test", null);

    static List<Opcode> opcodes(List<Instruction> insns) {
        List<Opcode> ls = new ArrayList<>();
        for (Instruction insn : insns) {
            ls.add(insn.getOpcode());
        }
        return ls;
    }

    @Test
    void testPatternTagging() {
        List<Instruction> insns = PatternTagging.INSTANCE.extract(SCRIPT, "local x = 1\nprint(\"hi\")\nreturn x");
        assertEquals(Arrays.asList(Opcode.MOVE, Opcode.CALL, Opcode.LOADK, Opcode.RETURN), opcodes(insns));
        Instruction call = insns.get(1);
        assertEquals(12, call.getMeta(InsnMetadata.SOURCE_START));
        assertEquals(18, call.getMeta(InsnMetadata.SOURCE_END));
        assertNotNull(call.getMeta(InsnMetadata.PATTERN));
        assertEquals(Instruction.ARITY, call.getOperandCount());
        for (int i = 0; i < insns.size(); i++) {
            assertEquals(i * Instruction.STRIDE, insns.get(i).getAddress());
        }
    }

    @Test
    void testPatternTaggingDropsNestedMatches() {
        assertEquals(Arrays.asList(Opcode.CALL, Opcode.LOADK),
                opcodes(PatternTagging.INSTANCE.extract(SCRIPT, "print(\"if while for\")")));
        assertEquals(Arrays.asList(Opcode.NAMECALL),
                opcodes(PatternTagging.INSTANCE.extract(SCRIPT, "obj:method(1)")));
        assertEquals(Arrays.asList(Opcode.MOVE, Opcode.NEWCLOSURE, Opcode.RETURN),
                opcodes(PatternTagging.INSTANCE.extract(SCRIPT, "local f = function(a) return a end")));
        assertEquals(Arrays.asList(Opcode.JUMPIF, Opcode.CALL),
                opcodes(PatternTagging.INSTANCE.extract(SCRIPT, "if (x) then warn() end")));
    }

    @Test
    void testPatternTaggingOperands() {
        Instruction loadk = PatternTagging.INSTANCE.extract(SCRIPT, "'abc 12 34'").get(0);
        assertArrayEquals(new int[]{12, 34, 0}, loadk.getOperands());
    }

    @Test
    void testPatternTaggingLongLiteral() {
        StringBuilder sb = new StringBuilder("print(\"");
        for (int i = 0; i < 50000; i++) {
            sb.append(i % 1000 == 0 ? "\\\"" : "a");
        }
        sb.append("\")");
        List<Instruction> insns = PatternTagging.INSTANCE.extract(SCRIPT, sb.toString());
        assertEquals(Arrays.asList(Opcode.CALL, Opcode.LOADK), opcodes(insns));
        assertEquals(sb.length() - 1, insns.get(1).getMeta(InsnMetadata.SOURCE_END));
    }

    @Test
    void testPatternTaggingNothing() {
        assertTrue(PatternTagging.INSTANCE.extract(SCRIPT, "x = y").isEmpty());
        assertTrue(PatternTagging.INSTANCE.extract(SCRIPT, "").isEmpty());
        assertTrue(PatternTagging.INSTANCE.extract(SCRIPT, null).isEmpty());
    }

    @Test
    void testTokenizer() {
        List<Tokenizer.Token> tokens = Tokenizer.tokenize("a.b(1.5, 'x') -- gone\n--[[ also\ngone ]] c .. d ~= #e");
        List<String> texts = new ArrayList<>();
        for (Tokenizer.Token token : tokens) {
            texts.add(token.text);
        }
        assertEquals(Arrays.asList("a", ".", "b", "(", "1.5", ",", "'x'", ")", "c", "..", "d", "~=", "#", "e"), texts);
        assertEquals(Tokenizer.Type.NUMBER, tokens.get(4).type);
        assertEquals(Tokenizer.Type.STRING, tokens.get(6).type);
    }

    @Test
    void testTokenSynthesis() {
        List<Instruction> insns = TokenSynthesis.INSTANCE.extract(SCRIPT, "local x = 1 + 2 -- comment\nprint(\"hi\")");
        assertEquals(Arrays.asList(
                Opcode.MOVE, Opcode.NOP, Opcode.NOP, Opcode.LOADN, Opcode.ADD, Opcode.LOADN, Opcode.CALL, Opcode.LOADK
        ), opcodes(insns));
        assertArrayEquals(new int[]{0, 2, 0}, insns.get(5).getOperands());
        assertEquals("print", insns.get(6).getMeta(InsnMetadata.TOKEN));
        assertEquals(Boolean.TRUE, insns.get(6).getMeta(InsnMetadata.SYNTHETIC));
    }

    @Test
    void testTokenSynthesisKeywords() {
        assertEquals(Arrays.asList(
                Opcode.JUMPIF, Opcode.NOT, Opcode.NOP, Opcode.AND, Opcode.NOP, Opcode.OR, Opcode.NOP, Opcode.NOP
        ), opcodes(TokenSynthesis.INSTANCE.extract(SCRIPT, "if not x and y or z then")));
        assertEquals(Arrays.asList(Opcode.NOP, Opcode.CONCAT, Opcode.LENGTH, Opcode.NOP),
                opcodes(TokenSynthesis.INSTANCE.extract(SCRIPT, "a .. #b")));
    }

    @Test
    void testTokenSynthesisDeterministic() {
        String text = "for i = 1, 10 do print(i * 2) end";
        assertEquals(TokenSynthesis.INSTANCE.extract(SCRIPT, text), TokenSynthesis.INSTANCE.extract(SCRIPT, text));
        assertTrue(TokenSynthesis.INSTANCE.extract(SCRIPT, "").isEmpty());
    }

    @Test
    void testSignatureScan() {
        List<Instruction> insns = SignatureScan.INSTANCE.extract(SCRIPT, String.join("\n",
                "0000: GETGLOBAL 0 1",
                "0004: LOADK 1 2",
                "0008: CALL 0 2 1",
                "000c: JUMPIF -2",
                "0010: RETURN 0 1"
        ));
        assertEquals(Arrays.asList(Opcode.GETGLOBAL, Opcode.LOADK, Opcode.CALL, Opcode.JUMPIF, Opcode.RETURN),
                opcodes(insns));
        assertArrayEquals(new int[]{0, 1, 0}, insns.get(0).getOperands());
        assertArrayEquals(new int[]{0, 2, 1}, insns.get(2).getOperands());
        assertArrayEquals(new int[]{-2, 0, 0}, insns.get(3).getOperands());
        assertEquals("LOADK CALL", insns.get(0).getMeta(InsnMetadata.PATTERN));
    }

    @Test
    void testSignatureScanNeedsSignature() {
        assertTrue(SignatureScan.INSTANCE.extract(SCRIPT, "NOP\nADD 1 2 3").isEmpty());
        assertTrue(SignatureScan.INSTANCE.extract(SCRIPT, "LOADKX CALLS").isEmpty());
        assertEquals(2, SignatureScan.INSTANCE.extract(SCRIPT, "MOVE 1 2 RETURN 1").size());
    }
}
