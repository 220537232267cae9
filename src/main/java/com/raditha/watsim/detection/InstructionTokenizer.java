package com.raditha.watsim.detection;

import com.raditha.watsim.model.TokenSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts instruction mnemonics from WAT text.
 *
 * The text is split on parentheses and whitespace. A piece is kept only when
 * it looks like an instruction:
 * - dotted opcodes ({@code i32.add}, {@code local.get}, {@code memory.grow}) by pattern
 * - bare control and stack opcodes from a fixed list
 *
 * Numbers, hex immediates and declaration keywords are always dropped. Other
 * bare mnemonics (e.g. {@code call_indirect}) are dropped as well; the filter
 * is a heuristic, not a WAT grammar.
 */
public class InstructionTokenizer {

    static final Set<String> SINGLE_WORD_OPS = Set.of(
            "block", "loop", "if", "else", "end",
            "call", "drop", "return", "nop", "unreachable",
            "br", "br_if", "br_table", "select");

    static final Set<String> DECL_TOKENS = Set.of(
            "module", "func", "type", "import", "export",
            "param", "result", "local", "global", "memory", "table", "elem", "data");

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[()\\s]+");
    private static final Pattern DOT_INSTR = Pattern.compile("^[a-z][a-z0-9_]*(?:\\.[a-z0-9_]+)+$");
    private static final Pattern INT_LITERAL = Pattern.compile("[-+]?\\d+");
    private static final Pattern HEX_LITERAL = Pattern.compile("0x[0-9a-fA-F]+");

    /**
     * Tokenize a whole WAT text.
     *
     * @param watText WAT source; null is treated as empty
     * @return instruction tokens in source order
     */
    public TokenSequence tokenize(String watText) {
        if (watText == null || watText.isEmpty()) {
            return TokenSequence.empty();
        }
        List<String> tokens = new ArrayList<>();
        for (String raw : TOKEN_SPLIT.split(watText)) {
            if (isInstructionToken(raw)) {
                tokens.add(raw);
            }
        }
        return new TokenSequence(tokens);
    }

    /**
     * Check whether one raw piece of text is an instruction token.
     */
    public boolean isInstructionToken(String tok) {
        if (tok == null || tok.isEmpty()) {
            return false;
        }
        if (INT_LITERAL.matcher(tok).matches() || HEX_LITERAL.matcher(tok).matches()) {
            return false;
        }
        if (DECL_TOKENS.contains(tok)) {
            return false;
        }
        return DOT_INSTR.matcher(tok).matches() || SINGLE_WORD_OPS.contains(tok);
    }
}
