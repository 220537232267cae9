package com.raditha.watsim.model;

import java.util.List;

/**
 * Ordered instruction tokens extracted from a WAT text.
 * Source order is preserved; literals and declarations are never present.
 *
 * @param tokens Instruction mnemonics in source order
 */
public record TokenSequence(List<String> tokens) {

    private static final TokenSequence EMPTY = new TokenSequence(List.of());

    public TokenSequence {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public static TokenSequence empty() {
        return EMPTY;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public String get(int index) {
        return tokens.get(index);
    }

    /**
     * Join the tokens with single spaces, the form the tokenizer reads back
     * unchanged.
     */
    public String join() {
        return String.join(" ", tokens);
    }
}
