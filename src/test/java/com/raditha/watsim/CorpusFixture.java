package com.raditha.watsim;

import com.raditha.watsim.model.CorpusLabel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds small corpus trees on disk for tests.
 */
public final class CorpusFixture {

    public static final String ADD_FUNC = """
            (module
              (func $add (param i32 i32) (result i32)
                local.get 0
                local.get 1
                i32.add)
              (export "add" (func $add)))
            """;

    public static final String LOOP_FUNC = """
            (module
              (func $count (param i32)
                block
                  loop
                    local.get 0
                    i32.eqz
                    br_if 1
                    local.get 0
                    i32.const 1
                    i32.sub
                    local.set 0
                    br 0
                  end
                end))
            """;

    public static final String MEMORY_FUNC = """
            (module
              (memory 1)
              (func $grow
                memory.size
                memory.grow
                f64.convert_i32_s
                nop))
            """;

    /** Nine instructions; starts with the three of {@link #ADD_FUNC}. */
    public static final String CALL_FUNC = """
            (module
              (import "env" "f" (func $f (param i32) (result i32)))
              (func $g (param i32 i32) (result i32) (local i32)
                local.get 0
                local.get 1
                i32.add
                local.tee 2
                i32.const 1
                i32.shl
                call $f
                drop
                local.get 2))
            """;

    private CorpusFixture() {
    }

    public static Path writeWat(Path root, String label, String text) throws IOException {
        CorpusLabel l = CorpusLabel.parse(label);
        Path file = root.resolve(l.algorithm()).resolve(l.language()).resolve(l.algorithm() + ".wat");
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
        return file;
    }

    /**
     * A WAT body of {@code count} numbered lines, each holding one instruction.
     */
    public static String numberedLines(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            sb.append("i32.const ").append(i).append('\n');
        }
        return sb.toString();
    }
}
