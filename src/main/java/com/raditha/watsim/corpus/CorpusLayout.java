package com.raditha.watsim.corpus;

import com.raditha.watsim.model.CorpusLabel;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Paths of a corpus tree:
 * <pre>
 * &lt;root&gt;/&lt;algorithm&gt;/&lt;language&gt;/&lt;algorithm&gt;.wat
 * &lt;root&gt;/&lt;algorithm&gt;/&lt;language&gt;/grams/&lt;algorithm&gt;&lt;suffix&gt;_&lt;n&gt;gram.txt
 * </pre>
 *
 * @param root       Corpus root
 * @param gramSuffix Text between the algorithm and {@code _<n>gram.txt}
 */
public record CorpusLayout(Path root, String gramSuffix) {

    public static final String WAT_EXTENSION = ".wat";
    public static final String GRAMS_DIR = "grams";

    public CorpusLayout {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (gramSuffix == null) {
            gramSuffix = "";
        }
    }

    public Path itemDir(CorpusLabel label) {
        return root.resolve(label.algorithm()).resolve(label.language());
    }

    public Path watFile(CorpusLabel label) {
        return itemDir(label).resolve(label.algorithm() + WAT_EXTENSION);
    }

    public Path gramsDir(CorpusLabel label) {
        return itemDir(label).resolve(GRAMS_DIR);
    }

    public Path gramFile(CorpusLabel label, int n) {
        return gramsDir(label).resolve(gramFileName(label.algorithm(), n));
    }

    public String gramFileName(String algorithm, int n) {
        return algorithm + gramSuffix + "_" + n + "gram.txt";
    }

    /**
     * @throws IllegalArgumentException if the root is not a readable directory
     */
    public void requireReadableRoot() {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Corpus root not found or not a directory: " + root);
        }
        if (!Files.isReadable(root)) {
            throw new IllegalArgumentException("Corpus root is not readable: " + root);
        }
    }
}
