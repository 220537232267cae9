package com.raditha.watsim.trimming;

/**
 * One line of a trimming audit log.
 *
 * @param trial        Trial number or deterministic variant name
 * @param algorithm    Algorithm
 * @param language     Language
 * @param relativePath File path below the language directory
 * @param totalLines   Lines before trimming
 * @param keptLines    Lines written
 * @param startIndex   0-based first retained line
 */
public record TrimAuditRecord(
        String trial,
        String algorithm,
        String language,
        String relativePath,
        int totalLines,
        int keptLines,
        int startIndex) {

    public static final String CSV_HEADER =
            "trial,algo,lang,relpath_after_lang,total_lines,kept_lines,start_index";

    public String toCsvRow() {
        return String.join(",",
                trial,
                algorithm,
                language,
                relativePath,
                Integer.toString(totalLines),
                Integer.toString(keptLines),
                Integer.toString(startIndex));
    }
}
