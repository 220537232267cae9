package com.raditha.watsim.trimming;

import java.util.List;

/**
 * Outcome of a corpus trimming run.
 *
 * @param strategy     Strategy used
 * @param targetLength Requested lines per file
 * @param masterSeed   Master seed for random runs, null otherwise
 * @param records      One audit record per written file, across all variants
 * @param skipped      Inputs that were missing, summed across variants
 * @param originalBytes Size of the inputs of all written files, in bytes
 * @param trimmedBytes  Size of all written files, in bytes
 */
public record TrimReport(
        TrimStrategy strategy,
        int targetLength,
        Long masterSeed,
        List<TrimAuditRecord> records,
        int skipped,
        long originalBytes,
        long trimmedBytes) {

    public TrimReport {
        records = List.copyOf(records);
    }

    public int successCount() {
        return records.size();
    }

    public double averageOriginalLines() {
        return records.stream().mapToInt(TrimAuditRecord::totalLines).average().orElse(0.0);
    }

    public double averageTrimmedLines() {
        return records.stream().mapToInt(TrimAuditRecord::keptLines).average().orElse(0.0);
    }

    /**
     * Percentage of bytes removed across all written files.
     */
    public double byteReductionRate() {
        if (originalBytes <= 0) {
            return 0.0;
        }
        return (1.0 - (double) trimmedBytes / originalBytes) * 100.0;
    }

    /**
     * Percentage of lines removed on average, {@code (1 - avgTrimmed/avgOriginal) * 100}.
     */
    public double reductionRate() {
        double original = averageOriginalLines();
        if (original <= 0.0) {
            return 0.0;
        }
        return (1.0 - averageTrimmedLines() / original) * 100.0;
    }
}
