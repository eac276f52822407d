package personal.studio.schedule.scheduling.domain.model;

/**
 * 여러 패턴을 한 번에 생성했을 때의 집계
 */
public record BulkGenerationSummary(
        int patterns,
        int created,
        int skipped,
        int failed
) {
    public static BulkGenerationSummary empty() {
        return new BulkGenerationSummary(0, 0, 0, 0);
    }

    public BulkGenerationSummary add(GenerationResult result) {
        return new BulkGenerationSummary(patterns + 1, created + result.createdCount(),
                skipped + result.skippedCount(), failed);
    }

    public BulkGenerationSummary addFailure() {
        return new BulkGenerationSummary(patterns + 1, created, skipped, failed + 1);
    }
}
