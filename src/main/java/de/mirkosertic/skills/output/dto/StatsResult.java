package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.config.ApplicationConfig;
import de.mirkosertic.skills.output.TaggedResult;
import de.mirkosertic.skills.search.CategoryCount;
import de.mirkosertic.skills.search.DatabaseStats;
import org.jspecify.annotations.Nullable;

import java.util.List;

public record StatsResult(
        Configuration configuration,
        Database database,
        List<CategoryCount> categoryBreakdown
) implements TaggedResult {

    public static final String TYPE = "stats";

    public record Configuration(
            String databasePath,
            String projectRoot,
            String skillsDirectory,
            String promptsDirectory,
            String promptConfigsDirectory,
            boolean autoMigrate,
            int maxResults,
            @Nullable String outputFormat
    ) {

        public static Configuration from(final ApplicationConfig config) {
            return new Configuration(
                    config.getDatabasePath().toString(),
                    config.getProjectRoot().toString(),
                    config.getSkillsDirectory().toString(),
                    config.getPromptsDirectory().toString(),
                    config.getPromptConfigsDirectory().toString(),
                    config.isAutoMigrate(),
                    config.getMaxResults(),
                    config.getOutputFormat());
        }
    }

    public record Database(
            int schemaVersion,
            long skills,
            long prompts,
            long categories,
            long totalSizeBytes,
            long totalTokens
    ) {
    }

    public static StatsResult of(final ApplicationConfig config, final int schemaVersion, final DatabaseStats stats) {
        return new StatsResult(
                Configuration.from(config),
                new Database(schemaVersion, stats.skills(), stats.prompts(), stats.categories(),
                        stats.totalSizeBytes(), stats.totalTokens()),
                stats.categoryBreakdown());
    }

    @Override
    public String type() {
        return TYPE;
    }
}
