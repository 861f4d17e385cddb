package de.mirkosertic.skills.search;

import de.mirkosertic.skills.db.FragmentRepository;
import de.mirkosertic.skills.db.FragmentRepository.ReferenceKind;
import de.mirkosertic.skills.db.PromptRecord;
import de.mirkosertic.skills.db.PromptRepository;
import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.db.SkillRepository;
import de.mirkosertic.skills.db.SkillsDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Full-text search, listings and statistics over the indexed skills and prompts.
 * <p>
 * Searches go through the FTS5 tables and are ordered by the FTS5 {@code rank}. The snippet
 * is taken from the content column with matches wrapped in square brackets.
 */
public class SearchService {

    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

    public static final int DEFAULT_LIST_LIMIT = 100;

    private static final String SKILL_SEARCH_SQL = """
            SELECT s.id, s.path, s.category, s.name, s.title, s.description, s.size_bytes, s.token_count,
                   snippet(skills_fts, 5, '[', ']', '...', 30) AS snippet,
                   rank
              FROM skills_fts
              JOIN skills s ON s.id = skills_fts.rowid
             WHERE skills_fts MATCH ?""";

    private static final String PROMPT_SEARCH_SQL = """
            SELECT p.id, p.name, p.path, p.title, p.author, p.description, p.size_bytes, p.token_count,
                   snippet(prompts_fts, 5, '[', ']', '...', 30) AS snippet,
                   rank
              FROM prompts_fts
              JOIN prompts p ON p.id = prompts_fts.rowid
             WHERE prompts_fts MATCH ?
             ORDER BY rank
             LIMIT ?""";

    /**
     * Skills and prompts matching one query.
     */
    public record CombinedResults(List<SkillHit> skills, List<PromptHit> prompts) {
    }

    private final SkillsDatabase database;
    private final SkillRepository skillRepository;
    private final PromptRepository promptRepository;
    private final FragmentRepository fragmentRepository;
    private final int defaultMaxResults;

    public SearchService(final SkillsDatabase database, final int defaultMaxResults) {
        this.database = database;
        this.skillRepository = new SkillRepository(database);
        this.promptRepository = new PromptRepository(database);
        this.fragmentRepository = new FragmentRepository();
        this.defaultMaxResults = defaultMaxResults;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    /**
     * Search skills. A null {@code maxResults} uses the configured default, a null category
     * searches all categories.
     */
    public List<SkillHit> searchSkills(final String query, final Integer maxResults, final String category)
            throws SQLException {
        requireQuery(query);
        final int limit = effectiveLimit(maxResults);
        final String sql = SKILL_SEARCH_SQL
                + (category != null ? "\n   AND s.category = ?" : "")
                + "\n ORDER BY rank\n LIMIT ?";

        logger.debug("Searching skills for '{}' (category={}, limit={})", query, category, limit);
        try (final PreparedStatement ps = database.connection().prepareStatement(sql)) {
            int index = 1;
            ps.setString(index++, query);
            if (category != null) {
                ps.setString(index++, category);
            }
            ps.setInt(index, limit);

            final List<SkillHit> hits = new ArrayList<>();
            try (final ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    hits.add(new SkillHit(
                            rs.getLong("id"),
                            rs.getString("path"),
                            rs.getString("category"),
                            rs.getString("name"),
                            rs.getString("title"),
                            rs.getString("description"),
                            rs.getLong("size_bytes"),
                            rs.getInt("token_count"),
                            rs.getString("snippet"),
                            rs.getDouble("rank")));
                }
            }
            return hits;
        }
    }

    public List<PromptHit> searchPrompts(final String query, final Integer maxResults) throws SQLException {
        requireQuery(query);
        final int limit = effectiveLimit(maxResults);

        logger.debug("Searching prompts for '{}' (limit={})", query, limit);
        try (final PreparedStatement ps = database.connection().prepareStatement(PROMPT_SEARCH_SQL)) {
            ps.setString(1, query);
            ps.setInt(2, limit);

            final List<PromptHit> hits = new ArrayList<>();
            try (final ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    hits.add(new PromptHit(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getString("path"),
                            rs.getString("title"),
                            rs.getString("author"),
                            rs.getString("description"),
                            rs.getLong("size_bytes"),
                            rs.getInt("token_count"),
                            rs.getString("snippet"),
                            rs.getDouble("rank")));
                }
            }
            return hits;
        }
    }

    /**
     * Run the same query against skills and prompts. The category filter only applies to skills.
     */
    public CombinedResults searchAll(final String query, final Integer maxResults, final String category)
            throws SQLException {
        requireQuery(query);
        return new CombinedResults(searchSkills(query, maxResults, category), searchPrompts(query, maxResults));
    }

    public List<SkillRecord> listSkills(final String category, final Integer limit, final Integer offset)
            throws SQLException {
        return skillRepository.list(category,
                limit != null ? limit : DEFAULT_LIST_LIMIT,
                offset != null ? offset : 0);
    }

    public List<PromptRecord> listPrompts(final Integer limit, final Integer offset) throws SQLException {
        return promptRepository.list(
                limit != null ? limit : DEFAULT_LIST_LIMIT,
                offset != null ? offset : 0);
    }

    public List<CategoryCount> listCategories() throws SQLException {
        return categoryBreakdown(database.connection());
    }

    public Optional<SkillRecord> getSkillByName(final String name, final String category) throws SQLException {
        requireName(name);
        return skillRepository.findByName(name, category);
    }

    public Optional<PromptDetails> getPromptByName(final String name) throws SQLException {
        requireName(name);
        final Optional<PromptRecord> prompt = promptRepository.findByName(name);
        if (prompt.isEmpty()) {
            return Optional.empty();
        }
        final Connection conn = database.connection();
        final long promptId = prompt.get().id();
        return Optional.of(new PromptDetails(
                prompt.get(),
                fragmentRepository.skillsForPrompt(conn, promptId, ReferenceKind.EMBEDDED),
                fragmentRepository.skillsForPrompt(conn, promptId, ReferenceKind.REFERENCE)));
    }

    public DatabaseStats stats() throws SQLException {
        final Connection conn = database.connection();
        final long skills = singleLong(conn, "SELECT COUNT(*) FROM skills");
        final long prompts = singleLong(conn, "SELECT COUNT(*) FROM prompts");
        final long categories = singleLong(conn, "SELECT COUNT(DISTINCT category) FROM skills");

        long totalSize = 0;
        long totalTokens = 0;
        try (final PreparedStatement ps = conn.prepareStatement("""
                SELECT COALESCE(SUM(size_bytes), 0), COALESCE(SUM(token_count), 0)
                  FROM (SELECT size_bytes, token_count FROM skills
                        UNION ALL
                        SELECT size_bytes, token_count FROM prompts)""");
             final ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                totalSize = rs.getLong(1);
                totalTokens = rs.getLong(2);
            }
        }

        return new DatabaseStats(skills, prompts, categories, totalSize, totalTokens, categoryBreakdown(conn));
    }

    private static List<CategoryCount> categoryBreakdown(final Connection conn) throws SQLException {
        final List<CategoryCount> result = new ArrayList<>();
        try (final PreparedStatement ps = conn.prepareStatement(
                "SELECT category, COUNT(*) AS count FROM skills GROUP BY category ORDER BY category");
             final ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(new CategoryCount(rs.getString("category"), rs.getLong("count")));
            }
        }
        return result;
    }

    private static long singleLong(final Connection conn, final String sql) throws SQLException {
        try (final PreparedStatement ps = conn.prepareStatement(sql);
             final ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private int effectiveLimit(final Integer maxResults) {
        if (maxResults == null) {
            return defaultMaxResults;
        }
        if (maxResults < 1) {
            throw new IllegalArgumentException("Max results must be at least 1, got " + maxResults);
        }
        return maxResults;
    }

    private static void requireQuery(final String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be empty");
        }
    }

    private static void requireName(final String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name must not be empty");
        }
    }
}
