package de.mirkosertic.skills.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Access to prompt fragments, their ordered skills and the references from prompts to fragments.
 * <p>
 * All methods operate on the connection passed in, so a caller can group several calls into one
 * transaction via {@link SkillsDatabase#inTransaction(SkillsDatabase.SqlWork)}.
 */
public class FragmentRepository {

    /**
     * Reference positions at or above this value point to reference-only fragments.
     */
    public static final int REFERENCE_POSITION_OFFSET = 100;

    /**
     * Position of the embedded fragment reference of a prompt.
     */
    public static final int EMBEDDED_POSITION = 1;

    /**
     * How a prompt refers to a fragment.
     */
    public enum ReferenceKind {
        EMBEDDED("embedded"),
        REFERENCE("reference");

        private final String columnValue;

        ReferenceKind(final String columnValue) {
            this.columnValue = columnValue;
        }

        public String columnValue() {
            return columnValue;
        }
    }

    /**
     * A skill as it appears in a prompt, either embedded or referenced.
     */
    public record FragmentSkill(int position, SkillRecord skill) {
    }

    /**
     * Return the id of the fragment with the given name, creating it if it does not exist.
     * Title and description of an existing fragment are left unchanged.
     */
    public long findOrCreate(final Connection conn, final String name, final String title,
                             final String description) throws SQLException {
        final Optional<Long> existing = findIdByName(conn, name);
        if (existing.isPresent()) {
            return existing.get();
        }
        try (final PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO prompt_fragments (name, title, description) VALUES (?, ?, ?)")) {
            ps.setString(1, name);
            ps.setString(2, title);
            ps.setString(3, description);
            ps.executeUpdate();
        }
        return findIdByName(conn, name)
                .orElseThrow(() -> new SQLException("Fragment not found after insert: " + name));
    }

    public Optional<Long> findIdByName(final Connection conn, final String name) throws SQLException {
        try (final PreparedStatement ps = conn.prepareStatement("SELECT id FROM prompt_fragments WHERE name = ?")) {
            ps.setString(1, name);
            try (final ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    public void clearSkills(final Connection conn, final long fragmentId) throws SQLException {
        try (final PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM prompt_fragment_skills WHERE fragment_id = ?")) {
            ps.setLong(1, fragmentId);
            ps.executeUpdate();
        }
    }

    public void addSkill(final Connection conn, final long fragmentId, final long skillId, final int position)
            throws SQLException {
        try (final PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO prompt_fragment_skills (fragment_id, skill_id, position) VALUES (?, ?, ?)")) {
            ps.setLong(1, fragmentId);
            ps.setLong(2, skillId);
            ps.setInt(3, position);
            ps.executeUpdate();
        }
    }

    /**
     * Remove all references of the given kind that originate from a prompt.
     *
     * @return the number of removed references
     */
    public int deleteReferences(final Connection conn, final long promptId, final ReferenceKind kind)
            throws SQLException {
        try (final PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM prompt_references WHERE source_prompt_id = ? AND reference_kind = ?")) {
            ps.setLong(1, promptId);
            ps.setString(2, kind.columnValue());
            return ps.executeUpdate();
        }
    }

    public void addReference(final Connection conn, final long promptId, final long fragmentId,
                             final ReferenceKind kind, final int position) throws SQLException {
        try (final PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO prompt_references "
                        + "(source_prompt_id, target_fragment_id, reference_type, reference_kind, position) "
                        + "VALUES (?, ?, 'fragment', ?, ?)")) {
            ps.setLong(1, promptId);
            ps.setLong(2, fragmentId);
            ps.setString(3, kind.columnValue());
            ps.setInt(4, position);
            ps.executeUpdate();
        }
    }

    /**
     * Skills reachable from a prompt through references of the given kind.
     * <p>
     * Positions are the entry's index in the descriptor's fragment or reference list.
     */
    public List<FragmentSkill> skillsForPrompt(final Connection conn, final long promptId, final ReferenceKind kind)
            throws SQLException {
        final String positionExpression = kind == ReferenceKind.EMBEDDED
                ? "pfs.position"
                : "pr.position - " + REFERENCE_POSITION_OFFSET;
        final String sql = "SELECT s.*, " + positionExpression + " AS skill_position "
                + "FROM prompt_references pr "
                + "JOIN prompt_fragment_skills pfs ON pfs.fragment_id = pr.target_fragment_id "
                + "JOIN skills s ON s.id = pfs.skill_id "
                + "WHERE pr.source_prompt_id = ? AND pr.reference_kind = ? "
                + "ORDER BY pr.position, pfs.position";
        try (final PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, promptId);
            ps.setString(2, kind.columnValue());
            final List<FragmentSkill> result = new ArrayList<>();
            try (final ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new FragmentSkill(rs.getInt("skill_position"), SkillRecord.fromResultSet(rs)));
                }
            }
            return result;
        }
    }
}
