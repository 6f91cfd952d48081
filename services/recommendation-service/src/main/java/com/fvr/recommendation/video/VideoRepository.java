package com.fvr.recommendation.video;

import com.fvr.recommendation.common.JdbcUtils;
import com.fvr.recommendation.common.StorageException;
import java.sql.Blob;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

@Repository
public class VideoRepository {
    static final int ROWID_CHUNK = 900;
    static final int KEY_CHUNK = 450;

    private static final String METADATA_COLUMNS = new StringBuilder()
        .append("e.id AS row_id, ")
        .append("v.video_id, v.video_uuid, v.instance_domain, ")
        .append("v.channel_id, v.channel_name, v.channel_url, ")
        .append("c.display_name AS channel_display_name, c.avatar_url AS channel_avatar_url, ")
        .append("v.title, v.description, v.category, v.published_at, v.video_url, v.duration, ")
        .append("v.thumbnail_url, v.embed_path, v.preview_path, v.views, v.likes, v.nsfw, v.popularity, ")
        .append("e.embedding_dim, e.model_name ")
        .toString();

    private static final String METADATA_FROM = new StringBuilder()
        .append("FROM video_embeddings e ")
        .append("JOIN videos v ON v.video_id = e.video_id AND v.instance_domain = e.instance_domain ")
        .append("LEFT JOIN channels c ON c.channel_id = v.channel_id AND c.instance_domain = v.instance_domain ")
        .toString();

    private final JdbcTemplate jdbcTemplate;

    public VideoRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<VideoIdentity> resolveIdentity(String videoId, String uuid, String host) {
        StringBuilder sql = new StringBuilder()
            .append("SELECT video_id, video_uuid, instance_domain, channel_id, title FROM videos WHERE ");
        List<Object> params = new ArrayList<>();
        if (videoId != null) {
            sql.append("video_id = ? ");
            params.add(videoId);
        } else {
            sql.append("video_uuid = ? ");
            params.add(uuid);
        }
        if (host != null) {
            sql.append("AND instance_domain = ? ");
            params.add(host);
        }
        sql.append("ORDER BY instance_domain ASC LIMIT 1");
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql.toString(), params.toArray());
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toIdentity(rows.get(0)));
    }

    /**
     * Resolves (uuid, host) references to identities, preserving input order and
     * dropping references with no matching video.
     */
    public List<VideoIdentity> resolveByUuids(List<VideoIdentity> refs) {
        if (refs == null || refs.isEmpty()) {
            return List.of();
        }
        Map<String, VideoIdentity> found = new LinkedHashMap<>();
        for (List<VideoIdentity> batch : chunk(refs, KEY_CHUNK)) {
            StringBuilder sql = new StringBuilder()
                .append("SELECT video_id, video_uuid, instance_domain, channel_id, title FROM videos WHERE ");
            List<Object> params = new ArrayList<>();
            appendConditions(sql, params, batch, "video_uuid", "instance_domain", true);
            for (Map<String, Object> row : jdbcTemplate.queryForList(sql.toString(), params.toArray())) {
                VideoIdentity identity = toIdentity(row);
                found.put(VideoKeys.uuidKey(identity.getUuid(), identity.getInstanceDomain()), identity);
            }
        }
        List<VideoIdentity> resolved = new ArrayList<>();
        for (VideoIdentity ref : refs) {
            VideoIdentity identity = found.get(VideoKeys.uuidKey(ref.getUuid(), ref.getInstanceDomain()));
            if (identity != null) {
                resolved.add(identity);
            }
        }
        return resolved;
    }

    public Optional<SeedVideo> findSeed(VideoIdentity identity) {
        Map<String, SeedVideo> seeds = findSeeds(List.of(identity));
        return Optional.ofNullable(seeds.get(identity.key()));
    }

    /**
     * Loads embeddings for the given identities keyed by {@link VideoIdentity#key()}.
     * Identities not found by id are retried by {@code (uuid, instance)}.
     */
    public Map<String, SeedVideo> findSeeds(Collection<VideoIdentity> identities) {
        Map<String, SeedVideo> result = new LinkedHashMap<>();
        if (identities == null || identities.isEmpty()) {
            return result;
        }
        List<VideoIdentity> list = new ArrayList<>(identities);
        for (List<VideoIdentity> batch : chunk(list, KEY_CHUNK)) {
            StringBuilder sql = seedSelect();
            List<Object> params = new ArrayList<>();
            appendConditions(sql, params, batch, "e.video_id", "e.instance_domain", false);
            for (Map<String, Object> row : jdbcTemplate.queryForList(sql.toString(), params.toArray())) {
                SeedVideo seed = toSeed(row);
                if (seed != null) {
                    result.putIfAbsent(seed.getIdentity().key(), seed);
                }
            }
        }
        List<VideoIdentity> missing = new ArrayList<>();
        for (VideoIdentity identity : list) {
            if (!result.containsKey(identity.key()) && identity.getUuid() != null) {
                missing.add(identity);
            }
        }
        for (List<VideoIdentity> batch : chunk(missing, KEY_CHUNK)) {
            StringBuilder sql = seedSelect();
            List<Object> params = new ArrayList<>();
            appendConditions(sql, params, batch, "v.video_uuid", "e.instance_domain", true);
            Map<String, SeedVideo> byUuid = new LinkedHashMap<>();
            for (Map<String, Object> row : jdbcTemplate.queryForList(sql.toString(), params.toArray())) {
                SeedVideo seed = toSeed(row);
                if (seed != null) {
                    byUuid.putIfAbsent(
                        VideoKeys.uuidKey(seed.getIdentity().getUuid(), seed.getIdentity().getInstanceDomain()),
                        seed
                    );
                }
            }
            for (VideoIdentity identity : batch) {
                SeedVideo seed = byUuid.get(VideoKeys.uuidKey(identity.getUuid(), identity.getInstanceDomain()));
                if (seed != null) {
                    result.put(identity.key(), seed);
                }
            }
        }
        return result;
    }

    public Map<Long, CandidateRow> findByRowIds(Collection<Long> rowIds, int errorThreshold) {
        Map<Long, CandidateRow> result = new LinkedHashMap<>();
        if (rowIds == null || rowIds.isEmpty()) {
            return result;
        }
        for (List<Long> batch : chunk(new ArrayList<>(rowIds), ROWID_CHUNK)) {
            StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(METADATA_COLUMNS)
                .append(METADATA_FROM)
                .append("WHERE e.id IN (").append(placeholders(batch.size())).append(") ");
            List<Object> params = new ArrayList<>(batch);
            appendErrorClause(sql, params, errorThreshold);
            for (Map<String, Object> row : jdbcTemplate.queryForList(sql.toString(), params.toArray())) {
                CandidateRow candidate = CandidateRow.fromRow(row);
                result.put(candidate.getRowId(), candidate);
            }
        }
        return result;
    }

    public Map<String, CandidateRow> findByKeys(Collection<VideoIdentity> identities, int errorThreshold) {
        Map<String, CandidateRow> result = new LinkedHashMap<>();
        if (identities == null || identities.isEmpty()) {
            return result;
        }
        for (List<VideoIdentity> batch : chunk(new ArrayList<>(identities), KEY_CHUNK)) {
            StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(METADATA_COLUMNS)
                .append(METADATA_FROM)
                .append("WHERE ");
            List<Object> params = new ArrayList<>();
            appendConditions(sql, params, batch, "v.video_id", "v.instance_domain", false);
            appendErrorClause(sql, params, errorThreshold);
            for (Map<String, Object> row : jdbcTemplate.queryForList(sql.toString(), params.toArray())) {
                CandidateRow candidate = CandidateRow.fromRow(row);
                result.putIfAbsent(candidate.likeKey(), candidate);
            }
        }
        return result;
    }

    /**
     * Most recently published videos that have an embedding, newest first.
     */
    public List<CandidateRow> findRecent(int limit, int errorThreshold) {
        if (limit <= 0) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder()
            .append("SELECT ").append(METADATA_COLUMNS)
            .append(METADATA_FROM)
            .append("WHERE v.published_at IS NOT NULL ");
        List<Object> params = new ArrayList<>();
        appendErrorClause(sql, params, errorThreshold);
        sql.append("ORDER BY v.published_at DESC, e.id ASC LIMIT ?");
        params.add(limit);
        List<CandidateRow> rows = new ArrayList<>();
        for (Map<String, Object> row : jdbcTemplate.queryForList(sql.toString(), params.toArray())) {
            rows.add(CandidateRow.fromRow(row));
        }
        return rows;
    }

    public Map<String, float[]> findEmbeddingsByKeys(Collection<VideoIdentity> identities) {
        Map<String, float[]> result = new LinkedHashMap<>();
        for (Map.Entry<String, SeedVideo> entry : findSeeds(identities).entrySet()) {
            result.put(entry.getKey(), entry.getValue().getEmbedding());
        }
        return result;
    }

    public long countEmbeddings() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM video_embeddings", Long.class);
        return count == null ? 0L : count;
    }

    /**
     * Streams every stored embedding in row-id order. Rows whose blob does not
     * match their declared dimension are skipped.
     */
    public void forEachEmbedding(BiConsumer<Long, float[]> consumer) {
        jdbcTemplate.query(
            "SELECT id, embedding, embedding_dim FROM video_embeddings ORDER BY id ASC",
            (RowCallbackHandler) rs -> {
                float[] vector = EmbeddingCodec.decode(rs.getBytes("embedding"), rs.getInt("embedding_dim"));
                if (vector != null) {
                    consumer.accept(rs.getLong("id"), vector);
                }
            }
        );
    }

    private StringBuilder seedSelect() {
        return new StringBuilder()
            .append("SELECT e.id AS row_id, e.video_id, e.instance_domain, e.embedding, e.embedding_dim, ")
            .append("v.video_uuid, v.channel_id, v.title ")
            .append("FROM video_embeddings e ")
            .append("JOIN videos v ON v.video_id = e.video_id AND v.instance_domain = e.instance_domain ")
            .append("WHERE ");
    }

    private SeedVideo toSeed(Map<String, Object> row) {
        Integer dim = JdbcUtils.asInt(row.get("embedding_dim"));
        byte[] bytes = blobBytes(row.get("embedding"));
        if (bytes == null) {
            return null;
        }
        float[] vector = EmbeddingCodec.decode(bytes, dim == null ? 0 : dim);
        if (vector == null) {
            return null;
        }
        return new SeedVideo(JdbcUtils.asLong(row.get("row_id")), toIdentity(row), vector);
    }

    private static byte[] blobBytes(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof Blob blob) {
            try {
                return blob.getBytes(1, (int) blob.length());
            } catch (SQLException ex) {
                throw new StorageException("Failed to read embedding blob", ex);
            }
        }
        return null;
    }

    private VideoIdentity toIdentity(Map<String, Object> row) {
        return new VideoIdentity(
            JdbcUtils.asString(row.get("video_id")),
            JdbcUtils.asString(row.get("instance_domain")),
            JdbcUtils.asString(row.get("video_uuid")),
            JdbcUtils.asString(row.get("channel_id")),
            JdbcUtils.asString(row.get("title"))
        );
    }

    private void appendConditions(
        StringBuilder sql,
        List<Object> params,
        List<VideoIdentity> batch,
        String idColumn,
        String domainColumn,
        boolean byUuid
    ) {
        sql.append("(");
        for (int i = 0; i < batch.size(); i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            sql.append("(").append(idColumn).append(" = ? AND ").append(domainColumn).append(" = ?)");
            VideoIdentity identity = batch.get(i);
            params.add(byUuid ? identity.getUuid() : identity.getVideoId());
            params.add(identity.getInstanceDomain());
        }
        sql.append(") ");
    }

    private void appendErrorClause(StringBuilder sql, List<Object> params, int errorThreshold) {
        if (errorThreshold > 0) {
            sql.append("AND (v.error_count IS NULL OR v.error_count < ?) ");
            params.add(errorThreshold);
        }
    }

    static String placeholders(int count) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                out.append(",");
            }
            out.append("?");
        }
        return out.toString();
    }

    static <T> List<List<T>> chunk(List<T> values, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < values.size(); i += size) {
            chunks.add(values.subList(i, Math.min(values.size(), i + size)));
        }
        return chunks;
    }
}
