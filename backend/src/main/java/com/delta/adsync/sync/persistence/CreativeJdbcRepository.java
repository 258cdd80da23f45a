package com.delta.adsync.sync.persistence;

import com.delta.adsync.sync.model.CreativeRecord;
import com.delta.adsync.sync.model.CreativeType;
import com.delta.adsync.sync.model.FetchStatus;
import com.delta.adsync.sync.model.ResolutionQuality;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.delta.adsync.sync.persistence.JdbcSupport.nullableInt;
import static com.delta.adsync.sync.persistence.JdbcSupport.nullableLong;
import static com.delta.adsync.sync.persistence.JdbcSupport.toInstant;
import static com.delta.adsync.sync.persistence.JdbcSupport.toTimestamp;
import static com.delta.adsync.sync.persistence.JdbcSupport.truncate;

/**
 * One row per (tenant, ad). Re-resolution overwrites the row in place and bumps
 * {@code fetch_attempts}.
 */
@Repository
public class CreativeJdbcRepository {
    private static final String COLUMNS = """
        tenant_id,
        ad_id,
        external_account_id,
        ad_name,
        creative_id,
        creative_type,
        image_url,
        image_url_hd,
        thumbnail_url,
        image_width,
        image_height,
        resolution_quality,
        image_source,
        video_id,
        video_url,
        preview_url,
        title,
        body,
        description,
        call_to_action,
        link_url,
        fetch_status,
        has_carousel,
        carousel_count,
        cached_image_url,
        cached_file_size,
        raw_snapshot,
        error_message,
        fetch_attempts,
        fetched_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public CreativeJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    /**
     * Writes the record. A cached image URL already on the row survives a re-resolution that did
     * not produce a new one.
     */
    public void upsertCreative(CreativeRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", record.tenantId())
            .addValue("adId", record.adId())
            .addValue("accountId", record.externalAccountId())
            .addValue("adName", truncate(record.adName(), 512))
            .addValue("creativeId", record.creativeId())
            .addValue("creativeType", record.creativeType().dbValue())
            .addValue("imageUrl", record.imageUrl())
            .addValue("imageUrlHd", record.imageUrlHd())
            .addValue("thumbnailUrl", record.thumbnailUrl())
            .addValue("imageWidth", record.imageWidth())
            .addValue("imageHeight", record.imageHeight())
            .addValue("quality", record.resolutionQuality().dbValue())
            .addValue("imageSource", record.imageSource())
            .addValue("videoId", record.videoId())
            .addValue("videoUrl", record.videoUrl())
            .addValue("previewUrl", record.previewUrl())
            .addValue("title", record.title())
            .addValue("body", record.body())
            .addValue("description", record.description())
            .addValue("callToAction", truncate(record.callToAction(), 64))
            .addValue("linkUrl", record.linkUrl())
            .addValue("fetchStatus", record.fetchStatus().dbValue())
            .addValue("carousel", record.carousel())
            .addValue("carouselCount", record.carouselCount())
            .addValue("cachedImageUrl", record.cachedImageUrl())
            .addValue("cachedFileSize", record.cachedFileSize())
            .addValue("rawSnapshot", record.rawSnapshot())
            .addValue("errorMessage", truncate(record.errorMessage(), 4000))
            .addValue("fetchedAt", toTimestamp(record.fetchedAt()));
        String insert = """
            INSERT INTO ad_creatives (
            """ + COLUMNS + """
            )
            VALUES (
                :tenantId,
                :adId,
                :accountId,
                :adName,
                :creativeId,
                :creativeType,
                :imageUrl,
                :imageUrlHd,
                :thumbnailUrl,
                :imageWidth,
                :imageHeight,
                :quality,
                :imageSource,
                :videoId,
                :videoUrl,
                :previewUrl,
                :title,
                :body,
                :description,
                :callToAction,
                :linkUrl,
                :fetchStatus,
                :carousel,
                :carouselCount,
                :cachedImageUrl,
                :cachedFileSize,
                :rawSnapshot,
                :errorMessage,
                1,
                :fetchedAt
            )
            """;
        if (postgres) {
            jdbc.update(
                insert + """
                    ON CONFLICT (tenant_id, ad_id)
                    DO UPDATE SET
                        external_account_id = COALESCE(EXCLUDED.external_account_id, ad_creatives.external_account_id),
                        ad_name = EXCLUDED.ad_name,
                        creative_id = EXCLUDED.creative_id,
                        creative_type = EXCLUDED.creative_type,
                        image_url = EXCLUDED.image_url,
                        image_url_hd = EXCLUDED.image_url_hd,
                        thumbnail_url = EXCLUDED.thumbnail_url,
                        image_width = EXCLUDED.image_width,
                        image_height = EXCLUDED.image_height,
                        resolution_quality = EXCLUDED.resolution_quality,
                        image_source = EXCLUDED.image_source,
                        video_id = EXCLUDED.video_id,
                        video_url = EXCLUDED.video_url,
                        preview_url = EXCLUDED.preview_url,
                        title = EXCLUDED.title,
                        body = EXCLUDED.body,
                        description = EXCLUDED.description,
                        call_to_action = EXCLUDED.call_to_action,
                        link_url = EXCLUDED.link_url,
                        fetch_status = EXCLUDED.fetch_status,
                        has_carousel = EXCLUDED.has_carousel,
                        carousel_count = EXCLUDED.carousel_count,
                        cached_image_url = COALESCE(EXCLUDED.cached_image_url, ad_creatives.cached_image_url),
                        cached_file_size = COALESCE(EXCLUDED.cached_file_size, ad_creatives.cached_file_size),
                        raw_snapshot = EXCLUDED.raw_snapshot,
                        error_message = EXCLUDED.error_message,
                        fetch_attempts = ad_creatives.fetch_attempts + 1,
                        fetched_at = EXCLUDED.fetched_at
                    """,
                params
            );
            return;
        }
        String update = """
            UPDATE ad_creatives
            SET external_account_id = COALESCE(:accountId, external_account_id),
                ad_name = :adName,
                creative_id = :creativeId,
                creative_type = :creativeType,
                image_url = :imageUrl,
                image_url_hd = :imageUrlHd,
                thumbnail_url = :thumbnailUrl,
                image_width = :imageWidth,
                image_height = :imageHeight,
                resolution_quality = :quality,
                image_source = :imageSource,
                video_id = :videoId,
                video_url = :videoUrl,
                preview_url = :previewUrl,
                title = :title,
                body = :body,
                description = :description,
                call_to_action = :callToAction,
                link_url = :linkUrl,
                fetch_status = :fetchStatus,
                has_carousel = :carousel,
                carousel_count = :carouselCount,
                cached_image_url = COALESCE(:cachedImageUrl, cached_image_url),
                cached_file_size = COALESCE(:cachedFileSize, cached_file_size),
                raw_snapshot = :rawSnapshot,
                error_message = :errorMessage,
                fetch_attempts = fetch_attempts + 1,
                fetched_at = :fetchedAt
            WHERE tenant_id = :tenantId
              AND ad_id = :adId
            """;
        if (jdbc.update(update, params) > 0) {
            return;
        }
        try {
            jdbc.update(insert, params);
        } catch (DataIntegrityViolationException e) {
            jdbc.update(update, params);
        }
    }

    public CreativeRecord findCreative(String tenantId, String adId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("adId", adId);
        List<CreativeRecord> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM ad_creatives WHERE tenant_id = :tenantId AND ad_id = :adId",
            params,
            creativeMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public Map<String, CreativeRecord> findCreatives(String tenantId, Collection<String> adIds) {
        Map<String, CreativeRecord> out = new LinkedHashMap<>();
        if (adIds == null || adIds.isEmpty()) {
            return out;
        }
        List<String> ids = new ArrayList<>(adIds);
        for (int i = 0; i < ids.size(); i += 500) {
            List<String> chunk = ids.subList(i, Math.min(ids.size(), i + 500));
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("adIds", chunk);
            List<CreativeRecord> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM ad_creatives WHERE tenant_id = :tenantId AND ad_id IN (:adIds)",
                params,
                creativeMapper()
            );
            for (CreativeRecord row : rows) {
                out.put(row.adId(), row);
            }
        }
        return out;
    }

    private RowMapper<CreativeRecord> creativeMapper() {
        return (rs, rowNum) -> new CreativeRecord(
            rs.getString("tenant_id"),
            rs.getString("ad_id"),
            rs.getString("external_account_id"),
            rs.getString("ad_name"),
            rs.getString("creative_id"),
            CreativeType.fromDb(rs.getString("creative_type")),
            rs.getString("image_url"),
            rs.getString("image_url_hd"),
            rs.getString("thumbnail_url"),
            nullableInt(rs, "image_width"),
            nullableInt(rs, "image_height"),
            ResolutionQuality.fromDb(rs.getString("resolution_quality")),
            rs.getString("image_source"),
            rs.getString("video_id"),
            rs.getString("video_url"),
            rs.getString("preview_url"),
            rs.getString("title"),
            rs.getString("body"),
            rs.getString("description"),
            rs.getString("call_to_action"),
            rs.getString("link_url"),
            FetchStatus.fromDb(rs.getString("fetch_status")),
            rs.getBoolean("has_carousel"),
            rs.getInt("carousel_count"),
            rs.getString("cached_image_url"),
            nullableLong(rs, "cached_file_size"),
            rs.getString("raw_snapshot"),
            rs.getString("error_message"),
            rs.getInt("fetch_attempts"),
            toInstant(rs.getTimestamp("fetched_at"))
        );
    }
}
