package org.docstore.repository;

import org.docstore.entity.Document;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

    Optional<Document> findByVaultIdAndPath(UUID vaultId, String path);

    List<Document> findByVaultIdOrderByPathAsc(UUID vaultId);

    /**
     * 查询某目录下（递归）的所有文档
     *
     * @param vaultId 知识库ID
     * @param pattern 已转义的 LIKE 模式，形如 "notes/%"
     */
    @Query(value = "SELECT * FROM documents WHERE vault_id = :vaultId AND path LIKE :pattern ESCAPE '\\' ORDER BY path",
            nativeQuery = true)
    List<Document> findUnderPrefix(@Param("vaultId") UUID vaultId, @Param("pattern") String pattern);

    /**
     * 删除某目录下（递归）的所有文档，版本记录由外键级联删除
     *
     * @return 删除的行数
     */
    @Modifying
    @Query(value = "DELETE FROM documents WHERE vault_id = :vaultId AND path LIKE :pattern ESCAPE '\\'",
            nativeQuery = true)
    int deleteUnderPrefix(@Param("vaultId") UUID vaultId, @Param("pattern") String pattern);

    /**
     * 目录移动：把 oldPrefix 开头的路径整体替换为 newPrefix
     *
     * @param start oldPrefix 的字符数 + 1（按码点计）
     */
    @Modifying
    @Query(value = "UPDATE documents SET path = :newPrefix || substr(path, :start), updated_at = now() " +
            "WHERE vault_id = :vaultId AND path LIKE :pattern ESCAPE '\\'",
            nativeQuery = true)
    int movePrefix(@Param("vaultId") UUID vaultId,
                   @Param("pattern") String pattern,
                   @Param("newPrefix") String newPrefix,
                   @Param("start") int start);

    // 重新计算全文检索向量：标题 + 标签 + 去格式正文
    @Modifying
    @Query(value = "UPDATE documents SET content_tsv = to_tsvector('english', " +
            "coalesce(title, '') || ' ' || coalesce(array_to_string(tags, ' '), '') || ' ' || coalesce(stripped_content, '')) " +
            "WHERE id = :id",
            nativeQuery = true)
    int refreshSearchVector(@Param("id") UUID id);

    @Modifying
    @Query(value = "UPDATE documents SET content_tsv = to_tsvector('english', " +
            "coalesce(title, '') || ' ' || coalesce(array_to_string(tags, ' '), '') || ' ' || coalesce(stripped_content, '')) " +
            "WHERE content_tsv IS NULL",
            nativeQuery = true)
    int refreshMissingSearchVectors();

    /**
     * 全文检索，限定在该用户的知识库内
     *
     * @param vaultId 可为空，按知识库过滤（UUID 字符串）
     * @param tags    可为空，逗号分隔，要求文档包含全部标签
     */
    @Query(value = "SELECT d.id AS id, d.vault_id AS vaultId, v.name AS vaultName, d.path AS path, d.title AS title, " +
            "array_to_string(d.tags, ',') AS tags, " +
            "ts_headline('english', coalesce(d.stripped_content, ''), q, 'MaxWords=35, MinWords=15, MaxFragments=2') AS snippet, " +
            "CAST(ts_rank_cd(d.content_tsv, q) AS double precision) AS rank, " +
            "count(*) OVER() AS total " +
            "FROM documents d JOIN vaults v ON v.id = d.vault_id, websearch_to_tsquery('english', :query) q " +
            "WHERE v.user_id = :userId AND d.content_tsv @@ q " +
            "AND (CAST(:vaultId AS text) IS NULL OR d.vault_id = CAST(CAST(:vaultId AS text) AS uuid)) " +
            "AND (CAST(:tags AS text) IS NULL OR d.tags @> string_to_array(CAST(:tags AS text), ',')) " +
            "ORDER BY rank DESC, d.path LIMIT :limit OFFSET :offset",
            nativeQuery = true)
    List<SearchRow> search(@Param("userId") UUID userId,
                           @Param("query") String query,
                           @Param("vaultId") String vaultId,
                           @Param("tags") String tags,
                           @Param("limit") int limit,
                           @Param("offset") int offset);

    /**
     * 检索结果投影
     */
    interface SearchRow {
        UUID getId();

        UUID getVaultId();

        String getVaultName();

        String getPath();

        String getTitle();

        String getTags();

        String getSnippet();

        Double getRank();

        Long getTotal();
    }
}
