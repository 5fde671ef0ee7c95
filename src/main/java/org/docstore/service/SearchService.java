package org.docstore.service;

import org.docstore.DTO.SearchHit;
import org.docstore.DTO.SearchResponse;
import org.docstore.config.DocStoreProperties;
import org.docstore.entity.Vault;
import org.docstore.exception.ValidationException;
import org.docstore.repository.DocumentRepository;
import org.docstore.utils.BaseDirPaths;
import org.docstore.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 全文检索服务，基于 PostgreSQL tsvector（content_tsv 列）
 */
@Service
public class SearchService {

    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final DocumentRepository documentRepository;
    private final VaultService vaultService;
    private final DocStoreProperties properties;

    public SearchService(DocumentRepository documentRepository, VaultService vaultService, DocStoreProperties properties) {
        this.documentRepository = documentRepository;
        this.vaultService = vaultService;
        this.properties = properties;
    }

    /**
     * 检索当前用户的文档
     *
     * @param vaultId 可选，限定知识库
     * @param tags    可选，文档必须包含全部标签
     */
    @Transactional(readOnly = true)
    public SearchResponse search(UUID userId, String query, UUID vaultId, List<String> tags, Integer limit, Integer offset) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query cannot be empty");
        }
        int pageSize = limit == null ? DEFAULT_LIMIT : limit;
        int skip = offset == null ? 0 : offset;
        if (pageSize < 1 || pageSize > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (skip < 0) {
            throw new ValidationException("offset must not be negative");
        }

        // 指定知识库时先校验归属
        Map<UUID, Vault> vaults = new HashMap<>();
        if (vaultId != null) {
            vaults.put(vaultId, vaultService.getRow(userId, vaultId));
        }

        String tagFilter = normalizeTags(tags);
        List<DocumentRepository.SearchRow> rows = documentRepository.search(
                userId, query.trim(), vaultId == null ? null : vaultId.toString(), tagFilter, pageSize, skip);

        List<SearchHit> hits = new ArrayList<>();
        long total = 0;
        for (DocumentRepository.SearchRow row : rows) {
            total = row.getTotal() == null ? 0 : row.getTotal();
            Vault vault = vaults.computeIfAbsent(row.getVaultId(), id -> vaultService.getRow(userId, id));
            if (!BaseDirPaths.isVisible(vault, row.getPath())) {
                continue;
            }
            SearchHit hit = new SearchHit();
            hit.setDocumentId(row.getId());
            hit.setVaultId(row.getVaultId());
            hit.setVaultName(row.getVaultName());
            hit.setPath(BaseDirPaths.toUser(vault, row.getPath()));
            hit.setTitle(row.getTitle());
            hit.setTags(row.getTags() == null || row.getTags().isEmpty()
                    ? new ArrayList<>()
                    : new ArrayList<>(Arrays.asList(row.getTags().split(","))));
            hit.setSnippet(row.getSnippet());
            hit.setRank(row.getRank() == null ? 0.0 : row.getRank());
            hits.add(hit);
        }
        LogUtils.logBusiness("SEARCH", userId.toString(), "query=%s, 命中=%d", query, total);
        return new SearchResponse(hits, total);
    }

    /**
     * 为缺少全文检索向量的文档补算 content_tsv
     *
     * @return 更新的行数
     */
    @Transactional
    public int backfill() {
        int updated = documentRepository.refreshMissingSearchVectors();
        logger.info("全文检索向量补算完成，更新 {} 行", updated);
        return updated;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void backfillOnStartup() {
        if (properties.getSearch().isBackfillOnStartup()) {
            backfill();
        }
    }

    static String normalizeTags(List<String> tags) {
        if (tags == null) {
            return null;
        }
        List<String> normalized = tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .collect(Collectors.toList());
        return normalized.isEmpty() ? null : String.join(",", normalized);
    }
}
