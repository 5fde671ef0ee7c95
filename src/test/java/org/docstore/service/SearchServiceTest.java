package org.docstore.service;

import org.docstore.DTO.SearchResponse;
import org.docstore.config.DocStoreProperties;
import org.docstore.entity.Vault;
import org.docstore.exception.NotFoundException;
import org.docstore.exception.ValidationException;
import org.docstore.repository.DocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SearchServiceTest {

    private final UUID userId = UUID.randomUUID();
    private final UUID vaultId = UUID.randomUUID();

    private DocumentRepository documentRepository;
    private VaultService vaultService;
    private DocStoreProperties properties;
    private SearchService searchService;
    private Vault vault;

    @BeforeEach
    void setUp() {
        documentRepository = mock(DocumentRepository.class);
        vaultService = mock(VaultService.class);
        properties = new DocStoreProperties();
        searchService = new SearchService(documentRepository, vaultService, properties);

        vault = new Vault();
        vault.setId(vaultId);
        vault.setUserId(userId);
        vault.setSlug("notes");
        when(vaultService.getRow(userId, vaultId)).thenReturn(vault);
    }

    @Test
    void mapsRowsToHits() {
        DocumentRepository.SearchRow row = row("ideas/launch.md", "Launch", "plans,work", 0.5, 1L);
        when(documentRepository.search(eq(userId), eq("launch plan"), isNull(), isNull(), eq(20), eq(0)))
                .thenReturn(List.of(row));

        SearchResponse response = searchService.search(userId, "  launch plan ", null, null, null, null);

        assertEquals(1, response.getTotal());
        assertEquals(1, response.getResults().size());
        assertEquals("ideas/launch.md", response.getResults().get(0).getPath());
        assertEquals(Arrays.asList("plans", "work"), response.getResults().get(0).getTags());
        assertEquals("Notes", response.getResults().get(0).getVaultName());
        assertEquals(0.5, response.getResults().get(0).getRank());
    }

    @Test
    void passesVaultAndNormalizedTagFilters() {
        when(documentRepository.search(any(), anyString(), any(), any(), anyInt(), anyInt())).thenReturn(List.of());

        searchService.search(userId, "q", vaultId, List.of(" Work", "ideas", "work", ""), 5, 10);

        verify(documentRepository).search(userId, "q", vaultId.toString(), "work,ideas", 5, 10);
    }

    @Test
    void baseDirHidesAndRewritesResults() {
        vault.setBaseDir("public");
        List<DocumentRepository.SearchRow> rows = List.of(
                row("private/secret.md", "Secret", null, 0.9, 2L),
                row("public/open.md", "Open", "", 0.4, 2L));
        when(documentRepository.search(any(), anyString(), any(), any(), anyInt(), anyInt())).thenReturn(rows);

        SearchResponse response = searchService.search(userId, "q", vaultId, null, null, null);

        assertEquals(1, response.getResults().size());
        assertEquals("open.md", response.getResults().get(0).getPath());
        assertTrue(response.getResults().get(0).getTags().isEmpty());
    }

    @Test
    void rejectsBadParameters() {
        assertThrows(ValidationException.class, () -> searchService.search(userId, " ", null, null, null, null));
        assertThrows(ValidationException.class, () -> searchService.search(userId, "q", null, null, 0, null));
        assertThrows(ValidationException.class, () -> searchService.search(userId, "q", null, null, 101, null));
        assertThrows(ValidationException.class, () -> searchService.search(userId, "q", null, null, null, -1));
        verify(documentRepository, never()).search(any(), anyString(), any(), any(), anyInt(), anyInt());
    }

    @Test
    void foreignVaultIsNotFound() {
        UUID other = UUID.randomUUID();
        when(vaultService.getRow(userId, other)).thenThrow(new NotFoundException("Vault not found"));
        assertThrows(NotFoundException.class, () -> searchService.search(userId, "q", other, null, null, null));
    }

    @Test
    void backfillOnlyRunsWhenEnabled() {
        searchService.backfillOnStartup();
        verify(documentRepository, never()).refreshMissingSearchVectors();

        properties.getSearch().setBackfillOnStartup(true);
        when(documentRepository.refreshMissingSearchVectors()).thenReturn(3);
        searchService.backfillOnStartup();
        verify(documentRepository).refreshMissingSearchVectors();
    }

    @Test
    void normalizeTagsDropsBlanksAndDuplicates() {
        assertNull(SearchService.normalizeTags(null));
        assertNull(SearchService.normalizeTags(List.of(" ", "")));
        assertEquals("a,b", SearchService.normalizeTags(List.of("A", "b", "a")));
    }

    private DocumentRepository.SearchRow row(String path, String title, String tags, double rank, long total) {
        DocumentRepository.SearchRow row = mock(DocumentRepository.SearchRow.class);
        when(row.getId()).thenReturn(UUID.randomUUID());
        when(row.getVaultId()).thenReturn(vaultId);
        when(row.getVaultName()).thenReturn("Notes");
        when(row.getPath()).thenReturn(path);
        when(row.getTitle()).thenReturn(title);
        when(row.getTags()).thenReturn(tags);
        when(row.getSnippet()).thenReturn("...");
        when(row.getRank()).thenReturn(rank);
        when(row.getTotal()).thenReturn(total);
        return row;
    }
}
