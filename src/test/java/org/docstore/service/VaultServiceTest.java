package org.docstore.service;

import org.docstore.DTO.VaultDTO;
import org.docstore.config.DocStoreProperties;
import org.docstore.entity.Vault;
import org.docstore.exception.ConflictException;
import org.docstore.exception.NotFoundException;
import org.docstore.exception.ValidationException;
import org.docstore.repository.VaultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VaultServiceTest {

    @TempDir
    Path dataDir;

    private final UUID userId = UUID.randomUUID();

    private VaultRepository vaultRepository;
    private FileStorageService storage;
    private VaultService vaultService;

    @BeforeEach
    void setUp() {
        DocStoreProperties properties = new DocStoreProperties();
        properties.setDataDir(dataDir.toString());
        storage = new FileStorageService(properties);
        vaultRepository = mock(VaultRepository.class);
        when(vaultRepository.save(any(Vault.class))).thenAnswer(inv -> {
            Vault vault = inv.getArgument(0);
            if (vault.getId() == null) {
                vault.setId(UUID.randomUUID());
            }
            return vault;
        });
        vaultService = new VaultService(vaultRepository, storage);
    }

    @Test
    void slugifyNormalizesNames() {
        assertEquals("my-notes", VaultService.slugify("My Notes!"));
        assertEquals("hello-world", VaultService.slugify("  --Hello   World--  "));
        assertEquals("a-b", VaultService.slugify("a - b"));
        assertEquals("", VaultService.slugify("!!!"));
    }

    @Test
    void createPersistsAndMakesDirectory() throws IOException {
        VaultDTO dto = vaultService.create(userId, " Work Notes ", "desc");

        assertEquals("Work Notes", dto.getName());
        assertEquals("work-notes", dto.getSlug());
        assertTrue(Files.isDirectory(storage.vaultPath(userId, "work-notes")));
    }

    @Test
    void createRejectsDuplicateSlug() {
        when(vaultRepository.existsByUserIdAndSlug(userId, "work")).thenReturn(true);

        ConflictException ex = assertThrows(ConflictException.class, () -> vaultService.create(userId, "WORK", null));
        assertEquals("A vault with the slug \"work\" already exists", ex.getMessage());
        verify(vaultRepository, never()).save(any(Vault.class));
    }

    @Test
    void createRejectsUnusableNames() {
        assertThrows(ValidationException.class, () -> vaultService.create(userId, "   ", null));
        assertThrows(ValidationException.class, () -> vaultService.create(userId, "!!!", null));
        assertThrows(ValidationException.class, () -> vaultService.create(userId, "x".repeat(101), null));
    }

    @Test
    void getRowHidesOtherUsersVaults() {
        UUID vaultId = UUID.randomUUID();
        when(vaultRepository.findByIdAndUserId(vaultId, userId)).thenReturn(Optional.empty());

        NotFoundException ex = assertThrows(NotFoundException.class, () -> vaultService.getRow(userId, vaultId));
        assertEquals("Vault not found", ex.getMessage());
    }

    @Test
    void updateKeepsSlugAndValidatesBaseDir() throws IOException {
        Vault vault = existingVault("notes");
        Files.createDirectories(storage.vaultPath(userId, "notes").resolve("public"));

        VaultDTO renamed = vaultService.update(userId, vault.getId(), "Renamed", null, null);
        assertEquals("Renamed", renamed.getName());
        assertEquals("notes", renamed.getSlug());

        assertThrows(ValidationException.class, () -> vaultService.update(userId, vault.getId(), null, null, "missing"));
        assertThrows(ValidationException.class, () -> vaultService.update(userId, vault.getId(), null, null, "../up"));

        assertEquals("public", vaultService.update(userId, vault.getId(), null, null, "public").getBaseDir());
        assertNull(vaultService.update(userId, vault.getId(), null, null, "  ").getBaseDir());
    }

    @Test
    void removeDeletesRowAndDirectory() throws IOException {
        Vault vault = existingVault("notes");
        Path dir = storage.ensureVaultDir(userId, "notes");
        Files.writeString(dir.resolve("a.md"), "a");

        vaultService.remove(userId, vault.getId());

        verify(vaultRepository).delete(vault);
        assertFalse(Files.exists(dir));
    }

    private Vault existingVault(String slug) {
        Vault vault = new Vault();
        vault.setId(UUID.randomUUID());
        vault.setUserId(userId);
        vault.setName(slug);
        vault.setSlug(slug);
        when(vaultRepository.findByIdAndUserId(vault.getId(), userId)).thenReturn(Optional.of(vault));
        return vault;
    }
}
