package org.docstore.service;

import org.docstore.DTO.PathType;
import org.docstore.DTO.VaultDTO;
import org.docstore.entity.Vault;
import org.docstore.exception.ConflictException;
import org.docstore.exception.NotFoundException;
import org.docstore.exception.ValidationException;
import org.docstore.repository.VaultRepository;
import org.docstore.utils.LogUtils;
import org.docstore.utils.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 知识库管理服务
 * slug 由名称生成且创建后不再变化，磁盘目录为 dataDir/userId/slug。
 */
@Service
public class VaultService {

    private static final Logger logger = LoggerFactory.getLogger(VaultService.class);

    private static final int MAX_NAME_LENGTH = 100;

    private final VaultRepository vaultRepository;
    private final FileStorageService fileStorageService;

    public VaultService(VaultRepository vaultRepository, FileStorageService fileStorageService) {
        this.vaultRepository = vaultRepository;
        this.fileStorageService = fileStorageService;
    }

    /**
     * 名称转 slug：小写，去掉除字母数字、空白和连字符以外的字符，空白变连字符，合并并去掉首尾连字符
     */
    public static String slugify(String name) {
        return name.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("[^a-z0-9\\s-]", "")
                .replaceAll("\\s+", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
    }

    @Transactional(rollbackFor = Exception.class)
    public VaultDTO create(UUID userId, String name, String description) throws IOException {
        validateName(name);
        String slug = slugify(name);
        if (slug.isEmpty()) {
            throw new ValidationException("Vault name must contain at least one alphanumeric character");
        }
        if (vaultRepository.existsByUserIdAndSlug(userId, slug)) {
            throw new ConflictException("A vault with the slug \"" + slug + "\" already exists");
        }

        Vault vault = new Vault();
        vault.setUserId(userId);
        vault.setName(name.trim());
        vault.setSlug(slug);
        vault.setDescription(description);
        Vault saved = vaultRepository.save(vault);

        fileStorageService.ensureVaultDir(userId, slug);
        LogUtils.logBusiness("CREATE_VAULT", userId.toString(), "创建知识库 %s (slug=%s)", saved.getName(), slug);
        return VaultDTO.from(saved);
    }

    @Transactional(readOnly = true)
    public List<VaultDTO> list(UUID userId) {
        return vaultRepository.findByUserIdOrderByNameAsc(userId).stream()
                .map(VaultDTO::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public VaultDTO get(UUID userId, UUID vaultId) {
        return VaultDTO.from(getRow(userId, vaultId));
    }

    /**
     * 获取知识库并校验归属；不存在或不属于该用户时统一报 "Vault not found"
     */
    public Vault getRow(UUID userId, UUID vaultId) {
        return vaultRepository.findByIdAndUserId(vaultId, userId)
                .orElseThrow(() -> new NotFoundException("Vault not found"));
    }

    public Optional<Vault> findBySlug(UUID userId, String slug) {
        return vaultRepository.findByUserIdAndSlug(userId, slug);
    }

    public Path rootOf(Vault vault) {
        return fileStorageService.vaultPath(vault.getUserId(), vault.getSlug());
    }

    /**
     * 更新名称、描述和 baseDir；参数为 null 表示不修改，baseDir 传空白字符串表示清除
     */
    @Transactional(rollbackFor = Exception.class)
    public VaultDTO update(UUID userId, UUID vaultId, String name, String description, String baseDir) {
        Vault vault = getRow(userId, vaultId);

        if (name != null) {
            validateName(name);
            // slug 不随名称变化
            vault.setName(name.trim());
        }
        if (description != null) {
            vault.setDescription(description);
        }
        if (baseDir != null) {
            if (baseDir.isBlank()) {
                vault.setBaseDir(null);
            } else {
                PathGuard.validateDirPath(baseDir);
                if (fileStorageService.pathExists(rootOf(vault), baseDir) != PathType.DIRECTORY) {
                    throw new ValidationException("Base directory does not exist: " + baseDir);
                }
                vault.setBaseDir(baseDir);
            }
        }

        Vault saved = vaultRepository.save(vault);
        logger.info("知识库已更新: id={}, name={}, baseDir={}", saved.getId(), saved.getName(), saved.getBaseDir());
        return VaultDTO.from(saved);
    }

    /**
     * 删除知识库：数据库行删除（文档与版本级联删除），再删除磁盘目录
     */
    @Transactional(rollbackFor = Exception.class)
    public void remove(UUID userId, UUID vaultId) throws IOException {
        Vault vault = getRow(userId, vaultId);
        vaultRepository.delete(vault);
        vaultRepository.flush();
        fileStorageService.deleteVaultDir(userId, vault.getSlug());
        LogUtils.logBusiness("DELETE_VAULT", userId.toString(), "删除知识库 %s (slug=%s)", vault.getName(), vault.getSlug());
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Vault name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Vault name must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }
}
