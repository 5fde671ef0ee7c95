package org.docstore.controller;

import org.docstore.DTO.DocumentContent;
import org.docstore.DTO.DocumentDTO;
import org.docstore.DTO.DocumentListItem;
import org.docstore.DTO.DocumentVersionDTO;
import org.docstore.DTO.FileOperationRequest;
import org.docstore.DTO.FileOperationResult;
import org.docstore.DTO.TreeNode;
import org.docstore.annotation.LogAction;
import org.docstore.entity.ChangeSource;
import org.docstore.service.DocumentService;
import org.docstore.utils.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * 文档接口，路径均相对于知识库（设置了 baseDir 时相对于 baseDir）
 */
@RestController
@RequestMapping("/api/v1/vaults/{vaultId}/documents")
public class DocumentController {

    @Autowired
    private DocumentService documentService;

    @GetMapping
    public ResponseEntity<Result<List<DocumentListItem>>> list(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId,
            @RequestParam(value = "dir", required = false) String dir) {
        return ResponseEntity.ok(Result.success(documentService.list(UserHeader.parse(userHeader), vaultId, dir)));
    }

    @GetMapping("/tree")
    public ResponseEntity<Result<List<TreeNode>>> tree(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId) {
        return ResponseEntity.ok(Result.success(documentService.tree(UserHeader.parse(userHeader), vaultId)));
    }

    @GetMapping("/content")
    public ResponseEntity<Result<DocumentContent>> get(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId,
            @RequestParam("path") String path) throws IOException {
        return ResponseEntity.ok(Result.success(documentService.get(UserHeader.parse(userHeader), vaultId, path)));
    }

    // 请求体即 Markdown 原文
    @PutMapping("/content")
    @LogAction(value = "DocumentController", action = "putDocument")
    public ResponseEntity<Result<DocumentDTO>> put(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId,
            @RequestParam("path") String path,
            @RequestParam(value = "source", defaultValue = "api") String source,
            @RequestBody(required = false) String content) throws IOException {
        DocumentDTO document = documentService.put(UserHeader.parse(userHeader), vaultId, path,
                content == null ? "" : content, ChangeSource.fromValue(source));
        return ResponseEntity.ok(Result.success(document));
    }

    @DeleteMapping("/content")
    @LogAction(value = "DocumentController", action = "deleteDocument")
    public ResponseEntity<Result<Void>> delete(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId,
            @RequestParam("path") String path) throws IOException {
        documentService.remove(UserHeader.parse(userHeader), vaultId, path);
        return ResponseEntity.ok(Result.success("删除成功", null));
    }

    @GetMapping("/versions")
    public ResponseEntity<Result<List<DocumentVersionDTO>>> versions(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId,
            @RequestParam("path") String path) {
        return ResponseEntity.ok(Result.success(documentService.getVersions(UserHeader.parse(userHeader), vaultId, path)));
    }

    @PostMapping("/directories")
    @LogAction(value = "DocumentController", action = "createDirectory")
    public ResponseEntity<Result<FileOperationResult>> createDirectory(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId,
            @RequestBody FileOperationRequest request) throws IOException {
        return ResponseEntity.ok(Result.success(
                documentService.createDirectory(UserHeader.parse(userHeader), vaultId, request.getDestination())));
    }

    @PostMapping("/move")
    @LogAction(value = "DocumentController", action = "move")
    public ResponseEntity<Result<FileOperationResult>> move(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId,
            @RequestBody FileOperationRequest request) throws IOException {
        return ResponseEntity.ok(Result.success(documentService.move(UserHeader.parse(userHeader), vaultId,
                request.getSource(), request.getDestination(), request.isOverwrite())));
    }

    @PostMapping("/copy")
    @LogAction(value = "DocumentController", action = "copy")
    public ResponseEntity<Result<FileOperationResult>> copy(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId,
            @RequestBody FileOperationRequest request) throws IOException {
        return ResponseEntity.ok(Result.success(documentService.copy(UserHeader.parse(userHeader), vaultId,
                request.getSource(), request.getDestination(), request.isOverwrite())));
    }
}
