package org.docstore.controller;

import org.docstore.DTO.VaultDTO;
import org.docstore.DTO.VaultRequest;
import org.docstore.annotation.LogAction;
import org.docstore.service.VaultService;
import org.docstore.utils.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * 知识库管理接口
 */
@RestController
@RequestMapping("/api/v1/vaults")
public class VaultController {

    @Autowired
    private VaultService vaultService;

    @GetMapping
    public ResponseEntity<Result<List<VaultDTO>>> list(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader) {
        return ResponseEntity.ok(Result.success(vaultService.list(UserHeader.parse(userHeader))));
    }

    @PostMapping
    @LogAction(value = "VaultController", action = "createVault")
    public ResponseEntity<Result<VaultDTO>> create(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @RequestBody VaultRequest request) throws IOException {
        VaultDTO vault = vaultService.create(UserHeader.parse(userHeader), request.getName(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(Result.created(vault));
    }

    @GetMapping("/{vaultId}")
    public ResponseEntity<Result<VaultDTO>> get(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId) {
        return ResponseEntity.ok(Result.success(vaultService.get(UserHeader.parse(userHeader), vaultId)));
    }

    @PatchMapping("/{vaultId}")
    @LogAction(value = "VaultController", action = "updateVault")
    public ResponseEntity<Result<VaultDTO>> update(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId,
            @RequestBody VaultRequest request) {
        VaultDTO vault = vaultService.update(UserHeader.parse(userHeader), vaultId,
                request.getName(), request.getDescription(), request.getBaseDir());
        return ResponseEntity.ok(Result.success(vault));
    }

    @DeleteMapping("/{vaultId}")
    @LogAction(value = "VaultController", action = "deleteVault")
    public ResponseEntity<Result<Void>> delete(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @PathVariable UUID vaultId) throws IOException {
        vaultService.remove(UserHeader.parse(userHeader), vaultId);
        return ResponseEntity.ok(Result.success("知识库已删除", null));
    }
}
