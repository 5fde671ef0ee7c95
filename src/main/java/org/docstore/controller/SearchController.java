package org.docstore.controller;

import org.docstore.DTO.SearchResponse;
import org.docstore.annotation.LogAction;
import org.docstore.service.SearchService;
import org.docstore.utils.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/search")
public class SearchController {

    @Autowired
    private SearchService searchService;

    /**
     * 全文检索
     *
     * @param q       websearch 语法的查询串
     * @param vaultId 可选，限定知识库
     * @param tags    可选，逗号分隔，要求全部包含
     */
    @GetMapping
    @LogAction(value = "SearchController", action = "search")
    public ResponseEntity<Result<SearchResponse>> search(
            @RequestHeader(value = UserHeader.NAME, required = false) String userHeader,
            @RequestParam("q") String q,
            @RequestParam(value = "vaultId", required = false) UUID vaultId,
            @RequestParam(value = "tags", required = false) List<String> tags,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset) {
        return ResponseEntity.ok(Result.success(
                searchService.search(UserHeader.parse(userHeader), q, vaultId, tags, limit, offset)));
    }
}
