package org.docstore.controller;

import org.docstore.DTO.DocumentDTO;
import org.docstore.DTO.FileOperationResult;
import org.docstore.entity.ChangeSource;
import org.docstore.exception.GlobalExceptionHandler;
import org.docstore.exception.NotFoundException;
import org.docstore.service.DocumentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DocumentControllerTest {

    private final UUID userId = UUID.randomUUID();
    private final UUID vaultId = UUID.randomUUID();

    private DocumentService documentService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        documentService = mock(DocumentService.class);
        DocumentController controller = new DocumentController();
        ReflectionTestUtils.setField(controller, "documentService", documentService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void putPassesRawBodyAndSource() throws Exception {
        DocumentDTO dto = new DocumentDTO();
        dto.setPath("notes/a.md");
        dto.setTitle("A");
        when(documentService.put(eq(userId), eq(vaultId), eq("notes/a.md"), eq("# A\n"), eq(ChangeSource.WEB)))
                .thenReturn(dto);

        mockMvc.perform(put("/api/v1/vaults/{vaultId}/documents/content", vaultId)
                        .header(UserHeader.NAME, userId.toString())
                        .param("path", "notes/a.md")
                        .param("source", "web")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("# A\n"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.title").value("A"));
    }

    @Test
    void missingUserHeaderIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/vaults/{vaultId}/documents", vaultId))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value(401))
                .andExpect(jsonPath("$.success").value(false));
        verifyNoInteractions(documentService);
    }

    @Test
    void unknownSourceIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/v1/vaults/{vaultId}/documents/content", vaultId)
                        .header(UserHeader.NAME, userId.toString())
                        .param("path", "a.md")
                        .param("source", "ftp")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("x"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(documentService);
    }

    @Test
    void missingPathParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/vaults/{vaultId}/documents/content", vaultId)
                        .header(UserHeader.NAME, userId.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    void notFoundMapsTo404() throws Exception {
        when(documentService.get(userId, vaultId, "gone.md")).thenThrow(new NotFoundException("Document not found: gone.md"));

        mockMvc.perform(get("/api/v1/vaults/{vaultId}/documents/content", vaultId)
                        .header(UserHeader.NAME, userId.toString())
                        .param("path", "gone.md"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Document not found: gone.md"));
    }

    @Test
    void moveReadsJsonRequest() throws Exception {
        when(documentService.move(any(), any(), anyString(), anyString(), anyBoolean()))
                .thenReturn(new FileOperationResult("Move operation completed successfully", "a.md", "b/a.md"));

        mockMvc.perform(post("/api/v1/vaults/{vaultId}/documents/move", vaultId)
                        .header(UserHeader.NAME, userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"a.md\",\"destination\":\"b/a.md\",\"overwrite\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.destination").value("b/a.md"));

        verify(documentService).move(userId, vaultId, "a.md", "b/a.md", true);
    }
}
