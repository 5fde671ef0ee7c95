package org.docstore.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class DocumentListItem {
    private String path;
    private String title;
    private List<String> tags;
    private long sizeBytes;
    private OffsetDateTime fileModifiedAt;
}
