package com.example.projectservice.dto.request;

import com.example.projectservice.metadata.FileEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileRequest {

    private String name;
    private String size;
    private String type;

    public FileEntry toEntry() {
        return FileEntry.builder().name(name).size(size).type(type).build();
    }
}
