package com.cellarexport.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManifestEntry {
    private String filename;
    private long size;
    @JsonProperty("r2_key")
    private String r2Key;
    private String product;
    private String category;

    public static ManifestEntry from(ProcessedFile file) {
        return new ManifestEntry(file.getFilename(), file.getSizeBytes(), file.getR2Key(),
                file.getProduct(), file.getCategory());
    }
}
