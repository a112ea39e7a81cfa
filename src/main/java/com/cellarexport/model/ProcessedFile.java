package com.cellarexport.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedFile {
    private String id;
    private String r2Key;
    private String filename;
    private long sizeBytes;
    private String product;
    private String category;

    public static ProcessedFile from(FileRecord file) {
        return new ProcessedFile(file.getId(), file.getR2Key(), file.getFilename(),
                file.getSizeBytes(), file.getProduct(), file.getCategory());
    }

    /**
     * Path of this file inside the export archive.
     */
    public String archivePath() {
        return product + "/" + category + "/" + filename;
    }
}
