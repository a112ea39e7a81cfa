package com.cellarexport.service;

import com.cellarexport.exception.ArchiveException;
import com.cellarexport.model.ExportState;
import com.cellarexport.model.ManifestEntry;
import com.cellarexport.model.ProcessedFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes export archives: a readme, a JSON manifest, then every processed file under
 * {@code product/category/filename}.
 */
@Service
@Slf4j
public class ZipArchiveBuilder {

    public static final String README_ENTRY = "README.txt";
    public static final String MANIFEST_ENTRY = "manifest.json";

    static final int PIPE_BUFFER_SIZE = 256 * 1024;

    private static final String README = """
            Cellar export
            =============

            This archive contains the files stored in your Cellar account at the time of export.

            Layout:
              manifest.json                   metadata of every file in this archive
              <product>/<category>/<filename> the files themselves

            Files that could not be found in storage when the export ran are not included.
            The download link for this archive expires 7 days after the export completed.
            """;

    private final CloudflareR2Service r2Service;
    private final ObjectMapper objectMapper;
    private final Executor writerExecutor;
    private final Clock clock;

    public ZipArchiveBuilder(CloudflareR2Service r2Service,
                             ObjectMapper objectMapper,
                             @Qualifier("archiveWriterExecutor") Executor writerExecutor,
                             Clock clock) {
        this.r2Service = r2Service;
        this.objectMapper = objectMapper;
        this.writerExecutor = writerExecutor;
        this.clock = clock;
    }

    /**
     * Start writing the archive of an export on the writer executor and return the stream the
     * archive bytes can be read from.
     */
    public ArchiveStream open(ExportState state) {
        PipedInputStream consumer = new PipedInputStream(PIPE_BUFFER_SIZE);
        PipedOutputStream producer;
        try {
            producer = new PipedOutputStream(consumer);
        } catch (IOException e) {
            throw new ArchiveException("Cannot open archive pipe: " + e.getMessage(), e);
        }

        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
            try (OutputStream out = producer) {
                writeArchive(state.getExportId(), state.getProcessedFiles(), out);
            } catch (IOException e) {
                throw new ArchiveException("Failed to write archive for export "
                        + state.getExportId() + ": " + e.getMessage(), e);
            }
        }, writerExecutor);

        return new ArchiveStream(consumer, writer);
    }

    /**
     * Write the complete archive to {@code out}. The stream is finished but not closed.
     */
    public void writeArchive(String exportId, List<ProcessedFile> files, OutputStream out) throws IOException {
        ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8);
        long mtime = clock.millis();

        addEntry(zip, README_ENTRY, README.getBytes(StandardCharsets.UTF_8), mtime);
        addEntry(zip, MANIFEST_ENTRY, manifest(files), mtime);

        Set<String> usedPaths = new HashSet<>();
        int skipped = 0;
        for (ProcessedFile file : files) {
            Optional<ResponseInputStream<GetObjectResponse>> object = r2Service.openObject(file.getR2Key());
            if (object.isEmpty()) {
                log.warn("Export {}: skipping file {} - not found during finalization", exportId, file.getR2Key());
                skipped++;
                continue;
            }
            try (ResponseInputStream<GetObjectResponse> body = object.get()) {
                ZipEntry entry = new ZipEntry(uniquePath(file.archivePath(), usedPaths));
                entry.setTime(mtime);
                zip.putNextEntry(entry);
                IOUtils.copyLarge(body, zip);
                zip.closeEntry();
            }
        }

        zip.finish();
        zip.flush();
        log.info("Export {}: archive written with {} files ({} skipped)", exportId, files.size() - skipped, skipped);
    }

    /**
     * ZIP entry names must be unique; a second file with the same path gets a " (n)" suffix.
     */
    static String uniquePath(String path, Set<String> usedPaths) {
        String candidate = path;
        int n = 1;
        while (!usedPaths.add(candidate)) {
            String extension = FilenameUtils.getExtension(path);
            String stem = FilenameUtils.removeExtension(path);
            candidate = extension.isEmpty()
                    ? stem + " (" + n + ")"
                    : stem + " (" + n + ")." + extension;
            n++;
        }
        return candidate;
    }

    byte[] manifest(List<ProcessedFile> files) throws IOException {
        List<ManifestEntry> entries = files.stream().map(ManifestEntry::from).toList();
        return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsBytes(entries);
    }

    private static void addEntry(ZipOutputStream zip, String name, byte[] content, long mtime) throws IOException {
        ZipEntry entry = new ZipEntry(name);
        entry.setTime(mtime);
        zip.putNextEntry(entry);
        zip.write(content);
        zip.closeEntry();
    }
}
