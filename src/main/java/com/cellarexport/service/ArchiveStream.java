package com.cellarexport.service;

import com.cellarexport.exception.ArchiveException;

import java.io.FilterInputStream;
import java.io.InputStream;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Consumer end of an archive being written on another thread. Reaching EOF only means the
 * writer stopped; {@link #awaitCompletion()} tells whether it finished the archive.
 */
public class ArchiveStream extends FilterInputStream {

    private final CompletableFuture<Void> producer;

    ArchiveStream(InputStream source, CompletableFuture<Void> producer) {
        super(source);
        this.producer = producer;
    }

    /**
     * Block until the writer is done and rethrow its failure, if any.
     */
    public void awaitCompletion() {
        try {
            producer.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ArchiveException) {
                throw (ArchiveException) cause;
            }
            throw new ArchiveException("Archive writer failed: " + cause.getMessage(), cause);
        }
    }
}
