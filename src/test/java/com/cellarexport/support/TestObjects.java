package com.cellarexport.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

public final class TestObjects {

    private TestObjects() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    public static Optional<ResponseInputStream<GetObjectResponse>> object(String content) {
        return object(content.getBytes(StandardCharsets.UTF_8));
    }

    public static Optional<ResponseInputStream<GetObjectResponse>> object(byte[] content) {
        return Optional.of(new ResponseInputStream<>(
                GetObjectResponse.builder().contentLength((long) content.length).build(),
                AbortableInputStream.create(new ByteArrayInputStream(content))));
    }
}
