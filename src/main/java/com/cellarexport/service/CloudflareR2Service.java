package com.cellarexport.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class CloudflareR2Service {

    private final S3Client s3Client;
    private final String bucketName;

    public CloudflareR2Service(S3Client s3Client, @Value("${cloudflare.r2.bucket}") String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        log.info("Using Cloudflare R2 bucket: {}", bucketName);
    }

    /**
     * Checks whether an object exists. Errors other than "not found" propagate to the caller.
     */
    public boolean objectExists(String objectKey) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucketName)
                    .key(objectKey)
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Opens a streamed read of an object, or empty when it no longer exists.
     * The caller owns the returned stream.
     */
    public Optional<ResponseInputStream<GetObjectResponse>> openObject(String objectKey) {
        GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .build();
        try {
            return Optional.of(s3Client.getObject(getObjectRequest));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        }
    }

    /**
     * Upload a complete object in a single request
     */
    public void putObject(String objectKey, byte[] data, String contentType, Map<String, String> metadata) {
        log.info("Uploading object to R2: {} ({} bytes)", objectKey, data.length);

        PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .contentType(contentType)
                .metadata(metadata)
                .build();

        s3Client.putObject(putObjectRequest, RequestBody.fromBytes(data));

        log.info("Object uploaded successfully: {}", objectKey);
    }

    public String createMultipartUpload(String objectKey, String contentType, Map<String, String> metadata) {
        CreateMultipartUploadRequest request = CreateMultipartUploadRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .contentType(contentType)
                .metadata(metadata)
                .build();
        String uploadId = s3Client.createMultipartUpload(request).uploadId();
        log.info("Started multipart upload for {} (upload ID: {})", objectKey, uploadId);
        return uploadId;
    }

    /**
     * Upload one part of a multipart upload and return its ETag
     */
    public String uploadPart(String objectKey, String uploadId, int partNumber, byte[] data, int length) {
        UploadPartRequest request = UploadPartRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .uploadId(uploadId)
                .partNumber(partNumber)
                .contentLength((long) length)
                .build();
        String eTag = s3Client.uploadPart(request, RequestBody.fromBytes(copyOf(data, length))).eTag();
        log.debug("Uploaded part {} of {} ({} bytes)", partNumber, objectKey, length);
        return eTag;
    }

    public void completeMultipartUpload(String objectKey, String uploadId, List<String> eTags) {
        List<CompletedPart> completedParts = new ArrayList<>();
        for (int i = 0; i < eTags.size(); i++) {
            completedParts.add(CompletedPart.builder()
                    .partNumber(i + 1)
                    .eTag(eTags.get(i))
                    .build());
        }

        s3Client.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .uploadId(uploadId)
                .multipartUpload(CompletedMultipartUpload.builder()
                        .parts(completedParts)
                        .build())
                .build());

        log.info("Completed multipart upload for {} with {} parts", objectKey, eTags.size());
    }

    public void abortMultipartUpload(String objectKey, String uploadId) {
        s3Client.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .uploadId(uploadId)
                .build());
        log.info("Aborted multipart upload for {} (upload ID: {})", objectKey, uploadId);
    }

    public void deleteObject(String objectKey) {
        s3Client.deleteObject(DeleteObjectRequest.builder()
                .bucket(bucketName)
                .key(objectKey)
                .build());
        log.info("Deleted object from R2: {}", objectKey);
    }

    private static byte[] copyOf(byte[] data, int length) {
        if (length == data.length) {
            return data;
        }
        byte[] copy = new byte[length];
        System.arraycopy(data, 0, copy, 0, length);
        return copy;
    }
}
