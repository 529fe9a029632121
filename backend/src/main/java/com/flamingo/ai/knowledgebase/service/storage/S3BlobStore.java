package com.flamingo.ai.knowledgebase.service.storage;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.exception.StorageException;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/** {@link BlobStore} backed by S3 or an S3-compatible server such as MinIO. */
@Service
@RequiredArgsConstructor
@Slf4j
public class S3BlobStore implements BlobStore {

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final RagConfig ragConfig;

  @PostConstruct
  void ensureBucket() {
    String bucket = bucket();
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
    } catch (NoSuchBucketException e) {
      log.info("Creating bucket {}", bucket);
      s3Client.createBucket(b -> b.bucket(bucket));
    } catch (SdkException e) {
      log.warn("Could not verify bucket {} at startup: {}", bucket, e.getMessage());
    }
  }

  @Override
  public void put(String key, byte[] bytes, String contentType) {
    try {
      PutObjectRequest.Builder request =
          PutObjectRequest.builder().bucket(bucket()).key(key).contentLength((long) bytes.length);
      if (contentType != null) {
        request.contentType(contentType);
      }
      s3Client.putObject(request.build(), RequestBody.fromBytes(bytes));
      log.debug("Stored {} bytes at {}", bytes.length, key);
    } catch (SdkException e) {
      throw new StorageException(key, "Failed to store object: " + e.getMessage(), e);
    }
  }

  @Override
  public byte[] get(String key) {
    try {
      return s3Client
          .getObjectAsBytes(GetObjectRequest.builder().bucket(bucket()).key(key).build())
          .asByteArray();
    } catch (SdkException e) {
      throw new StorageException(key, "Failed to read object: " + e.getMessage(), e);
    }
  }

  @Override
  public String presignedUrl(String key, Duration expiry) {
    try {
      GetObjectPresignRequest request =
          GetObjectPresignRequest.builder()
              .signatureDuration(expiry)
              .getObjectRequest(b -> b.bucket(bucket()).key(key))
              .build();
      return s3Presigner.presignGetObject(request).url().toString();
    } catch (SdkException e) {
      throw new StorageException(key, "Failed to presign object: " + e.getMessage(), e);
    }
  }

  @Override
  public int deletePrefix(String prefix) {
    int deleted = 0;
    try {
      ListObjectsV2Request listRequest =
          ListObjectsV2Request.builder().bucket(bucket()).prefix(prefix).build();
      for (var page : s3Client.listObjectsV2Paginator(listRequest)) {
        List<ObjectIdentifier> ids =
            page.contents().stream()
                .map(S3Object::key)
                .map(k -> ObjectIdentifier.builder().key(k).build())
                .collect(Collectors.toList());
        if (ids.isEmpty()) {
          continue;
        }
        s3Client.deleteObjects(
            DeleteObjectsRequest.builder()
                .bucket(bucket())
                .delete(Delete.builder().objects(ids).build())
                .build());
        deleted += ids.size();
      }
    } catch (SdkException e) {
      throw new StorageException(prefix, "Failed to delete objects: " + e.getMessage(), e);
    }
    log.debug("Deleted {} objects under {}", deleted, prefix);
    return deleted;
  }

  private String bucket() {
    return ragConfig.getStorage().getBucket();
  }
}
