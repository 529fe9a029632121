package com.flamingo.ai.knowledgebase.config;

import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * S3 client configuration. With an endpoint set (MinIO or another S3-compatible store) static
 * credentials and path-style access are used; otherwise the default AWS provider chain applies.
 */
@Configuration
@RequiredArgsConstructor
public class ObjectStorageConfig {

  private final RagConfig ragConfig;

  @Bean
  public S3Client s3Client() {
    RagConfig.Storage storage = ragConfig.getStorage();
    var builder =
        S3Client.builder()
            .region(Region.of(storage.getRegion()))
            .credentialsProvider(credentialsProvider(storage))
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(storage.isPathStyleAccess())
                    .build());
    if (hasEndpoint(storage)) {
      builder.endpointOverride(URI.create(storage.getEndpoint()));
    }
    return builder.build();
  }

  @Bean
  public S3Presigner s3Presigner() {
    RagConfig.Storage storage = ragConfig.getStorage();
    var builder =
        S3Presigner.builder()
            .region(Region.of(storage.getRegion()))
            .credentialsProvider(credentialsProvider(storage))
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(storage.isPathStyleAccess())
                    .build());
    if (hasEndpoint(storage)) {
      builder.endpointOverride(URI.create(storage.getEndpoint()));
    }
    return builder.build();
  }

  private static boolean hasEndpoint(RagConfig.Storage storage) {
    return storage.getEndpoint() != null && !storage.getEndpoint().isBlank();
  }

  private static AwsCredentialsProvider credentialsProvider(RagConfig.Storage storage) {
    if (storage.getAccessKey() != null && !storage.getAccessKey().isBlank()) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey()));
    }
    return DefaultCredentialsProvider.create();
  }
}
