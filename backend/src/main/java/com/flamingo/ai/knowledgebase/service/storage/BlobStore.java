package com.flamingo.ai.knowledgebase.service.storage;

import java.time.Duration;

/**
 * Opaque blob store holding original uploads and extracted images.
 *
 * <p>Implementations throw {@link com.flamingo.ai.knowledgebase.exception.StorageException} on
 * failure.
 */
public interface BlobStore {

  /**
   * Stores bytes under the given key, replacing any existing object.
   *
   * @param key object key
   * @param bytes content
   * @param contentType MIME type recorded with the object, may be null
   */
  void put(String key, byte[] bytes, String contentType);

  /**
   * Reads an object fully.
   *
   * @param key object key
   * @return object content
   */
  byte[] get(String key);

  /**
   * Creates a time-limited GET URL that external services can fetch without credentials.
   *
   * @param key object key
   * @param expiry URL lifetime
   * @return absolute URL
   */
  String presignedUrl(String key, Duration expiry);

  /**
   * Deletes every object whose key starts with the prefix.
   *
   * @param prefix key prefix
   * @return number of deleted objects
   */
  int deletePrefix(String prefix);
}
