package com.apiserver.hal;

import com.apiserver.common.status.Status;
import com.apiserver.common.status.StatusOr;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.tinylog.Logger;

/**
 * Process-wide registry of rendering metadata, keyed by entity and collection class.
 *
 * <p>Registered values are immutable, so lookups from concurrent requests need no further
 * coordination.
 */
public class MetadataMap {

  private final ConcurrentMap<Class<?>, CollectionMetadata> collections = new ConcurrentHashMap<>();
  private final ConcurrentMap<Class<?>, ResourceMetadata> resources = new ConcurrentHashMap<>();

  /** Registers (or replaces) the metadata of a collection type. */
  public MetadataMap register(CollectionMetadata metadata) {
    collections.put(metadata.collectionType(), metadata);
    Logger.debug(
        "Registered collection metadata for {} at {}",
        metadata.collectionType().getSimpleName(),
        metadata.route());
    return this;
  }

  /** Registers (or replaces) the metadata of an entity type. */
  public MetadataMap register(ResourceMetadata metadata) {
    resources.put(metadata.entityType(), metadata);
    Logger.debug(
        "Registered resource metadata for {} at {}",
        metadata.entityType().getSimpleName(),
        metadata.route());
    return this;
  }

  /**
   * Looks up the metadata of a collection type.
   *
   * @param collectionType the collection class
   * @return the metadata, or a NOT_FOUND status if none is registered
   */
  public StatusOr<CollectionMetadata> getCollection(Class<?> collectionType) {
    CollectionMetadata metadata = collections.get(collectionType);
    if (metadata == null) {
      return StatusOr.ofStatus(
          Status.notFound("No collection metadata registered for " + collectionType.getName()));
    }
    return StatusOr.ofValue(metadata);
  }

  /** Looks up the metadata of an entity type. */
  public Optional<ResourceMetadata> getResource(Class<?> entityType) {
    return Optional.ofNullable(resources.get(entityType));
  }
}
