package com.apiserver.rest;

import com.apiserver.common.status.StatusCode;
import com.apiserver.hal.CollectionMetadata;
import com.apiserver.hal.Entity;
import com.apiserver.hal.EntityCollection;
import com.apiserver.hal.HalResourceGenerator;

/**
 * Renders operation results into responses.
 *
 * <p>Entities and collections have separate entry points. The status code passed in is applied
 * to both.
 */
public class ResponseShaper {

  private final HalResourceGenerator resourceGenerator;

  public ResponseShaper(HalResourceGenerator resourceGenerator) {
    this.resourceGenerator = resourceGenerator;
  }

  /** Renders an entity with status 200. */
  public ApiResponse shape(Entity entity, ApiRequest request) {
    return shape(entity, request, StatusCode.OK.getHttpCode());
  }

  /** Renders an entity with the given status. */
  public ApiResponse shape(Entity entity, ApiRequest request, int status) {
    return ApiResponse.hal(status, resourceGenerator.fromEntity(entity));
  }

  /** Renders a collection with status 200. */
  public ApiResponse shape(EntityCollection<?> collection, ApiRequest request) {
    return shape(collection, request, StatusCode.OK.getHttpCode());
  }

  /**
   * Renders a collection with the given status.
   *
   * <p>The caller's query parameters are overlaid on the collection's default query-string
   * arguments for this render only; the registered metadata is left untouched.
   *
   * @throws IllegalStateException if no metadata is registered for the collection's type
   */
  public ApiResponse shape(EntityCollection<?> collection, ApiRequest request, int status) {
    CollectionMetadata metadata =
        resourceGenerator.getMetadataMap().getCollection(collection.getClass()).getValue();
    CollectionMetadata merged = metadata.withQueryOverlay(request.queryParams());
    return ApiResponse.hal(status, resourceGenerator.fromCollection(collection, merged));
  }
}
