/**
 * Contains classes for error handling and status reporting.
 *
 * <ul>
 *   <li>{@link com.apiserver.common.status.StatusCode} - HTTP-aligned status codes with their
 *       reason phrases</li>
 *   <li>{@link com.apiserver.common.status.Status} - a status with an optional message and cause</li>
 *   <li>{@link com.apiserver.common.status.StatusOr} - either a value or an error status</li>
 * </ul>
 *
 * <p>The REST layer's exceptions each carry a {@code Status}; problem payloads are rendered from
 * it. Registry lookups return a {@code StatusOr} so that the caller decides whether a miss is a
 * user-facing condition or a programming error:
 * <pre>
 * CollectionMetadata metadata = metadataMap.getCollection(AlbumCollection.class).getValue();
 * </pre>
 */
package com.apiserver.common.status;
