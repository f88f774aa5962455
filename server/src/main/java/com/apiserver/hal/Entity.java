package com.apiserver.hal;

/**
 * A single resource instance returned by a resource's item operations.
 *
 * <p>Implementations are plain beans or records; their properties are rendered as the state of
 * the HAL resource. The identifier is used to build the entity's self link.
 */
public interface Entity {

  /** Returns the identifier of this entity, as it appears in the item route. */
  Object getId();
}
