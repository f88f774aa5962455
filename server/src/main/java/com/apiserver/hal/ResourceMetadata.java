package com.apiserver.hal;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.net.UrlEscapers;

/**
 * Rendering metadata for one entity type: the route its self link is built from.
 *
 * @param entityType the entity class
 * @param route the collection route the entity lives under, e.g. {@code /albums}
 */
public record ResourceMetadata(Class<? extends Entity> entityType, String route) {

  public ResourceMetadata {
    Preconditions.checkNotNull(entityType, "entityType");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(route), "route must not be empty");
  }

  /** Returns the item route of the given entity, e.g. {@code /albums/42}. */
  public String selfHref(Entity entity) {
    return route + "/" + UrlEscapers.urlPathSegmentEscaper().escape(String.valueOf(entity.getId()));
  }
}
