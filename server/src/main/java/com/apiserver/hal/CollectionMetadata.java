package com.apiserver.hal;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rendering metadata for one collection type.
 *
 * <p>Instances are immutable and shared by every request for the collection type. A request that
 * carries its own query parameters renders against the copy returned by
 * {@link #withQueryOverlay(Map)}; the registered instance never changes.
 *
 * @param collectionType the {@link EntityCollection} subclass this metadata describes
 * @param route the collection route, e.g. {@code /albums}
 * @param collectionRelation the relation name the entities are embedded under
 * @param queryStringArguments default query-string arguments for links of this collection
 * @param paginationParam the query-string argument that selects the page
 * @param pageSize the number of entities per page
 */
public record CollectionMetadata(
    Class<?> collectionType,
    String route,
    String collectionRelation,
    Map<String, Object> queryStringArguments,
    String paginationParam,
    int pageSize) {

  public static final String DEFAULT_PAGINATION_PARAM = "page";
  public static final int DEFAULT_PAGE_SIZE = 25;

  public CollectionMetadata {
    Preconditions.checkNotNull(collectionType, "collectionType");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(route), "route must not be empty");
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(collectionRelation), "collectionRelation must not be empty");
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(paginationParam), "paginationParam must not be empty");
    Preconditions.checkArgument(pageSize >= 1, "pageSize must be >= 1: %s", pageSize);
    queryStringArguments = ImmutableMap.copyOf(queryStringArguments);
  }

  /**
   * Creates metadata with no default query-string arguments, the default pagination parameter
   * and the default page size.
   */
  public static CollectionMetadata of(
      Class<? extends EntityCollection<?>> collectionType, String route, String collectionRelation) {
    return new CollectionMetadata(
        collectionType,
        route,
        collectionRelation,
        ImmutableMap.of(),
        DEFAULT_PAGINATION_PARAM,
        DEFAULT_PAGE_SIZE);
  }

  /** Returns a copy with the given default query-string arguments. */
  public CollectionMetadata withQueryStringArguments(Map<String, ?> arguments) {
    return new CollectionMetadata(
        collectionType,
        route,
        collectionRelation,
        ImmutableMap.<String, Object>copyOf(arguments),
        paginationParam,
        pageSize);
  }

  /** Returns a copy with the given page size. */
  public CollectionMetadata withPageSize(int newPageSize) {
    return new CollectionMetadata(
        collectionType,
        route,
        collectionRelation,
        queryStringArguments,
        paginationParam,
        newPageSize);
  }

  /**
   * Returns a copy whose query-string arguments are these defaults overlaid with the caller's
   * query parameters.
   *
   * <p>A caller parameter replaces the default of the same name; parameters with no default are
   * added after the defaults. A parameter given once becomes a string, one given several times
   * a list of strings, and one with no values is skipped.
   *
   * @param queryParams the caller's query parameters
   * @return the merged metadata, or this instance when there is nothing to merge
   */
  public CollectionMetadata withQueryOverlay(Map<String, List<String>> queryParams) {
    if (queryParams.isEmpty()) {
      return this;
    }
    Map<String, Object> merged = new LinkedHashMap<>(queryStringArguments);
    queryParams.forEach(
        (key, values) -> {
          if (values == null || values.isEmpty()) {
            return;
          }
          merged.put(key, values.size() == 1 ? values.get(0) : ImmutableList.copyOf(values));
        });
    return new CollectionMetadata(
        collectionType, route, collectionRelation, merged, paginationParam, pageSize);
  }
}
