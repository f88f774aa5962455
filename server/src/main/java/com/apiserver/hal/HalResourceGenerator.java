package com.apiserver.hal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import com.google.common.primitives.Ints;
import io.javalin.http.BadRequestResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders entities and collections as HAL+JSON resource maps.
 *
 * <p>The generator is stateless apart from its collaborators. Collection rendering takes the
 * metadata to render with as an argument, so callers can pass a per-request copy carrying the
 * caller's query parameters.
 */
public class HalResourceGenerator {

  private static final TypeReference<LinkedHashMap<String, Object>> STATE_TYPE =
      new TypeReference<LinkedHashMap<String, Object>>() {};
  private static final Escaper QUERY_ESCAPER = UrlEscapers.urlFormParameterEscaper();

  private final ObjectMapper objectMapper;
  private final MetadataMap metadataMap;

  public HalResourceGenerator(ObjectMapper objectMapper, MetadataMap metadataMap) {
    this.objectMapper = objectMapper;
    this.metadataMap = metadataMap;
  }

  /** Returns the metadata registry this generator resolves entity links from. */
  public MetadataMap getMetadataMap() {
    return metadataMap;
  }

  /**
   * Renders a single entity: its properties, plus a self link when metadata is registered for
   * its type.
   */
  public Map<String, Object> fromEntity(Entity entity) {
    Map<String, Object> resource = objectMapper.convertValue(entity, STATE_TYPE);
    metadataMap
        .getResource(entity.getClass())
        .ifPresent(metadata -> resource.put("_links", Map.of("self", link(metadata.selfHref(entity)))));
    return resource;
  }

  /**
   * Renders one page of a collection.
   *
   * @param collection the collection to render
   * @param metadata the metadata to render with; its query-string arguments appear in every link
   * @return the HAL resource map
   * @throws BadRequestResponse if the requested page is not a number or is out of bounds
   */
  public Map<String, Object> fromCollection(
      EntityCollection<?> collection, CollectionMetadata metadata) {
    int pageSize = metadata.pageSize();
    int totalItems = collection.size();
    int pageCount = Math.max(1, (totalItems + pageSize - 1) / pageSize);
    int page = currentPage(metadata);
    if (page < 1 || page > pageCount) {
      throw new BadRequestResponse(
          String.format(
              "Page %d is out of bounds. Collection has %d page(s)", page, pageCount));
    }

    Map<String, Object> links = new LinkedHashMap<>();
    links.put("self", link(href(metadata.route(), metadata.queryStringArguments())));
    links.put("first", link(pageHref(metadata, 1)));
    if (page > 1) {
      links.put("prev", link(pageHref(metadata, page - 1)));
    }
    if (page < pageCount) {
      links.put("next", link(pageHref(metadata, page + 1)));
    }
    links.put("last", link(pageHref(metadata, pageCount)));

    List<Map<String, Object>> items =
        collection.page(page, pageSize).stream()
            .map(this::fromEntity)
            .collect(Collectors.toList());

    Map<String, Object> resource = new LinkedHashMap<>();
    resource.put("_links", links);
    resource.put("_embedded", Map.of(metadata.collectionRelation(), items));
    resource.put("_page", page);
    resource.put("_page_count", pageCount);
    resource.put("_total_items", totalItems);
    return resource;
  }

  private static int currentPage(CollectionMetadata metadata) {
    Object raw = metadata.queryStringArguments().get(metadata.paginationParam());
    if (raw instanceof List<?> values) {
      raw = values.isEmpty() ? null : values.get(0);
    }
    if (raw == null) {
      return 1;
    }
    if (raw instanceof Number number) {
      return number.intValue();
    }
    Integer page = Ints.tryParse(raw.toString().trim());
    if (page == null) {
      throw new BadRequestResponse(
          "Invalid value for " + metadata.paginationParam() + ": " + raw);
    }
    return page;
  }

  private static String pageHref(CollectionMetadata metadata, int page) {
    Map<String, Object> arguments = new LinkedHashMap<>(metadata.queryStringArguments());
    arguments.put(metadata.paginationParam(), page);
    return href(metadata.route(), arguments);
  }

  static String href(String route, Map<String, ?> arguments) {
    if (arguments.isEmpty()) {
      return route;
    }
    List<String> pairs = new ArrayList<>();
    arguments.forEach(
        (key, value) -> {
          if (value instanceof List<?> values) {
            values.forEach(v -> pairs.add(pair(key, v)));
          } else {
            pairs.add(pair(key, value));
          }
        });
    return route + "?" + Joiner.on('&').join(pairs);
  }

  private static String pair(String key, Object value) {
    return QUERY_ESCAPER.escape(key) + "=" + QUERY_ESCAPER.escape(String.valueOf(value));
  }

  private static Map<String, String> link(String href) {
    return Map.of("href", href);
  }
}
