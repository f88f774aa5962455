package com.apiserver.hal;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered set of entities returned by a resource's collection operations.
 *
 * <p>Each resource subclasses this type (for example {@code AlbumCollection}); the subclass is
 * the key under which the collection's {@link CollectionMetadata} is registered in the
 * {@link MetadataMap}.
 *
 * @param <E> the entity type
 */
public class EntityCollection<E extends Entity> implements Iterable<E> {

  private final ImmutableList<E> items;

  public EntityCollection(List<? extends E> items) {
    this.items = ImmutableList.copyOf(items);
  }

  /** Returns all entities of the collection. */
  public List<E> getItems() {
    return items;
  }

  /** Returns the number of entities in the collection. */
  public int size() {
    return items.size();
  }

  /**
   * Returns the entities on the given one-based page.
   *
   * @param page the page number, starting at 1
   * @param pageSize the number of entities per page
   * @return the entities of that page, empty if the page lies past the end
   */
  public List<E> page(int page, int pageSize) {
    Preconditions.checkArgument(page >= 1, "page must be >= 1: %s", page);
    Preconditions.checkArgument(pageSize >= 1, "pageSize must be >= 1: %s", pageSize);
    long from = (long) (page - 1) * pageSize;
    if (from >= items.size()) {
      return ImmutableList.of();
    }
    int to = (int) Math.min(items.size(), from + pageSize);
    return items.subList((int) from, to);
  }

  @Override
  public Iterator<E> iterator() {
    return items.iterator();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("size", items.size()).toString();
  }
}
