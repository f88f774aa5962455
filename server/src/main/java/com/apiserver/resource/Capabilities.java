package com.apiserver.resource;

import com.apiserver.hal.Entity;
import com.apiserver.hal.EntityCollection;
import com.apiserver.rest.ApiResponse;
import java.util.EnumSet;
import java.util.Map;

/**
 * The capability interfaces a {@link Resource} implements, one per {@link Operation}.
 *
 * <p>Input maps handed to operations have already been validated and only contain keys the
 * caller sent.
 */
public final class Capabilities {

  private Capabilities() {
    // Holder for the capability interfaces, no instances
  }

  /**
   * Returns the operations the given resource supports.
   *
   * @param resource the resource to inspect
   * @return the supported operations, possibly empty
   */
  public static EnumSet<Operation> of(Resource resource) {
    EnumSet<Operation> operations = EnumSet.noneOf(Operation.class);
    for (Operation operation : Operation.values()) {
      if (operation.getCapability().isInstance(resource)) {
        operations.add(operation);
      }
    }
    return operations;
  }

  /** GET on an item. */
  public interface Fetch<E extends Entity> extends Resource {
    E fetch(String id);
  }

  /** GET on the collection. */
  public interface FetchAll<C extends EntityCollection<?>> extends Resource {
    C fetchAll();
  }

  /** POST on the collection. */
  public interface Create<E extends Entity> extends Resource {
    E create(Map<String, Object> data);
  }

  /** PUT on an item. */
  public interface Update<E extends Entity> extends Resource {
    E update(String id, Map<String, Object> data);
  }

  /** PUT on the collection. */
  public interface UpdateList<C extends EntityCollection<?>> extends Resource {
    C updateList(Map<String, Object> data);
  }

  /** PATCH on an item. */
  public interface Patch<E extends Entity> extends Resource {
    E patch(String id, Map<String, Object> data);
  }

  /** PATCH on the collection. */
  public interface PatchList<C extends EntityCollection<?>> extends Resource {
    C patchList(Map<String, Object> data);
  }

  /** DELETE on an item. */
  public interface Delete extends Resource {
    void delete(String id);
  }

  /** DELETE on the collection. */
  public interface DeleteList extends Resource {
    void deleteList();
  }

  /** HEAD on an item or the collection; the resource builds the whole response. */
  public interface Head extends Resource {
    ApiResponse head();
  }

  /** OPTIONS on an item or the collection; the resource builds the whole response. */
  public interface Options extends Resource {
    ApiResponse options();
  }
}
