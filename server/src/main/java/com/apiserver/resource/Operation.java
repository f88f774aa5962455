package com.apiserver.resource;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The operations a resource may support, with the HTTP method and scope each is reached by.
 */
public enum Operation {
  FETCH("GET", Scope.ITEM, Capabilities.Fetch.class),
  FETCH_ALL("GET", Scope.COLLECTION, Capabilities.FetchAll.class),
  CREATE("POST", Scope.COLLECTION, Capabilities.Create.class),
  UPDATE("PUT", Scope.ITEM, Capabilities.Update.class),
  UPDATE_LIST("PUT", Scope.COLLECTION, Capabilities.UpdateList.class),
  PATCH("PATCH", Scope.ITEM, Capabilities.Patch.class),
  PATCH_LIST("PATCH", Scope.COLLECTION, Capabilities.PatchList.class),
  DELETE("DELETE", Scope.ITEM, Capabilities.Delete.class),
  DELETE_LIST("DELETE", Scope.COLLECTION, Capabilities.DeleteList.class),
  HEAD("HEAD", Scope.ANY, Capabilities.Head.class),
  OPTIONS("OPTIONS", Scope.ANY, Capabilities.Options.class);

  /** Whether an operation addresses a single item, the collection, or either. */
  public enum Scope {
    ITEM,
    COLLECTION,
    ANY;

    boolean covers(Scope requested) {
      return this == ANY || requested == ANY || this == requested;
    }
  }

  private final String httpMethod;
  private final Scope scope;
  private final Class<? extends Resource> capability;

  Operation(String httpMethod, Scope scope, Class<? extends Resource> capability) {
    this.httpMethod = httpMethod;
    this.scope = scope;
    this.capability = capability;
  }

  public String getHttpMethod() {
    return httpMethod;
  }

  public Scope getScope() {
    return scope;
  }

  /** Returns the capability interface a resource implements to support this operation. */
  public Class<? extends Resource> getCapability() {
    return capability;
  }

  /**
   * Returns the HTTP methods that reach one of the given operations at the given scope, in
   * declaration order. {@link Scope#ANY} collects the methods of both the item and the
   * collection route.
   */
  public static Set<String> allowedMethods(EnumSet<Operation> operations, Scope scope) {
    Set<String> methods = new LinkedHashSet<>();
    for (Operation operation : operations) {
      if (operation.scope.covers(scope)) {
        methods.add(operation.httpMethod);
      }
    }
    return methods;
  }
}
