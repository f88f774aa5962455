package com.apiserver.rest;

import com.apiserver.common.status.StatusCode;
import com.apiserver.hal.Entity;
import com.apiserver.hal.EntityCollection;
import com.apiserver.resource.Capabilities;
import com.apiserver.resource.Operation;
import com.apiserver.resource.Resource;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.tinylog.Logger;

/**
 * Dispatches HTTP requests for one resource onto the resource's operations.
 *
 * <p>The method and the presence of an identifier select the operation:
 *
 * <pre>
 *   method    with identifier     without identifier
 *   GET       fetch               fetchAll
 *   POST      (405)               create      -> 201
 *   PUT       update              updateList
 *   PATCH     patch               patchList
 *   DELETE    delete   -> 204     deleteList  -> 204
 *   HEAD      head                head
 *   OPTIONS   options             options
 * </pre>
 *
 * <p>An operation the resource has not declared in its capability set is rejected with an
 * {@link OperationNotPermittedException} before anything else happens. A
 * {@link ValidationException} raised while preparing an operation's input is converted to a
 * problem response here, and only here; every other exception propagates to the caller.
 *
 * <p>Handlers hold no per-request state and may serve concurrent requests.
 */
public class RestHandler implements Handler {

  private final Resource resource;
  private final EnumSet<Operation> capabilities;
  private final BodyValidator bodyValidator;
  private final ResponseShaper responseShaper;
  private final ProblemResponseFactory problemResponseFactory;
  private final ObjectMapper objectMapper;

  /**
   * Creates a handler for the given resource.
   *
   * @param resource the resource to dispatch to
   * @param responseShaper renders operation results
   * @param problemResponseFactory renders validation failures
   * @param objectMapper parses request bodies
   */
  public RestHandler(
      Resource resource,
      ResponseShaper responseShaper,
      ProblemResponseFactory problemResponseFactory,
      ObjectMapper objectMapper) {
    this.resource = resource;
    this.capabilities = Capabilities.of(resource);
    this.bodyValidator = new BodyValidator(resource.inputFilter().orElse(null));
    this.responseShaper = responseShaper;
    this.problemResponseFactory = problemResponseFactory;
    this.objectMapper = objectMapper;
  }

  /** Returns the resource this handler dispatches to. */
  public Resource getResource() {
    return resource;
  }

  /** Returns the operations the resource supports. */
  public Set<Operation> getCapabilities() {
    return EnumSet.copyOf(capabilities);
  }

  @Override
  public void handle(@NotNull Context ctx) {
    dispatch(ApiRequest.fromContext(ctx, objectMapper)).writeTo(ctx);
  }

  /**
   * Dispatches a request to the matching operation.
   *
   * @param request the request
   * @return the response of the operation, or a problem response if validation failed
   * @throws OperationNotPermittedException if the method or operation is not supported
   */
  public ApiResponse dispatch(ApiRequest request) {
    String method = request.method().toUpperCase(Locale.ROOT);
    Optional<String> id = request.pathParam(resource.identifierName());
    Logger.info(
        "REST {} request for {} with identifier: {}", method, resource.resourceName(), id.orElse(null));

    try {
      return dispatchMethod(method, id, request);
    } catch (ValidationException e) {
      return problemResponseFactory.fromValidation(e);
    }
  }

  private ApiResponse dispatchMethod(String method, Optional<String> id, ApiRequest request) {
    Operation.Scope scope = id.isPresent() ? Operation.Scope.ITEM : Operation.Scope.COLLECTION;
    return switch (method) {
      case "GET" -> id.isPresent() ? handleFetch(id.get(), request) : handleFetchAll(request);
      case "POST" -> {
        if (id.isPresent()) {
          throw notPermitted("Invalid entity operation POST", scope);
        }
        yield handleCreate(request);
      }
      case "PUT" -> id.isPresent() ? handleUpdate(id.get(), request) : handleUpdateList(request);
      case "PATCH" -> id.isPresent() ? handlePatch(id.get(), request) : handlePatchList(request);
      case "DELETE" -> id.isPresent() ? handleDelete(id.get()) : handleDeleteList();
      case "HEAD" -> ((Capabilities.Head) require(Operation.HEAD, scope)).head();
      case "OPTIONS" -> ((Capabilities.Options) require(Operation.OPTIONS, scope)).options();
      default -> throw notPermitted("Invalid operation", scope);
    };
  }

  private ApiResponse handleFetch(String id, ApiRequest request) {
    Entity entity =
        ((Capabilities.Fetch<?>) require(Operation.FETCH, Operation.Scope.ITEM)).fetch(id);
    return responseShaper.shape(entity, request);
  }

  private ApiResponse handleFetchAll(ApiRequest request) {
    EntityCollection<?> list =
        ((Capabilities.FetchAll<?>) require(Operation.FETCH_ALL, Operation.Scope.COLLECTION))
            .fetchAll();
    return responseShaper.shape(list, request);
  }

  private ApiResponse handleCreate(ApiRequest request) {
    Capabilities.Create<?> create =
        (Capabilities.Create<?>) require(Operation.CREATE, Operation.Scope.COLLECTION);
    Map<String, Object> data = bodyValidator.validate(request.body(), request.method());
    Entity entity = create.create(data);
    return responseShaper.shape(entity, request, StatusCode.CREATED.getHttpCode());
  }

  private ApiResponse handleUpdate(String id, ApiRequest request) {
    Capabilities.Update<?> update =
        (Capabilities.Update<?>) require(Operation.UPDATE, Operation.Scope.ITEM);
    Map<String, Object> data = bodyValidator.validate(request.body(), request.method());
    return responseShaper.shape(update.update(id, data), request);
  }

  private ApiResponse handleUpdateList(ApiRequest request) {
    Capabilities.UpdateList<?> updateList =
        (Capabilities.UpdateList<?>) require(Operation.UPDATE_LIST, Operation.Scope.COLLECTION);
    Map<String, Object> data = bodyValidator.validate(request.body(), request.method());
    return responseShaper.shape(updateList.updateList(data), request);
  }

  private ApiResponse handlePatch(String id, ApiRequest request) {
    Capabilities.Patch<?> patch =
        (Capabilities.Patch<?>) require(Operation.PATCH, Operation.Scope.ITEM);
    Map<String, Object> data = bodyValidator.validate(request.body(), request.method());
    return responseShaper.shape(patch.patch(id, data), request);
  }

  private ApiResponse handlePatchList(ApiRequest request) {
    Capabilities.PatchList<?> patchList =
        (Capabilities.PatchList<?>) require(Operation.PATCH_LIST, Operation.Scope.COLLECTION);
    Map<String, Object> data = bodyValidator.validate(request.body(), request.method());
    return responseShaper.shape(patchList.patchList(data), request);
  }

  private ApiResponse handleDelete(String id) {
    ((Capabilities.Delete) require(Operation.DELETE, Operation.Scope.ITEM)).delete(id);
    return ApiResponse.empty(StatusCode.NO_CONTENT.getHttpCode());
  }

  private ApiResponse handleDeleteList() {
    ((Capabilities.DeleteList) require(Operation.DELETE_LIST, Operation.Scope.COLLECTION))
        .deleteList();
    return ApiResponse.empty(StatusCode.NO_CONTENT.getHttpCode());
  }

  private Resource require(Operation operation, Operation.Scope scope) {
    if (!capabilities.contains(operation)) {
      throw notPermitted(
          String.format(
              "Operation %s is not permitted on resource %s", operation, resource.resourceName()),
          scope);
    }
    return resource;
  }

  private OperationNotPermittedException notPermitted(String message, Operation.Scope scope) {
    Logger.warn("Rejected request for {}: {}", resource.resourceName(), message);
    return new OperationNotPermittedException(
        message, Operation.allowedMethods(capabilities, scope));
  }
}
