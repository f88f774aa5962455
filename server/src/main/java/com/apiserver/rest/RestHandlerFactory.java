package com.apiserver.rest;

import static io.javalin.apibuilder.ApiBuilder.delete;
import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.head;
import static io.javalin.apibuilder.ApiBuilder.patch;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;
import static io.javalin.apibuilder.ApiBuilder.put;

import com.apiserver.hal.HalResourceGenerator;
import com.apiserver.resource.Resource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import io.javalin.Javalin;
import io.javalin.config.RouterConfig;
import io.javalin.http.HandlerType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.tinylog.Logger;

/**
 * Creates a {@link RestHandler} per resource and wires them into Javalin.
 *
 * <p>Each resource is served on its collection route and on {@code <route>/{id}} for every method
 * the dispatcher understands. Which of them actually succeed is decided by the resource's
 * capabilities, not by the routing.
 */
public class RestHandlerFactory {

  private final Map<String, RestHandler> handlers = new LinkedHashMap<>();
  private final ResponseShaper responseShaper;
  private final ProblemResponseFactory problemResponseFactory;
  private final ObjectMapper objectMapper;

  /**
   * Creates a new RestHandlerFactory.
   *
   * @param resourceGenerator renders entities and collections
   * @param objectMapper parses request bodies
   */
  public RestHandlerFactory(HalResourceGenerator resourceGenerator, ObjectMapper objectMapper) {
    this.responseShaper = new ResponseShaper(resourceGenerator);
    this.problemResponseFactory = new ProblemResponseFactory();
    this.objectMapper = objectMapper;
  }

  /**
   * Creates the handler of a resource and serves it under the given route.
   *
   * @param route the collection route, e.g. {@code /albums}
   * @param resource the resource
   * @return the created handler
   */
  public RestHandler register(String route, Resource resource) {
    Preconditions.checkArgument(route.startsWith("/"), "route must start with '/': %s", route);
    Preconditions.checkArgument(
        !handlers.containsKey(route), "route is already registered: %s", route);
    RestHandler handler =
        new RestHandler(resource, responseShaper, problemResponseFactory, objectMapper);
    handlers.put(route, handler);
    Logger.info(
        "Registered resource {} at {} with operations {}",
        resource.resourceName(),
        route,
        handler.getCapabilities());
    return handler;
  }

  /** Returns the handler registered for the given route. */
  public Optional<RestHandler> getHandler(String route) {
    return Optional.ofNullable(handlers.get(route));
  }

  /** Returns all handlers by route, in registration order. */
  public Map<String, RestHandler> getHandlers() {
    return Collections.unmodifiableMap(handlers);
  }

  /**
   * Configures the Javalin router to serve the registered resources.
   *
   * <p>OPTIONS has no {@code ApiBuilder} shortcut, so it is added through the default routing.
   */
  public void configureRoutes(RouterConfig router) {
    router.apiBuilder(
        () ->
            handlers.forEach(
                (route, handler) ->
                    path(
                        route,
                        () -> {
                          serveAllMethods(handler);
                          path(itemSegment(handler), () -> serveAllMethods(handler));
                        })));
    router.mount(
        routing ->
            handlers.forEach(
                (route, handler) -> {
                  routing.addHttpHandler(HandlerType.OPTIONS, route, handler);
                  routing.addHttpHandler(
                      HandlerType.OPTIONS, route + "/" + itemSegment(handler), handler);
                }));
  }

  /**
   * Maps the dispatcher's rejected operations to 405 problem responses.
   */
  public void configureExceptions(Javalin app) {
    app.exception(
        OperationNotPermittedException.class,
        (e, ctx) -> problemResponseFactory.fromNotPermitted(e).writeTo(ctx));
  }

  private static void serveAllMethods(RestHandler handler) {
    get(handler);
    post(handler);
    put(handler);
    patch(handler);
    delete(handler);
    head(handler);
  }

  private static String itemSegment(RestHandler handler) {
    return "{" + handler.getResource().identifierName() + "}";
  }
}
