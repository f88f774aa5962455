package com.apiserver;

import com.apiserver.config.ServerConfig;
import com.apiserver.hal.CollectionMetadata;
import com.apiserver.hal.HalResourceGenerator;
import com.apiserver.hal.MetadataMap;
import com.apiserver.hal.ResourceMetadata;
import com.apiserver.rest.RestHandlerFactory;
import com.apiserver.sample.Album;
import com.apiserver.sample.AlbumCollection;
import com.apiserver.sample.AlbumInput;
import com.apiserver.sample.AlbumResource;
import com.apiserver.validation.BeanInputFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import io.javalin.plugin.bundled.CorsPluginConfig.CorsRule;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.tinylog.Logger;

/**
 * Entry point of the REST server.
 *
 * <p>Builds the shared infrastructure (JSON mapper, validator, HAL metadata), registers the
 * resources and serves them with Javalin. The only resource registered out of the box is the
 * in-memory album store at {@code /albums}.
 */
public class Main {

  static final String ALBUMS_ROUTE = "/albums";

  private final ServerConfig config;
  private final ObjectMapper objectMapper;
  private final ValidatorFactory validatorFactory;
  private final MetadataMap metadataMap;
  private final RestHandlerFactory restHandlerFactory;

  public Main(ServerConfig config) {
    this.config = config;
    this.objectMapper = new ObjectMapper();
    this.validatorFactory = Validation.buildDefaultValidatorFactory();
    this.metadataMap = new MetadataMap();
    this.restHandlerFactory =
        new RestHandlerFactory(new HalResourceGenerator(objectMapper, metadataMap), objectMapper);
    registerResources();
  }

  private void registerResources() {
    metadataMap
        .register(new ResourceMetadata(Album.class, ALBUMS_ROUTE))
        .register(
            CollectionMetadata.of(AlbumCollection.class, ALBUMS_ROUTE, AlbumResource.NAME)
                .withPageSize(config.pageSize()));
    restHandlerFactory.register(
        ALBUMS_ROUTE,
        new AlbumResource(
            new BeanInputFilter<>(
                AlbumInput.class, objectMapper, validatorFactory.getValidator())));
  }

  /** Returns the factory holding the registered handlers. */
  public RestHandlerFactory getRestHandlerFactory() {
    return restHandlerFactory;
  }

  /** Creates the Javalin application serving all registered resources, without starting it. */
  public Javalin createJavalinApp() {
    Javalin app =
        Javalin.create(
            javalinConfig -> {
              javalinConfig.bundledPlugins.enableCors(cors -> cors.addRule(CorsRule::anyHost));
              javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));
              javalinConfig.showJavalinBanner = false;
              restHandlerFactory.configureRoutes(javalinConfig.router);
            });
    restHandlerFactory.configureExceptions(app);
    return app;
  }

  /** Starts the REST server and stops it again when the JVM shuts down. */
  public Javalin startJavalinServer() {
    Javalin app = createJavalinApp();
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down REST server since JVM is shutting down");
                  app.stop();
                  validatorFactory.close();
                }));
    app.start(config.port());
    Logger.info("REST server started, listening on port {}.", config.port());
    return app;
  }

  public static void main(String[] args) {
    ServerConfig config = ServerConfig.fromEnvironment();
    Logger.info("Starting REST server with {}", config);
    new Main(config).startJavalinServer();
  }
}
