package com.apiserver.sample;

import com.apiserver.common.status.StatusCode;
import com.apiserver.resource.Capabilities;
import com.apiserver.resource.Operation;
import com.apiserver.rest.ApiResponse;
import com.apiserver.validation.InputFilter;
import com.google.common.base.Joiner;
import com.google.common.primitives.Longs;
import io.javalin.http.NotFoundResponse;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * In-memory album store served at {@code /albums}.
 *
 * <p>Supports fetching, creating, replacing, patching and deleting single albums and listing the
 * whole collection. Collection-wide writes are not supported.
 */
public class AlbumResource
    implements Capabilities.Fetch<Album>,
        Capabilities.FetchAll<AlbumCollection>,
        Capabilities.Create<Album>,
        Capabilities.Update<Album>,
        Capabilities.Patch<Album>,
        Capabilities.Delete,
        Capabilities.Options {

  public static final String NAME = "albums";

  private final ConcurrentNavigableMap<Long, Album> albums = new ConcurrentSkipListMap<>();
  private final AtomicLong nextId = new AtomicLong(1);
  private final InputFilter inputFilter;

  public AlbumResource(InputFilter inputFilter) {
    this.inputFilter = inputFilter;
  }

  @Override
  public String resourceName() {
    return NAME;
  }

  @Override
  public Optional<InputFilter> inputFilter() {
    return Optional.of(inputFilter);
  }

  @Override
  public Album fetch(String id) {
    return find(id);
  }

  @Override
  public AlbumCollection fetchAll() {
    return new AlbumCollection(new ArrayList<>(albums.values()));
  }

  @Override
  public Album create(Map<String, Object> data) {
    long id = nextId.getAndIncrement();
    Album album =
        new Album(
            id,
            (String) data.get("title"),
            (String) data.get("artist"),
            intValue(data.get("year")),
            (String) data.get("label"));
    albums.put(id, album);
    Logger.info("Created album {}", album);
    return album;
  }

  @Override
  public Album update(String id, Map<String, Object> data) {
    Album existing = find(id);
    Album album =
        new Album(
            existing.getId(),
            (String) data.get("title"),
            (String) data.get("artist"),
            intValue(data.get("year")),
            (String) data.get("label"));
    albums.put(existing.getId(), album);
    return album;
  }

  @Override
  public Album patch(String id, Map<String, Object> data) {
    Album existing = find(id);
    Album album =
        new Album(
            existing.getId(),
            data.containsKey("title") ? (String) data.get("title") : existing.getTitle(),
            data.containsKey("artist") ? (String) data.get("artist") : existing.getArtist(),
            data.containsKey("year") ? intValue(data.get("year")) : existing.getYear(),
            data.containsKey("label") ? (String) data.get("label") : existing.getLabel());
    albums.put(existing.getId(), album);
    return album;
  }

  @Override
  public void delete(String id) {
    Album removed = albums.remove(parseId(id));
    if (removed == null) {
      throw new NotFoundResponse("Album not found: " + id);
    }
    Logger.info("Deleted album {}", id);
  }

  /**
   * Answers OPTIONS on both the item and the collection route, so the advertised methods are
   * those of either scope.
   */
  @Override
  public ApiResponse options() {
    String allowed =
        Joiner.on(", ")
            .join(Operation.allowedMethods(Capabilities.of(this), Operation.Scope.ANY));
    return ApiResponse.empty(StatusCode.NO_CONTENT.getHttpCode()).withHeader("Allow", allowed);
  }

  private Album find(String id) {
    Album album = albums.get(parseId(id));
    if (album == null) {
      throw new NotFoundResponse("Album not found: " + id);
    }
    return album;
  }

  private static long parseId(String id) {
    Long parsed = Longs.tryParse(id);
    if (parsed == null) {
      throw new NotFoundResponse("Album not found: " + id);
    }
    return parsed;
  }

  @Nullable
  private static Integer intValue(@Nullable Object value) {
    return value instanceof Number number ? number.intValue() : null;
  }
}
