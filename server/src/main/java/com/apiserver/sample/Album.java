package com.apiserver.sample;

import com.apiserver.hal.Entity;
import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.annotation.Nullable;

/** An album held by the sample {@link AlbumResource}. */
public final class Album implements Entity {

  private final long id;
  private final String title;
  private final String artist;
  @Nullable private final Integer year;
  @Nullable private final String label;

  public Album(long id, String title, String artist, @Nullable Integer year, @Nullable String label) {
    this.id = id;
    this.title = Objects.requireNonNull(title, "title");
    this.artist = Objects.requireNonNull(artist, "artist");
    this.year = year;
    this.label = label;
  }

  @Override
  public Long getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getArtist() {
    return artist;
  }

  @Nullable
  public Integer getYear() {
    return year;
  }

  @Nullable
  public String getLabel() {
    return label;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Album other)) {
      return false;
    }
    return id == other.id
        && title.equals(other.title)
        && artist.equals(other.artist)
        && Objects.equals(year, other.year)
        && Objects.equals(label, other.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, title, artist, year, label);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("title", title)
        .add("artist", artist)
        .add("year", year)
        .add("label", label)
        .toString();
  }
}
