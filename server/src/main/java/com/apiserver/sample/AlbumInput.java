package com.apiserver.sample;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Validation rules for album request bodies.
 *
 * <p>{@code label} defaults to {@value #DEFAULT_LABEL}. The default is visible to the input
 * filter but is never handed to the resource unless the caller sent a label.
 */
public class AlbumInput {

  public static final String DEFAULT_LABEL = "independent";

  @NotBlank(message = "Title is required")
  @Size(max = 255, message = "Title must be at most 255 characters")
  private String title;

  @NotBlank(message = "Artist is required")
  private String artist;

  @Min(value = 1900, message = "Year must not be before 1900")
  @Max(value = 2100, message = "Year must not be after 2100")
  private Integer year;

  @Size(max = 100, message = "Label must be at most 100 characters")
  private String label = DEFAULT_LABEL;

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getArtist() {
    return artist;
  }

  public void setArtist(String artist) {
    this.artist = artist;
  }

  public Integer getYear() {
    return year;
  }

  public void setYear(Integer year) {
    this.year = year;
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }
}
