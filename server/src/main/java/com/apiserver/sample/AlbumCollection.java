package com.apiserver.sample;

import com.apiserver.hal.EntityCollection;
import java.util.List;

public class AlbumCollection extends EntityCollection<Album> {

  public AlbumCollection(List<Album> albums) {
    super(albums);
  }
}
