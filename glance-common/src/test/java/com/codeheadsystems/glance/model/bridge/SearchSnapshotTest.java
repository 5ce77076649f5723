package com.codeheadsystems.glance.model.bridge;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.glance.model.artwork.Artwork;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchSnapshotTest {

  @Test
  void empty_serializesNullQueryAndTimestamp() {
    JsonNode json = new ObjectMapper().valueToTree(SearchSnapshot.EMPTY);

    assertThat(json.get("query").isNull()).isTrue();
    assertThat(json.get("results").isArray()).isTrue();
    assertThat(json.get("results")).isEmpty();
    assertThat(json.get("timestamp").isNull()).isTrue();
    assertThat(json.has("empty")).isFalse();
  }

  @Test
  void constructor_copiesResults() {
    List<Artwork> results = new ArrayList<>();
    results.add(new Artwork("1", "Water Lilies", "Monet", null, "http://img/1.jpg", null, "met"));
    SearchSnapshot snapshot = new SearchSnapshot("monet", results, 42L);

    results.clear();

    assertThat(snapshot.results()).hasSize(1);
    assertThat(snapshot.isEmpty()).isFalse();
  }

  @Test
  void nullResults_becomeEmptyList() {
    assertThat(new SearchSnapshot(null, null, null).isEmpty()).isTrue();
  }

  @Test
  void nullEntries_areDropped() {
    List<Artwork> results = new ArrayList<>();
    results.add(null);
    results.add(new Artwork("1", "Water Lilies", "Monet", null, "http://img/1.jpg", null, "met"));

    assertThat(new SearchSnapshot("monet", results, 42L).results())
        .extracting(Artwork::id)
        .containsExactly("1");
  }
}
