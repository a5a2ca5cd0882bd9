/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.docstore.aggregation.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.docstore.aggregation.partition.KeyBound;
import org.docstore.aggregation.partition.KeyRange;
import org.docstore.aggregation.partition.KeySentinel;
import org.docstore.aggregation.partition.PartitionChunk;
import org.docstore.aggregation.partition.PartitionKeyPattern;
import org.docstore.aggregation.partition.PartitionMap;
import org.docstore.aggregation.pipeline.Namespace;

/**
 * JSON description of a collection's routing metadata. A collection without {@code key} is
 * unpartitioned. Chunk bounds list one value per key field in key order; {@code {"$minKey": 1}}
 * and {@code {"$maxKey": 1}} stand for the sentinels.
 *
 * <pre>
 * {"namespace": "db.words", "key": ["word"],
 *  "chunks": [{"min": [{"$minKey": 1}], "max": ["hello"], "shard": "0"}, ...]}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
public class CollectionMetadata {

  private static final Logger LOG = LogManager.getLogger();

  private static final String MIN_KEY = "$minKey";

  private static final String MAX_KEY = "$maxKey";

  @JsonProperty(required = true)
  private String namespace;

  private List<String> key;

  private List<ChunkMetadata> chunks = new ArrayList<>();

  /** One chunk of a partitioned collection. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  @Getter
  @Setter
  public static class ChunkMetadata {

    @JsonProperty(required = true)
    private List<Object> min;

    @JsonProperty(required = true)
    private List<Object> max;

    @JsonProperty(required = true)
    private String shard;
  }

  /**
   * Converts inputstream of bytes into list of collection metadata.
   *
   * @param inputStream inputstream.
   * @return List of collection metadata.
   */
  public static List<CollectionMetadata> fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      return objectMapper.readValue(inputStream, new TypeReference<>() {});
    } catch (IOException e) {
      LOG.error("Collection metadata file is malformed. Verify and reload.");
      throw new IllegalArgumentException("Malformed collection metadata json: " + e.getMessage());
    }
  }

  public Namespace toNamespace() {
    return Namespace.parse(namespace);
  }

  public boolean isPartitioned() {
    return key != null && !key.isEmpty();
  }

  /**
   * Builds the partition map described by this metadata.
   *
   * @return partition map
   * @throws IllegalArgumentException if the collection is unpartitioned or the chunks are invalid
   */
  public PartitionMap toPartitionMap() {
    if (!isPartitioned()) {
      throw new IllegalArgumentException("Collection " + namespace + " has no partition key");
    }
    PartitionKeyPattern pattern = new PartitionKeyPattern(key);
    List<PartitionChunk> partitionChunks = new ArrayList<>(chunks.size());
    for (ChunkMetadata chunk : chunks) {
      partitionChunks.add(
          new PartitionChunk(
              new KeyRange(toBound(pattern, chunk.getMin()), toBound(pattern, chunk.getMax())),
              chunk.getShard()));
    }
    return new PartitionMap(pattern, partitionChunks);
  }

  private KeyBound toBound(PartitionKeyPattern pattern, List<Object> values) {
    if (values.size() != pattern.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Chunk bound %s of %s does not match key %s", values, namespace, pattern));
    }
    List<KeyBound.Field> fields = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      fields.add(new KeyBound.Field(pattern.fields().get(i), toKeyValue(values.get(i))));
    }
    return new KeyBound(fields);
  }

  private static Object toKeyValue(Object value) {
    if (value instanceof Map<?, ?> map && map.size() == 1) {
      if (map.containsKey(MIN_KEY)) {
        return KeySentinel.MIN_KEY;
      }
      if (map.containsKey(MAX_KEY)) {
        return KeySentinel.MAX_KEY;
      }
    }
    return value;
  }
}
