package entitygc;

import entitygc.model.GraphSnapshot;
import entitygc.model.ReferenceEdge;
import entitygc.model.ReprocessingSignal;
import entitygc.spi.GraphStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory GraphStore for unit tests that don't need real JDBC.
 */
class StubGraphStore implements GraphStore {
  final Map<String, String> resultHash = new LinkedHashMap<>();
  final Map<String, String> finalHash = new LinkedHashMap<>();
  final Set<String> flagged = new HashSet<>();
  final List<ReferenceEdge> edges = new ArrayList<>();
  final AtomicInteger loadCount = new AtomicInteger();
  final AtomicInteger markCalls = new AtomicInteger();
  RuntimeException failOnDelete;
  int deleteShortfall;

  StubGraphStore entities(String... refs) {
    for (String ref : refs) {
      resultHash.put(ref, "original");
      finalHash.put(ref, "original");
    }
    return this;
  }

  StubGraphStore root(String key, String target) {
    edges.add(ReferenceEdge.root(key, target));
    return this;
  }

  StubGraphStore edge(String source, String target) {
    edges.add(ReferenceEdge.internal(source, target));
    return this;
  }

  @Override
  public GraphSnapshot loadSnapshot(Connection conn) {
    loadCount.incrementAndGet();
    return GraphSnapshot.of(new ArrayList<>(resultHash.keySet()), new ArrayList<>(edges));
  }

  @Override
  public int deleteEntities(Connection conn, Collection<String> entityRefs) {
    if (failOnDelete != null) {
      throw failOnDelete;
    }
    int deleted = 0;
    for (String ref : entityRefs) {
      finalHash.remove(ref);
      if (resultHash.remove(ref) != null) {
        deleted++;
      }
    }
    return deleted - deleteShortfall;
  }

  @Override
  public int markForReprocessing(Connection conn, Collection<String> entityRefs,
      ReprocessingSignal signal) {
    markCalls.incrementAndGet();
    int changed = 0;
    for (String ref : entityRefs) {
      if (!resultHash.containsKey(ref)) {
        continue;
      }
      if (signal == ReprocessingSignal.FLAG) {
        if (flagged.add(ref)) {
          changed++;
        }
      } else if (!ReprocessingSignal.SENTINEL_HASH_VALUE.equals(resultHash.get(ref))) {
        resultHash.put(ref, ReprocessingSignal.SENTINEL_HASH_VALUE);
        finalHash.put(ref, ReprocessingSignal.SENTINEL_HASH_VALUE);
        changed++;
      }
    }
    return changed;
  }

  @Override
  public int pruneEdgesFrom(Connection conn, Collection<String> sourceEntityRefs) {
    Set<String> sources = new HashSet<>(sourceEntityRefs);
    int before = edges.size();
    edges.removeIf(e -> !e.isRoot() && sources.contains(e.sourceEntityRef()));
    return before - edges.size();
  }
}
