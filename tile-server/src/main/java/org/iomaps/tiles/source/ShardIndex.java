/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.iomaps.tiles.source;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.iomaps.common.projection.FixedPointBounds;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

/**
 * Finds the shard serving a tile.  Shards are bucketed by the zoom levels they cover.  Large buckets are searched
 * through an R-tree and small ones by a scan; either way the match is the lowest ordinal shard whose extent
 * fully contains the tile.
 */
public class ShardIndex {
  private final Map<Integer, Bucket> buckets = new HashMap<>();

  public ShardIndex(List<ShardEntry> shards, int spatialIndexThreshold) {
    Map<Integer, List<ShardEntry>> byZoom = new HashMap<>();
    for (ShardEntry shard : shards) {
      for (int z = shard.getHeader().getMinZoom(); z <= shard.getHeader().getMaxZoom(); z++) {
        byZoom.computeIfAbsent(z, k -> new ArrayList<>()).add(shard);
      }
    }
    for (Map.Entry<Integer, List<ShardEntry>> e : byZoom.entrySet()) {
      List<ShardEntry> members = e.getValue();
      members.sort(Comparator.comparingInt(ShardEntry::getOrdinal));
      buckets.put(e.getKey(), members.size() >= spatialIndexThreshold ? new IndexedBucket(members) : new ScanBucket(members));
    }
  }

  /**
   * @return the serving shard or null when no shard covers the tile
   */
  public ShardEntry find(int z, FixedPointBounds tile) {
    Bucket bucket = buckets.get(z);
    return bucket == null ? null : bucket.find(tile);
  }

  boolean isIndexed(int z) {
    return buckets.get(z) instanceof IndexedBucket;
  }

  private interface Bucket {
    ShardEntry find(FixedPointBounds tile);
  }

  private static class ScanBucket implements Bucket {
    private final List<ShardEntry> shards;

    ScanBucket(List<ShardEntry> shards) {
      this.shards = shards;
    }

    @Override
    public ShardEntry find(FixedPointBounds tile) {
      for (ShardEntry shard : shards) {
        if (shard.getBounds().contains(tile)) {
          return shard;
        }
      }
      return null;
    }
  }

  private static class IndexedBucket implements Bucket {
    private final STRtree tree = new STRtree();

    IndexedBucket(List<ShardEntry> shards) {
      for (ShardEntry shard : shards) {
        tree.insert(envelope(shard.getBounds()), shard);
      }
      // built before publication, queries on a built tree are read only
      tree.build();
    }

    @Override
    public ShardEntry find(FixedPointBounds tile) {
      List<ShardEntry> candidates = new ArrayList<>();
      for (Object hit : tree.query(envelope(tile))) {
        candidates.add((ShardEntry) hit);
      }
      candidates.sort(Comparator.comparingInt(ShardEntry::getOrdinal));
      for (ShardEntry shard : candidates) {
        if (shard.getBounds().contains(tile)) {
          return shard;
        }
      }
      return null;
    }
  }

  private static Envelope envelope(FixedPointBounds b) {
    return new Envelope(b.getMinLon(), b.getMaxLon(), b.getMinLat(), b.getMaxLat());
  }
}
