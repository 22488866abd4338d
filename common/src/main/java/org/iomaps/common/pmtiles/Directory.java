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
package org.iomaps.common.pmtiles;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.iomaps.common.error.MapsException;

/**
 * A decoded PMTiles directory, sorted by tile id.
 *
 * The serialized form is a varint entry count followed by four columns: delta encoded tile ids, run lengths,
 * lengths, and offsets.  An offset of zero after the first entry means the entry directly follows its predecessor,
 * otherwise the stored value is the offset plus one.
 */
public final class Directory {
  private final List<DirectoryEntry> entries;

  public Directory(List<DirectoryEntry> entries) {
    this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
  }

  public List<DirectoryEntry> getEntries() {
    return entries;
  }

  /**
   * Finds the entry covering the tile id: either a run that contains it or the leaf directory that may.
   *
   * @return the entry or null
   */
  public DirectoryEntry find(long tileId) {
    int lo = 0;
    int hi = entries.size() - 1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      long cmp = tileId - entries.get(mid).getTileId();
      if (cmp > 0) {
        lo = mid + 1;
      } else if (cmp < 0) {
        hi = mid - 1;
      } else {
        return entries.get(mid);
      }
    }

    // hi is now the last entry with a smaller tile id
    if (hi >= 0) {
      DirectoryEntry candidate = entries.get(hi);
      if (candidate.isLeaf() || tileId - candidate.getTileId() < candidate.getRunLength()) {
        return candidate;
      }
    }
    return null;
  }

  public static Directory decode(byte[] bytes) {
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    try {
      int count = (int) readVarint(buffer);
      List<DirectoryEntry> raw = new ArrayList<>(count);
      long[] tileIds = new long[count];
      int[] runLengths = new int[count];
      int[] lengths = new int[count];
      long[] offsets = new long[count];

      long lastId = 0;
      for (int i = 0; i < count; i++) {
        lastId += readVarint(buffer);
        tileIds[i] = lastId;
      }
      for (int i = 0; i < count; i++) {
        runLengths[i] = (int) readVarint(buffer);
      }
      for (int i = 0; i < count; i++) {
        lengths[i] = (int) readVarint(buffer);
      }
      for (int i = 0; i < count; i++) {
        long v = readVarint(buffer);
        if (v == 0 && i > 0) {
          offsets[i] = offsets[i - 1] + lengths[i - 1];
        } else {
          offsets[i] = v - 1;
        }
      }
      for (int i = 0; i < count; i++) {
        raw.add(new DirectoryEntry(tileIds[i], offsets[i], lengths[i], runLengths[i]));
      }
      return new Directory(raw);
    } catch (RuntimeException e) {
      throw MapsException.malformed("Corrupt PMTiles directory", e);
    }
  }

  public byte[] encode() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeVarint(out, entries.size());
    long lastId = 0;
    for (DirectoryEntry e : entries) {
      writeVarint(out, e.getTileId() - lastId);
      lastId = e.getTileId();
    }
    for (DirectoryEntry e : entries) {
      writeVarint(out, e.getRunLength());
    }
    for (DirectoryEntry e : entries) {
      writeVarint(out, e.getLength());
    }
    for (int i = 0; i < entries.size(); i++) {
      DirectoryEntry e = entries.get(i);
      if (i > 0 && e.getOffset() == entries.get(i - 1).getOffset() + entries.get(i - 1).getLength()) {
        writeVarint(out, 0);
      } else {
        writeVarint(out, e.getOffset() + 1);
      }
    }
    return out.toByteArray();
  }

  static long readVarint(ByteBuffer buffer) {
    long value = 0;
    int shift = 0;
    while (true) {
      byte b = buffer.get();
      value |= (long) (b & 0x7f) << shift;
      if ((b & 0x80) == 0) {
        return value;
      }
      shift += 7;
      if (shift > 63) {
        throw new IllegalStateException("Varint too long");
      }
    }
  }

  static void writeVarint(ByteArrayOutputStream out, long value) {
    while ((value & ~0x7fL) != 0) {
      out.write((int) ((value & 0x7f) | 0x80));
      value >>>= 7;
    }
    out.write((int) value);
  }
}
