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

import lombok.Value;

/**
 * A run of tiles sharing the same bytes, or a pointer to a leaf directory when the run length is zero.
 * Offsets are relative to the tile data section, or to the leaf directory section for leaf pointers.
 */
@Value
public class DirectoryEntry {
  long tileId;
  long offset;
  int length;
  int runLength;

  public boolean isLeaf() {
    return runLength == 0;
  }
}
