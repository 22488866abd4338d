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
package org.iomaps.tiles.cog;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An open file shared by the cache and the requests reading from it.
 *
 * The cache holds one reference from loading until eviction, and each request holds one while it reads.  The file
 * is closed when the last reference is released, so an evicted file stays usable until its readers finish.
 */
public class CogHandle {
  private static final Logger LOG = LoggerFactory.getLogger(CogHandle.class);

  private final String locator;
  private final PlaneReader reader;
  private final AtomicInteger references = new AtomicInteger(1);

  CogHandle(String locator, PlaneReader reader) {
    this.locator = locator;
    this.reader = reader;
  }

  PlaneReader getReader() {
    return reader;
  }

  /**
   * @return false if the file has already been closed
   */
  boolean acquire() {
    while (true) {
      int count = references.get();
      if (count == 0) {
        return false;
      }
      if (references.compareAndSet(count, count + 1)) {
        return true;
      }
    }
  }

  void release() {
    int count = references.decrementAndGet();
    if (count == 0) {
      LOG.debug("Closing {}", locator);
      try {
        reader.close();
      } catch (IOException e) {
        LOG.warn("Unable to close {}", locator, e);
      }
    } else if (count < 0) {
      throw new IllegalStateException("Released " + locator + " more often than acquired");
    }
  }
}
