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
package org.iomaps.common.io;

import java.util.Arrays;

/**
 * Serves ranges of an in-memory buffer.
 */
public class ByteArrayRangeReader implements RangeReader {
  private final String locator;
  private final byte[] data;

  public ByteArrayRangeReader(String locator, byte[] data) {
    this.locator = locator;
    this.data = data;
  }

  @Override
  public byte[] read(long offset, int length) {
    int from = (int) Math.min(offset, data.length);
    int to = (int) Math.min(offset + length, data.length);
    return Arrays.copyOfRange(data, from, to);
  }

  @Override
  public byte[] readAll() {
    return data.clone();
  }

  @Override
  public String getLocator() {
    return locator;
  }
}
