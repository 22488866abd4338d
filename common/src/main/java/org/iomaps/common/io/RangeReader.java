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

import java.io.Closeable;
import java.io.IOException;

/**
 * Random access to the bytes of a local file or remote object.
 */
public interface RangeReader extends Closeable {

  /**
   * Reads up to {@code length} bytes starting at {@code offset}.  Fewer bytes are returned only when the range runs
   * past the end of the resource.
   */
  byte[] read(long offset, int length) throws IOException;

  /**
   * Reads the complete resource.
   */
  byte[] readAll() throws IOException;

  /**
   * @return the locator this reader was opened on, used in log and error messages
   */
  String getLocator();

  @Override
  default void close() throws IOException {
  }
}
