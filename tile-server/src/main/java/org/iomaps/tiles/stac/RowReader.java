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
package org.iomaps.tiles.stac;

import java.util.List;
import java.util.Map;

/**
 * Decodes every row of a columnar file into column name to value maps.  Strings are {@link String}s, other binary
 * columns are byte arrays, lists are {@link List}s and nested groups are {@link Map}s.
 */
@FunctionalInterface
public interface RowReader {

  /**
   * @throws org.iomaps.common.error.MapsException of kind MALFORMED_INPUT if the file cannot be decoded
   */
  List<Map<String, Object>> read(String locator, byte[] file);
}
