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

import java.io.IOException;
import java.net.URI;

/**
 * Opens {@link RangeReader}s on locators, which are either {@code http(s)} URLs, {@code file:} URIs or plain paths.
 */
public interface RangeReaderFactory {

  RangeReader open(String locator) throws IOException;

  /**
   * Resolves {@code relative} against the directory of {@code base}, as a browser resolves a link.
   */
  static String resolve(String base, String relative) {
    if (isUrl(relative) || relative.startsWith("/")) {
      return relative;
    }
    if (isUrl(base)) {
      return URI.create(base).resolve(relative).toString();
    }
    java.nio.file.Path parent = java.nio.file.Paths.get(stripFileScheme(base)).getParent();
    return parent == null ? relative : parent.resolve(relative).normalize().toString();
  }

  static boolean isUrl(String locator) {
    return locator.startsWith("http://") || locator.startsWith("https://");
  }

  static String stripFileScheme(String locator) {
    return locator.startsWith("file:") ? URI.create(locator).getPath() : locator;
  }
}
