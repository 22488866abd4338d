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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.iomaps.common.error.MapsException;

/**
 * The URL prefixes rasters may be read from.
 */
public class OriginPolicy {
  private final List<String> allowedPrefixes;

  public OriginPolicy(List<String> allowedPrefixes) {
    this.allowedPrefixes = Collections.unmodifiableList(new ArrayList<>(allowedPrefixes));
  }

  public boolean isAllowed(String locator) {
    if (locator == null) {
      return false;
    }
    for (String prefix : allowedPrefixes) {
      if (locator.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  /**
   * @throws MapsException of kind FORBIDDEN unless the locator starts with an allowed prefix
   */
  public void check(String locator) {
    if (!isAllowed(locator)) {
      throw MapsException.forbidden("URL not in whitelist");
    }
  }

  public List<String> getAllowedPrefixes() {
    return allowedPrefixes;
  }
}
