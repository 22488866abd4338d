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
import java.net.SocketTimeoutException;

import org.iomaps.common.error.MapsException;

/**
 * Classifies I/O failures into {@link MapsException} kinds.
 */
public final class ReadFailures {

  private ReadFailures() {
  }

  /**
   * Network failures, timeouts, missing objects and server errors are unavailable resources that may later recover.
   * A range past the end of the object means the file is shorter than its own structure claims, so it is malformed.
   * Any other HTTP status is an unknown failure.
   */
  public static MapsException translate(String locator, IOException e) {
    if (e instanceof HttpRangeReader.HttpStatusException) {
      int status = ((HttpRangeReader.HttpStatusException) e).getStatus();
      if (status == 404 || status >= 500) {
        return MapsException.unavailable("Unable to read " + locator + ": HTTP " + status, e);
      }
      if (status == 416) {
        return MapsException.malformed("Read past the end of " + locator, e);
      }
      return new MapsException(MapsException.Kind.UNKNOWN, "Unexpected HTTP " + status + " reading " + locator, e);
    }
    if (e instanceof SocketTimeoutException) {
      return MapsException.unavailable("Timed out reading " + locator, e);
    }
    return MapsException.unavailable("Unable to read " + locator + ": " + e.getMessage(), e);
  }
}
