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
package org.iomaps.common.error;

/**
 * The failure raised by every tile, raster and catalog component.  Callers act on the {@link Kind}; the web layer
 * maps it to a status code.
 *
 * A missing tile is not an error: components return an empty {@link java.util.Optional} for that case and
 * {@link Kind#NOT_FOUND} is only used for unknown named resources such as a collection or item.
 */
public class MapsException extends RuntimeException {
  private static final long serialVersionUID = 6915254325488104621L;

  public enum Kind {
    NOT_FOUND,
    BAD_REQUEST,
    FORBIDDEN,
    // the upstream fetch failed in a way that might succeed if retried
    RESOURCE_UNAVAILABLE,
    // the data was read but cannot be interpreted
    MALFORMED_INPUT,
    UNKNOWN
  }

  private final Kind kind;

  public MapsException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public MapsException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public static MapsException notFound(String message) {
    return new MapsException(Kind.NOT_FOUND, message);
  }

  public static MapsException badRequest(String message) {
    return new MapsException(Kind.BAD_REQUEST, message);
  }

  public static MapsException forbidden(String message) {
    return new MapsException(Kind.FORBIDDEN, message);
  }

  public static MapsException unavailable(String message, Throwable cause) {
    return new MapsException(Kind.RESOURCE_UNAVAILABLE, message, cause);
  }

  public static MapsException malformed(String message) {
    return new MapsException(Kind.MALFORMED_INPUT, message);
  }

  public static MapsException malformed(String message, Throwable cause) {
    return new MapsException(Kind.MALFORMED_INPUT, message, cause);
  }

  /**
   * Wraps any failure, keeping the kind of one that is already a MapsException.
   */
  public static MapsException wrap(String message, Throwable cause) {
    if (cause instanceof MapsException) {
      return (MapsException) cause;
    }
    return new MapsException(Kind.UNKNOWN, message + ": " + cause.getMessage(), cause);
  }
}
