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
package org.iomaps.tiles.resource;

import java.util.Collections;
import java.util.Map;

import javax.servlet.http.HttpServletResponse;

import org.iomaps.common.error.MapsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns failures of the JSON endpoints into an {@code {error}} body with the status for their kind.
 */
@RestControllerAdvice
public class ErrorHandler {
  private static final Logger LOG = LoggerFactory.getLogger(ErrorHandler.class);

  static HttpStatus status(MapsException.Kind kind) {
    switch (kind) {
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case BAD_REQUEST:
        return HttpStatus.BAD_REQUEST;
      case FORBIDDEN:
        return HttpStatus.FORBIDDEN;
      case RESOURCE_UNAVAILABLE:
        return HttpStatus.FAILED_DEPENDENCY;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
    return ResponseEntity.status(status)
      .contentType(MediaType.APPLICATION_JSON)
      .body(Collections.singletonMap("error", message));
  }

  @ExceptionHandler(MapsException.class)
  public ResponseEntity<Map<String, String>> handle(MapsException e, HttpServletResponse response) {
    HttpStatus status = status(e.getKind());
    if (status.is5xxServerError()) {
      LOG.error("Request failed", e);
    } else {
      LOG.info("Request refused: {}", e.getMessage());
    }
    Params.enableCORS(response);
    return error(status, e.getMessage());
  }
}
