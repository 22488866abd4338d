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
import java.util.Arrays;

import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads ranges of a remote object with HTTP range requests.
 *
 * Servers that ignore the Range header and answer 200 with the full body are tolerated; the requested slice is cut
 * out of the full response.
 */
public class HttpRangeReader implements RangeReader {
  private static final Logger LOG = LoggerFactory.getLogger(HttpRangeReader.class);

  private final CloseableHttpClient client;
  private final String url;

  public HttpRangeReader(CloseableHttpClient client, String url) {
    this.client = client;
    this.url = url;
  }

  @Override
  public byte[] read(long offset, int length) throws IOException {
    if (length <= 0) {
      return new byte[0];
    }
    HttpGet get = new HttpGet(url);
    get.setHeader(HttpHeaders.RANGE, "bytes=" + offset + "-" + (offset + length - 1));
    LOG.debug("GET {} [{}+{}]", url, offset, length);
    try (CloseableHttpResponse response = client.execute(get)) {
      int status = response.getStatusLine().getStatusCode();
      byte[] body = response.getEntity() == null ? new byte[0] : EntityUtils.toByteArray(response.getEntity());
      if (status == HttpStatus.SC_PARTIAL_CONTENT) {
        return body;
      }
      if (status == HttpStatus.SC_OK) {
        int from = (int) Math.min(offset, body.length);
        int to = (int) Math.min(offset + length, body.length);
        return Arrays.copyOfRange(body, from, to);
      }
      throw new HttpStatusException(url, status);
    }
  }

  @Override
  public byte[] readAll() throws IOException {
    HttpGet get = new HttpGet(url);
    LOG.debug("GET {}", url);
    try (CloseableHttpResponse response = client.execute(get)) {
      int status = response.getStatusLine().getStatusCode();
      if (status != HttpStatus.SC_OK) {
        EntityUtils.consumeQuietly(response.getEntity());
        throw new HttpStatusException(url, status);
      }
      return response.getEntity() == null ? new byte[0] : EntityUtils.toByteArray(response.getEntity());
    }
  }

  @Override
  public String getLocator() {
    return url;
  }

  /**
   * A non-successful HTTP response.
   */
  public static class HttpStatusException extends IOException {
    private static final long serialVersionUID = -1907326401532214017L;
    private final int status;

    public HttpStatusException(String url, int status) {
      super("HTTP " + status + " fetching " + url);
      this.status = status;
    }

    public int getStatus() {
      return status;
    }
  }
}
