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
import java.nio.file.Paths;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;

/**
 * Opens HTTP readers for URLs and file readers for everything else.  The HTTP client is shared by all readers
 * and its timeouts bound every fetch.
 */
public class DefaultRangeReaderFactory implements RangeReaderFactory, Closeable {
  private final CloseableHttpClient httpClient;

  public DefaultRangeReaderFactory(int connectTimeoutMs, int readTimeoutMs, int maxConnections) {
    RequestConfig requestConfig = RequestConfig.custom()
      .setConnectTimeout(connectTimeoutMs)
      .setConnectionRequestTimeout(connectTimeoutMs)
      .setSocketTimeout(readTimeoutMs)
      .build();
    this.httpClient = HttpClients.custom()
      .setDefaultRequestConfig(requestConfig)
      .setMaxConnTotal(maxConnections)
      .setMaxConnPerRoute(maxConnections)
      .useSystemProperties()
      .build();
  }

  @Override
  public RangeReader open(String locator) throws IOException {
    if (RangeReaderFactory.isUrl(locator)) {
      return new HttpRangeReader(httpClient, locator);
    }
    return new FileRangeReader(Paths.get(RangeReaderFactory.stripFileScheme(locator)));
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
  }
}
