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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads ranges from a local file through a positional {@link FileChannel}, which is safe for concurrent use.
 */
public class FileRangeReader implements RangeReader {
  private final Path path;
  private final FileChannel channel;

  public FileRangeReader(Path path) throws IOException {
    this.path = path;
    this.channel = FileChannel.open(path, StandardOpenOption.READ);
  }

  @Override
  public byte[] read(long offset, int length) throws IOException {
    long available = Math.max(0, channel.size() - offset);
    ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(length, available));
    long position = offset;
    while (buffer.hasRemaining()) {
      int n = channel.read(buffer, position);
      if (n < 0) {
        break;
      }
      position += n;
    }
    if (buffer.hasRemaining()) {
      byte[] partial = new byte[buffer.position()];
      System.arraycopy(buffer.array(), 0, partial, 0, partial.length);
      return partial;
    }
    return buffer.array();
  }

  @Override
  public byte[] readAll() throws IOException {
    return read(0, (int) channel.size());
  }

  @Override
  public String getLocator() {
    return path.toString();
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
