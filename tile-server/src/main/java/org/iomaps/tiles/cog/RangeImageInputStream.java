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

import java.io.IOException;
import java.util.concurrent.ExecutionException;

import javax.imageio.stream.ImageInputStreamImpl;

import org.iomaps.common.io.RangeReader;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * An image stream over a range reader that fetches fixed size blocks on demand and keeps the recent ones.
 */
class RangeImageInputStream extends ImageInputStreamImpl {
  private static final int MAX_BLOCKS = 256;

  private final RangeReader reader;
  private final int blockSize;
  private final Cache<Long, byte[]> blocks = CacheBuilder.newBuilder().maximumSize(MAX_BLOCKS).build();

  /**
   * Raised when the underlying reader fails, so that transport failures can be told apart from corrupt files once
   * the image reader has wrapped them.
   */
  static class FetchException extends IOException {
    private final IOException failure;

    FetchException(IOException failure) {
      super(failure.getMessage(), failure);
      this.failure = failure;
    }

    IOException getFailure() {
      return failure;
    }
  }

  RangeImageInputStream(RangeReader reader, int blockSize) {
    this.reader = reader;
    this.blockSize = blockSize;
  }

  @Override
  public int read() throws IOException {
    byte[] one = new byte[1];
    return read(one, 0, 1) < 0 ? -1 : one[0] & 0xFF;
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    checkClosed();
    bitOffset = 0;
    if (len == 0) {
      return 0;
    }

    long position = streamPos;
    int copied = 0;
    while (copied < len) {
      long blockIndex = position / blockSize;
      int inBlock = (int) (position % blockSize);
      byte[] block = block(blockIndex);
      if (inBlock >= block.length) {
        break;
      }
      int n = Math.min(len - copied, block.length - inBlock);
      System.arraycopy(block, inBlock, b, off + copied, n);
      copied += n;
      position += n;
      if (block.length < blockSize && inBlock + n >= block.length) {
        // end of resource
        break;
      }
    }
    if (copied == 0) {
      return -1;
    }
    streamPos = position;
    return copied;
  }

  private byte[] block(long index) throws IOException {
    try {
      return blocks.get(index, () -> {
        try {
          return reader.read(index * blockSize, blockSize);
        } catch (IOException e) {
          throw new FetchException(e);
        }
      });
    } catch (ExecutionException e) {
      if (e.getCause() instanceof IOException) {
        throw (IOException) e.getCause();
      }
      throw new IOException("Unable to read block " + index + " of " + reader.getLocator(), e.getCause());
    }
  }

  @Override
  public void close() throws IOException {
    super.close();
    blocks.invalidateAll();
  }
}
