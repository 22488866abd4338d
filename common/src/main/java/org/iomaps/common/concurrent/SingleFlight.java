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
package org.iomaps.common.concurrent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Lazily computes a value exactly once, however many threads ask for it concurrently.
 *
 * The first caller runs the initializer while later callers wait for and share its outcome, whether that is the
 * value or the exception.  A failed attempt clears the latch so that the next call starts a fresh attempt, which
 * means a transient network failure does not leave the owner broken for the life of the process.
 *
 * @param <T> the type of the initialized value
 */
public final class SingleFlight<T> {
  private static final Logger LOG = LoggerFactory.getLogger(SingleFlight.class);

  private final String name;
  private final Supplier<T> initializer;
  private final AtomicReference<CompletableFuture<T>> flight = new AtomicReference<>();

  public SingleFlight(String name, Supplier<T> initializer) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.initializer = Preconditions.checkNotNull(initializer, "initializer");
  }

  /**
   * Returns the initialized value, running the initializer if no attempt has succeeded or is in progress.
   * Exceptions thrown by the initializer are rethrown unchanged to every caller sharing the attempt.
   */
  public T get() {
    while (true) {
      CompletableFuture<T> current = flight.get();
      if (current != null) {
        return await(current);
      }

      CompletableFuture<T> attempt = new CompletableFuture<>();
      if (flight.compareAndSet(null, attempt)) {
        LOG.debug("Initializing {}", name);
        try {
          attempt.complete(initializer.get());
        } catch (RuntimeException | Error e) {
          LOG.warn("Initialization of {} failed, a later call will retry", name, e);
          attempt.completeExceptionally(e);
          flight.compareAndSet(attempt, null);
        }
        return await(attempt);
      }
      // lost the race to another caller, loop to join its attempt
    }
  }

  /**
   * @return true if an attempt has completed successfully
   */
  public boolean isInitialized() {
    CompletableFuture<T> current = flight.get();
    return current != null && current.isDone() && !current.isCompletedExceptionally();
  }

  private static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw e;
    }
  }
}
