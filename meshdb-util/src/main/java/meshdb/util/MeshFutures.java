/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package meshdb.util;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetbrains.annotations.NotNull;
import org.jetlang.fibers.Fiber;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Supplier;

public class MeshFutures {

  /**
   * Run success or failure on the given fiber once the future completes. ExecutionExceptions are
   * unwrapped so the failure consumer sees the original cause.
   */
  public static <V> void addCallback(@NotNull final ListenableFuture<V> future,
                                     @NotNull final Consumer<? super V> success,
                                     @NotNull final Consumer<Throwable> failure,
                                     @NotNull Fiber fiber) {
    Runnable callbackListener = () -> {
      final V value;
      try {
        value = getUninterruptibly(future);
      } catch (ExecutionException e) {
        failure.accept(e.getCause() == null ? e : e.getCause());
        return;
      } catch (RuntimeException | Error e) {
        failure.accept(e);
        return;
      }
      success.accept(value);
    };
    future.addListener(callbackListener, fiber);
  }

  /**
   * Evaluate the supplier on the fiber and deliver its result through the returned future. Used to
   * read fiber-owned state from other threads.
   */
  public static <V> ListenableFuture<V> callOnFiber(@NotNull Fiber fiber, @NotNull Supplier<V> supplier) {
    SettableFuture<V> result = SettableFuture.create();
    fiber.execute(() -> {
      try {
        result.set(supplier.get());
      } catch (RuntimeException e) {
        result.setException(e);
      }
    });
    return result;
  }

  public static <V> V getUninterruptibly(@NotNull Future<V> future)
      throws ExecutionException {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

}
