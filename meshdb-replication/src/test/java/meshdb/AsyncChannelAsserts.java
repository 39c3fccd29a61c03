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

package meshdb;

import meshdb.util.ExceptionHandlingBatchExecutor;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.StringDescription;
import org.jetlang.channels.Channel;
import org.jetlang.core.BatchExecutor;
import org.jetlang.core.RunnableExecutorImpl;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.ThreadFiber;
import org.junit.runners.model.MultipleFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Helpers that allow us to assert or wait for channel messages from jetlang, or for some state to
 * settle.
 */
public class AsyncChannelAsserts {
  private static final int TIMEOUT_SECONDS = 5;

  public static class ChannelListener<T> {
    final Fiber subscribedFiber;
    final BlockingQueue<T> messages;
    final List<Throwable> throwables;

    public ChannelListener(Fiber subscribedFiber, BlockingQueue<T> messages, List<Throwable> throwables) {
      this.subscribedFiber = subscribedFiber;
      this.messages = messages;
      this.throwables = throwables;
    }

    public void dispose() {
      subscribedFiber.dispose();
    }
  }

  public static <T> ChannelListener<T> listenTo(Channel<T> channel) {
    List<Throwable> throwables = new ArrayList<>();
    BatchExecutor batchExecutor = new ExceptionHandlingBatchExecutor("channel-listener", throwables::add);
    Fiber fiber = new ThreadFiber(new RunnableExecutorImpl(batchExecutor), null, true);
    BlockingQueue<T> messages = new LinkedBlockingQueue<>();
    channel.subscribe(fiber, messages::add);
    fiber.start();
    return new ChannelListener<>(fiber, messages, throwables);
  }

  /**
   * Waits for a message that matches the matcher; if none arrives within a short time frame this
   * throws an assertion failure describing what did arrive.
   */
  public static <T> void assertEventually(ChannelListener<T> listener,
                                          Matcher<? super T> matcher) throws Throwable {
    List<T> received = new ArrayList<>();
    while (true) {
      T msg = listener.messages.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);

      if (msg == null) {
        Description d = new StringDescription();
        matcher.describeTo(d);
        if (!received.isEmpty()) {
          d.appendText(" we received messages:");
        }
        for (T m : received) {
          matcher.describeMismatch(m, d);
        }
        listener.throwables.add(new AssertionError("Failing waiting for " + d.toString()));
        MultipleFailureException.assertEmpty(listener.throwables);
        return;
      }

      if (matcher.matches(msg)) {
        MultipleFailureException.assertEmpty(listener.throwables);
        return;
      }
      received.add(msg);
    }
  }

  /**
   * Polls the supplier until its value matches.
   */
  public static <T> void assertEventually(Supplier<T> state, Matcher<? super T> matcher) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
    T value = state.get();
    while (!matcher.matches(value)) {
      if (System.nanoTime() > deadline) {
        Description d = new StringDescription();
        d.appendText("Expected eventually ").appendDescriptionOf(matcher).appendText(" but ");
        matcher.describeMismatch(value, d);
        throw new AssertionError(d.toString());
      }
      Thread.sleep(20);
      value = state.get();
    }
  }
}
