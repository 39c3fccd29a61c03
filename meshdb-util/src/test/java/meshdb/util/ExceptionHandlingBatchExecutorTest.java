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

import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.core.RunnableExecutorImpl;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.ThreadFiber;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;

public class ExceptionHandlingBatchExecutorTest {

  private final MemoryChannel<Long> channel = new MemoryChannel<>();
  private final SettableFuture<Throwable> caught = SettableFuture.create();
  private final List<Long> delivered = Collections.synchronizedList(new ArrayList<>());
  private Fiber fiber;

  @Before
  public void before() {
    fiber = new ThreadFiber(
        new RunnableExecutorImpl(new ExceptionHandlingBatchExecutor("test-fiber", caught::set)),
        "test-fiber",
        true);
  }

  @After
  public void after() {
    fiber.dispose();
  }

  @Test
  public void passesAThrowableFromACallbackToTheHandler() throws Exception {
    channel.subscribe(fiber, (val) -> {
      throw new IndexOutOfBoundsException();
    });
    fiber.start();

    channel.publish(4L);

    assertThat(caught.get(10, TimeUnit.SECONDS), is(instanceOf(IndexOutOfBoundsException.class)));
  }

  @Test
  public void keepsRunningCallbacksAfterOneOfThemThrows() throws Exception {
    SettableFuture<Boolean> secondDelivered = SettableFuture.create();
    channel.subscribe(fiber, (val) -> {
      if (val == 1L) {
        throw new IllegalStateException("first");
      }
      delivered.add(val);
      secondDelivered.set(true);
    });
    fiber.start();

    channel.publish(1L);
    channel.publish(2L);

    assertThat(secondDelivered.get(10, TimeUnit.SECONDS), is(true));
    assertThat(delivered, contains(2L));
    assertThat(caught.get(10, TimeUnit.SECONDS), is(instanceOf(IllegalStateException.class)));
  }
}
