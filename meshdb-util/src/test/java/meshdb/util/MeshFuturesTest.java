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
import org.hamcrest.Description;
import org.jetlang.fibers.Fiber;
import org.jmock.Expectations;
import org.jmock.api.Action;
import org.jmock.api.Invocation;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

public class MeshFuturesTest {
  public static class RunARunnableAction implements Action {
    public Object invoke(Invocation invocation) throws Throwable {
      ((Runnable) invocation.getParameter(0)).run();
      return null;
    }

    @Override
    public void describeTo(Description description) {
      description.appendText("runs the runnable");
    }
  }

  public static Action runTheRunnable() {
    return new RunARunnableAction();
  }

  @Rule
  public final JUnitRuleMockery context = new JUnitRuleMockery();
  @SuppressWarnings("unchecked")
  private final Consumer<Integer> success = context.mock(Consumer.class, "success");
  @SuppressWarnings("unchecked")
  private final Consumer<Throwable> failure = context.mock(Consumer.class, "failure");
  @SuppressWarnings("unchecked")
  private final ListenableFuture<Integer> mockFuture = context.mock(ListenableFuture.class, "mockFuture");
  private final Fiber mockFiber = context.mock(Fiber.class);

  @Before
  public void setupRunnable() {
    context.checking(new Expectations() {{
      oneOf(mockFuture).addListener(with(any(Runnable.class)), with(same(mockFiber)));
      will(runTheRunnable());
    }});
  }

  @Test
  public void deliversTheValueOfASuccessfulFutureToTheSuccessConsumer() throws Exception {
    Integer futureValue = 12;

    context.checking(new Expectations() {{
      oneOf(mockFuture).get();
      will(returnValue(futureValue));

      oneOf(success).accept(futureValue);
    }});

    MeshFutures.addCallback(mockFuture, success, failure, mockFiber);
  }

  @Test
  public void unwrapsTheCauseOfAFailedFutureBeforeCallingTheFailureConsumer() throws Exception {
    IOException cause = new IOException("peer went away");

    context.checking(new Expectations() {{
      oneOf(mockFuture).get();
      will(throwException(new ExecutionException(cause)));

      oneOf(failure).accept(cause);
    }});

    MeshFutures.addCallback(mockFuture, success, failure, mockFiber);
  }
}
