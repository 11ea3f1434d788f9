/*
 * Copyright (C) 2024 Brett Wooldridge
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.zaxxer.spawnasync;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.junit.Assert;
import org.junit.Test;

public class SpawnCollectorTest
{
   @Test
   public void waitFailureIsStitchedToTheCallSite() throws Exception
   {
      CompletableFuture<SpawnResult> future = new CompletableFuture<>();
      SpawnCollector collector = new SpawnCollector("sleep 5", false, StandardCharsets.UTF_8, spawnCallSite(), future);

      SpawnException error = new SpawnException("sleep 5 could not be waited for: ECHILD", SpawnException.Reason.WAIT_FAILED,
                                                4242, "", "", null, null, "ECHILD");
      int ownFrames = error.getStackTrace().length;
      collector.onError(error);

      SpawnException failure = failureOf(future);
      Assert.assertSame(error, failure);
      Assert.assertEquals(SpawnException.Reason.WAIT_FAILED, failure.getReason());
      Assert.assertEquals(Integer.valueOf(4242), failure.getPid());
      Assert.assertEquals("ECHILD", failure.getCode());
      Assert.assertNull(failure.getStatus());
      Assert.assertNull(failure.getSignal());

      StackTraceElement[] trace = failure.getStackTrace();
      Assert.assertSame(SpawnException.ASYNC_BOUNDARY, trace[ownFrames]);
      Assert.assertEquals("spawnCallSite", trace[ownFrames + 1].getMethodName());
   }

   @Test
   public void launchErrorKeepsItsOwnTrace() throws Exception
   {
      CompletableFuture<SpawnResult> future = new CompletableFuture<>();
      SpawnCollector collector = new SpawnCollector("nope", false, StandardCharsets.UTF_8, spawnCallSite(), future);

      SpawnException error = new SpawnException("spawn nope ENOENT", SpawnException.Reason.LAUNCH_ERROR, null, "", "", null, null, "ENOENT");
      List<StackTraceElement> before = Arrays.asList(error.getStackTrace());
      collector.onError(error);

      SpawnException failure = failureOf(future);
      Assert.assertEquals(before, Arrays.asList(failure.getStackTrace()));
      assertThat(Arrays.asList(failure.getStackTrace()), not(hasItem(SpawnException.ASYNC_BOUNDARY)));
   }

   @Test
   public void onlyTheFirstOutcomeSettles() throws Exception
   {
      CompletableFuture<SpawnResult> future = new CompletableFuture<>();
      SpawnCollector collector = new SpawnCollector("sleep 5", false, StandardCharsets.UTF_8, spawnCallSite(), future);

      SpawnException error = new SpawnException("sleep 5 could not be waited for: ECHILD", SpawnException.Reason.WAIT_FAILED,
                                                4242, "", "", null, null, "ECHILD");
      collector.onError(error);
      collector.onClose(0, null);
      collector.onError(new SpawnException("again", SpawnException.Reason.WAIT_FAILED, 4242, "", "", null, null, "ECHILD"));

      Assert.assertSame(error, failureOf(future));
   }

   @Test
   public void capturedOutputSettlesOnCloseNotExit() throws Exception
   {
      CompletableFuture<SpawnResult> future = new CompletableFuture<>();
      SpawnCollector collector = new SpawnCollector("echo hi", false, StandardCharsets.UTF_8, spawnCallSite(), future);

      collector.onStdout(ByteBuffer.wrap("hi\n".getBytes(StandardCharsets.UTF_8)), false);
      collector.onExit(0, null);
      Assert.assertFalse(future.isDone());

      collector.onStderr(ByteBuffer.wrap("warn".getBytes(StandardCharsets.UTF_8)), true);
      collector.onClose(0, null);

      SpawnResult result = future.get();
      Assert.assertEquals("hi\n", result.getStdout());
      Assert.assertEquals("warn", result.getStderr());
      Assert.assertEquals(Integer.valueOf(0), result.getStatus());
   }

   @Test
   public void ignoredStdioSettlesOnExitWithEmptyOutput() throws Exception
   {
      CompletableFuture<SpawnResult> future = new CompletableFuture<>();
      SpawnCollector collector = new SpawnCollector("false", true, StandardCharsets.UTF_8, spawnCallSite(), future);

      collector.onStdout(ByteBuffer.wrap("ignored".getBytes(StandardCharsets.UTF_8)), false);
      collector.onExit(1, null);

      SpawnException failure = failureOf(future);
      Assert.assertEquals(SpawnException.Reason.ABNORMAL_EXIT, failure.getReason());
      Assert.assertEquals(Integer.valueOf(1), failure.getStatus());
      Assert.assertEquals("", failure.getStdout());
      assertThat(Arrays.asList(failure.getStackTrace()), hasItem(SpawnException.ASYNC_BOUNDARY));
   }

   private static Throwable spawnCallSite()
   {
      return new Throwable("spawn call site");
   }

   private static SpawnException failureOf(CompletableFuture<SpawnResult> future) throws InterruptedException
   {
      Assert.assertTrue(future.isCompletedExceptionally());
      try {
         future.get();
         throw new AssertionError("Expected the task to fail");
      }
      catch (ExecutionException e) {
         return (SpawnException) e.getCause();
      }
   }
}
