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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * The value returned by {@link SpawnAsync#spawn}. It combines the live
 * {@link SpawnedProcess}, usable immediately and for the whole life of the
 * process, with a result that settles exactly once when the process
 * terminates.
 */
public final class SpawnTask
{
   private final SpawnedProcess child;
   private final CompletableFuture<SpawnResult> future;

   SpawnTask(SpawnedProcess child, CompletableFuture<SpawnResult> future)
   {
      this.child = child;
      this.future = future;
   }

   /**
    * @return the process handle; never {@code null}, even if the launch failed
    */
   public SpawnedProcess getChild()
   {
      return child;
   }

   /**
    * Block until the process has terminated.
    *
    * @return the result of a process that exited with status 0
    * @throws SpawnException if the process could not be launched, exited with
    *         a non-zero status, or was killed by a signal
    * @throws InterruptedException if the calling thread was interrupted while
    *         waiting; the process is unaffected
    */
   public SpawnResult await() throws InterruptedException
   {
      try {
         return future.get();
      }
      catch (ExecutionException e) {
         throw unwrap(e);
      }
   }

   /**
    * Block until the process has terminated or the timeout elapses. A timeout
    * neither terminates the process nor settles the task.
    *
    * @param timeout the maximum time to wait
    * @param unit the unit of {@code timeout}
    * @return the result of a process that exited with status 0
    * @throws SpawnException if the process failed, see {@link #await()}
    * @throws InterruptedException if the calling thread was interrupted
    * @throws TimeoutException if the process is still running after {@code timeout}
    */
   public SpawnResult await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException
   {
      try {
         return future.get(timeout, unit);
      }
      catch (ExecutionException e) {
         throw unwrap(e);
      }
   }

   /**
    * @return {@code true} once the task has settled, successfully or not
    */
   public boolean isDone()
   {
      return future.isDone();
   }

   /**
    * @return a new future that completes with the same outcome as this task;
    *         completing or cancelling it has no effect on the task
    */
   public CompletableFuture<SpawnResult> toCompletableFuture()
   {
      return future.thenApply(Function.identity());
   }

   private static RuntimeException unwrap(ExecutionException e)
   {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
         return (RuntimeException) cause;
      }

      return new RuntimeException(cause);
   }
}
