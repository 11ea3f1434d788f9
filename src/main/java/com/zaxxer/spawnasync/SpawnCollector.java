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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The orchestrator's own listener. It accumulates output unless stdio is
 * ignored, and settles the task's future exactly once: on close when output
 * is captured, on exit when it is not, or on error.
 */
final class SpawnCollector extends SpawnAdapter
{
   private final String description;
   private final boolean ignoreStdio;
   private final Charset charset;
   private final Throwable callSite;
   private final CompletableFuture<SpawnResult> future;

   private final ByteArrayOutputStream stdout;
   private final ByteArrayOutputStream stderr;
   private final AtomicBoolean settled;

   private volatile int pid;

   SpawnCollector(String description, boolean ignoreStdio, Charset charset, Throwable callSite, CompletableFuture<SpawnResult> future)
   {
      this.description = description;
      this.ignoreStdio = ignoreStdio;
      this.charset = charset;
      this.callSite = callSite;
      this.future = future;
      this.stdout = new ByteArrayOutputStream();
      this.stderr = new ByteArrayOutputStream();
      this.settled = new AtomicBoolean();
      this.pid = -1;
   }

   @Override
   public void onStart(SpawnedProcess process)
   {
      pid = process.getPID();
   }

   @Override
   public void onStdout(ByteBuffer buffer, boolean closed)
   {
      if (!ignoreStdio) {
         append(stdout, buffer);
      }
   }

   @Override
   public void onStderr(ByteBuffer buffer, boolean closed)
   {
      if (!ignoreStdio) {
         append(stderr, buffer);
      }
   }

   @Override
   public void onExit(Integer status, String signal)
   {
      // Output may be held open by a descendant, so don't wait for close
      if (ignoreStdio) {
         settle(status, signal);
      }
   }

   @Override
   public void onClose(Integer status, String signal)
   {
      if (!ignoreStdio) {
         settle(status, signal);
      }
   }

   @Override
   public void onError(SpawnException error)
   {
      if (settled.compareAndSet(false, true)) {
         // A launch error is raised on the spawning thread and already carries the call site
         if (error.getReason() != SpawnException.Reason.LAUNCH_ERROR) {
            error.appendCallSite(callSite);
         }

         future.completeExceptionally(error);
      }
   }

   private void settle(Integer status, String signal)
   {
      if (!settled.compareAndSet(false, true)) {
         return;
      }

      String out = ignoreStdio ? "" : new String(stdout.toByteArray(), charset);
      String err = ignoreStdio ? "" : new String(stderr.toByteArray(), charset);

      if (status != null && status == 0 && signal == null) {
         future.complete(new SpawnResult(pid, out, err, status, null));
         return;
      }

      SpawnException exception;
      if (signal != null) {
         exception = new SpawnException(description + " exited with signal: " + signal, SpawnException.Reason.SIGNAL_TERMINATION,
                                        pid, out, err, null, signal, null);
      }
      else {
         exception = new SpawnException(description + " exited with non-zero code: " + status, SpawnException.Reason.ABNORMAL_EXIT,
                                        pid, out, err, status, null, null);
      }

      exception.appendCallSite(callSite);
      future.completeExceptionally(exception);
   }

   private static void append(ByteArrayOutputStream sink, ByteBuffer buffer)
   {
      if (buffer.hasRemaining()) {
         byte[] bytes = new byte[buffer.remaining()];
         buffer.get(bytes);
         sink.write(bytes, 0, bytes.length);
      }
   }
}
