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

package com.zaxxer.spawnasync.streams;

import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.spawnasync.SpawnAdapter;
import com.zaxxer.spawnasync.SpawnException;
import com.zaxxer.spawnasync.SpawnListener;
import com.zaxxer.spawnasync.internal.PosixProcess;

/**
 * A {@link Subscriber} that writes every element it receives to the stdin of a
 * process, and closes stdin once all of them have been written and the
 * upstream has terminated.
 * <p>
 * At most {@value #MAX_IN_FLIGHT} elements are requested ahead of what has
 * actually been written to the pipe; one more is requested each time a write
 * completes. A process that does not read its input therefore throttles the
 * upstream instead of letting it fill the heap. The upstream is cancelled
 * when the process exits.
 */
public class StdinSubscriber implements Subscriber<ByteBuffer>
{
   private static final Logger LOGGER = LoggerFactory.getLogger(StdinSubscriber.class);

   static final int MAX_IN_FLIGHT = 16;

   private final PosixProcess process;
   private final AtomicReference<Subscription> subscription;
   private final AtomicBoolean cancelled;
   private final Runnable requestNext;
   private final SpawnListener exitListener;
   private volatile boolean exited;

   public StdinSubscriber(final PosixProcess process)
   {
      this.process = process;
      this.subscription = new AtomicReference<>();
      this.cancelled = new AtomicBoolean();
      this.requestNext = new Runnable() {
         @Override
         public void run()
         {
            Subscription s = subscription.get();
            if (s != null && !cancelled.get()) {
               s.request(1);
            }
         }
      };
      this.exitListener = new SpawnAdapter() {
         @Override
         public void onExit(Integer status, String signal)
         {
            processGone();
         }

         @Override
         public void onError(SpawnException error)
         {
            processGone();
         }
      };

      process.addListener(exitListener);
   }

   @Override
   public void onSubscribe(final Subscription s)
   {
      if (s == null) {
         throw new NullPointerException("Subscription cannot be null");
      }

      if (!subscription.compareAndSet(null, s)) {
         // Rule 2.5, only one active subscription
         s.cancel();
         return;
      }

      if (exited) {
         cancelUpstream();
         return;
      }

      s.request(MAX_IN_FLIGHT);
   }

   @Override
   public void onNext(final ByteBuffer buffer)
   {
      if (buffer == null) {
         throw new NullPointerException("Element cannot be null");
      }

      try {
         process.writeStdin(buffer, requestNext);
      }
      catch (IllegalStateException e) {
         LOGGER.debug("Stdin of {} is closed, cancelling upstream", process);
         cancelUpstream();
      }
   }

   @Override
   public void onError(final Throwable t)
   {
      if (t == null) {
         throw new NullPointerException("Throwable cannot be null");
      }

      LOGGER.debug("Upstream of stdin of {} failed, closing stdin", process, t);
      close();
   }

   @Override
   public void onComplete()
   {
      close();
   }

   private void processGone()
   {
      exited = true;
      if (subscription.get() != null) {
         LOGGER.debug("{} has exited, cancelling upstream of its stdin", process);
         cancelUpstream();
      }
   }

   private void cancelUpstream()
   {
      if (cancelled.compareAndSet(false, true)) {
         process.removeListener(exitListener);
         Subscription s = subscription.get();
         if (s != null) {
            s.cancel();
         }
      }
   }

   private void close()
   {
      try {
         process.closeStdin(false);
      }
      catch (IllegalStateException e) {
         LOGGER.debug("Stdin of {} was already closing", process);
      }
   }
}
