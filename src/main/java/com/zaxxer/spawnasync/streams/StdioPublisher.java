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
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.spawnasync.SpawnAdapter;
import com.zaxxer.spawnasync.SpawnedProcess.Stream;

/**
 * A hot {@link Publisher} of one output stream of a process. Every subscriber
 * receives its own copy of each chunk read after it subscribed, and
 * {@code onComplete} once the stream reaches end-of-file. Chunks that arrive
 * while a subscriber has no outstanding demand are queued for it.
 * <p>
 * A subscriber may fall at most {@value #MAX_QUEUED_CHUNKS} chunks behind.
 * While any subscriber is that far behind, the process's pipe is not read,
 * so a process writing faster than its slowest subscriber consumes blocks in
 * {@code write()}. A subscriber that stops requesting therefore stalls the
 * stream for every other subscriber and for the result capture, until it
 * requests more or cancels.
 */
public class StdioPublisher extends SpawnAdapter implements Publisher<ByteBuffer>
{
   private static final Logger LOGGER = LoggerFactory.getLogger(StdioPublisher.class);

   static final int MAX_QUEUED_CHUNKS = 16;

   private final Stream stream;
   private final CopyOnWriteArrayList<StdioSubscription> subscriptions;
   private final Object capacityLock;
   private volatile boolean completed;

   public StdioPublisher(final Stream stream)
   {
      this.stream = stream;
      this.subscriptions = new CopyOnWriteArrayList<>();
      this.capacityLock = new Object();
   }

   @Override
   public void subscribe(final Subscriber<? super ByteBuffer> subscriber)
   {
      if (subscriber == null) {
         throw new NullPointerException("Subscriber cannot be null");
      }

      StdioSubscription subscription = new StdioSubscription(subscriber);
      subscriptions.add(subscription);
      if (completed) {
         subscription.complete();
      }

      LOGGER.debug("New subscription {} to {}", subscription, stream);
      subscription.start();
   }

   /**
    * Block until no subscriber has {@value #MAX_QUEUED_CHUNKS} or more chunks
    * queued. Called by the thread that reads the pipe, before each read.
    *
    * @throws InterruptedException if the reading thread is interrupted while waiting
    */
   public void awaitCapacity() throws InterruptedException
   {
      synchronized (capacityLock) {
         while (isSaturated()) {
            capacityLock.wait();
         }
      }
   }

   private boolean isSaturated()
   {
      for (StdioSubscription subscription : subscriptions) {
         if (subscription.queued.get() >= MAX_QUEUED_CHUNKS) {
            return true;
         }
      }

      return false;
   }

   private void signalCapacity()
   {
      synchronized (capacityLock) {
         capacityLock.notifyAll();
      }
   }

   @Override
   public void onStdout(ByteBuffer buffer, boolean closed)
   {
      if (stream == Stream.STDOUT) {
         publish(buffer, closed);
      }
   }

   @Override
   public void onStderr(ByteBuffer buffer, boolean closed)
   {
      if (stream == Stream.STDERR) {
         publish(buffer, closed);
      }
   }

   private void publish(ByteBuffer buffer, boolean closed)
   {
      if (buffer.hasRemaining() && !subscriptions.isEmpty()) {
         ByteBuffer copy = ByteBuffer.allocate(buffer.remaining());
         copy.put(buffer);
         copy.flip();

         for (StdioSubscription subscription : subscriptions) {
            subscription.enqueue(copy.asReadOnlyBuffer());
         }
      }

      if (closed) {
         completed = true;
         for (StdioSubscription subscription : subscriptions) {
            subscription.complete();
         }
      }
   }

   class StdioSubscription implements Subscription
   {
      private final Subscriber<? super ByteBuffer> subscriber;
      private final ConcurrentLinkedQueue<ByteBuffer> queue;
      private final AtomicInteger queued;
      private final AtomicLong requested;
      // Starts at 1 so that nothing is signalled before onSubscribe() has returned
      private final AtomicInteger wip;

      private volatile boolean done;
      private volatile boolean cancelled;
      private volatile Throwable error;

      StdioSubscription(final Subscriber<? super ByteBuffer> subscriber)
      {
         this.subscriber = subscriber;
         this.queue = new ConcurrentLinkedQueue<>();
         this.queued = new AtomicInteger();
         this.requested = new AtomicLong();
         this.wip = new AtomicInteger(1);
      }

      @Override
      public void request(long n)
      {
         if (n <= 0) {
            error = new IllegalArgumentException("Subscription.request() value cannot be less than 1, rule 3.9");
         }
         else {
            long current;
            long next;
            do {
               current = requested.get();
               next = current + n;
               if (next < 0) {
                  next = Long.MAX_VALUE;
               }
            }
            while (!requested.compareAndSet(current, next));
         }

         drain();
      }

      @Override
      public void cancel()
      {
         LOGGER.debug("StdioSubscription.cancel() called on subscription {}", this);
         cancelled = true;
         subscriptions.remove(this);
         queue.clear();
         queued.set(0);
         signalCapacity();
      }

      void start()
      {
         try {
            subscriber.onSubscribe(this);
         }
         catch (RuntimeException e) {
            LOGGER.warn("Exception thrown from onSubscribe() of {}", subscriber, e);
            cancel();
            return;
         }

         drainLoop();
      }

      void enqueue(ByteBuffer buffer)
      {
         if (!cancelled) {
            queued.incrementAndGet();
            queue.add(buffer);
            drain();
         }
      }

      void complete()
      {
         done = true;
         drain();
      }

      private void drain()
      {
         if (wip.getAndIncrement() == 0) {
            drainLoop();
         }
      }

      private void drainLoop()
      {
         int missed = 1;
         while (true) {
            if (cancelled) {
               return;
            }

            if (error != null) {
               cancel();
               subscriber.onError(error);
               return;
            }

            long r = requested.get();
            long emitted = 0;
            while (emitted != r) {
               ByteBuffer buffer = queue.poll();
               if (buffer == null) {
                  break;
               }

               if (queued.decrementAndGet() == MAX_QUEUED_CHUNKS - 1) {
                  signalCapacity();
               }

               try {
                  subscriber.onNext(buffer);
               }
               catch (RuntimeException e) {
                  LOGGER.warn("Exception thrown from onNext() of {}, cancelling", subscriber, e);
                  cancel();
                  return;
               }

               emitted++;
               if (cancelled) {
                  return;
               }
            }

            if (emitted != 0 && r != Long.MAX_VALUE) {
               requested.addAndGet(-emitted);
            }

            if (done && queue.isEmpty()) {
               cancel();
               subscriber.onComplete();
               return;
            }

            missed = wip.addAndGet(-missed);
            if (missed == 0) {
               return;
            }
         }
      }
   }
}
