/*
 * Copyright (C) 2013 Brett Wooldridge
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

import java.nio.ByteBuffer;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

/**
 * The live handle of a process started by {@link SpawnAsync#spawn}. It is
 * available from {@link SpawnTask#getChild()} as soon as {@code spawn} returns
 * and stays usable for the whole life of the process, independently of whether
 * the task has settled.
 * <p>
 * The handle is shared: the task's own bookkeeping is attached to it as one
 * listener among others, and the caller may attach listeners, subscribe to or
 * write the stdio streams and terminate the process at any time.
 */
public interface SpawnedProcess
{
   enum Stream
   {
      STDIN,
      STDOUT,
      STDERR
   }

   /**
    * @return the process id, or {@code -1} if the process never started
    */
   int getPID();

   /**
    * Tests whether or not the process is still running or has exited.
    *
    * @return true if the process is still running, false if it has exited
    *         or never started
    */
   boolean isRunning();

   /**
    * Attach an additional listener. Lifecycle notifications that already
    * happened are replayed to it immediately, on the calling thread.
    *
    * @param listener the {@link SpawnListener} to attach
    */
   void addListener(SpawnListener listener);

   /**
    * @param listener a listener previously passed to {@link #addListener}
    * @return {@code true} if the listener was attached
    */
   boolean removeListener(SpawnListener listener);

   /**
    * A hot publisher of the process's stdout. Subscribers receive the chunks
    * read after they subscribed and complete at EOF. Available whether or not
    * output is being captured. The pipe is not read while any subscriber has
    * fallen too far behind its demand, which blocks the process's writes.
    *
    * @return the stdout {@link Publisher}
    */
   Publisher<ByteBuffer> getStdout();

   /**
    * A hot publisher of the process's stderr, see {@link #getStdout()}.
    *
    * @return the stderr {@link Publisher}
    */
   Publisher<ByteBuffer> getStderr();

   /**
    * A subscriber that writes every element it receives to the process's
    * stdin and closes stdin when its upstream completes. Subscribing it to
    * another process's {@link #getStdout()} pipes one process into the other,
    * and the upstream is only asked for more as this process reads its input.
    *
    * @return a new stdin {@link Subscriber}
    */
   Subscriber<ByteBuffer> getStdin();

   /**
    * Queue {@code buffer} for writing to the process's stdin. This method
    * returns immediately; the write happens on a background thread as the
    * process reads its input. The buffer must not be modified after it has
    * been handed over.
    * <p>
    * Note that if the process is not reading its stdin, calling this method
    * repeatedly accumulates unwritten buffers in the Java process.
    *
    * @param buffer the {@link ByteBuffer} to write to the STDIN stream of the process
    * @throws IllegalStateException if stdin has been closed
    */
   void writeStdin(ByteBuffer buffer);

   /**
    * Close the STDIN pipe between the Java process and the spawned process.
    * <p>
    * If {@code force} is {@code true} the pipe is closed right away and
    * pending unwritten data is discarded. Otherwise stdin is closed once every
    * pending write has completed.
    *
    * @param force {@code true} to force the pipe closed immediately
    * @throws IllegalStateException if a graceful close was already requested
    */
   void closeStdin(boolean force);

   /**
    * @return {@code true} if there are pending writes or STDIN is pending
    *         close, {@code false} otherwise
    */
   boolean hasPendingWrites();

   /**
    * Send SIGTERM to the process. See {@link #terminate(Signal)}.
    *
    * @return {@code true} if the signal was delivered
    */
   boolean terminate();

   /**
    * Send {@code signal} to the process. Delivery is asynchronous: the task
    * settles only once the resulting termination is observed, normally as a
    * {@link SpawnException} carrying the signal name.
    *
    * @param signal the {@link Signal} to send
    * @return {@code true} if the signal was delivered, {@code false} if the
    *         process is no longer running
    */
   boolean terminate(Signal signal);
}
