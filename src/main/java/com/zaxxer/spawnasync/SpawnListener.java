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

/**
 * Observers of a {@link SpawnedProcess} implement this interface. Any number
 * of listeners may be attached to one process, either before launch through
 * {@link SpawnOptions#addListener(SpawnListener)} or at any later time through
 * {@link SpawnedProcess#addListener(SpawnListener)}. Each listener is notified
 * independently; the listener that settles the {@link SpawnTask} is always
 * notified after every listener attached by the caller.
 * <p>
 * Lifecycle notifications ({@link #onStart}, {@link #onExit}, {@link #onClose}
 * and {@link #onError}) are delivered exactly once per listener. A listener
 * attached after one of them has already happened receives it immediately, on
 * the thread that attached it. Output notifications are only delivered for data
 * that arrives after the listener was attached.
 * <p>
 * Except for {@link #onPreStart} and {@link #onStart}, which run on the thread
 * that called {@link SpawnAsync#spawn}, methods are invoked by the process's
 * pump and reaper threads. Never block in a callback for longer than it takes
 * to hand the work to another thread; a blocked stdout callback stops the
 * process's stdout from draining.
 * <p>
 * Exceptions thrown from a callback are logged and otherwise ignored.
 */
public interface SpawnListener
{
   /**
    * Invoked before the process is spawned, and only for listeners supplied
    * through {@link SpawnOptions}. The process has no PID yet. Subscribing to
    * its {@link SpawnedProcess#getStdout() stdout} or
    * {@link SpawnedProcess#getStderr() stderr} here guarantees that no output
    * is missed; writing to it or terminating it is not possible yet.
    *
    * @param process the {@link SpawnedProcess} that is about to start
    */
   void onPreStart(SpawnedProcess process);

   /**
    * Invoked once the process is running, before any output, exit or close
    * notification.
    *
    * @param process the {@link SpawnedProcess} that started
    */
   void onStart(SpawnedProcess process);

   /**
    * Invoked for every chunk read from the process's stdout, in arrival order,
    * and once more with an empty buffer and {@code closed} set to {@code true}
    * when stdout reaches end-of-file.
    * <p>
    * The buffer is a read-only view that is only valid for the duration of the
    * call. Copy what you need; do not retain the buffer.
    *
    * @param buffer a read-only {@link ByteBuffer} with the received data
    * @param closed {@code true} if EOF has been reached
    */
   void onStdout(ByteBuffer buffer, boolean closed);

   /**
    * Invoked for every chunk read from the process's stderr, with the same
    * contract as {@link #onStdout(ByteBuffer, boolean)}.
    *
    * @param buffer a read-only {@link ByteBuffer} with the received data
    * @param closed {@code true} if EOF has been reached
    */
   void onStderr(ByteBuffer buffer, boolean closed);

   /**
    * Invoked when the process has terminated, whether or not its stdout and
    * stderr have been drained. Exactly one of the two arguments is non-null.
    *
    * @param status the exit status, or {@code null} if the process was killed by a signal
    * @param signal the name of the terminating signal, or {@code null} if the process exited
    */
   void onExit(Integer status, String signal);

   /**
    * Invoked after {@link #onExit} once stdout and stderr have both reached
    * EOF. If a descendant of the process inherited one of those streams this
    * may happen long after the process itself exited, or never.
    *
    * @param status the exit status, or {@code null} if the process was killed by a signal
    * @param signal the name of the terminating signal, or {@code null} if the process exited
    */
   void onClose(Integer status, String signal);

   /**
    * Invoked when the process could not be launched, or when the process was
    * lost before its termination status could be collected. No {@link #onStart},
    * {@link #onExit} or {@link #onClose} follows a launch failure.
    *
    * @param error the failure, carrying its errno code
    */
   void onError(SpawnException error);
}
