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

package com.zaxxer.spawnasync.internal;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.zaxxer.spawnasync.SpawnException;
import com.zaxxer.spawnasync.SpawnListener;
import com.zaxxer.spawnasync.SpawnedProcess;
import com.zaxxer.spawnasync.SpawnedProcess.Stream;

/**
 * Fans process events out to any number of {@link SpawnListener}s.
 * <p>
 * Lifecycle events (start, exit, close, error) are latched. A listener added
 * after one of them fired receives it on the adding thread; a listener that
 * was already attached receives it from the dispatching thread. Latching and
 * attaching share one lock, so each listener sees each lifecycle event once.
 * <p>
 * The settlement listener, if any, receives every event after all other
 * listeners.
 */
public final class EventDispatcher
{
   private static final Logger LOGGER = Logger.getLogger(EventDispatcher.class.getCanonicalName());

   private final SpawnedProcess process;
   private final CopyOnWriteArrayList<SpawnListener> listeners;
   private final SpawnListener settlement;

   private boolean started;
   private boolean exited;
   private boolean closed;
   private Integer exitStatus;
   private String exitSignal;
   private SpawnException error;

   public EventDispatcher(SpawnedProcess process, List<SpawnListener> initial, SpawnListener settlement)
   {
      this.process = process;
      this.listeners = new CopyOnWriteArrayList<>(initial);
      this.settlement = settlement;
   }

   public void add(SpawnListener listener)
   {
      if (listener == null) {
         throw new IllegalArgumentException("A SpawnListener must be specified");
      }

      final boolean replayStart;
      final boolean replayExit;
      final boolean replayClose;
      final Integer status;
      final String signal;
      final SpawnException replayError;
      synchronized (this) {
         listeners.add(listener);
         replayStart = started;
         replayExit = exited;
         replayClose = closed;
         status = exitStatus;
         signal = exitSignal;
         replayError = error;
      }

      if (replayStart) {
         notify(listener, l -> l.onStart(process));
      }
      if (replayExit) {
         notify(listener, l -> l.onExit(status, signal));
      }
      if (replayClose) {
         notify(listener, l -> l.onClose(status, signal));
      }
      if (replayError != null) {
         notify(listener, l -> l.onError(replayError));
      }
   }

   public boolean remove(SpawnListener listener)
   {
      return listeners.remove(listener);
   }

   public void dispatchPreStart()
   {
      fire(snapshot(), l -> l.onPreStart(process));
   }

   public void dispatchStart()
   {
      SpawnListener[] targets;
      synchronized (this) {
         started = true;
         targets = snapshot();
      }

      fire(targets, l -> l.onStart(process));
   }

   public void dispatchOutput(Stream stream, ByteBuffer buffer, boolean eof)
   {
      Consumer<SpawnListener> event;
      if (stream == Stream.STDOUT) {
         event = l -> l.onStdout(buffer.asReadOnlyBuffer(), eof);
      }
      else {
         event = l -> l.onStderr(buffer.asReadOnlyBuffer(), eof);
      }

      fire(snapshot(), event);
   }

   public void dispatchExit(Integer status, String signal)
   {
      SpawnListener[] targets;
      synchronized (this) {
         exited = true;
         exitStatus = status;
         exitSignal = signal;
         targets = snapshot();
      }

      fire(targets, l -> l.onExit(status, signal));
   }

   public void dispatchClose(Integer status, String signal)
   {
      SpawnListener[] targets;
      synchronized (this) {
         closed = true;
         targets = snapshot();
      }

      fire(targets, l -> l.onClose(status, signal));
   }

   public void dispatchError(SpawnException exception)
   {
      SpawnListener[] targets;
      synchronized (this) {
         error = exception;
         targets = snapshot();
      }

      fire(targets, l -> l.onError(exception));
   }

   private SpawnListener[] snapshot()
   {
      return listeners.toArray(new SpawnListener[0]);
   }

   private void fire(SpawnListener[] targets, Consumer<SpawnListener> event)
   {
      for (SpawnListener listener : targets) {
         notify(listener, event);
      }

      if (settlement != null) {
         notify(settlement, event);
      }
   }

   private static void notify(SpawnListener listener, Consumer<SpawnListener> event)
   {
      try {
         event.accept(listener);
      }
      catch (Exception e) {
         // Don't let an exception thrown from one listener interrupt the others
         LOGGER.log(Level.WARNING, "Exception thrown from listener " + listener, e);
      }
   }
}
