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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.zaxxer.spawnasync.SpawnAdapter;
import com.zaxxer.spawnasync.SpawnException;
import com.zaxxer.spawnasync.SpawnedProcess;
import com.zaxxer.spawnasync.SpawnedProcess.Stream;

public class EventDispatcherTest
{
   private List<String> events;

   @Before
   public void setup()
   {
      events = new CopyOnWriteArrayList<>();
   }

   @Test
   public void lateListenerReceivesLatchedLifecycleOnce()
   {
      EventDispatcher dispatcher = new EventDispatcher(null, Collections.emptyList(), null);
      dispatcher.dispatchStart();
      dispatcher.dispatchOutput(Stream.STDOUT, utf8("missed"), false);
      dispatcher.dispatchExit(3, null);

      dispatcher.add(new RecordingListener("late"));
      assertThat(events, contains("late start", "late exit 3/null"));

      dispatcher.dispatchClose(3, null);
      assertThat(events, contains("late start", "late exit 3/null", "late close 3/null"));
   }

   @Test
   public void settlementListenerRunsLast()
   {
      RecordingListener settlement = new RecordingListener("settlement");
      EventDispatcher dispatcher = new EventDispatcher(null, Collections.singletonList(new RecordingListener("a")), settlement);
      dispatcher.add(new RecordingListener("b"));

      dispatcher.dispatchExit(null, "SIGTERM");

      assertThat(events, contains("a exit null/SIGTERM", "b exit null/SIGTERM", "settlement exit null/SIGTERM"));
   }

   @Test
   public void throwingListenerDoesNotStopDispatch()
   {
      RecordingListener settlement = new RecordingListener("settlement");
      EventDispatcher dispatcher = new EventDispatcher(null, Collections.emptyList(), settlement);
      dispatcher.add(new SpawnAdapter() {
         @Override
         public void onClose(Integer status, String signal)
         {
            throw new RuntimeException("listener failure");
         }
      });
      dispatcher.add(new RecordingListener("after"));

      dispatcher.dispatchClose(0, null);

      assertThat(events, contains("after close 0/null", "settlement close 0/null"));
   }

   @Test
   public void outputIsDeliveredReadOnly()
   {
      final List<Boolean> readOnly = new CopyOnWriteArrayList<>();
      EventDispatcher dispatcher = new EventDispatcher(null, Collections.emptyList(), null);
      dispatcher.add(new RecordingListener("first") {
         @Override
         public void onStdout(ByteBuffer buffer, boolean closed)
         {
            readOnly.add(buffer.isReadOnly());
            // Consuming the view must not affect the next listener
            super.onStdout(buffer, closed);
         }
      });
      dispatcher.add(new RecordingListener("second"));

      dispatcher.dispatchOutput(Stream.STDOUT, utf8("chunk"), false);
      dispatcher.dispatchOutput(Stream.STDERR, utf8("oops"), true);

      assertThat(readOnly, contains(true));
      assertThat(events, contains("first stdout chunk", "second stdout chunk", "first stderr oops closed", "second stderr oops closed"));
   }

   @Test
   public void removedListenerIsNotNotified()
   {
      RecordingListener listener = new RecordingListener("removed");
      EventDispatcher dispatcher = new EventDispatcher(null, Collections.emptyList(), null);
      dispatcher.add(listener);

      Assert.assertTrue(dispatcher.remove(listener));
      Assert.assertFalse(dispatcher.remove(listener));

      dispatcher.dispatchStart();
      assertThat(events, empty());
   }

   @Test
   public void errorIsLatched()
   {
      SpawnException error = new SpawnException("spawn nope ENOENT", SpawnException.Reason.LAUNCH_ERROR, null, "", "", null, null, "ENOENT");
      EventDispatcher dispatcher = new EventDispatcher(null, Collections.emptyList(), null);
      dispatcher.dispatchError(error);

      dispatcher.add(new RecordingListener("late"));
      assertThat(events, contains("late error ENOENT"));
   }

   @Test
   public void preStartGoesToInitialListeners()
   {
      EventDispatcher dispatcher = new EventDispatcher(null, Collections.singletonList(new RecordingListener("initial")), null);
      dispatcher.dispatchPreStart();
      dispatcher.add(new RecordingListener("late"));

      assertThat(events, contains("initial prestart"));
   }

   private static ByteBuffer utf8(String text)
   {
      return ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
   }

   private class RecordingListener extends SpawnAdapter
   {
      private final String name;

      RecordingListener(String name)
      {
         this.name = name;
      }

      @Override
      public void onPreStart(SpawnedProcess process)
      {
         events.add(name + " prestart");
      }

      @Override
      public void onStart(SpawnedProcess process)
      {
         events.add(name + " start");
      }

      @Override
      public void onStdout(ByteBuffer buffer, boolean closed)
      {
         events.add(name + " stdout " + StandardCharsets.UTF_8.decode(buffer) + (closed ? " closed" : ""));
      }

      @Override
      public void onStderr(ByteBuffer buffer, boolean closed)
      {
         events.add(name + " stderr " + StandardCharsets.UTF_8.decode(buffer) + (closed ? " closed" : ""));
      }

      @Override
      public void onExit(Integer status, String signal)
      {
         events.add(name + " exit " + status + "/" + signal);
      }

      @Override
      public void onClose(Integer status, String signal)
      {
         events.add(name + " close " + status + "/" + signal);
      }

      @Override
      public void onError(SpawnException error)
      {
         events.add(name + " error " + error.getCode());
      }
   }
}
