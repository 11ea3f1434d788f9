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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Thrown from {@link SpawnTask#await()} (and used to complete the task's
 * future exceptionally) when a process exits with a non-zero status, is killed
 * by a signal, or cannot be launched at all. The structured accessors carry
 * enough to branch on without parsing the message.
 * <p>
 * Failures observed on a background thread have the stack trace of the
 * {@link SpawnAsync#spawn} call appended below an {@link #ASYNC_BOUNDARY}
 * frame, so the originating call site stays visible.
 */
public class SpawnException extends RuntimeException
{
   private static final long serialVersionUID = 1L;

   /**
    * Separates the frames of the thread that observed the failure from the
    * frames of the {@code spawn} call site. Prints as {@code at ....(async boundary)}.
    */
   public static final StackTraceElement ASYNC_BOUNDARY = new StackTraceElement("...", "", "async boundary", -1);

   public enum Reason
   {
      /** The process never started; {@link #getCode()} holds the errno name. */
      LAUNCH_ERROR,
      /** The process exited with a non-zero status. */
      ABNORMAL_EXIT,
      /** The process was terminated by a signal. */
      SIGNAL_TERMINATION,
      /** The process started but its termination status could not be collected. */
      WAIT_FAILED
   }

   private final Reason reason;
   private final Integer pid;
   private final String stdout;
   private final String stderr;
   private final List<String> output;
   private final Integer status;
   private final String signal;
   private final String code;

   public SpawnException(String message, Reason reason, Integer pid, String stdout, String stderr,
                         Integer status, String signal, String code)
   {
      super(message);
      this.reason = reason;
      this.pid = pid;
      this.stdout = stdout != null ? stdout : "";
      this.stderr = stderr != null ? stderr : "";
      this.output = Collections.unmodifiableList(Arrays.asList(this.stdout, this.stderr));
      this.status = status;
      this.signal = signal;
      this.code = code;
   }

   public Reason getReason()
   {
      return reason;
   }

   /**
    * @return the process id, or {@code null} if no process was created
    */
   public Integer getPid()
   {
      return pid;
   }

   public String getStdout()
   {
      return stdout;
   }

   public String getStderr()
   {
      return stderr;
   }

   public List<String> getOutput()
   {
      return output;
   }

   /**
    * @return the exit status, or {@code null} if the process was killed by a
    *         signal or never ran
    */
   public Integer getStatus()
   {
      return status;
   }

   /**
    * @return the terminating signal name, or {@code null} if the process
    *         exited or never ran
    */
   public String getSignal()
   {
      return signal;
   }

   /**
    * @return the errno name of a launch or wait failure (e.g. {@code "ENOENT"}),
    *         otherwise {@code null}
    */
   public String getCode()
   {
      return code;
   }

   void appendCallSite(Throwable callSite)
   {
      StackTraceElement[] async = getStackTrace();
      StackTraceElement[] sync = callSite.getStackTrace();

      StackTraceElement[] merged = new StackTraceElement[async.length + 1 + sync.length];
      System.arraycopy(async, 0, merged, 0, async.length);
      merged[async.length] = ASYNC_BOUNDARY;
      System.arraycopy(sync, 0, merged, async.length + 1, sync.length);
      setStackTrace(merged);
   }
}
