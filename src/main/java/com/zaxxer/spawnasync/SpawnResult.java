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
 * The outcome of a process that exited with status 0.
 */
public final class SpawnResult
{
   private final int pid;
   private final String stdout;
   private final String stderr;
   private final List<String> output;
   private final Integer status;
   private final String signal;

   SpawnResult(int pid, String stdout, String stderr, Integer status, String signal)
   {
      this.pid = pid;
      this.stdout = stdout;
      this.stderr = stderr;
      this.output = Collections.unmodifiableList(Arrays.asList(stdout, stderr));
      this.status = status;
      this.signal = signal;
   }

   public int getPid()
   {
      return pid;
   }

   /**
    * @return the captured stdout, or an empty string if stdio was ignored
    */
   public String getStdout()
   {
      return stdout;
   }

   /**
    * @return the captured stderr, or an empty string if stdio was ignored
    */
   public String getStderr()
   {
      return stderr;
   }

   /**
    * @return the two-element list {@code [stdout, stderr]}
    */
   public List<String> getOutput()
   {
      return output;
   }

   public Integer getStatus()
   {
      return status;
   }

   public String getSignal()
   {
      return signal;
   }

   @Override
   public String toString()
   {
      return "SpawnResult[pid=" + pid + ", status=" + status + ", signal=" + signal
         + ", stdout=" + stdout.length() + " chars, stderr=" + stderr.length() + " chars]";
   }
}
