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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.zaxxer.spawnasync.internal.Constants;
import com.zaxxer.spawnasync.internal.PosixProcess;

/**
 * Spawns external programs without blocking the caller.
 * <p>
 * Each call returns a {@link SpawnTask} whose {@link SpawnTask#getChild()
 * child} is usable right away, and which settles exactly once when the
 * process terminates:
 *
 * <pre>
 * SpawnTask task = SpawnAsync.spawn("git", "status", "--short");
 * task.getChild().addListener(new SpawnAdapter() {
 *    &#64;Override
 *    public void onExit(Integer status, String signal)
 *    {
 *       System.out.println("git finished");
 *    }
 * });
 *
 * SpawnResult result = task.await();
 * </pre>
 *
 * The task completes normally only when the process exits with status 0. A
 * non-zero status, a terminating signal and a failed launch all surface as a
 * {@link SpawnException} whose stack trace continues with the frames of the
 * {@code spawn} call, below {@link SpawnException#ASYNC_BOUNDARY}.
 */
public final class SpawnAsync
{
   private SpawnAsync()
   {
   }

   /**
    * Spawn {@code command} with the given arguments and default options.
    *
    * @param command the program to run, looked up on the {@code PATH} if it
    *        contains no slash
    * @param args the arguments passed to the program
    * @return the {@link SpawnTask} for the process
    */
   public static SpawnTask spawn(String command, String... args)
   {
      return spawn(command, args == null ? Collections.<String>emptyList() : Arrays.asList(args), new SpawnOptions());
   }

   /**
    * Spawn {@code command} with the given arguments and default options.
    *
    * @param command the program to run
    * @param args the arguments passed to the program
    * @return the {@link SpawnTask} for the process
    */
   public static SpawnTask spawn(String command, List<String> args)
   {
      return spawn(command, args, new SpawnOptions());
   }

   /**
    * Spawn {@code command} with the given arguments and options.
    * <p>
    * If the program cannot be launched, the returned task is already settled
    * with a {@link SpawnException} of reason {@link SpawnException.Reason#LAUNCH_ERROR}
    * and listeners from {@code options} have received
    * {@link SpawnListener#onError}.
    *
    * @param command the program to run
    * @param args the arguments passed to the program
    * @param options the {@link SpawnOptions}, or {@code null} for defaults
    * @return the {@link SpawnTask} for the process
    * @throws IllegalArgumentException if the command is empty, or the command,
    *         an argument or the environment contains a NUL character
    * @throws UnsupportedOperationException if the operating system is not
    *         POSIX-compliant
    */
   public static SpawnTask spawn(String command, List<String> args, SpawnOptions options)
   {
      final Throwable callSite = new Throwable("spawn call site");

      if (command == null || command.isEmpty()) {
         throw new IllegalArgumentException("Command may not be null or empty");
      }

      if (options == null) {
         options = new SpawnOptions();
      }

      List<String> commands = new ArrayList<>();
      commands.add(command);
      if (args != null) {
         commands.addAll(args);
      }
      ensureNoNullCharacters(commands);

      if (!Constants.isSupported()) {
         throw new UnsupportedOperationException("Unsupported operating system: " + System.getProperty("os.name"));
      }

      String[] environment = options.prepareEnvironment();

      CompletableFuture<SpawnResult> future = new CompletableFuture<>();
      SpawnCollector collector = new SpawnCollector(String.join(" ", commands), options.isIgnoreStdio(), options.getCharset(), callSite, future);
      PosixProcess process = new PosixProcess(commands, environment, options.getCwd(), options.getListeners(), collector);
      process.start();

      return new SpawnTask(process, future);
   }

   private static void ensureNoNullCharacters(List<String> commands)
   {
      for (String command : commands) {
         if (command == null) {
            throw new IllegalArgumentException("Arguments may not be null");
         }

         if (command.indexOf('\u0000') >= 0) {
            throw new IllegalArgumentException("Commands may not contain null characters");
         }
      }
   }
}
