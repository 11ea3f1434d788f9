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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The daemon threads that serve running processes, and the registry of
 * processes that have not yet been reaped.
 */
public final class ProcessThreads
{
   private static final Logger LOGGER = Logger.getLogger(ProcessThreads.class.getCanonicalName());

   private static final ExecutorService EXECUTOR;
   private static final Set<PosixProcess> RUNNING = ConcurrentHashMap.newKeySet();

   static {
      final AtomicInteger threadNumber = new AtomicInteger();
      EXECUTOR = Executors.newCachedThreadPool(new ThreadFactory() {
         @Override
         public Thread newThread(Runnable r)
         {
            Thread t = new Thread(r, "SpawnAsync-" + threadNumber.incrementAndGet());
            t.setDaemon(true);
            return t;
         }
      });

      if (Constants.isShutdownHookEnabled()) {
         Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {
            @Override
            public void run()
            {
               for (PosixProcess process : RUNNING) {
                  try {
                     process.terminate();
                  }
                  catch (RuntimeException e) {
                     LOGGER.log(Level.WARNING, "Unable to terminate process " + process.getPID() + " at shutdown", e);
                  }
               }
            }
         }, "SpawnAsync-shutdown"));
      }
   }

   private ProcessThreads()
   {
   }

   static void execute(Runnable task)
   {
      EXECUTOR.execute(task);
   }

   static void register(PosixProcess process)
   {
      RUNNING.add(process);
   }

   static void unregister(PosixProcess process)
   {
      RUNNING.remove(process);
   }
}
