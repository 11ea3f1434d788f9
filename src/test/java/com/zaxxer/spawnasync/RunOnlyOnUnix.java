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

import org.junit.runner.notification.RunNotifier;
import org.junit.runners.BlockJUnit4ClassRunner;
import org.junit.runners.model.InitializationError;

public class RunOnlyOnUnix extends BlockJUnit4ClassRunner
{
   public RunOnlyOnUnix(Class<?> klass) throws InitializationError
   {
      super(klass);
   }

   @Override
   public void run(RunNotifier notifier)
   {
      final String osname = System.getProperty("os.name").toLowerCase();
      if (osname.contains("linux") || osname.contains("mac") || osname.contains("freebsd")) {
         super.run(notifier);
      }
   }
}
