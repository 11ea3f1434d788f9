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

import org.junit.Assert;
import org.junit.Test;

import com.zaxxer.spawnasync.internal.Constants;

public class SignalTest
{
   @Test
   public void portableSignals()
   {
      Assert.assertEquals(9, Signal.SIGKILL.number());
      Assert.assertEquals(15, Signal.SIGTERM.number());
      Assert.assertEquals(Signal.SIGKILL, Signal.fromNumber(9));
      Assert.assertEquals("SIGTERM", Signal.nameOf(15));
      Assert.assertEquals("SIGINT", Signal.nameOf(2));
   }

   @Test
   public void platformSpecificSignals()
   {
      if (Constants.isBsd()) {
         Assert.assertEquals(30, Signal.SIGUSR1.number());
         Assert.assertEquals("SIGBUS", Signal.nameOf(10));
         Assert.assertEquals(-1, Signal.SIGPWR.number());
      }
      else {
         Assert.assertEquals(10, Signal.SIGUSR1.number());
         Assert.assertEquals("SIGUSR1", Signal.nameOf(10));
         Assert.assertEquals(-1, Signal.SIGINFO.number());
      }
   }

   @Test
   public void unknownSignalIsNamedByNumber()
   {
      Assert.assertNull(Signal.fromNumber(0));
      Assert.assertNull(Signal.fromNumber(-1));
      Assert.assertEquals("SIG64", Signal.nameOf(64));
   }
}
