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

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class ConstantsTest
{
   @After
   public void clearProperty()
   {
      System.clearProperty(Constants.BUFFER_CAPACITY_PROPERTY);
   }

   @Test
   public void detectsOperatingSystem()
   {
      Assert.assertEquals(Constants.OperatingSystem.LINUX, Constants.detectOperatingSystem("Linux"));
      Assert.assertEquals(Constants.OperatingSystem.MAC, Constants.detectOperatingSystem("Mac OS X"));
      Assert.assertEquals(Constants.OperatingSystem.FREEBSD, Constants.detectOperatingSystem("FreeBSD"));
      Assert.assertEquals(Constants.OperatingSystem.UNSUPPORTED, Constants.detectOperatingSystem("Windows 10"));
      Assert.assertEquals(Constants.OperatingSystem.UNSUPPORTED, Constants.detectOperatingSystem("SunOS"));
   }

   @Test
   public void checkDefaultBufferCapacity()
   {
      System.setProperty(Constants.BUFFER_CAPACITY_PROPERTY, "");
      Assert.assertEquals(Constants.DEFAULT_BUFFER_CAPACITY, Constants.getBufferCapacity());
   }

   @Test
   public void settingUnparsableBufferCapacityDefaultsToDefault()
   {
      System.setProperty(Constants.BUFFER_CAPACITY_PROPERTY, "foo");
      Assert.assertEquals(Constants.DEFAULT_BUFFER_CAPACITY, Constants.getBufferCapacity());
   }

   @Test
   public void settingSmallerBufferCapacityDefaultsToMin()
   {
      System.setProperty(Constants.BUFFER_CAPACITY_PROPERTY, String.valueOf(Constants.MIN_BUFFER_CAPACITY - 1));
      Assert.assertEquals(Constants.MIN_BUFFER_CAPACITY, Constants.getBufferCapacity());
   }

   @Test
   public void settingLargerBufferCapacityDefaultsToMax()
   {
      System.setProperty(Constants.BUFFER_CAPACITY_PROPERTY, String.valueOf(Constants.MAX_BUFFER_CAPACITY + 1));
      Assert.assertEquals(Constants.MAX_BUFFER_CAPACITY, Constants.getBufferCapacity());
   }

   @Test
   public void settingBufferCapacityNormalCase()
   {
      int value = Constants.MIN_BUFFER_CAPACITY + (Constants.MAX_BUFFER_CAPACITY - Constants.MIN_BUFFER_CAPACITY) / 2;
      System.setProperty(Constants.BUFFER_CAPACITY_PROPERTY, " " + value + " ");
      Assert.assertEquals(value, Constants.getBufferCapacity());
   }

   @Test
   public void shutdownHookIsEnabledByDefault()
   {
      String previous = System.getProperty(Constants.SHUTDOWN_HOOK_PROPERTY);
      try {
         System.clearProperty(Constants.SHUTDOWN_HOOK_PROPERTY);
         Assert.assertTrue(Constants.isShutdownHookEnabled());

         System.setProperty(Constants.SHUTDOWN_HOOK_PROPERTY, "false");
         Assert.assertFalse(Constants.isShutdownHookEnabled());
      }
      finally {
         if (previous == null) {
            System.clearProperty(Constants.SHUTDOWN_HOOK_PROPERTY);
         }
         else {
            System.setProperty(Constants.SHUTDOWN_HOOK_PROPERTY, previous);
         }
      }
   }
}
