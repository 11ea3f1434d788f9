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

package com.zaxxer.spawnasync.internal;

import java.util.logging.Level;
import java.util.logging.Logger;

public final class Constants
{
   private static final Logger LOGGER = Logger.getLogger(Constants.class.getCanonicalName());

   public static final String BUFFER_CAPACITY_PROPERTY = "com.zaxxer.spawnasync.bufferCapacity";
   public static final String SHUTDOWN_HOOK_PROPERTY = "com.zaxxer.spawnasync.enableShutdownHook";

   public static final OperatingSystem OS;

   static final int DEFAULT_BUFFER_CAPACITY = 64 * 1024;
   static final int MIN_BUFFER_CAPACITY = 1024;
   static final int MAX_BUFFER_CAPACITY = 1024 * 1024;

   public enum OperatingSystem
   {
      MAC,
      FREEBSD,
      LINUX,
      UNSUPPORTED
   }

   static {
      OS = detectOperatingSystem(System.getProperty("os.name"));
   }

   private Constants()
   {
   }

   static OperatingSystem detectOperatingSystem(String osName)
   {
      final String osname = osName.toLowerCase();
      if (osname.contains("mac")) {
         return OperatingSystem.MAC;
      }
      else if (osname.contains("freebsd")) {
         return OperatingSystem.FREEBSD;
      }
      else if (osname.contains("linux")) {
         return OperatingSystem.LINUX;
      }

      return OperatingSystem.UNSUPPORTED;
   }

   public static boolean isSupported()
   {
      return OS != OperatingSystem.UNSUPPORTED;
   }

   /**
    * @return {@code true} if signal and errno numbers follow the BSD layout
    */
   public static boolean isBsd()
   {
      return OS == OperatingSystem.MAC || OS == OperatingSystem.FREEBSD;
   }

   public static int getBufferCapacity()
   {
      final String bufferCapacityProperty = System.getProperty(BUFFER_CAPACITY_PROPERTY);
      if (bufferCapacityProperty == null || bufferCapacityProperty.trim().isEmpty()) {
         return DEFAULT_BUFFER_CAPACITY;
      }

      try {
         final int value = Integer.parseInt(bufferCapacityProperty.trim());
         if (value < MIN_BUFFER_CAPACITY) {
            LOGGER.log(Level.WARNING, "Requested bufferCapacity of " + value + " is less than min, defaulting to min value of " + MIN_BUFFER_CAPACITY);
            return MIN_BUFFER_CAPACITY;
         }
         else if (value > MAX_BUFFER_CAPACITY) {
            LOGGER.log(Level.WARNING, "Requested bufferCapacity of " + value + " is more than max, defaulting to max value of " + MAX_BUFFER_CAPACITY);
            return MAX_BUFFER_CAPACITY;
         }

         return value;
      }
      catch (NumberFormatException e) {
         return DEFAULT_BUFFER_CAPACITY;
      }
   }

   public static boolean isShutdownHookEnabled()
   {
      return Boolean.parseBoolean(System.getProperty(SHUTDOWN_HOOK_PROPERTY, "true"));
   }
}
