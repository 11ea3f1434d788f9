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

import com.sun.jna.Native;
import com.sun.jna.Platform;
import com.sun.jna.Pointer;

/**
 * Registered separately from {@link LibC} because the symbol only exists on
 * glibc 2.29+ and macOS 10.15+. Processes spawned without a working directory
 * never load this class.
 */
public class LibSpawnChdir
{
   static {
      Native.register(Platform.C_LIBRARY_NAME);
   }

   public static native int posix_spawn_file_actions_addchdir_np(Pointer actions, String path);
}
