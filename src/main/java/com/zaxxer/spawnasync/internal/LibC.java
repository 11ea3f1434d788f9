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

import java.nio.ByteBuffer;

import com.sun.jna.Native;
import com.sun.jna.NativeLibrary;
import com.sun.jna.Pointer;
import com.sun.jna.ptr.IntByReference;

@SuppressWarnings("WeakerAccess")
public class LibC
{
   static {
      Native.register(NativeLibrary.getProcess());
   }

   public static native int pipe(int[] fildes);

   public static native int fcntl(int fildes, int cmd, long arg);

   public static native int close(int fildes);

   // buf is addressed from its base, not its position
   public static native int read(int fildes, ByteBuffer buf, int nbyte);

   public static native int write(int fildes, ByteBuffer buf, int nbyte);

   public static native int kill(int pid, int sig);

   public static native int waitpid(int pid, IntByReference status, int options);

   public static native int posix_spawnattr_init(Pointer posix_spawnattr_t);

   public static native int posix_spawnattr_destroy(Pointer posix_spawnattr_t);

   public static native int posix_spawnattr_setflags(Pointer posix_spawnattr_t, short flags);

   public static native int posix_spawnattr_setsigmask(Pointer posix_spawnattr_t, Pointer sigset_t);

   public static native int posix_spawn_file_actions_init(Pointer posix_spawn_file_actions_t);

   public static native int posix_spawn_file_actions_destroy(Pointer posix_spawn_file_actions_t);

   public static native int posix_spawn_file_actions_addclose(Pointer actions, int fildes);

   public static native int posix_spawn_file_actions_adddup2(Pointer actions, int fildes, int newfildes);

   public static native int posix_spawnp(IntByReference restrict_pid, String restrict_file, Pointer file_actions,
                                         Pointer /*const posix_spawnattr_t*/ restrict_attrp, Pointer /*String[]*/ argv,
                                         Pointer /*String[]*/ envp);

   // Opaque on macOS (a single pointer), a struct on glibc (80 bytes for file actions, 336 for attributes,
   // 128 for sigset_t). Allocations use this size for all three so either layout fits.
   public static final int OPAQUE_STRUCT_SIZE = 512;

   public static final int F_SETFD = 2;
   public static final int FD_CLOEXEC = 1;

   // from /usr/include/spawn.h
   public static final short POSIX_SPAWN_SETSIGMASK = 0x08; // Linux and macOS
   public static final short POSIX_SPAWN_SETSIGMASK_FREEBSD = 0x20; // 0x08 is POSIX_SPAWN_SETSCHEDULER there
   public static final short POSIX_SPAWN_CLOEXEC_DEFAULT = 0x4000; // macOS only

   /* If WIFEXITED(STATUS), the low-order 8 bits of the status.  */
   public static int WEXITSTATUS(int status)
   {
      return (((status) & 0xff00) >> 8);
   }

   /* If WIFSIGNALED(STATUS), the terminating signal.  */
   public static int WTERMSIG(int status)
   {
      return ((status) & 0x7f);
   }

   /* Nonzero if STATUS indicates normal termination.  */
   public static boolean WIFEXITED(int status)
   {
      return ((status) & 0x7f) == 0;
   }

   /* Nonzero if STATUS indicates termination by a signal.  */
   public static boolean WIFSIGNALED(int status)
   {
      return (((byte) (((status) & 0x7f) + 1) >> 1) > 0);
   }
}
