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

/**
 * Symbolic names for the errno values a spawn, wait or kill can report.
 * Numbers differ between Linux and macOS/BSD for a handful of entries.
 */
public enum Errno
{
   EPERM(1, 1),
   ENOENT(2, 2),
   ESRCH(3, 3),
   EINTR(4, 4),
   EIO(5, 5),
   ENXIO(6, 6),
   E2BIG(7, 7),
   ENOEXEC(8, 8),
   EBADF(9, 9),
   ECHILD(10, 10),
   EAGAIN(11, 35),
   ENOMEM(12, 12),
   EACCES(13, 13),
   EFAULT(14, 14),
   EBUSY(16, 16),
   EEXIST(17, 17),
   ENOTDIR(20, 20),
   EISDIR(21, 21),
   EINVAL(22, 22),
   ENFILE(23, 23),
   EMFILE(24, 24),
   ETXTBSY(26, 26),
   EPIPE(32, 32),
   ENAMETOOLONG(36, 63),
   ENOSYS(38, 78),
   ELOOP(40, 62);

   private final int linux;
   private final int bsd;

   Errno(int linux, int bsd)
   {
      this.linux = linux;
      this.bsd = bsd;
   }

   public int number()
   {
      return Constants.isBsd() ? bsd : linux;
   }

   public static Errno fromNumber(int errno)
   {
      for (Errno e : values()) {
         if (e.number() == errno) {
            return e;
         }
      }

      return null;
   }

   /**
    * @param errno an errno value as returned by {@code Native.getLastError()} or a posix_spawn call
    * @return the symbolic name, or {@code "errno N"} for values not in this table
    */
   public static String nameOf(int errno)
   {
      Errno e = fromNumber(errno);
      return e != null ? e.name() : "errno " + errno;
   }
}
