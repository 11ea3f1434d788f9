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

import com.zaxxer.spawnasync.internal.Constants;

/**
 * POSIX signals that can terminate a spawned process, with their numbers on
 * Linux and on macOS/BSD. A number of {@code -1} means the platform does not
 * define the signal.
 */
public enum Signal
{
   SIGHUP(1, 1),
   SIGINT(2, 2),
   SIGQUIT(3, 3),
   SIGILL(4, 4),
   SIGTRAP(5, 5),
   SIGABRT(6, 6),
   SIGEMT(-1, 7),
   SIGBUS(7, 10),
   SIGFPE(8, 8),
   SIGKILL(9, 9),
   SIGUSR1(10, 30),
   SIGSEGV(11, 11),
   SIGUSR2(12, 31),
   SIGPIPE(13, 13),
   SIGALRM(14, 14),
   SIGTERM(15, 15),
   SIGSTKFLT(16, -1),
   SIGCHLD(17, 20),
   SIGCONT(18, 19),
   SIGSTOP(19, 17),
   SIGTSTP(20, 18),
   SIGTTIN(21, 21),
   SIGTTOU(22, 22),
   SIGURG(23, 16),
   SIGXCPU(24, 24),
   SIGXFSZ(25, 25),
   SIGVTALRM(26, 26),
   SIGPROF(27, 27),
   SIGWINCH(28, 28),
   SIGIO(29, 23),
   SIGINFO(-1, 29),
   SIGPWR(30, -1),
   SIGSYS(31, 12);

   private final int linux;
   private final int bsd;

   Signal(int linux, int bsd)
   {
      this.linux = linux;
      this.bsd = bsd;
   }

   /**
    * @return the signal number on the running platform, or {@code -1} if the
    *         platform has no such signal
    */
   public int number()
   {
      return Constants.isBsd() ? bsd : linux;
   }

   public static Signal fromNumber(int signo)
   {
      if (signo <= 0) {
         return null;
      }

      for (Signal s : values()) {
         if (s.number() == signo) {
            return s;
         }
      }

      return null;
   }

   /**
    * Name a terminating signal. Real-time and other signals outside this
    * table are named {@code SIG<number>}.
    *
    * @param signo the signal number reported by the operating system
    * @return the signal name, e.g. {@code "SIGKILL"}
    */
   public static String nameOf(int signo)
   {
      Signal s = fromNumber(signo);
      return s != null ? s.name() : "SIG" + signo;
   }
}
