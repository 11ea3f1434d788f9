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

/**
 * A file descriptor shared between the caller's thread and the pump, reaper
 * and writer threads. A {@link #close()} requested while the descriptor is
 * acquired is deferred until the last {@link #release()}, so a descriptor
 * number is never closed (and possibly reused by the OS) underneath a thread
 * still using it.
 */
public class ReferenceCountedFileDescriptor
{
   private int fd;
   private int fdRefCount;
   private boolean closePending;

   public ReferenceCountedFileDescriptor(int fd)
   {
      this.fd = fd;
   }

   /**
    * @return the descriptor, or {@code -1} if it has been closed; every call
    *         must be paired with {@link #release()}
    */
   public synchronized int acquire()
   {
      fdRefCount++;
      return fd;
   }

   public synchronized void release()
   {
      fdRefCount--;
      if (fdRefCount == 0 && closePending && fd != -1) {
         doClose();
      }
   }

   public synchronized void close()
   {
      if (fd == -1 || closePending) {
         return;
      }

      if (fdRefCount == 0) {
         doClose();
      }
      else {
         closePending = true;
      }
   }

   public synchronized boolean isOpen()
   {
      return fd != -1 && !closePending;
   }

   private void doClose()
   {
      LibC.close(fd);
      fd = -1;
      closePending = false;
   }
}
