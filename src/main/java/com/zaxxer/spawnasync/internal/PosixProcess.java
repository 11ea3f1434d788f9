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

import static com.zaxxer.spawnasync.internal.Constants.OS;

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

import com.sun.jna.Memory;
import com.sun.jna.Native;
import com.sun.jna.Pointer;
import com.sun.jna.StringArray;
import com.sun.jna.ptr.IntByReference;
import com.zaxxer.spawnasync.Signal;
import com.zaxxer.spawnasync.SpawnException;
import com.zaxxer.spawnasync.SpawnListener;
import com.zaxxer.spawnasync.SpawnedProcess;
import com.zaxxer.spawnasync.streams.StdinSubscriber;
import com.zaxxer.spawnasync.streams.StdioPublisher;

/**
 * A process launched with {@code posix_spawnp}.
 * <p>
 * Once started, the process is served by pooled threads: a reaper blocked in
 * {@code waitpid}, which produces the exit notification, one pump per output
 * pipe reading until end-of-file, and a stdin writer scheduled whenever there
 * is something to write. The close notification follows once the exit has
 * been delivered and both pumps have reached end-of-file.
 */
public class PosixProcess implements SpawnedProcess
{
   private static final Logger LOGGER = Logger.getLogger(PosixProcess.class.getCanonicalName());

   private static final int BUFFER_CAPACITY = Constants.getBufferCapacity();
   private static final PendingWrite STDIN_CLOSED_PENDING_WRITE_TOMBSTONE = new PendingWrite(ByteBuffer.allocate(1), null);

   // Pipes must be marked close-on-exec before any other child is spawned
   private static final Object SPAWN_LOCK = new Object();

   private final List<String> command;
   private final String[] environment;
   private final Path cwd;
   private final EventDispatcher dispatcher;
   private final StdioPublisher stdoutPublisher;
   private final StdioPublisher stderrPublisher;

   private volatile int pid;
   private volatile boolean isRunning;

   private volatile ReferenceCountedFileDescriptor stdin;
   private volatile ReferenceCountedFileDescriptor stdout;
   private volatile ReferenceCountedFileDescriptor stderr;

   private final ConcurrentLinkedQueue<PendingWrite> pendingWrites;
   private final AtomicBoolean stdinClosing;
   private final AtomicBoolean writerScheduled;
   private volatile ByteBuffer inBuffer;

   private boolean exited;
   private boolean outClosed;
   private boolean errClosed;
   private boolean closeFired;
   private Integer exitStatus;
   private String exitSignal;

   public PosixProcess(List<String> command, String[] environment, Path cwd, List<SpawnListener> listeners, SpawnListener settlement)
   {
      this.command = new ArrayList<>(command);
      this.environment = environment;
      this.cwd = cwd;
      this.pid = -1;
      this.stdin = new ReferenceCountedFileDescriptor(-1);
      this.stdout = new ReferenceCountedFileDescriptor(-1);
      this.stderr = new ReferenceCountedFileDescriptor(-1);
      this.pendingWrites = new ConcurrentLinkedQueue<>();
      this.stdinClosing = new AtomicBoolean();
      this.writerScheduled = new AtomicBoolean();

      this.stdoutPublisher = new StdioPublisher(Stream.STDOUT);
      this.stderrPublisher = new StdioPublisher(Stream.STDERR);

      List<SpawnListener> initial = new ArrayList<>(listeners);
      initial.add(stdoutPublisher);
      initial.add(stderrPublisher);
      this.dispatcher = new EventDispatcher(this, initial, settlement);
   }

   /**
    * Launch the process. A failure of {@code posix_spawnp} itself is reported
    * through {@link SpawnListener#onError} before this method returns.
    *
    * @throws RuntimeException if the pipes or spawn attributes could not be set up
    */
   public void start()
   {
      dispatcher.dispatchPreStart();

      String[] commands = command.toArray(new String[0]);
      IntByReference restrict_pid = new IntByReference();
      int[] in = new int[2];
      int[] out = new int[2];
      int[] err = new int[2];
      int rc;

      synchronized (SPAWN_LOCK) {
         createPipes(in, out, err);

         Pointer posix_spawn_file_actions = new Memory(LibC.OPAQUE_STRUCT_SIZE);
         Pointer posix_spawnattr = new Memory(LibC.OPAQUE_STRUCT_SIZE);
         boolean actionsInitialized = false;
         boolean attributesInitialized = false;
         try {
            checkReturnCode(LibC.posix_spawn_file_actions_init(posix_spawn_file_actions), "Internal call to posix_spawn_file_actions_init() failed");
            actionsInitialized = true;
            prepareFileActions(posix_spawn_file_actions, in, out, err);

            checkReturnCode(LibC.posix_spawnattr_init(posix_spawnattr), "Internal call to posix_spawnattr_init() failed");
            attributesInitialized = true;
            prepareAttributes(posix_spawnattr);

            rc = LibC.posix_spawnp(restrict_pid, commands[0], posix_spawn_file_actions, posix_spawnattr,
                                   new StringArray(commands), new StringArray(environment));
         }
         catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Exception preparing to spawn " + commands[0], e);
            initFailureCleanup(in, out, err);
            throw e;
         }
         finally {
            if (attributesInitialized) {
               LibC.posix_spawnattr_destroy(posix_spawnattr);
            }
            if (actionsInitialized) {
               LibC.posix_spawn_file_actions_destroy(posix_spawn_file_actions);
            }
         }

         // The child has its own copies of these, dup'd onto 0, 1 and 2
         LibC.close(in[0]);
         LibC.close(out[1]);
         LibC.close(err[1]);
      }

      if (rc != 0) {
         LibC.close(in[1]);
         LibC.close(out[0]);
         LibC.close(err[0]);

         String code = Errno.nameOf(rc);
         LOGGER.log(Level.FINE, "Launch of {0} failed: {1}", new Object[] {commands[0], code});
         dispatcher.dispatchError(new SpawnException("spawn " + commands[0] + " " + code, SpawnException.Reason.LAUNCH_ERROR,
                                                     null, "", "", null, null, code));
         return;
      }

      stdin = new ReferenceCountedFileDescriptor(in[1]);
      stdout = new ReferenceCountedFileDescriptor(out[0]);
      stderr = new ReferenceCountedFileDescriptor(err[0]);
      inBuffer = ByteBuffer.allocateDirect(BUFFER_CAPACITY);

      pid = restrict_pid.getValue();
      isRunning = true;
      ProcessThreads.register(this);
      LOGGER.log(Level.FINE, "Started {0} as pid {1}", new Object[] {commands[0], pid});

      dispatcher.dispatchStart();

      ProcessThreads.execute(new Runnable() {
         @Override
         public void run()
         {
            pump(stdout, Stream.STDOUT, stdoutPublisher);
         }
      });
      ProcessThreads.execute(new Runnable() {
         @Override
         public void run()
         {
            pump(stderr, Stream.STDERR, stderrPublisher);
         }
      });
      ProcessThreads.execute(new Runnable() {
         @Override
         public void run()
         {
            reap();
         }
      });
   }

   // ************************************************************************
   //                     SpawnedProcess interface methods
   // ************************************************************************

   /** {@inheritDoc} */
   @Override
   public int getPID()
   {
      return pid;
   }

   /** {@inheritDoc} */
   @Override
   public boolean isRunning()
   {
      return isRunning;
   }

   /** {@inheritDoc} */
   @Override
   public void addListener(SpawnListener listener)
   {
      dispatcher.add(listener);
   }

   /** {@inheritDoc} */
   @Override
   public boolean removeListener(SpawnListener listener)
   {
      return dispatcher.remove(listener);
   }

   /** {@inheritDoc} */
   @Override
   public Publisher<ByteBuffer> getStdout()
   {
      return stdoutPublisher;
   }

   /** {@inheritDoc} */
   @Override
   public Publisher<ByteBuffer> getStderr()
   {
      return stderrPublisher;
   }

   /** {@inheritDoc} */
   @Override
   public Subscriber<ByteBuffer> getStdin()
   {
      return new StdinSubscriber(this);
   }

   /** {@inheritDoc} */
   @Override
   public void writeStdin(ByteBuffer buffer)
   {
      writeStdin(buffer, null);
   }

   /**
    * Queue a buffer for writing to stdin, like {@link #writeStdin(ByteBuffer)},
    * and run {@code onWritten} on the writer thread once the whole buffer has
    * been written to the pipe. The callback is not run for a buffer that is
    * discarded because stdin was closed or the process stopped reading.
    *
    * @param buffer the bytes to write
    * @param onWritten run after the buffer has been written, may be {@code null}
    */
   public void writeStdin(ByteBuffer buffer, Runnable onWritten)
   {
      if (buffer == null) {
         throw new IllegalArgumentException("Buffer may not be null");
      }

      try {
         int fd = stdin.acquire();
         if (fd == -1 || stdinClosing.get()) {
            throw new IllegalStateException("closeStdin() method has already been called.");
         }

         pendingWrites.add(new PendingWrite(buffer, onWritten));
      }
      finally {
         stdin.release();
      }

      scheduleWriter();
   }

   /** {@inheritDoc} */
   @Override
   public void closeStdin(boolean force)
   {
      if (force) {
         stdin.close();
         pendingWrites.clear();
         return;
      }

      if (!stdinClosing.compareAndSet(false, true)) {
         throw new IllegalStateException("closeStdin() method has already been called.");
      }

      if (stdin.isOpen()) {
         pendingWrites.add(STDIN_CLOSED_PENDING_WRITE_TOMBSTONE);
         scheduleWriter();
      }
   }

   /** {@inheritDoc} */
   @Override
   public boolean hasPendingWrites()
   {
      return !pendingWrites.isEmpty();
   }

   /** {@inheritDoc} */
   @Override
   public boolean terminate()
   {
      return terminate(Signal.SIGTERM);
   }

   /** {@inheritDoc} */
   @Override
   public boolean terminate(Signal signal)
   {
      int signo = signal.number();
      if (signo == -1) {
         throw new IllegalArgumentException(signal + " is not defined on this platform");
      }

      if (!isRunning) {
         return false;
      }

      if (LibC.kill(pid, signo) == 0) {
         return true;
      }

      int errno = Native.getLastError();
      if (errno == Errno.ESRCH.number()) {
         return false;
      }

      throw new RuntimeException("Sending " + signal + " to process " + pid + " failed, last error: " + Errno.nameOf(errno));
   }

   @Override
   public String toString()
   {
      return "PosixProcess[pid=" + pid + ", command=" + command.get(0) + "]";
   }

   // ************************************************************************
   //                       Pump, reaper and writer tasks
   // ************************************************************************

   private void pump(ReferenceCountedFileDescriptor pipe, Stream stream, StdioPublisher publisher)
   {
      ByteBuffer buffer = ByteBuffer.allocateDirect(BUFFER_CAPACITY);
      try {
         while (true) {
            // Leaving the pipe unread while a subscriber is behind makes the process block in write()
            try {
               publisher.awaitCapacity();
            }
            catch (InterruptedException e) {
               Thread.currentThread().interrupt();
               LOGGER.log(Level.WARNING, "Interrupted while waiting for subscribers of {0} of pid {1}", new Object[] {stream, pid});
               break;
            }

            int read;
            int errno = 0;
            try {
               int fd = pipe.acquire();
               if (fd == -1) {
                  break;
               }

               buffer.clear();
               read = LibC.read(fd, buffer, buffer.capacity());
               if (read < 0) {
                  errno = Native.getLastError();
               }
            }
            finally {
               pipe.release();
            }

            if (read > 0) {
               buffer.limit(read);
               dispatcher.dispatchOutput(stream, buffer, false);
            }
            else if (read == 0) {
               break;
            }
            else if (errno != Errno.EINTR.number()) {
               LOGGER.log(Level.WARNING, "read() on {0} of pid {1} failed: {2}", new Object[] {stream, pid, Errno.nameOf(errno)});
               break;
            }
         }
      }
      finally {
         pipe.close();
         buffer.clear();
         buffer.limit(0);
         dispatcher.dispatchOutput(stream, buffer, true);

         synchronized (this) {
            if (stream == Stream.STDOUT) {
               outClosed = true;
            }
            else {
               errClosed = true;
            }
         }
         maybeFireClose();
      }
   }

   private void reap()
   {
      IntByReference status = new IntByReference();
      int rc;
      int errno;
      do {
         rc = LibC.waitpid(pid, status, 0);
         errno = rc == -1 ? Native.getLastError() : 0;
      }
      while (rc == -1 && errno == Errno.EINTR.number());

      isRunning = false;
      ProcessThreads.unregister(this);
      closeStdin(true);

      if (rc == -1) {
         String code = Errno.nameOf(errno);
         LOGGER.log(Level.WARNING, "waitpid() for pid {0} failed: {1}", new Object[] {pid, code});
         dispatcher.dispatchError(new SpawnException(describe() + " could not be waited for: " + code, SpawnException.Reason.WAIT_FAILED,
                                                     pid, "", "", null, null, code));
         return;
      }

      Integer exitCode = null;
      String signal = null;
      int raw = status.getValue();
      if (LibC.WIFEXITED(raw)) {
         exitCode = LibC.WEXITSTATUS(raw);
      }
      else if (LibC.WIFSIGNALED(raw)) {
         signal = Signal.nameOf(LibC.WTERMSIG(raw));
      }

      LOGGER.log(Level.FINE, "pid {0} exited, status={1}, signal={2}", new Object[] {pid, exitCode, signal});
      dispatcher.dispatchExit(exitCode, signal);

      synchronized (this) {
         exited = true;
         exitStatus = exitCode;
         exitSignal = signal;
      }
      maybeFireClose();
   }

   private void maybeFireClose()
   {
      synchronized (this) {
         if (closeFired || !exited || !outClosed || !errClosed) {
            return;
         }
         closeFired = true;
      }

      LOGGER.log(Level.FINE, "pid {0} closed", pid);
      dispatcher.dispatchClose(exitStatus, exitSignal);
   }

   private void scheduleWriter()
   {
      if (writerScheduled.compareAndSet(false, true)) {
         ProcessThreads.execute(new Runnable() {
            @Override
            public void run()
            {
               drainStdin();
            }
         });
      }
   }

   private void drainStdin()
   {
      try {
         PendingWrite pending;
         while ((pending = pendingWrites.peek()) != null) {
            if (pending == STDIN_CLOSED_PENDING_WRITE_TOMBSTONE) {
               // Everything requested has been written, and the caller wants stdin closed now
               stdin.close();
               pendingWrites.clear();
               return;
            }

            if (!writeFully(pending.buffer)) {
               pendingWrites.clear();
               return;
            }

            pendingWrites.poll();
            if (pending.onWritten != null) {
               try {
                  pending.onWritten.run();
               }
               catch (RuntimeException e) {
                  LOGGER.log(Level.WARNING, "Exception thrown from write callback for stdin of pid " + pid, e);
               }
            }
         }
      }
      finally {
         writerScheduled.set(false);
         if (!pendingWrites.isEmpty()) {
            scheduleWriter();
         }
      }
   }

   // The pending buffer is copied into inBuffer in slices; write() always starts at the base of inBuffer
   private boolean writeFully(ByteBuffer source)
   {
      while (source.hasRemaining()) {
         int chunk = Math.min(source.remaining(), inBuffer.capacity());
         ByteBuffer slice = source.slice();
         slice.limit(chunk);
         inBuffer.clear();
         inBuffer.put(slice);
         inBuffer.flip();
         source.position(source.position() + chunk);

         while (inBuffer.hasRemaining()) {
            int wrote;
            int errno = 0;
            try {
               int fd = stdin.acquire();
               if (fd == -1) {
                  return false;
               }

               wrote = LibC.write(fd, inBuffer, inBuffer.remaining());
               if (wrote < 0) {
                  errno = Native.getLastError();
               }
            }
            finally {
               stdin.release();
            }

            if (wrote < 0) {
               if (errno == Errno.EINTR.number()) {
                  continue;
               }

               // EPIPE when the process has stopped reading its input
               LOGGER.log(Level.FINE, "write() to stdin of pid {0} failed: {1}", new Object[] {pid, Errno.nameOf(errno)});
               stdin.close();
               return false;
            }

            inBuffer.position(inBuffer.position() + wrote);
            inBuffer.compact();
            inBuffer.flip();
         }
      }

      return true;
   }

   // ************************************************************************
   //                             Private methods
   // ************************************************************************

   private String describe()
   {
      return String.join(" ", command);
   }

   private void createPipes(int[] in, int[] out, int[] err)
   {
      try {
         checkReturnCode(LibC.pipe(in), "Create stdin pipe() failed");
         checkReturnCode(LibC.pipe(out), "Create stdout pipe() failed");
         checkReturnCode(LibC.pipe(err), "Create stderr pipe() failed");

         for (int fd : new int[] {in[0], in[1], out[0], out[1], err[0], err[1]}) {
            checkReturnCode(LibC.fcntl(fd, LibC.F_SETFD, LibC.FD_CLOEXEC), "fcntl(FD_CLOEXEC) on pipe failed");
         }
      }
      catch (RuntimeException e) {
         LOGGER.log(Level.SEVERE, "Error creating pipes", e);
         initFailureCleanup(in, out, err);
         throw e;
      }
   }

   private void prepareFileActions(Pointer actions, int[] in, int[] out, int[] err)
   {
      // Dup the reading end of the stdin pipe into the child, and close our end
      checkReturnCode(LibC.posix_spawn_file_actions_adddup2(actions, in[0], 0), "Internal call to posix_spawn_file_actions_adddup2() failed");
      checkReturnCode(LibC.posix_spawn_file_actions_addclose(actions, in[1]), "Internal call to posix_spawn_file_actions_addclose() failed");

      // Dup the writing ends of the stdout and stderr pipes into the child, and close our ends
      checkReturnCode(LibC.posix_spawn_file_actions_adddup2(actions, out[1], 1), "Internal call to posix_spawn_file_actions_adddup2() failed");
      checkReturnCode(LibC.posix_spawn_file_actions_addclose(actions, out[0]), "Internal call to posix_spawn_file_actions_addclose() failed");
      checkReturnCode(LibC.posix_spawn_file_actions_adddup2(actions, err[1], 2), "Internal call to posix_spawn_file_actions_adddup2() failed");
      checkReturnCode(LibC.posix_spawn_file_actions_addclose(actions, err[0]), "Internal call to posix_spawn_file_actions_addclose() failed");

      if (cwd != null) {
         String dir = cwd.toAbsolutePath().toString();
         checkReturnCode(LibSpawnChdir.posix_spawn_file_actions_addchdir_np(actions, dir), "Internal call to posix_spawn_file_actions_addchdir_np() failed");
      }
   }

   private void prepareAttributes(Pointer attributes)
   {
      // The JVM blocks some signals on its threads; the child must not inherit that mask
      Memory emptySigset = new Memory(LibC.OPAQUE_STRUCT_SIZE);
      emptySigset.clear();
      checkReturnCode(LibC.posix_spawnattr_setsigmask(attributes, emptySigset), "Internal call to posix_spawnattr_setsigmask() failed");

      checkReturnCode(LibC.posix_spawnattr_setflags(attributes, spawnFlags(OS)), "Internal call to posix_spawnattr_setflags() failed");
   }

   // The flag bits differ between the C libraries
   static short spawnFlags(Constants.OperatingSystem os)
   {
      switch (os) {
      case MAC:
         return (short) (LibC.POSIX_SPAWN_SETSIGMASK | LibC.POSIX_SPAWN_CLOEXEC_DEFAULT);
      case FREEBSD:
         return LibC.POSIX_SPAWN_SETSIGMASK_FREEBSD;
      default:
         return LibC.POSIX_SPAWN_SETSIGMASK;
      }
   }

   private static void initFailureCleanup(int[] in, int[] out, int[] err)
   {
      Set<Integer> unique = new HashSet<>();
      for (int[] pipe : new int[][] {in, out, err}) {
         unique.add(pipe[0]);
         unique.add(pipe[1]);
      }

      for (int fildes : unique) {
         if (fildes > 0) {
            LibC.close(fildes);
         }
      }
   }

   private static void checkReturnCode(int rc, String failureMessage)
   {
      if (rc != 0) {
         throw new RuntimeException(failureMessage + ", return code: " + rc + ", last error: " + Native.getLastError());
      }
   }

   private static final class PendingWrite
   {
      final ByteBuffer buffer;
      final Runnable onWritten;

      PendingWrite(ByteBuffer buffer, Runnable onWritten)
      {
         this.buffer = buffer;
         this.onWritten = onWritten;
      }
   }
}
