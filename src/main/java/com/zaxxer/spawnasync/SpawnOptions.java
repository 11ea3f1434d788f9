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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

/**
 * Per-call configuration for {@link SpawnAsync#spawn(String, List, SpawnOptions)}.
 * <p>
 * {@code SpawnOptions} manages these attributes:
 * <ul>
 * <li><em>ignoreStdio</em>: when {@code true}, stdout and stderr are not
 * accumulated into the result and the task settles as soon as the process
 * exits, even if a descendant still holds one of its output streams open.
 * Listeners and publishers still receive the output.</li>
 *
 * <li>an <em>environment</em>, which is a mapping from variables to values.
 * The initial value is a copy of the environment of the current process.
 * See {@link System#getenv()}.</li>
 *
 * <li>a <em>working directory</em>, or {@code null} to inherit the current
 * process's working directory.</li>
 *
 * <li>a <em>charset</em> used to decode captured output, UTF-8 by default.</li>
 *
 * <li>the <em>listeners</em> attached to the process before it is launched.</li>
 * </ul>
 * <p>
 * Modifying the options affects processes subsequently spawned with them, but
 * never affects processes that have already been spawned.
 */
public class SpawnOptions
{
   private final TreeMap<String, String> environment;
   private final List<SpawnListener> listeners;
   private boolean ignoreStdio;
   private Path cwd;
   private Charset charset;

   public SpawnOptions()
   {
      this.environment = new TreeMap<>(System.getenv());
      this.listeners = new ArrayList<>();
      this.charset = StandardCharsets.UTF_8;
   }

   public boolean isIgnoreStdio()
   {
      return ignoreStdio;
   }

   public SpawnOptions setIgnoreStdio(boolean ignoreStdio)
   {
      this.ignoreStdio = ignoreStdio;
      return this;
   }

   /**
    * Returns a string map view of the environment. It may be modified using
    * ordinary Map operations prior to spawning. The map is case-sensitive.
    *
    * @return the environment spawned processes will receive
    */
   public Map<String, String> environment()
   {
      return environment;
   }

   public Path getCwd()
   {
      return cwd;
   }

   /**
    * @param cwd a {@link Path} to use for the process's current working
    *        directory, or {@code null} to inherit the current one
    * @return these options
    */
   public SpawnOptions setCwd(Path cwd)
   {
      this.cwd = cwd;
      return this;
   }

   public Charset getCharset()
   {
      return charset;
   }

   public SpawnOptions setCharset(Charset charset)
   {
      if (charset == null) {
         throw new IllegalArgumentException("Charset may not be null");
      }

      this.charset = charset;
      return this;
   }

   /**
    * Attach a listener before the process is launched. Unlike
    * {@link SpawnedProcess#addListener(SpawnListener)}, such a listener also
    * receives {@link SpawnListener#onPreStart} and every output chunk from
    * the very first one.
    *
    * @param listener the {@link SpawnListener} to attach
    * @return these options
    */
   public SpawnOptions addListener(SpawnListener listener)
   {
      if (listener == null) {
         throw new IllegalArgumentException("A SpawnListener must be specified");
      }

      listeners.add(listener);
      return this;
   }

   public List<SpawnListener> getListeners()
   {
      return Collections.unmodifiableList(listeners);
   }

   String[] prepareEnvironment()
   {
      String[] env = new String[environment.size()];
      int i = 0;
      for (Entry<String, String> entry : environment.entrySet()) {
         String key = entry.getKey();
         String value = entry.getValue();
         if (key == null || value == null) {
            throw new IllegalArgumentException("Environment may not contain null keys or values");
         }

         ensureNoNullCharacters(key);
         ensureNoNullCharacters(value);
         env[i++] = key + "=" + value;
      }

      return env;
   }

   private static void ensureNoNullCharacters(String environment)
   {
      if (environment.indexOf('\u0000') >= 0) {
         throw new IllegalArgumentException("Environment may not contain null characters");
      }
   }
}
