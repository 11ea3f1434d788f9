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

package com.zaxxer.spawnasync;

import java.nio.ByteBuffer;

/**
 * Convenience implementation of the {@link SpawnListener} interface; every
 * callback does nothing.
 */
public abstract class SpawnAdapter implements SpawnListener
{
   /** {@inheritDoc} */
   @Override
   public void onPreStart(SpawnedProcess process)
   {
   }

   /** {@inheritDoc} */
   @Override
   public void onStart(SpawnedProcess process)
   {
   }

   /** {@inheritDoc} */
   @Override
   public void onStdout(ByteBuffer buffer, boolean closed)
   {
   }

   /** {@inheritDoc} */
   @Override
   public void onStderr(ByteBuffer buffer, boolean closed)
   {
   }

   /** {@inheritDoc} */
   @Override
   public void onExit(Integer status, String signal)
   {
   }

   /** {@inheritDoc} */
   @Override
   public void onClose(Integer status, String signal)
   {
   }

   /** {@inheritDoc} */
   @Override
   public void onError(SpawnException error)
   {
   }
}
