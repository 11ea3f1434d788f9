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

import org.junit.Assert;
import org.junit.Test;

public class ErrnoTest
{
   @Test
   public void namesCommonErrors()
   {
      Assert.assertEquals("ENOENT", Errno.nameOf(2));
      Assert.assertEquals("EACCES", Errno.nameOf(13));
      Assert.assertEquals("ESRCH", Errno.nameOf(3));
      Assert.assertEquals(Errno.ECHILD, Errno.fromNumber(10));
   }

   @Test
   public void platformSpecificNumbers()
   {
      if (Constants.isBsd()) {
         Assert.assertEquals(35, Errno.EAGAIN.number());
         Assert.assertEquals("ENOSYS", Errno.nameOf(78));
      }
      else {
         Assert.assertEquals(11, Errno.EAGAIN.number());
         Assert.assertEquals("ENOSYS", Errno.nameOf(38));
      }
   }

   @Test
   public void unknownErrnoIsNamedByNumber()
   {
      Assert.assertNull(Errno.fromNumber(9999));
      Assert.assertEquals("errno 9999", Errno.nameOf(9999));
   }
}
