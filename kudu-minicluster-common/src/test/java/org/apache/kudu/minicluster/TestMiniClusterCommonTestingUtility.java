/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.kudu.minicluster;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import org.apache.kudu.minicluster.testclassification.SmallTests;
import org.junit.ClassRule;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(SmallTests.class)
public class TestMiniClusterCommonTestingUtility {

  @ClassRule
  public static final MiniClusterClassTestRule CLASS_RULE =
      MiniClusterClassTestRule.forClass(TestMiniClusterCommonTestingUtility.class);

  @Test
  public void testEachInstanceGetsItsOwnDirectory() throws IOException {
    MiniClusterCommonTestingUtility first = new MiniClusterCommonTestingUtility();
    MiniClusterCommonTestingUtility second = new MiniClusterCommonTestingUtility();
    try {
      File firstDir = first.getDataTestDir();
      assertTrue(firstDir.isDirectory());
      assertTrue(firstDir.isAbsolute());
      assertEquals(firstDir, first.getDataTestDir());
      assertNotEquals(firstDir, second.getDataTestDir());
    } finally {
      assertTrue(first.cleanupTestDir());
      assertTrue(second.cleanupTestDir());
    }
  }

  @Test
  public void testSubdirectoriesAreRemovedOnCleanup() throws IOException {
    MiniClusterCommonTestingUtility util = new MiniClusterCommonTestingUtility();
    File root = util.getDataTestDir();
    File sub = util.getDataTestDir("master-0");
    assertTrue(sub.isDirectory());
    assertEquals(root, sub.getParentFile());
    assertTrue(util.cleanupTestDir());
    assertFalse(root.exists());
  }

  @Test(expected = IllegalStateException.class)
  public void testCannotMoveDirectoryOnceSetUp() throws IOException {
    MiniClusterCommonTestingUtility util = new MiniClusterCommonTestingUtility();
    try {
      File dir = util.getDataTestDir();
      util.setDataTestDir(new File(dir, "elsewhere"));
    } finally {
      util.cleanupTestDir();
    }
  }
}
