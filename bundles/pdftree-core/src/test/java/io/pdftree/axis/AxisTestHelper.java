/*
 * Copyright (c) 2024, PdfTree Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.pdftree.axis;

import io.pdftree.api.Axis;
import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.node.NodeRegistry;
import io.pdftree.node.PdfTreeNode;
import io.pdftree.record.InMemoryRecordSource;
import io.pdftree.record.PdfNames;
import io.pdftree.report.Findings;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import static io.pdftree.DocumentFixtures.dict;
import static io.pdftree.DocumentFixtures.ref;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Builds the tree the axis tests iterate over:
 *
 * <pre>
 * 10
 *  `- 1
 *     |- 2
 *     |  |- 4
 *     |  `- 5
 *     `- 3
 *        `- 6
 * </pre>
 */
final class AxisTestHelper {

  private AxisTestHelper() {
    throw new AssertionError("May never be instantiated!");
  }

  static NodeRegistry newTree() throws StructuralInvariantException {
    final InMemoryRecordSource.Builder builder = InMemoryRecordSource.newBuilder().trailerEntry(PdfNames.SIZE, 10);
    for (int id = 1; id <= 6; id++) {
      builder.record(id, dict(PdfNames.TYPE, "/N" + id));
    }
    final NodeRegistry registry = new NodeRegistry(builder.build(), new Findings());
    final PdfTreeNode root = registry.registerTrailer(10);
    final PdfTreeNode one = node(registry, 1);
    root.addChild(one);
    final PdfTreeNode two = node(registry, 2);
    final PdfTreeNode three = node(registry, 3);
    one.addChild(two);
    one.addChild(three);
    two.addChild(node(registry, 4));
    two.addChild(node(registry, 5));
    three.addChild(node(registry, 6));
    return registry;
  }

  private static PdfTreeNode node(final NodeRegistry registry, final int id) {
    return registry.buildOrFind(ref(id), "/N" + id);
  }

  /**
   * Iterate an axis to its end, compare the keys and check that the cursor is back on the start
   * node afterwards.
   *
   * @param axis     the fresh axis
   * @param expected the expected keys
   */
  static void testAxisConventions(final Axis axis, final int... expected) {
    final int startKey = axis.getCursor().getNodeKey();
    final IntArrayList actual = new IntArrayList();
    while (axis.hasNext()) {
      final int key = axis.nextInt();
      assertEquals(key, axis.getCursor().getNodeKey());
      actual.add(key);
    }
    assertArrayEquals(expected, actual.toIntArray());
    assertFalse(axis.hasNext());
    assertEquals(startKey, axis.getCursor().getNodeKey());
  }
}
