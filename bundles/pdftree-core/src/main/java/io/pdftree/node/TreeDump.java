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

package io.pdftree.node;

import com.google.common.base.Strings;
import io.pdftree.axis.LevelOrderAxis;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the part of the tree hanging off the root, one line per node in level order.
 */
public final class TreeDump {

  private TreeDump() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Render the tree.
   *
   * @param registry         the registry holding the tree
   * @param maxAddressLength maximum length of the rendered tree addresses
   * @return the lines, indented by level
   */
  public static List<String> lines(final NodeRegistry registry, final int maxAddressLength) {
    final List<String> lines = new ArrayList<>();
    final TreeCursor cursor = registry.newCursor();
    final LevelOrderAxis axis = LevelOrderAxis.newBuilder(cursor).includeSelf().build();
    while (axis.hasNext()) {
      axis.nextInt();
      final PdfTreeNode node = cursor.getNode();
      lines.add(Strings.repeat("  ", axis.getCurrentLevel()) + node + " @" + node.getTreeAddress(maxAddressLength)
          + " (" + node.descendantCount() + " descendants)");
    }
    return lines;
  }
}
