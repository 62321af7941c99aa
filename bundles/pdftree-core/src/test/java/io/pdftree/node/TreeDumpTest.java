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

import io.pdftree.exception.StructuralInvariantException;
import io.pdftree.record.InMemoryRecordSource;
import io.pdftree.record.PdfNames;
import io.pdftree.report.Findings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.pdftree.DocumentFixtures.dict;
import static io.pdftree.DocumentFixtures.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;

public final class TreeDumpTest {

  @Test
  public void testLines() throws StructuralInvariantException {
    final InMemoryRecordSource source = InMemoryRecordSource.newBuilder()
                                                            .trailerEntry(PdfNames.ROOT, ref(1))
                                                            .record(1, dict(PdfNames.TYPE, PdfNames.CATALOG,
                                                                PdfNames.PAGES, ref(2)))
                                                            .record(2, dict(PdfNames.TYPE, PdfNames.PAGES))
                                                            .build();
    final NodeRegistry registry = new NodeRegistry(source, new Findings());
    final PdfTreeNode root = registry.registerTrailer(3);
    final PdfTreeNode catalog = registry.buildOrFind(ref(1), PdfNames.ROOT);
    root.addChild(catalog);
    catalog.addChild(registry.buildOrFind(ref(2), PdfNames.PAGES));

    assertEquals(List.of("<3:/Trailer> @/ (2 descendants)",
        "  <1:/Catalog> @/Root (1 descendants)",
        "    <2:/Pages> @/Root/Pages (0 descendants)"), TreeDump.lines(registry, 90));
  }
}
