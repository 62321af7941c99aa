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

package io.pdftree.api;

import io.pdftree.exception.PdfTreeException;
import io.pdftree.node.TreeDump;
import io.pdftree.record.RecordSource;
import io.pdftree.report.Findings;
import io.pdftree.resolve.IndeterminateNodeResolver;
import io.pdftree.resolve.LostNodeRecovery;
import io.pdftree.settings.AnalysisConfiguration;
import io.pdftree.settings.DiagnosticSettings;
import io.pdftree.symlink.SymlinkEdge;
import io.pdftree.symlink.SymlinkMaterializer;
import io.pdftree.utils.LogWrapper;
import io.pdftree.verify.TreeVerifier;
import io.pdftree.verify.VerificationResult;
import io.pdftree.walk.GraphWalker;
import io.pdftree.walk.WalkState;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.LoggerFactory;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Entry point. Builds a {@link PdfTree} from the records of one document:
 *
 * <ol>
 * <li>walk the reference graph from the trailer, classifying every reference</li>
 * <li>place the nodes whose parent could not be decided during the walk</li>
 * <li>recover records nothing in the tree references</li>
 * <li>turn the remaining non-tree relationships into symlinks</li>
 * <li>verify the tree accounts for every record</li>
 * </ol>
 *
 * <p>
 * An analyzer is stateless and may be shared; each call to {@link #analyze(RecordSource)} works on
 * its own state.
 * </p>
 */
public final class PdfAnalyzer {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGGER = new LogWrapper(LoggerFactory.getLogger(PdfAnalyzer.class));

  private final AnalysisConfiguration config;

  /**
   * Constructor using {@link AnalysisConfiguration#DEFAULT}.
   */
  public PdfAnalyzer() {
    this(AnalysisConfiguration.DEFAULT);
  }

  /**
   * Constructor.
   *
   * @param config the configuration
   */
  public PdfAnalyzer(final AnalysisConfiguration config) {
    this.config = requireNonNull(config);
  }

  /**
   * Analyze a document.
   *
   * @param source the document's records
   * @return the tree
   * @throws PdfTreeException if the walk is aborted, or a
   *         {@link io.pdftree.exception.StructuralInvariantException} if the records cannot form a
   *         tree
   */
  public PdfTree analyze(final RecordSource source) throws PdfTreeException {
    final WalkState state = new WalkState(requireNonNull(source), config, new Findings());

    new GraphWalker(state).walk();

    final IndeterminateNodeResolver resolver = new IndeterminateNodeResolver(state);
    resolver.resolveAll();
    LOGGER.debug("Placement rules used: {}", resolver.getRuleCounts());

    if (config.isRecoverLostNodes()) {
      final IntList recovered = new LostNodeRecovery(state).recover();
      if (!recovered.isEmpty()) {
        LOGGER.info("Recovered {} lost nodes: {}", recovered.size(), recovered);
      }
    }

    final List<SymlinkEdge> symlinks = new SymlinkMaterializer(state.getRegistry()).materialize();
    final VerificationResult verification = new TreeVerifier(state).verify();

    if (DiagnosticSettings.isTreeDumpEnabled() && LOGGER.isDebugEnabled()) {
      for (final String line : TreeDump.lines(state.getRegistry(), config.getMaxAddressLength())) {
        LOGGER.debug(line);
      }
    }

    final PdfTree tree = new PdfTree(state.getRegistry(), symlinks, state.getFindings().snapshot(), verification,
        config, state.getMaxGeneration());
    LOGGER.info("Analysis finished: {}", tree);
    return tree;
  }
}
