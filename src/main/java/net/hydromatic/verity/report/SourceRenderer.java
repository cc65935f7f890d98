/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.verity.report;

import net.hydromatic.verity.ast.AstNode;
import net.hydromatic.verity.parse.Source;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Returns the source text of a node, exactly as written.
 *
 * <p>If the source is not available, or the node's position is not known
 * (because the tree was built programmatically), falls back to unparsing
 * the node. */
public class SourceRenderer {
  private static final Logger LOG =
      LoggerFactory.getLogger(SourceRenderer.class);

  private final @Nullable Source source;

  public SourceRenderer(@Nullable Source source) {
    this.source = source;
  }

  /** Returns the text of a node. */
  public String render(AstNode node) {
    if (source != null) {
      final String text = source.text(node.pos);
      if (text != null) {
        return text;
      }
    }
    final String text = node.toString();
    LOG.debug("source unavailable for {}; unparsed as [{}]", node.pos, text);
    return text;
  }
}

// End SourceRenderer.java
