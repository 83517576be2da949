/*
 * Copyright 2007 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.codepath;

import com.google.common.base.Joiner;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * DotFormatter prints out a code path in the dot format. For a detailed description of the dot
 * format and visualization tool refer to <a href="http://www.graphviz.org">Graphviz</a>.
 *
 * <p>Typical usage of this class
 *
 * <pre>System.out.println(DotFormatter.toDot(codePath));</pre>
 */
public final class DotFormatter {
  private static final String INITIAL = "initial";

  private DotFormatter() {}

  /**
   * Converts a code path to the compact arrow notation, for example
   *
   * <pre>
   * initial-&gt;s1_1-&gt;s1_2;
   * s1_1-&gt;s1_3-&gt;final;
   * </pre>
   *
   * Every edge of {@link CodePathSegment#getAllNextSegments()} appears once, chained while a walk
   * can continue from the previous arrow.
   */
  public static String makeDotArrows(CodePath codePath) {
    return makeDotArrows(codePath, new LinkedHashMap<>());
  }

  private static String makeDotArrows(CodePath codePath, Map<String, CodePathSegment> done) {
    CodePathSegment initialSegment = codePath.getInitialSegment();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.addLast(new Frame(initialSegment, 0));
    @Nullable String lastId = initialSegment.getId();
    StringBuilder text = new StringBuilder(INITIAL).append("->").append(initialSegment.getId());

    while (!stack.isEmpty()) {
      Frame item = stack.removeLast();
      CodePathSegment segment = item.segment;
      int index = item.index;

      if (done.containsKey(segment.getId()) && index == 0) {
        continue;
      }
      done.put(segment.getId(), segment);

      if (index >= segment.getAllNextSegments().size()) {
        continue;
      }
      CodePathSegment nextSegment = segment.getAllNextSegments().get(index);

      if (segment.getId().equals(lastId)) {
        text.append("->").append(nextSegment.getId());
      } else {
        text.append(";\n").append(segment.getId()).append("->").append(nextSegment.getId());
      }
      lastId = nextSegment.getId();

      // The remaining edges of this segment are drawn after everything else.
      stack.addFirst(new Frame(segment, index + 1));
      stack.addLast(new Frame(nextSegment, 0));
    }

    for (CodePathSegment finalSegment : codePath.getReturnedSegments()) {
      appendEnd(text, lastId, finalSegment, "final");
      lastId = null;
    }
    for (CodePathSegment finalSegment : codePath.getThrownSegments()) {
      appendEnd(text, lastId, finalSegment, "thrown");
      lastId = null;
    }
    return text.append(';').toString();
  }

  private static void appendEnd(
      StringBuilder text, @Nullable String lastId, CodePathSegment segment, String end) {
    if (segment.getId().equals(lastId)) {
      text.append("->").append(end);
    } else {
      text.append(";\n").append(segment.getId()).append("->").append(end);
    }
  }

  /** Converts a code path to a Graphviz digraph, labeling each segment with its nodes. */
  public static String toDot(CodePath codePath) {
    StringBuilder text = new StringBuilder();
    text.append("\ndigraph {\n")
        .append("node[shape=box,style=\"rounded,filled\",fillcolor=white];\n")
        .append(INITIAL)
        .append("[label=\"\",shape=circle,style=filled,fillcolor=black,width=0.25,height=0.25];\n");
    if (!codePath.getReturnedSegments().isEmpty()) {
      text.append(
          "final[label=\"\",shape=doublecircle,style=filled,fillcolor=black,"
              + "width=0.25,height=0.25];\n");
    }
    if (!codePath.getThrownSegments().isEmpty()) {
      text.append("thrown[label=\"✘\",shape=circle,width=0.3,height=0.3,fixedsize=true];\n");
    }

    Map<String, CodePathSegment> traceMap = new LinkedHashMap<>();
    String arrows = makeDotArrows(codePath, traceMap);

    for (Map.Entry<String, CodePathSegment> entry : traceMap.entrySet()) {
      CodePathSegment segment = entry.getValue();
      text.append(entry.getKey()).append('[');
      if (segment.isReachable()) {
        text.append("label=\"");
      } else {
        text.append("style=\"rounded,dashed,filled\",fillcolor=\"#FF9800\",")
            .append("label=\"<<unreachable>>\\n");
      }
      if (segment.getNodes().isEmpty()) {
        text.append("????");
      } else {
        text.append(Joiner.on("\\n").join(segment.getNodes()));
      }
      text.append("\"];\n");
    }

    return text.append(arrows).append("\n}").toString();
  }

  private static final class Frame {
    final CodePathSegment segment;
    final int index;

    Frame(CodePathSegment segment, int index) {
      this.segment = segment;
      this.index = index;
    }
  }
}
