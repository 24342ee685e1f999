/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.bin2ast.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * FlowGraph graph = new FlowGraph(nodes, edges, start);
 * MetadataState ms = graph.getExtOrThrow(GraphExts.METADATA_STATE);
 * ms.ensureValid(graph, MetadataState.DOMS);
 * graph.getExtOrThrow(GraphExts.IDOM); // => {0x10=0x10, 0x14=0x10, ...}
 * }</pre>
 * <p>
 * Analyses attach their results as exts and record their validity in
 * {@link io.github.eutro.bin2ast.core.ext.MetadataState}, so that they can be computed
 * on demand and recomputed after the graph changes, without having to pass ad-hoc
 * {@link java.util.Map}s around.
 */
package io.github.eutro.bin2ast.core.ext;
