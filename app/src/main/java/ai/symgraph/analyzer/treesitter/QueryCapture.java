package ai.symgraph.analyzer.treesitter;

import org.treesitter.TSNode;

/** One captured node of a structural query, in match order. */
public record QueryCapture(TSNode node, int captureIndex, String captureName, int matchId) {}
