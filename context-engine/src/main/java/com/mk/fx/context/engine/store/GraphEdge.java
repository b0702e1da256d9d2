package com.mk.fx.context.engine.store;

/**
 * Row of {@code graph.edges}.
 *
 * @param source source node id
 * @param target target node id
 * @param type relationship type, may be null
 */
public record GraphEdge(String source, String target, String type) {}
