package work.lcod.html2wt.runtime;

import work.lcod.html2wt.dom.Node;

/**
 * One emitted piece of wikitext and the node it came from.
 */
public record Chunk(String text, Node origin) {}
