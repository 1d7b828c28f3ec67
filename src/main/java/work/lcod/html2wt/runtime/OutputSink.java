package work.lcod.html2wt.runtime;

import work.lcod.html2wt.dom.Node;

/**
 * Receives emitted wikitext chunks in order, each tagged with the node it was emitted for.
 */
@FunctionalInterface
public interface OutputSink {
    void accept(String text, Node origin);
}
