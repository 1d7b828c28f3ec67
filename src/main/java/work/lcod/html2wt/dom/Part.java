package work.lcod.html2wt.dom;

/**
 * One piece of the ordered decomposition of a templated node's source: either literal wikitext or an
 * invocation.
 */
public interface Part {
}
