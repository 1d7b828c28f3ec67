package work.lcod.html2wt.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.lcod.html2wt.dom.Node;

/**
 * Sink that keeps every chunk and the concatenated text.
 */
public final class ChunkBuffer implements OutputSink {
    private final List<Chunk> chunks = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();

    @Override
    public void accept(String chunk, Node origin) {
        chunks.add(new Chunk(chunk, origin));
        text.append(chunk);
    }

    public List<Chunk> chunks() {
        return Collections.unmodifiableList(chunks);
    }

    public String text() {
        return text.toString();
    }
}
