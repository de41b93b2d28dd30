package ai.pipestream.transfer.metadata;

import java.util.List;

/**
 * One page of a prefix listing.
 *
 * @param keys       keys in ascending order
 * @param nextCursor cursor to pass to the next call, or null when the listing is exhausted
 */
public record KeyPage(List<String> keys, String nextCursor) {

    public boolean hasMore() {
        return nextCursor != null;
    }
}
