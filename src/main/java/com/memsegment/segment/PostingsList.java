package com.memsegment.segment;

import org.roaringbitmap.IntIterator;
import org.roaringbitmap.buffer.ImmutableRoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 一个 (字段, 词项) 的倒排列表视图。
 *
 * <p>位置记录按文档号递增分组存放：遍历成员位图时，出现在位置位图中的文档
 * 依次消费其登记的位置条数。词频可能大于位置条数，因为只有部分来源记录了位置。
 */
public final class PostingsList implements Iterable<Posting> {
    private final Segment segment;
    private final int postingIndex;

    PostingsList(Segment segment, int postingIndex) {
        this.segment = segment;
        this.postingIndex = postingIndex;
    }

    static PostingsList empty() {
        return new PostingsList(null, -1);
    }

    /**
     * 包含该词项的文档数。
     */
    public int count() {
        return segment == null ? 0 : segment.rawPostings(postingIndex).getCardinality();
    }

    public boolean isEmpty() {
        return count() == 0;
    }

    public int[] docNumbers() {
        return segment == null ? new int[0] : segment.rawPostings(postingIndex).toArray();
    }

    @Override
    public Iterator<Posting> iterator() {
        if (segment == null) {
            return Collections.emptyIterator();
        }
        return new PostingIterator();
    }

    public List<Posting> toList() {
        List<Posting> result = new ArrayList<>(count());
        for (Posting posting : this) {
            result.add(posting);
        }
        return result;
    }

    private final class PostingIterator implements Iterator<Posting> {
        private final IntIterator docIterator = segment.rawPostings(postingIndex).getIntIterator();
        private final ImmutableRoaringBitmap withLocations = segment.rawPostingsWithLocations(postingIndex);
        private int entryIndex;
        private int locationEntryIndex;
        private int locationCursor;

        @Override
        public boolean hasNext() {
            return docIterator.hasNext();
        }

        @Override
        public Posting next() {
            if (!docIterator.hasNext()) {
                throw new NoSuchElementException();
            }
            int docNum = docIterator.next();
            int frequency = segment.rawFrequency(postingIndex, entryIndex);
            float norm = segment.rawNorm(postingIndex, entryIndex);
            entryIndex++;

            List<Location> locations = List.of();
            if (withLocations.contains(docNum)) {
                int locationCount = segment.rawLocationCount(postingIndex, locationEntryIndex++);
                locations = new ArrayList<>(locationCount);
                for (int consumed = 0; consumed < locationCount; consumed++) {
                    locations.add(segment.rawLocation(postingIndex, locationCursor++));
                }
            }
            return new Posting(docNum, frequency, norm, locations);
        }
    }
}
