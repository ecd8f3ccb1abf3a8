/*
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
package io.framekit.operator.window;

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.framekit.spi.window.WindowPartition;
import io.prestosql.spi.Page;
import io.prestosql.spi.type.FixedWidthType;
import io.prestosql.spi.type.Type;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.airlift.slice.SizeOf.sizeOf;
import static java.util.Objects.requireNonNull;

/**
 * Window build for input that arrives ordered by the partition keys and then by the sort keys.
 * Rows are grouped into partitions as they were received; nothing is sorted.
 * Pages entirely before the current partition are released when the build advances.
 */
@NotThreadSafe
public class PresortedWindowBuild
        implements WindowBuild
{
    private static final Logger log = Logger.get(PresortedWindowBuild.class);

    private final List<Type> types;
    private final RowEqualityStrategy partitionStrategy;
    private final RowEqualityStrategy peerGroupStrategy;

    private final List<Page> pages = new ArrayList<>();
    // page index and page position of each row, in arrival order
    private final IntArrayList rowPages;
    private final IntArrayList rowPositions;
    private final IntArrayList partitionStarts = new IntArrayList();
    private long pagesRetainedSizeInBytes;

    private boolean noMoreInput;
    private int nextPartition;
    private int releasedPages;

    public PresortedWindowBuild(List<? extends Type> types, List<Integer> partitionChannels, List<Integer> sortChannels, int expectedPositions)
    {
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
        requireNonNull(partitionChannels, "partitionChannels is null");
        requireNonNull(sortChannels, "sortChannels is null");
        for (int channel : partitionChannels) {
            checkArgument(channel >= 0 && channel < this.types.size(), "invalid partition channel %s", channel);
        }
        for (int channel : sortChannels) {
            checkArgument(channel >= 0 && channel < this.types.size(), "invalid sort channel %s", channel);
        }
        checkArgument(expectedPositions >= 0, "expectedPositions is negative");

        this.partitionStrategy = new RowEqualityStrategy(this.types, partitionChannels);
        this.peerGroupStrategy = new RowEqualityStrategy(this.types, sortChannels);
        this.rowPages = new IntArrayList(expectedPositions);
        this.rowPositions = new IntArrayList(expectedPositions);
    }

    @Override
    public void addInput(Page page)
    {
        requireNonNull(page, "page is null");
        checkState(!noMoreInput, "noMoreInput was already called");
        if (page.getPositionCount() == 0) {
            return;
        }
        checkArgument(page.getChannelCount() == types.size(), "Expected %s channels, but page has %s", types.size(), page.getChannelCount());

        int pageIndex = pages.size();
        pages.add(page);
        for (int position = 0; position < page.getPositionCount(); position++) {
            rowPages.add(pageIndex);
            rowPositions.add(position);
        }
        pagesRetainedSizeInBytes += page.getRetainedSizeInBytes();
    }

    @Override
    public void noMoreInput()
    {
        checkState(!noMoreInput, "noMoreInput was already called");
        noMoreInput = true;

        int rowCount = rowPages.size();
        for (int row = 0; row < rowCount; row++) {
            if (row == 0 || !sameGroup(partitionStrategy, row - 1, row)) {
                partitionStarts.add(row);
            }
        }
        partitionStarts.add(rowCount);
        log.debug("Grouped %s rows in %s pages into %s partitions", rowCount, pages.size(), getPartitionCount());
    }

    private boolean sameGroup(RowEqualityStrategy strategy, int leftRow, int rightRow)
    {
        return strategy.rowEqualsRow(
                pages.get(rowPages.getInt(leftRow)),
                rowPositions.getInt(leftRow),
                pages.get(rowPages.getInt(rightRow)),
                rowPositions.getInt(rightRow));
    }

    public int getPartitionCount()
    {
        return Math.max(partitionStarts.size() - 1, 0);
    }

    @Override
    public long getRetainedSizeInBytes()
    {
        return pagesRetainedSizeInBytes + sizeOf(rowPages.elements()) + sizeOf(rowPositions.elements()) + sizeOf(partitionStarts.elements());
    }

    @Override
    public boolean hasNextPartition()
    {
        return noMoreInput && nextPartition < getPartitionCount();
    }

    @Override
    public WindowPartition nextPartition()
    {
        checkState(hasNextPartition(), "No more partitions");
        int partitionStart = partitionStarts.getInt(nextPartition);
        int partitionEnd = partitionStarts.getInt(nextPartition + 1);
        nextPartition++;

        releasePagesBefore(rowPages.getInt(partitionStart));
        return new PagesWindowPartition(pages, rowPages, rowPositions, types, peerGroupStrategy, partitionStart, partitionEnd);
    }

    private void releasePagesBefore(int pageIndex)
    {
        for (; releasedPages < pageIndex; releasedPages++) {
            pagesRetainedSizeInBytes -= pages.get(releasedPages).getRetainedSizeInBytes();
            pages.set(releasedPages, null);
        }
    }

    @Override
    public OptionalLong estimateRowSize()
    {
        long fixedRowSize = 0;
        for (Type type : types) {
            if (!(type instanceof FixedWidthType)) {
                if (rowPages.isEmpty()) {
                    return OptionalLong.empty();
                }
                return OptionalLong.of(Math.max(pagesRetainedSizeInBytes / rowPages.size(), 1));
            }
            // one byte for the null flag
            fixedRowSize += ((FixedWidthType) type).getFixedSize() + Byte.BYTES;
        }
        return OptionalLong.of(fixedRowSize);
    }
}
