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
import io.airlift.slice.Slice;
import io.framekit.spi.window.PeerGroup;
import io.framekit.spi.window.RowIndexBuffer;
import io.framekit.spi.window.WindowPartition;
import io.prestosql.spi.Page;
import io.prestosql.spi.block.Block;
import io.prestosql.spi.block.BlockBuilder;
import io.prestosql.spi.type.Type;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndexes;
import static java.util.Objects.requireNonNull;

/**
 * A partition over the rows {@code [partitionStart, partitionEnd)} of a list of pages.
 * Row {@code i} of the build is position {@code rowPositions[i]} of page {@code rowPages[i]}.
 */
public final class PagesWindowPartition
        implements WindowPartition
{
    private final List<Page> pages;
    private final IntList rowPages;
    private final IntList rowPositions;
    private final List<Type> types;
    private final RowEqualityStrategy peerGroupStrategy;
    private final int partitionStart;
    private final int partitionEnd;

    public PagesWindowPartition(
            List<Page> pages,
            IntList rowPages,
            IntList rowPositions,
            List<Type> types,
            RowEqualityStrategy peerGroupStrategy,
            int partitionStart,
            int partitionEnd)
    {
        this.pages = requireNonNull(pages, "pages is null");
        this.rowPages = requireNonNull(rowPages, "rowPages is null");
        this.rowPositions = requireNonNull(rowPositions, "rowPositions is null");
        checkArgument(rowPages.size() == rowPositions.size(), "rowPages and rowPositions differ in size");
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
        this.peerGroupStrategy = requireNonNull(peerGroupStrategy, "peerGroupStrategy is null");
        checkPositionIndexes(partitionStart, partitionEnd, rowPages.size());
        this.partitionStart = partitionStart;
        this.partitionEnd = partitionEnd;
    }

    @Override
    public int getPositionCount()
    {
        return partitionEnd - partitionStart;
    }

    @Override
    public Type getType(int channel)
    {
        return types.get(channel);
    }

    @Override
    public boolean isNull(int channel, int position)
    {
        return getBlock(channel, position).isNull(getBlockPosition(position));
    }

    @Override
    public long getLong(int channel, int position)
    {
        return types.get(channel).getLong(getBlock(channel, position), getBlockPosition(position));
    }

    @Override
    public double getDouble(int channel, int position)
    {
        return types.get(channel).getDouble(getBlock(channel, position), getBlockPosition(position));
    }

    @Override
    public Slice getSlice(int channel, int position)
    {
        return types.get(channel).getSlice(getBlock(channel, position), getBlockPosition(position));
    }

    @Override
    public void appendTo(int channel, int position, BlockBuilder output)
    {
        types.get(channel).appendTo(getBlock(channel, position), getBlockPosition(position), output);
    }

    @Override
    public void extractColumn(int channel, int partitionOffset, int numRows, int resultOffset, BlockBuilder result)
    {
        checkPositionIndexes(partitionOffset, partitionOffset + numRows, getPositionCount());
        checkArgument(result.getPositionCount() == resultOffset, "result has %s positions, but result offset is %s", result.getPositionCount(), resultOffset);

        Type type = types.get(channel);
        for (int position = partitionOffset; position < partitionOffset + numRows; position++) {
            type.appendTo(getBlock(channel, position), getBlockPosition(position), result);
        }
    }

    @Override
    public PeerGroup computePeerBuffers(
            int startRow,
            int endRow,
            int previousPeerStart,
            int previousPeerEnd,
            RowIndexBuffer peerStarts,
            RowIndexBuffer peerEnds)
    {
        checkPositionIndexes(startRow, endRow, getPositionCount());
        int numRows = endRow - startRow;
        peerStarts.setSize(numRows);
        peerEnds.setSize(numRows);

        int lastRow = getPositionCount() - 1;
        int peerStart = previousPeerStart;
        // exclusive
        int peerEnd = previousPeerEnd;
        for (int row = startRow, i = 0; row < endRow; row++, i++) {
            // rows before peerEnd belong to the group seeded by the previous call
            if (row == 0 || row >= peerEnd) {
                peerStart = row;
                peerEnd = row;
                while (peerEnd <= lastRow && isPeer(peerStart, peerEnd)) {
                    peerEnd++;
                }
            }
            peerStarts.set(i, peerStart);
            peerEnds.set(i, peerEnd - 1);
        }
        return new PeerGroup(peerStart, peerEnd);
    }

    private boolean isPeer(int leftRow, int rightRow)
    {
        int left = partitionStart + leftRow;
        int right = partitionStart + rightRow;
        return peerGroupStrategy.rowEqualsRow(pages.get(rowPages.getInt(left)), rowPositions.getInt(left), pages.get(rowPages.getInt(right)), rowPositions.getInt(right));
    }

    private Block getBlock(int channel, int position)
    {
        checkElementIndex(position, getPositionCount());
        return pages.get(rowPages.getInt(partitionStart + position)).getBlock(channel);
    }

    private int getBlockPosition(int position)
    {
        return rowPositions.getInt(partitionStart + position);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("partitionStart", partitionStart)
                .add("partitionEnd", partitionEnd)
                .toString();
    }
}
