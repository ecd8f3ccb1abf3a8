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
import io.framekit.spi.window.WindowPartition;
import io.prestosql.spi.PageBuilder;
import io.prestosql.spi.block.Block;
import io.prestosql.spi.type.Type;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Offset columns of the current slice. Each distinct offset channel is extracted at most once
 * per slice, however many frames and frame sides read it, into a page builder that is reused
 * from slice to slice.
 */
@NotThreadSafe
public final class FrameOffsetColumns
{
    private final int[] channels;
    private final PageBuilder[] columns;
    private final boolean[] loaded;

    private WindowPartition partition;
    private int startRow;
    private int numRows;

    public FrameOffsetColumns(List<FrameInfo> frames)
    {
        requireNonNull(frames, "frames is null");
        Map<Integer, Type> offsetChannels = new LinkedHashMap<>();
        for (FrameInfo frame : frames) {
            addChannel(offsetChannels, frame.getStartOffset());
            addChannel(offsetChannels, frame.getEndOffset());
        }

        this.channels = new int[offsetChannels.size()];
        this.columns = new PageBuilder[offsetChannels.size()];
        this.loaded = new boolean[offsetChannels.size()];
        int index = 0;
        for (Map.Entry<Integer, Type> entry : offsetChannels.entrySet()) {
            channels[index] = entry.getKey();
            columns[index] = new PageBuilder(ImmutableList.of(entry.getValue()));
            index++;
        }
    }

    private static void addChannel(Map<Integer, Type> offsetChannels, Optional<FrameOffset> offset)
    {
        if (!offset.isPresent() || !(offset.get() instanceof ChannelFrameOffset)) {
            return;
        }
        ChannelFrameOffset channelOffset = (ChannelFrameOffset) offset.get();
        Type previous = offsetChannels.putIfAbsent(channelOffset.getChannel(), channelOffset.getType());
        checkArgument(previous == null || previous.equals(channelOffset.getType()),
                "offset channel %s is used with types %s and %s", channelOffset.getChannel(), previous, channelOffset.getType());
    }

    public int getChannelCount()
    {
        return channels.length;
    }

    /**
     * Start a new slice; offsets are extracted lazily on first use.
     */
    public void reset(WindowPartition partition, int startRow, int numRows)
    {
        this.partition = requireNonNull(partition, "partition is null");
        this.startRow = startRow;
        this.numRows = numRows;
        Arrays.fill(loaded, false);
    }

    Block getOffsets(int channel)
    {
        checkState(partition != null, "no slice to read offsets from");
        int index = indexOf(channel);
        PageBuilder column = columns[index];
        if (!loaded[index]) {
            column.reset();
            partition.extractColumn(channel, startRow, numRows, 0, column.getBlockBuilder(0));
            column.declarePositions(numRows);
            loaded[index] = true;
        }
        return column.getBlockBuilder(0);
    }

    private int indexOf(int channel)
    {
        for (int i = 0; i < channels.length; i++) {
            if (channels[i] == channel) {
                return i;
            }
        }
        throw new IllegalArgumentException("Channel " + channel + " is not a frame offset channel");
    }

    public long getRetainedSizeInBytes()
    {
        long size = 0;
        for (PageBuilder column : columns) {
            size += column.getRetainedSizeInBytes();
        }
        return size;
    }
}
