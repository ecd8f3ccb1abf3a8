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
import io.framekit.spi.window.RowIndexBuffer;
import io.framekit.spi.window.ValiditySelector;
import io.framekit.spi.window.WindowFunction;
import io.framekit.spi.window.WindowPartition;
import io.prestosql.spi.block.BlockBuilder;

import java.util.ArrayList;
import java.util.List;

import static io.framekit.operator.window.WindowFunctionSignature.signature;
import static io.prestosql.spi.type.BigintType.BIGINT;

/**
 * Window functions used by the operator tests. Each one exposes one of the buffers the operator
 * passes to {@link WindowFunction#apply} as a BIGINT result.
 */
public final class TestingWindowFunctions
{
    private TestingWindowFunctions() {}

    public static WindowFunctionRegistry createTestingRegistry()
    {
        WindowFunctionRegistry registry = new WindowFunctionRegistry();
        registry.register("row_number", ImmutableList.of(signature(BIGINT)), (arguments, returnType, ignoreNulls, memoryContext, sessionProperties) -> new RowNumberFunction());
        registry.register("rank", ImmutableList.of(signature(BIGINT)), (arguments, returnType, ignoreNulls, memoryContext, sessionProperties) -> new RankFunction());
        registry.register("frame_count", ImmutableList.of(signature(BIGINT)), (arguments, returnType, ignoreNulls, memoryContext, sessionProperties) -> new FrameCountFunction());
        registry.register(
                "frame_sum",
                ImmutableList.of(signature(BIGINT, BIGINT)),
                (arguments, returnType, ignoreNulls, memoryContext, sessionProperties) -> new FrameSumFunction(arguments.get(0).getChannel().get()));
        return registry;
    }

    public static class RowNumberFunction
            implements WindowFunction
    {
        private long rowNumber;

        @Override
        public void resetPartition(WindowPartition partition)
        {
            rowNumber = 0;
        }

        @Override
        public void apply(RowIndexBuffer peerStarts, RowIndexBuffer peerEnds, RowIndexBuffer frameStarts, RowIndexBuffer frameEnds, ValiditySelector validFrames, int resultOffset, BlockBuilder result)
        {
            for (int i = 0; i < peerStarts.size(); i++) {
                rowNumber++;
                BIGINT.writeLong(result, rowNumber);
            }
        }
    }

    /**
     * Ignores the frame entirely.
     */
    public static class RankFunction
            implements WindowFunction
    {
        @Override
        public void resetPartition(WindowPartition partition) {}

        @Override
        public void apply(RowIndexBuffer peerStarts, RowIndexBuffer peerEnds, RowIndexBuffer frameStarts, RowIndexBuffer frameEnds, ValiditySelector validFrames, int resultOffset, BlockBuilder result)
        {
            for (int i = 0; i < peerStarts.size(); i++) {
                BIGINT.writeLong(result, peerStarts.get(i) + 1);
            }
        }
    }

    /**
     * Number of rows in the frame, or null for an empty frame.
     */
    public static class FrameCountFunction
            implements WindowFunction
    {
        @Override
        public void resetPartition(WindowPartition partition) {}

        @Override
        public void apply(RowIndexBuffer peerStarts, RowIndexBuffer peerEnds, RowIndexBuffer frameStarts, RowIndexBuffer frameEnds, ValiditySelector validFrames, int resultOffset, BlockBuilder result)
        {
            for (int i = 0; i < frameStarts.size(); i++) {
                if (validFrames.isValid(i)) {
                    BIGINT.writeLong(result, frameEnds.get(i) - frameStarts.get(i) + 1);
                }
                else {
                    result.appendNull();
                }
            }
        }
    }

    public static class FrameSumFunction
            implements WindowFunction
    {
        private final int channel;
        private WindowPartition partition;

        public FrameSumFunction(int channel)
        {
            this.channel = channel;
        }

        @Override
        public void resetPartition(WindowPartition partition)
        {
            this.partition = partition;
        }

        @Override
        public void apply(RowIndexBuffer peerStarts, RowIndexBuffer peerEnds, RowIndexBuffer frameStarts, RowIndexBuffer frameEnds, ValiditySelector validFrames, int resultOffset, BlockBuilder result)
        {
            for (int i = 0; i < frameStarts.size(); i++) {
                if (!validFrames.isValid(i)) {
                    result.appendNull();
                    continue;
                }
                long sum = 0;
                boolean hasValue = false;
                for (int row = frameStarts.get(i); row <= frameEnds.get(i); row++) {
                    if (!partition.isNull(channel, row)) {
                        sum += partition.getLong(channel, row);
                        hasValue = true;
                    }
                }
                if (hasValue) {
                    BIGINT.writeLong(result, sum);
                }
                else {
                    result.appendNull();
                }
            }
        }
    }

    /**
     * Copies every buffer it is called with and writes the peer end of each row.
     */
    public static class RecordingWindowFunction
            implements WindowFunction
    {
        private final List<Integer> partitionSizes = new ArrayList<>();
        private final List<RecordedSlice> slices = new ArrayList<>();

        @Override
        public void resetPartition(WindowPartition partition)
        {
            partitionSizes.add(partition.getPositionCount());
        }

        @Override
        public void apply(RowIndexBuffer peerStarts, RowIndexBuffer peerEnds, RowIndexBuffer frameStarts, RowIndexBuffer frameEnds, ValiditySelector validFrames, int resultOffset, BlockBuilder result)
        {
            boolean[] valid = new boolean[validFrames.size()];
            for (int i = 0; i < valid.length; i++) {
                valid[i] = validFrames.isValid(i);
            }
            slices.add(new RecordedSlice(resultOffset, peerStarts.toArray(), peerEnds.toArray(), frameStarts.toArray(), frameEnds.toArray(), valid));
            for (int i = 0; i < peerEnds.size(); i++) {
                BIGINT.writeLong(result, peerEnds.get(i));
            }
        }

        public List<Integer> getPartitionSizes()
        {
            return partitionSizes;
        }

        public List<RecordedSlice> getSlices()
        {
            return slices;
        }
    }

    public static class RecordedSlice
    {
        private final int resultOffset;
        private final int[] peerStarts;
        private final int[] peerEnds;
        private final int[] frameStarts;
        private final int[] frameEnds;
        private final boolean[] validFrames;

        public RecordedSlice(int resultOffset, int[] peerStarts, int[] peerEnds, int[] frameStarts, int[] frameEnds, boolean[] validFrames)
        {
            this.resultOffset = resultOffset;
            this.peerStarts = peerStarts;
            this.peerEnds = peerEnds;
            this.frameStarts = frameStarts;
            this.frameEnds = frameEnds;
            this.validFrames = validFrames;
        }

        public int getResultOffset()
        {
            return resultOffset;
        }

        public int[] getPeerStarts()
        {
            return peerStarts;
        }

        public int[] getPeerEnds()
        {
            return peerEnds;
        }

        public int[] getFrameStarts()
        {
            return frameStarts;
        }

        public int[] getFrameEnds()
        {
            return frameEnds;
        }

        public boolean[] getValidFrames()
        {
            return validFrames;
        }
    }
}
