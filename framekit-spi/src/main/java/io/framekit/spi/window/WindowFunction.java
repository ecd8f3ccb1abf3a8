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
package io.framekit.spi.window;

import io.prestosql.spi.block.BlockBuilder;

/**
 * A window function evaluated over the peer groups and frames computed by the window operator.
 * <p>
 * An instance is created once per operator and is stateful across calls: {@link #resetPartition}
 * is invoked once per partition before any call to {@link #apply} for that partition, and
 * {@link #apply} is then invoked once per contiguous slice of the partition, in row order.
 */
public interface WindowFunction
{
    /**
     * Reset the state of the function for a new partition. The partition stays valid
     * until the next call to this method.
     */
    void resetPartition(WindowPartition partition);

    /**
     * Append one value per row of the slice to {@code result}.
     * <p>
     * All buffers hold {@code peerStarts.size()} entries, one per row of the slice. Peer and
     * frame bounds are inclusive row indexes relative to the start of the partition. Rows for
     * which {@code validFrames} is not set have an empty frame and their frame bounds must not
     * be read; functions that do not use frames may ignore the selector.
     * <p>
     * The buffers are shared with the other functions of the operator and are read-only for
     * the function: it must not call {@code set}, {@code setSize} or any other mutator on them.
     *
     * @param resultOffset position in {@code result} of the first row of the slice;
     * equals the position count of {@code result} on entry
     */
    void apply(
            RowIndexBuffer peerStarts,
            RowIndexBuffer peerEnds,
            RowIndexBuffer frameStarts,
            RowIndexBuffer frameEnds,
            ValiditySelector validFrames,
            int resultOffset,
            BlockBuilder result);
}
