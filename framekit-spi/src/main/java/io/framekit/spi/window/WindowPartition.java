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

import io.airlift.slice.Slice;
import io.prestosql.spi.block.BlockBuilder;
import io.prestosql.spi.type.Type;

/**
 * An ordered run of rows sharing the same partition key.
 * Row positions are relative to the start of the partition.
 */
public interface WindowPartition
{
    int getPositionCount();

    Type getType(int channel);

    boolean isNull(int channel, int position);

    long getLong(int channel, int position);

    double getDouble(int channel, int position);

    Slice getSlice(int channel, int position);

    void appendTo(int channel, int position, BlockBuilder output);

    /**
     * Copy {@code numRows} values of {@code channel}, starting at {@code partitionOffset},
     * to the end of {@code result}. The position count of {@code result} must equal
     * {@code resultOffset}.
     */
    void extractColumn(int channel, int partitionOffset, int numRows, int resultOffset, BlockBuilder result);

    /**
     * Fill {@code peerStarts} and {@code peerEnds} with the inclusive peer group bounds of the rows
     * in {@code [startRow, endRow)}. The previous peer group lets consecutive calls over one
     * partition continue the group left open by the last call instead of scanning for it again.
     *
     * @param previousPeerStart start of the peer group returned by the previous call, or 0
     * @param previousPeerEnd exclusive end of the peer group returned by the previous call, or 0
     * @return the peer group of the last row of the range, to be passed to the next call
     */
    PeerGroup computePeerBuffers(
            int startRow,
            int endRow,
            int previousPeerStart,
            int previousPeerEnd,
            RowIndexBuffer peerStarts,
            RowIndexBuffer peerEnds);
}
