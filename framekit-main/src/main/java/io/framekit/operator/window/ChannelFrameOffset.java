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

import io.framekit.spi.window.RowIndexBuffer;
import io.prestosql.spi.block.Block;
import io.prestosql.spi.type.Type;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.framekit.util.Failures.checkCondition;
import static io.prestosql.spi.StandardErrorCode.INVALID_WINDOW_FRAME;
import static io.prestosql.spi.type.BigintType.BIGINT;
import static io.prestosql.spi.type.IntegerType.INTEGER;
import static java.util.Objects.requireNonNull;

public final class ChannelFrameOffset
        extends FrameOffset
{
    private final int channel;
    private final Type type;

    ChannelFrameOffset(int channel, Type type)
    {
        checkArgument(channel >= 0, "channel is negative");
        requireNonNull(type, "type is null");
        checkCondition(type.equals(INTEGER) || type.equals(BIGINT), INVALID_WINDOW_FRAME, "k frame bound must be INTEGER or BIGINT type, but was %s", type.getDisplayName());
        this.channel = channel;
        this.type = type;
    }

    public int getChannel()
    {
        return channel;
    }

    public Type getType()
    {
        return type;
    }

    @Override
    void computeBounds(boolean isPreceding, int startRow, int numRows, FrameOffsetColumns offsetColumns, RowIndexBuffer frameBounds)
    {
        Block offsets = offsetColumns.getOffsets(channel);
        checkArgument(offsets.getPositionCount() == numRows, "expected %s offsets, but got %s", numRows, offsets.getPositionCount());

        // every offset of the slice is checked before any bound is written
        for (int i = 0; i < numRows; i++) {
            checkCondition(!offsets.isNull(i), INVALID_WINDOW_FRAME, "Window frame offset must not be null");
            long offset = type.getLong(offsets, i);
            checkCondition(offset >= 0, INVALID_WINDOW_FRAME, "Window frame %s offset must not be negative", offset);
        }

        frameBounds.setSize(numRows);
        for (int i = 0; i < numRows; i++) {
            frameBounds.set(i, offsetBound(startRow + i, type.getLong(offsets, i), isPreceding));
        }
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }
        ChannelFrameOffset other = (ChannelFrameOffset) obj;
        return channel == other.channel && type.equals(other.type);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(channel, type);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("channel", channel)
                .add("type", type)
                .toString();
    }
}
