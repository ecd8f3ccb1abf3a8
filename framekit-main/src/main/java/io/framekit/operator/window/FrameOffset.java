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
import io.prestosql.spi.type.Type;

import javax.annotation.Nullable;

import static com.google.common.math.LongMath.saturatedAdd;
import static com.google.common.math.LongMath.saturatedSubtract;
import static com.google.common.primitives.Ints.saturatedCast;
import static io.framekit.util.Failures.checkCondition;
import static io.prestosql.spi.StandardErrorCode.INVALID_WINDOW_FRAME;

/**
 * Offset of a {@code k PRECEDING} or {@code k FOLLOWING} frame bound: either a constant
 * or a column of the input holding one offset per row.
 */
public abstract class FrameOffset
{
    FrameOffset() {}

    public static FrameOffset constantOffset(@Nullable Long value)
    {
        checkCondition(value != null, INVALID_WINDOW_FRAME, "Window frame offset must not be null");
        return new ConstantFrameOffset(value);
    }

    public static FrameOffset channelOffset(int channel, Type type)
    {
        return new ChannelFrameOffset(channel, type);
    }

    /**
     * Fill {@code frameBounds} with the bounds of rows {@code [startRow, startRow + numRows)}.
     */
    abstract void computeBounds(boolean isPreceding, int startRow, int numRows, FrameOffsetColumns offsetColumns, RowIndexBuffer frameBounds);

    /**
     * Bounds that do not fit in an int saturate, so they stay outside of any partition.
     */
    static int offsetBound(long row, long offset, boolean isPreceding)
    {
        return saturatedCast(isPreceding ? saturatedSubtract(row, offset) : saturatedAdd(row, offset));
    }
}
