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

import javax.annotation.concurrent.Immutable;

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.framekit.operator.window.FrameBoundType.CURRENT_ROW;
import static io.framekit.operator.window.FrameBoundType.UNBOUNDED_FOLLOWING;
import static io.framekit.operator.window.FrameBoundType.UNBOUNDED_PRECEDING;
import static io.framekit.operator.window.FrameType.RANGE;
import static io.framekit.operator.window.FrameType.ROWS;
import static io.framekit.util.Failures.checkCondition;
import static io.prestosql.spi.StandardErrorCode.INVALID_WINDOW_FRAME;
import static io.prestosql.spi.StandardErrorCode.NOT_SUPPORTED;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * Frame of one window function: {@code type BETWEEN start AND end}.
 * <p>
 * A frame is validated when it is created. {@code UNBOUNDED FOLLOWING} is rejected as the
 * frame start and {@code UNBOUNDED PRECEDING} as the frame end, with {@code INVALID_WINDOW_FRAME}.
 * {@code PRECEDING} and {@code FOLLOWING} offsets are only supported for {@code ROWS} frames;
 * a {@code RANGE} frame with an offset fails with {@code NOT_SUPPORTED}.
 */
@Immutable
public final class FrameInfo
{
    private final FrameType type;
    private final FrameBoundType startType;
    private final Optional<FrameOffset> startOffset;
    private final FrameBoundType endType;
    private final Optional<FrameOffset> endOffset;

    /**
     * The frame used when the OVER clause has none: {@code RANGE BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW}.
     */
    public static FrameInfo defaultFrame()
    {
        return new FrameInfo(RANGE, UNBOUNDED_PRECEDING, Optional.empty(), CURRENT_ROW, Optional.empty());
    }

    public static FrameInfo rowsFrame(FrameBoundType startType, Optional<FrameOffset> startOffset, FrameBoundType endType, Optional<FrameOffset> endOffset)
    {
        return new FrameInfo(ROWS, startType, startOffset, endType, endOffset);
    }

    public static FrameInfo rangeFrame(FrameBoundType startType, FrameBoundType endType)
    {
        return new FrameInfo(RANGE, startType, Optional.empty(), endType, Optional.empty());
    }

    public FrameInfo(
            FrameType type,
            FrameBoundType startType,
            Optional<FrameOffset> startOffset,
            FrameBoundType endType,
            Optional<FrameOffset> endOffset)
    {
        this.type = requireNonNull(type, "type is null");
        this.startType = requireNonNull(startType, "startType is null");
        this.startOffset = requireNonNull(startOffset, "startOffset is null");
        this.endType = requireNonNull(endType, "endType is null");
        this.endOffset = requireNonNull(endOffset, "endOffset is null");

        checkArgument(startType.isOffsetBound() == startOffset.isPresent(), "invalid offset %s for frame start %s", startOffset, startType.getSqlName());
        checkArgument(endType.isOffsetBound() == endOffset.isPresent(), "invalid offset %s for frame end %s", endOffset, endType.getSqlName());

        checkCondition(startType != UNBOUNDED_FOLLOWING, INVALID_WINDOW_FRAME, "Window frame start cannot be UNBOUNDED FOLLOWING");
        checkCondition(endType != UNBOUNDED_PRECEDING, INVALID_WINDOW_FRAME, "Window frame end cannot be UNBOUNDED PRECEDING");

        if (type == RANGE) {
            checkCondition(!startType.isOffsetBound(), NOT_SUPPORTED, "k %s frame is only supported in ROWS mode", startType.getSqlName().toLowerCase(ENGLISH));
            checkCondition(!endType.isOffsetBound(), NOT_SUPPORTED, "k %s frame is only supported in ROWS mode", endType.getSqlName().toLowerCase(ENGLISH));
        }
    }

    public FrameType getType()
    {
        return type;
    }

    public FrameBoundType getStartType()
    {
        return startType;
    }

    public Optional<FrameOffset> getStartOffset()
    {
        return startOffset;
    }

    public FrameBoundType getEndType()
    {
        return endType;
    }

    public Optional<FrameOffset> getEndOffset()
    {
        return endOffset;
    }

    public FrameBoundType getBoundType(boolean isStartBound)
    {
        return isStartBound ? startType : endType;
    }

    public Optional<FrameOffset> getOffset(boolean isStartBound)
    {
        return isStartBound ? startOffset : endOffset;
    }

    /**
     * Only frames with a {@code k PRECEDING} or {@code k FOLLOWING} bound can be empty or reach outside the partition.
     */
    public boolean hasOffset()
    {
        return startOffset.isPresent() || endOffset.isPresent();
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
        FrameInfo other = (FrameInfo) obj;
        return type == other.type &&
                startType == other.startType &&
                startOffset.equals(other.startOffset) &&
                endType == other.endType &&
                endOffset.equals(other.endOffset);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(type, startType, startOffset, endType, endOffset);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("type", type)
                .add("startType", startType)
                .add("startOffset", startOffset.orElse(null))
                .add("endType", endType)
                .add("endOffset", endOffset.orElse(null))
                .omitNullValues()
                .toString();
    }
}
