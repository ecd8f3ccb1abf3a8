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

import static io.framekit.operator.window.FrameType.RANGE;
import static io.framekit.operator.window.FrameType.ROWS;
import static io.framekit.util.Failures.checkCondition;
import static io.prestosql.spi.StandardErrorCode.NOT_SUPPORTED;
import static java.util.Locale.ENGLISH;

public final class FrameBoundsComputer
{
    private FrameBoundsComputer() {}

    /**
     * Fill {@code frameBounds} with one side of the frame of rows {@code [startRow, startRow + numRows)}.
     * Bounds of {@code k PRECEDING} and {@code k FOLLOWING} frames are not clamped to the partition.
     *
     * @param lastRow index of the last row of the partition
     */
    public static void computeFrameBounds(
            FrameInfo frame,
            boolean isStartBound,
            int lastRow,
            int startRow,
            int numRows,
            RowIndexBuffer peerStarts,
            RowIndexBuffer peerEnds,
            FrameOffsetColumns offsetColumns,
            RowIndexBuffer frameBounds)
    {
        FrameBoundType boundType = frame.getBoundType(isStartBound);
        switch (boundType) {
            case UNBOUNDED_PRECEDING:
                frameBounds.setSize(numRows);
                frameBounds.fill(0);
                return;
            case UNBOUNDED_FOLLOWING:
                frameBounds.setSize(numRows);
                frameBounds.fill(lastRow);
                return;
            case CURRENT_ROW:
                frameBounds.setSize(numRows);
                if (frame.getType() == RANGE) {
                    frameBounds.copyFrom(isStartBound ? peerStarts : peerEnds);
                }
                else {
                    frameBounds.fillSequence(startRow);
                }
                return;
            case PRECEDING:
            case FOLLOWING:
                checkCondition(frame.getType() == ROWS, NOT_SUPPORTED, "k %s frame is only supported in ROWS mode", boundType.getSqlName().toLowerCase(ENGLISH));
                frame.getOffset(isStartBound)
                        .orElseThrow(() -> new IllegalArgumentException("frame has no offset for " + boundType.getSqlName()))
                        .computeBounds(boundType == FrameBoundType.PRECEDING, startRow, numRows, offsetColumns, frameBounds);
                return;
            default:
                throw new UnsupportedOperationException("Unsupported frame bound type: " + boundType);
        }
    }
}
