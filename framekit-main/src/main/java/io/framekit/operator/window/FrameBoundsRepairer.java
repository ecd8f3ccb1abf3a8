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
import io.framekit.spi.window.ValiditySelector;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Frames of {@code k PRECEDING} and {@code k FOLLOWING} bounds can be empty, inverted, or
 * reach outside of the partition. Such rows are not errors; they are reported to the window
 * function through the validity selector.
 */
public final class FrameBoundsRepairer
{
    private FrameBoundsRepairer() {}

    /**
     * Clamp every valid frame to {@code [0, lastRow]} and clear the validity of every other row.
     * A frame is valid when {@code frameStart <= frameEnd}, {@code frameEnd >= 0} and
     * {@code frameStart <= lastRow}. Bounds of invalid rows are left as computed.
     */
    public static void repairFrameBounds(int lastRow, RowIndexBuffer frameStarts, RowIndexBuffer frameEnds, ValiditySelector validFrames)
    {
        int numRows = frameStarts.size();
        checkArgument(frameEnds.size() == numRows, "frame starts and ends have different sizes");
        checkArgument(validFrames.size() == numRows, "validity selector and frame bounds have different sizes");

        for (int i = 0; i < numRows; i++) {
            int frameStart = frameStarts.get(i);
            int frameEnd = frameEnds.get(i);
            if (frameStart <= frameEnd && frameEnd >= 0 && frameStart <= lastRow) {
                frameStarts.set(i, Math.max(frameStart, 0));
                frameEnds.set(i, Math.min(frameEnd, lastRow));
            }
            else {
                validFrames.setValid(i, false);
            }
        }
    }
}
