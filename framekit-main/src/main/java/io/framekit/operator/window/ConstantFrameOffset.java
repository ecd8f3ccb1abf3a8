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

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.math.LongMath.saturatedAdd;
import static com.google.common.math.LongMath.saturatedSubtract;
import static com.google.common.primitives.Ints.saturatedCast;
import static io.framekit.util.Failures.checkCondition;
import static io.prestosql.spi.StandardErrorCode.INVALID_WINDOW_FRAME;

public final class ConstantFrameOffset
        extends FrameOffset
{
    private final long value;

    ConstantFrameOffset(long value)
    {
        checkCondition(value >= 0, INVALID_WINDOW_FRAME, "Window frame %s offset must not be negative", value);
        this.value = value;
    }

    public long getValue()
    {
        return value;
    }

    @Override
    void computeBounds(boolean isPreceding, int startRow, int numRows, FrameOffsetColumns offsetColumns, RowIndexBuffer frameBounds)
    {
        frameBounds.setSize(numRows);
        long firstBound = isPreceding ? saturatedSubtract(startRow, value) : saturatedAdd(startRow, value);
        for (int i = 0; i < numRows; i++) {
            frameBounds.set(i, saturatedCast(saturatedAdd(firstBound, i)));
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
        return value == ((ConstantFrameOffset) obj).value;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(value);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("value", value)
                .toString();
    }
}
