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
import org.testng.annotations.Test;

import static io.framekit.operator.window.FrameBoundsRepairer.repairFrameBounds;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestFrameBoundsRepairer
{
    @Test
    public void testClampValidFrames()
    {
        RowIndexBuffer starts = buffer(-3, 0, 2);
        RowIndexBuffer ends = buffer(1, 9, 2);
        ValiditySelector validFrames = allValid(3);

        repairFrameBounds(4, starts, ends, validFrames);

        assertTrue(validFrames.isAllValid());
        assertEquals(starts.toArray(), new int[] {0, 0, 2});
        assertEquals(ends.toArray(), new int[] {1, 4, 2});
    }

    @Test
    public void testInvertedFrame()
    {
        RowIndexBuffer starts = buffer(3);
        RowIndexBuffer ends = buffer(2);
        ValiditySelector validFrames = allValid(1);

        repairFrameBounds(4, starts, ends, validFrames);

        assertFalse(validFrames.isValid(0));
        assertEquals(starts.get(0), 3);
        assertEquals(ends.get(0), 2);
    }

    @Test
    public void testFrameAfterPartition()
    {
        RowIndexBuffer starts = buffer(5, 4);
        RowIndexBuffer ends = buffer(7, 4);
        ValiditySelector validFrames = allValid(2);

        repairFrameBounds(4, starts, ends, validFrames);

        assertFalse(validFrames.isValid(0));
        assertTrue(validFrames.isValid(1));
    }

    @Test
    public void testFrameBeforePartitionIsNotClamped()
    {
        // start <= end, but the whole frame lies before the first row
        RowIndexBuffer starts = buffer(-10, -1, -1);
        RowIndexBuffer ends = buffer(-5, -1, 0);
        ValiditySelector validFrames = allValid(3);

        repairFrameBounds(4, starts, ends, validFrames);

        assertFalse(validFrames.isValid(0));
        assertFalse(validFrames.isValid(1));
        assertTrue(validFrames.isValid(2));
        assertEquals(starts.toArray(), new int[] {-10, -1, 0});
        assertEquals(ends.toArray(), new int[] {-5, -1, 0});
    }

    @Test
    public void testSizeMismatch()
    {
        assertThatThrownBy(() -> repairFrameBounds(4, buffer(0, 1), buffer(0), allValid(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("frame starts and ends have different sizes");
    }

    private static RowIndexBuffer buffer(int... values)
    {
        RowIndexBuffer buffer = new RowIndexBuffer(values.length);
        buffer.setSize(values.length);
        for (int i = 0; i < values.length; i++) {
            buffer.set(i, values[i]);
        }
        return buffer;
    }

    private static ValiditySelector allValid(int size)
    {
        ValiditySelector validFrames = new ValiditySelector(size);
        validFrames.resizeFill(size, true);
        return validFrames;
    }
}
