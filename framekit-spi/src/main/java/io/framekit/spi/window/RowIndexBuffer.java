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

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static io.airlift.slice.SizeOf.sizeOf;

/**
 * Reusable buffer of row indexes. The backing array is allocated once and only
 * grows when a caller asks for a size beyond its capacity.
 */
public final class RowIndexBuffer
{
    private int[] values;
    private int size;

    public RowIndexBuffer(int capacity)
    {
        checkArgument(capacity >= 0, "capacity is negative");
        this.values = new int[capacity];
    }

    public int capacity()
    {
        return values.length;
    }

    public int size()
    {
        return size;
    }

    public void setSize(int size)
    {
        checkArgument(size >= 0, "size is negative");
        if (size > values.length) {
            values = Arrays.copyOf(values, size);
        }
        this.size = size;
    }

    public int get(int index)
    {
        checkElementIndex(index, size);
        return values[index];
    }

    public void set(int index, int value)
    {
        checkElementIndex(index, size);
        values[index] = value;
    }

    public void fill(int value)
    {
        Arrays.fill(values, 0, size, value);
    }

    /**
     * Sets entry {@code i} to {@code firstValue + i}.
     */
    public void fillSequence(int firstValue)
    {
        for (int i = 0; i < size; i++) {
            values[i] = firstValue + i;
        }
    }

    public void copyFrom(RowIndexBuffer source)
    {
        checkArgument(source.size == size, "source size %s does not match size %s", source.size, size);
        System.arraycopy(source.values, 0, values, 0, size);
    }

    public int[] toArray()
    {
        return Arrays.copyOf(values, size);
    }

    public long getRetainedSizeInBytes()
    {
        return sizeOf(values);
    }
}
