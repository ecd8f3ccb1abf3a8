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
 * Marks the rows of a slice whose frame is usable.
 */
public final class ValiditySelector
{
    private boolean[] valid;
    private int size;

    public ValiditySelector(int capacity)
    {
        checkArgument(capacity >= 0, "capacity is negative");
        this.valid = new boolean[capacity];
    }

    public int size()
    {
        return size;
    }

    /**
     * Resize to {@code size} rows and set every row to {@code value}.
     */
    public void resizeFill(int size, boolean value)
    {
        checkArgument(size >= 0, "size is negative");
        if (size > valid.length) {
            valid = new boolean[size];
        }
        this.size = size;
        Arrays.fill(valid, 0, size, value);
    }

    public boolean isValid(int row)
    {
        checkElementIndex(row, size);
        return valid[row];
    }

    public void setValid(int row, boolean value)
    {
        checkElementIndex(row, size);
        valid[row] = value;
    }

    public int countValid()
    {
        int count = 0;
        for (int i = 0; i < size; i++) {
            if (valid[i]) {
                count++;
            }
        }
        return count;
    }

    public boolean isAllValid()
    {
        return countValid() == size;
    }

    public long getRetainedSizeInBytes()
    {
        return sizeOf(valid);
    }
}
