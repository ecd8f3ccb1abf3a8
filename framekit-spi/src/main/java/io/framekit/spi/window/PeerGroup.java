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

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * Rows {@code [start, end)} of a partition that compare equal on the ORDER BY key.
 */
public final class PeerGroup
{
    private final int start;
    private final int end;

    public PeerGroup(int start, int end)
    {
        checkArgument(start >= 0, "start is negative");
        checkArgument(end >= start, "end is less than start");
        this.start = start;
        this.end = end;
    }

    public int getStart()
    {
        return start;
    }

    /**
     * Exclusive end of the group.
     */
    public int getEnd()
    {
        return end;
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
        PeerGroup other = (PeerGroup) obj;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(start, end);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("start", start)
                .add("end", end)
                .toString();
    }
}
