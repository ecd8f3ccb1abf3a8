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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import io.prestosql.spi.Page;
import io.prestosql.spi.block.Block;
import io.prestosql.spi.type.Type;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Compares two rows, each given by page and position, on a set of channels. Two nulls compare equal.
 */
public class RowEqualityStrategy
{
    private final List<Type> types;
    private final int[] channels;

    public RowEqualityStrategy(List<Type> types, List<Integer> channels)
    {
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
        this.channels = Ints.toArray(requireNonNull(channels, "channels is null"));
    }

    public boolean rowEqualsRow(Page leftPage, int leftPosition, Page rightPage, int rightPosition)
    {
        for (int channel : channels) {
            Block leftBlock = leftPage.getBlock(channel);
            Block rightBlock = rightPage.getBlock(channel);
            if (!positionEqualsPosition(types.get(channel), leftBlock, leftPosition, rightBlock, rightPosition)) {
                return false;
            }
        }
        return true;
    }

    private static boolean positionEqualsPosition(Type type, Block leftBlock, int leftPosition, Block rightBlock, int rightPosition)
    {
        boolean leftIsNull = leftBlock.isNull(leftPosition);
        boolean rightIsNull = rightBlock.isNull(rightPosition);
        if (leftIsNull || rightIsNull) {
            return leftIsNull && rightIsNull;
        }
        return type.equalTo(leftBlock, leftPosition, rightBlock, rightPosition);
    }
}
