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
package io.framekit.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import io.framekit.util.Mergeable;

import javax.annotation.concurrent.Immutable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.Iterables.concat;

public class WindowInfo
        implements Mergeable<WindowInfo>
{
    private final List<DriverWindowInfo> windowInfos;

    @JsonCreator
    public WindowInfo(@JsonProperty("windowInfos") List<DriverWindowInfo> windowInfos)
    {
        this.windowInfos = ImmutableList.copyOf(windowInfos);
    }

    @JsonProperty
    public List<DriverWindowInfo> getWindowInfos()
    {
        return windowInfos;
    }

    @Override
    public WindowInfo mergeWith(WindowInfo other)
    {
        return new WindowInfo(ImmutableList.copyOf(concat(this.windowInfos, other.windowInfos)));
    }

    static class DriverWindowInfoBuilder
    {
        private long totalPartitionsCount;
        private long totalRowsCount;
        private long maxPartitionRowsCount;
        private double sumPartitionRowsSquared;
        private long outputPagesCount;

        public void addPartition(int rowsCount)
        {
            checkArgument(rowsCount >= 0, "rowsCount is negative");
            totalPartitionsCount++;
            totalRowsCount += rowsCount;
            maxPartitionRowsCount = Math.max(maxPartitionRowsCount, rowsCount);
            sumPartitionRowsSquared += (double) rowsCount * rowsCount;
        }

        public void addOutputPage()
        {
            outputPagesCount++;
        }

        public DriverWindowInfo build()
        {
            if (totalPartitionsCount == 0) {
                return new DriverWindowInfo(0.0, 0, 0, 0, outputPagesCount);
            }
            // sum of (partitionRows - averagePartitionRows) ^ 2
            double average = (double) totalRowsCount / totalPartitionsCount;
            double squaredDifferences = Math.max(sumPartitionRowsSquared - totalPartitionsCount * average * average, 0.0);
            return new DriverWindowInfo(squaredDifferences, totalPartitionsCount, totalRowsCount, maxPartitionRowsCount, outputPagesCount);
        }
    }

    @Immutable
    public static class DriverWindowInfo
    {
        private final double sumSquaredDifferencesSizeInPartition; // sum of (partitionSize - averagePartitionSize)^2 for each partition
        private final long totalPartitionsCount;
        private final long totalRowsCount;
        private final long maxPartitionRowsCount;
        private final long outputPagesCount;

        @JsonCreator
        public DriverWindowInfo(
                @JsonProperty("sumSquaredDifferencesSizeInPartition") double sumSquaredDifferencesSizeInPartition,
                @JsonProperty("totalPartitionsCount") long totalPartitionsCount,
                @JsonProperty("totalRowsCount") long totalRowsCount,
                @JsonProperty("maxPartitionRowsCount") long maxPartitionRowsCount,
                @JsonProperty("outputPagesCount") long outputPagesCount)
        {
            this.sumSquaredDifferencesSizeInPartition = sumSquaredDifferencesSizeInPartition;
            this.totalPartitionsCount = totalPartitionsCount;
            this.totalRowsCount = totalRowsCount;
            this.maxPartitionRowsCount = maxPartitionRowsCount;
            this.outputPagesCount = outputPagesCount;
        }

        @JsonProperty
        public double getSumSquaredDifferencesSizeInPartition()
        {
            return sumSquaredDifferencesSizeInPartition;
        }

        @JsonProperty
        public long getTotalPartitionsCount()
        {
            return totalPartitionsCount;
        }

        @JsonProperty
        public long getTotalRowsCount()
        {
            return totalRowsCount;
        }

        @JsonProperty
        public long getMaxPartitionRowsCount()
        {
            return maxPartitionRowsCount;
        }

        @JsonProperty
        public long getOutputPagesCount()
        {
            return outputPagesCount;
        }
    }
}
