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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.units.DataSize;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

import static io.airlift.units.DataSize.Unit.MEGABYTE;

public class WindowOperatorConfig
{
    private int preferredOutputBatchRows = 1024;
    private int maxOutputBatchRows = 10_000;
    private DataSize preferredOutputBatchSize = new DataSize(10, MEGABYTE);

    @Min(1)
    public int getPreferredOutputBatchRows()
    {
        return preferredOutputBatchRows;
    }

    @Config("window.preferred-output-batch-rows")
    @ConfigDescription("Rows per output page when the row size of the input is unknown")
    public WindowOperatorConfig setPreferredOutputBatchRows(int preferredOutputBatchRows)
    {
        this.preferredOutputBatchRows = preferredOutputBatchRows;
        return this;
    }

    @Min(1)
    public int getMaxOutputBatchRows()
    {
        return maxOutputBatchRows;
    }

    @Config("window.max-output-batch-rows")
    public WindowOperatorConfig setMaxOutputBatchRows(int maxOutputBatchRows)
    {
        this.maxOutputBatchRows = maxOutputBatchRows;
        return this;
    }

    @NotNull
    public DataSize getPreferredOutputBatchSize()
    {
        return preferredOutputBatchSize;
    }

    @Config("window.preferred-output-batch-size")
    public WindowOperatorConfig setPreferredOutputBatchSize(DataSize preferredOutputBatchSize)
    {
        this.preferredOutputBatchSize = preferredOutputBatchSize;
        return this;
    }
}
