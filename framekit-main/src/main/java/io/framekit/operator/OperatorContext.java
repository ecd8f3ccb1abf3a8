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

import com.google.common.collect.ImmutableMap;
import io.prestosql.memory.context.AggregatedMemoryContext;
import io.prestosql.memory.context.LocalMemoryContext;

import java.util.Map;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Per operator instance state supplied by the driver: identity, memory accounting and
 * the session properties of the query.
 */
public class OperatorContext
{
    private final int operatorId;
    private final String operatorType;
    private final AggregatedMemoryContext userMemoryContext;
    private final Map<String, String> sessionProperties;

    public OperatorContext(int operatorId, String operatorType, AggregatedMemoryContext userMemoryContext, Map<String, String> sessionProperties)
    {
        this.operatorId = operatorId;
        this.operatorType = requireNonNull(operatorType, "operatorType is null");
        this.userMemoryContext = requireNonNull(userMemoryContext, "userMemoryContext is null");
        this.sessionProperties = ImmutableMap.copyOf(requireNonNull(sessionProperties, "sessionProperties is null"));
    }

    public int getOperatorId()
    {
        return operatorId;
    }

    public String getOperatorType()
    {
        return operatorType;
    }

    public Map<String, String> getSessionProperties()
    {
        return sessionProperties;
    }

    public LocalMemoryContext localUserMemoryContext()
    {
        return userMemoryContext.newLocalMemoryContext(operatorType);
    }

    public AggregatedMemoryContext aggregateUserMemoryContext()
    {
        return userMemoryContext;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("operatorId", operatorId)
                .add("operatorType", operatorType)
                .toString();
    }
}
