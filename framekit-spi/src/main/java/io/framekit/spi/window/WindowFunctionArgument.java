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

import io.prestosql.spi.type.Type;

import javax.annotation.Nullable;

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * An argument of a window function call: either an input channel or a constant value.
 */
public final class WindowFunctionArgument
{
    private final Type type;
    private final Optional<Integer> channel;
    private final Object constantValue;

    public static WindowFunctionArgument channelArgument(Type type, int channel)
    {
        checkArgument(channel >= 0, "channel is negative");
        return new WindowFunctionArgument(type, Optional.of(channel), null);
    }

    public static WindowFunctionArgument constantArgument(Type type, @Nullable Object value)
    {
        return new WindowFunctionArgument(type, Optional.empty(), value);
    }

    private WindowFunctionArgument(Type type, Optional<Integer> channel, @Nullable Object constantValue)
    {
        this.type = requireNonNull(type, "type is null");
        this.channel = requireNonNull(channel, "channel is null");
        this.constantValue = constantValue;
    }

    public Type getType()
    {
        return type;
    }

    public Optional<Integer> getChannel()
    {
        return channel;
    }

    public boolean isConstant()
    {
        return !channel.isPresent();
    }

    /**
     * Native value of a constant argument, in the Java representation of {@link #getType()}.
     */
    @Nullable
    public Object getConstantValue()
    {
        checkArgument(isConstant(), "argument is not a constant");
        return constantValue;
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
        WindowFunctionArgument other = (WindowFunctionArgument) obj;
        return type.equals(other.type) &&
                channel.equals(other.channel) &&
                Objects.equals(constantValue, other.constantValue);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(type, channel, constantValue);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .omitNullValues()
                .add("type", type)
                .add("channel", channel.orElse(null))
                .add("constantValue", constantValue)
                .toString();
    }
}
