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
import io.prestosql.spi.type.Type;

import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Objects;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

@Immutable
public final class WindowFunctionSignature
{
    private final List<Type> argumentTypes;
    private final Type returnType;

    public static WindowFunctionSignature signature(Type returnType, Type... argumentTypes)
    {
        return new WindowFunctionSignature(ImmutableList.copyOf(argumentTypes), returnType);
    }

    public WindowFunctionSignature(List<Type> argumentTypes, Type returnType)
    {
        this.argumentTypes = ImmutableList.copyOf(requireNonNull(argumentTypes, "argumentTypes is null"));
        this.returnType = requireNonNull(returnType, "returnType is null");
    }

    public List<Type> getArgumentTypes()
    {
        return argumentTypes;
    }

    public Type getReturnType()
    {
        return returnType;
    }

    public boolean matchesArguments(List<Type> types)
    {
        return argumentTypes.equals(types);
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
        WindowFunctionSignature other = (WindowFunctionSignature) obj;
        return argumentTypes.equals(other.argumentTypes) &&
                returnType.equals(other.returnType);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(argumentTypes, returnType);
    }

    @Override
    public String toString()
    {
        return format("%s -> %s", formatArgumentTypes(argumentTypes), returnType.getDisplayName());
    }

    static String formatArgumentTypes(List<Type> types)
    {
        return types.stream()
                .map(Type::getDisplayName)
                .collect(toImmutableList())
                .toString()
                .replace('[', '(')
                .replace(']', ')');
    }
}
