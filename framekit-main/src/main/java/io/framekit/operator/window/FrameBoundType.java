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

public enum FrameBoundType
{
    UNBOUNDED_PRECEDING("UNBOUNDED PRECEDING"),
    PRECEDING("PRECEDING"),
    CURRENT_ROW("CURRENT ROW"),
    FOLLOWING("FOLLOWING"),
    UNBOUNDED_FOLLOWING("UNBOUNDED FOLLOWING");

    private final String sqlName;

    FrameBoundType(String sqlName)
    {
        this.sqlName = sqlName;
    }

    public String getSqlName()
    {
        return sqlName;
    }

    /**
     * Whether the bound is {@code k PRECEDING} or {@code k FOLLOWING} and needs an offset.
     */
    public boolean isOffsetBound()
    {
        return this == PRECEDING || this == FOLLOWING;
    }
}
