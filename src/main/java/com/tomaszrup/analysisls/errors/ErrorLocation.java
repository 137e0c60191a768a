////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.analysisls.errors;

import java.util.Objects;

import com.google.gson.JsonObject;

/**
 * Where an error sits in a file. Lines and columns are one-based; the end
 * is optional.
 */
public final class ErrorLocation {

    private final String filePath;
    private final int line;
    private final int column;
    private final Integer endLine;
    private final Integer endColumn;

    public ErrorLocation(String filePath, int line, int column) {
        this(filePath, line, column, null, null);
    }

    public ErrorLocation(String filePath, int line, int column, Integer endLine, Integer endColumn) {
        this.filePath = Objects.requireNonNull(filePath, "filePath");
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public String getFilePath() {
        return filePath;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public Integer getEndLine() {
        return endLine;
    }

    public Integer getEndColumn() {
        return endColumn;
    }

    /** {@code line:col}, or {@code line:col-endLine:endCol} when the end is known. */
    public String getRangeText() {
        if (endLine != null && endColumn != null) {
            return line + ":" + column + "-" + endLine + ":" + endColumn;
        }
        return line + ":" + column;
    }

    public String getFileName() {
        int separator = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        return separator >= 0 ? filePath.substring(separator + 1) : filePath;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("file_path", filePath);
        json.addProperty("line", line);
        json.addProperty("column", column);
        json.addProperty("end_line", endLine);
        json.addProperty("end_column", endColumn);
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorLocation)) {
            return false;
        }
        ErrorLocation other = (ErrorLocation) o;
        return line == other.line && column == other.column && filePath.equals(other.filePath)
                && Objects.equals(endLine, other.endLine) && Objects.equals(endColumn, other.endColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, line, column, endLine, endColumn);
    }

    @Override
    public String toString() {
        return filePath + ":" + getRangeText();
    }
}
