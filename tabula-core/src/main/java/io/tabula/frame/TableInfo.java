package io.tabula.frame;

import io.tabula.kernel.MemoryUsage;
import io.tabula.kernel.ReadOnlyViews;

import java.util.ArrayList;
import java.util.List;

public record TableInfo(int rows, int columns, List<String> columnNames, MemoryUsage memoryUsage) {

    public TableInfo {
        columnNames = ReadOnlyViews.list(new ArrayList<>(columnNames), "Table column name");
    }
}
