package com.chalanbook.billing.ui;

import com.chalanbook.billing.model.Amounts;
import com.chalanbook.billing.model.MasterItem;

import javax.swing.table.AbstractTableModel;
import java.util.ArrayList;
import java.util.List;

/**
 * Rows of the item master dialog.
 */
public class MasterItemTableModel extends AbstractTableModel {

    static final String[] COLUMNS = { "ID", "NAME", "RATE" };

    private final List<MasterItem> items = new ArrayList<>();

    public void setItems(List<MasterItem> newItems) {
        items.clear();
        items.addAll(newItems);
        fireTableDataChanged();
    }

    public MasterItem getItem(int row) {
        return items.get(row);
    }

    @Override
    public int getRowCount() {
        return items.size();
    }

    @Override
    public int getColumnCount() {
        return COLUMNS.length;
    }

    @Override
    public String getColumnName(int column) {
        return COLUMNS[column];
    }

    @Override
    public Object getValueAt(int row, int col) {
        MasterItem item = items.get(row);
        switch (col) {
            case 0:
                return item.getId();
            case 1:
                return item.getName();
            case 2:
                return Amounts.money(item.getDefaultRate());
            default:
                throw new IndexOutOfBoundsException("column " + col);
        }
    }
}
