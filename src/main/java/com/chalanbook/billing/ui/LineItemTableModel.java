package com.chalanbook.billing.ui;

import com.chalanbook.billing.model.Amounts;
import com.chalanbook.billing.model.LineItem;

import javax.swing.table.AbstractTableModel;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of the chalan's items: serial number, name, quantity, rate, amount.
 */
public class LineItemTableModel extends AbstractTableModel {

    static final String[] COLUMNS = { "SR", "ITEM", "QTY", "RATE", "AMOUNT" };

    private final List<LineItem> items = new ArrayList<>();

    public void setItems(List<LineItem> newItems) {
        items.clear();
        items.addAll(newItems);
        fireTableDataChanged();
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
    public boolean isCellEditable(int row, int col) {
        return false;
    }

    @Override
    public Object getValueAt(int row, int col) {
        LineItem item = items.get(row);
        switch (col) {
            case 0:
                return row + 1;
            case 1:
                return item.getItemName();
            case 2:
                return Amounts.quantity(item.getQuantity());
            case 3:
                return Amounts.money(item.getRate());
            case 4:
                return Amounts.money(item.getAmount());
            default:
                throw new IndexOutOfBoundsException("column " + col);
        }
    }
}
