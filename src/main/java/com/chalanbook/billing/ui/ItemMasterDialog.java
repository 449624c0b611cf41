package com.chalanbook.billing.ui;

import com.chalanbook.billing.exception.BillingException;
import com.chalanbook.billing.model.Amounts;
import com.chalanbook.billing.model.MasterItem;
import com.chalanbook.billing.store.ItemMasterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import java.awt.*;
import java.math.BigDecimal;

/**
 * Add, rename, re-rate and delete item master entries.
 */
class ItemMasterDialog extends JDialog {

    private static final Logger logger = LoggerFactory.getLogger(ItemMasterDialog.class);

    private final ItemMasterRepository repository;
    private final Runnable onChange;
    private final MasterItemTableModel model = new MasterItemTableModel();
    private final JTable table = new JTable(model);

    ItemMasterDialog(Frame owner, ItemMasterRepository repository, Runnable onChange) {
        super(owner, "Item Master", true);
        this.repository = repository;
        this.onChange = onChange;

        table.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
        table.getColumnModel().getColumn(0).setPreferredWidth(50);
        table.getColumnModel().getColumn(1).setPreferredWidth(300);
        table.getColumnModel().getColumn(2).setPreferredWidth(100);

        JButton btnAdd = new JButton("Add");
        JButton btnEdit = new JButton("Edit");
        JButton btnDelete = new JButton("Delete");
        btnAdd.addActionListener(e -> addItem());
        btnEdit.addActionListener(e -> editItem());
        btnDelete.addActionListener(e -> deleteItem());

        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.LEFT));
        buttons.add(btnAdd);
        buttons.add(btnEdit);
        buttons.add(btnDelete);

        JPanel root = new JPanel(new BorderLayout(0, 6));
        root.setBorder(new EmptyBorder(6, 6, 6, 6));
        JScrollPane scroll = new JScrollPane(table);
        scroll.setPreferredSize(new Dimension(460, 300));
        root.add(scroll, BorderLayout.CENTER);
        root.add(buttons, BorderLayout.SOUTH);
        setContentPane(root);

        refresh();
        pack();
        setLocationRelativeTo(owner);
    }

    private void refresh() {
        model.setItems(repository.findAll());
        onChange.run();
    }

    private void addItem() {
        String name = JOptionPane.showInputDialog(this, "Item name:", "Add Item", JOptionPane.QUESTION_MESSAGE);
        if (name == null || name.isBlank()) {
            return;
        }
        BigDecimal rate = askRate("0");
        if (rate == null) {
            return;
        }
        try {
            if (!repository.add(name, rate)) {
                JOptionPane.showMessageDialog(this, "Item already exists", "Exists", JOptionPane.ERROR_MESSAGE);
            }
        } catch (BillingException e) {
            report(e);
        }
        refresh();
    }

    private void editItem() {
        int row = table.getSelectedRow();
        if (row < 0) {
            return;
        }
        MasterItem item = model.getItem(table.convertRowIndexToModel(row));
        Object name = JOptionPane.showInputDialog(this, "Item name:", "Edit Item",
                JOptionPane.QUESTION_MESSAGE, null, null, item.getName());
        if (name == null) {
            return;
        }
        BigDecimal rate = askRate(Amounts.money(item.getDefaultRate()));
        if (rate == null) {
            return;
        }
        try {
            if (!repository.update(item.getId(), name.toString(), rate)) {
                JOptionPane.showMessageDialog(this, "Item already exists", "Exists", JOptionPane.ERROR_MESSAGE);
            }
        } catch (BillingException e) {
            report(e);
        }
        refresh();
    }

    private void deleteItem() {
        int row = table.getSelectedRow();
        if (row < 0) {
            return;
        }
        MasterItem item = model.getItem(table.convertRowIndexToModel(row));
        int answer = JOptionPane.showConfirmDialog(this, "Delete '" + item.getName() + "'?", "Delete",
                JOptionPane.YES_NO_OPTION);
        if (answer != JOptionPane.YES_OPTION) {
            return;
        }
        try {
            repository.delete(item.getId());
        } catch (BillingException e) {
            report(e);
        }
        refresh();
    }

    /** @return the entered rate, or null if cancelled, not a number or negative */
    private BigDecimal askRate(String initial) {
        Object text = JOptionPane.showInputDialog(this, "Default rate:", "Rate",
                JOptionPane.QUESTION_MESSAGE, null, null, initial);
        if (text == null) {
            return null;
        }
        String s = text.toString();
        if (s.isBlank()) {
            return BigDecimal.ZERO;
        }
        if (!Amounts.isNonNegative(s)) {
            JOptionPane.showMessageDialog(this, "Enter a rate of 0 or more", "Invalid", JOptionPane.ERROR_MESSAGE);
            return null;
        }
        return Amounts.parse(s, "rate");
    }

    private void report(BillingException e) {
        logger.error("Item master update failed: {}", e.getMessage(), e);
        JOptionPane.showMessageDialog(this, e.getMessage(), "Item Master", JOptionPane.ERROR_MESSAGE);
    }
}
