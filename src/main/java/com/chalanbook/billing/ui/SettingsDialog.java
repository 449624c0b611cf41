package com.chalanbook.billing.ui;

import com.chalanbook.billing.exception.BillingException;
import com.chalanbook.billing.model.CompanySettings;
import com.chalanbook.billing.store.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;

/**
 * Edits the company and bank details printed on the PDF.
 */
class SettingsDialog extends JDialog {

    private static final Logger logger = LoggerFactory.getLogger(SettingsDialog.class);

    private final SettingsStore store;

    private final JTextField tfName = new JTextField(32);
    private final JTextField tfCity = new JTextField(32);
    private final JTextField tfMobile = new JTextField(32);
    private final JTextField tfAccountName = new JTextField(32);
    private final JTextField tfBank = new JTextField(32);
    private final JTextField tfAccountNo = new JTextField(32);
    private final JTextField tfIfsc = new JTextField(32);
    private final JTextField tfLogo = new JTextField(32);

    SettingsDialog(Frame owner, SettingsStore store) {
        super(owner, "Settings", true);
        this.store = store;

        CompanySettings s = store.load();
        tfName.setText(s.getCompanyName());
        tfCity.setText(s.getCompanyCity());
        tfMobile.setText(s.getCompanyMobile());
        tfAccountName.setText(s.getBankAccountName());
        tfBank.setText(s.getBankName());
        tfAccountNo.setText(s.getBankAccountNo());
        tfIfsc.setText(s.getBankIfsc());
        tfLogo.setText(s.getLogoPath());

        JPanel p = new JPanel(new GridBagLayout());
        p.setBorder(new EmptyBorder(8, 8, 8, 8));
        GridBagConstraints c = new GridBagConstraints();
        c.insets = new Insets(4, 6, 4, 6);
        c.anchor = GridBagConstraints.WEST;

        int y = 0;
        addRow(p, c, y++, "Company Name", tfName);
        addRow(p, c, y++, "City", tfCity);
        addRow(p, c, y++, "Mobile", tfMobile);
        addRow(p, c, y++, "Bank A/C Name", tfAccountName);
        addRow(p, c, y++, "Bank Name", tfBank);
        addRow(p, c, y++, "Bank A/C No", tfAccountNo);
        addRow(p, c, y++, "IFSC", tfIfsc);
        addRow(p, c, y, "Logo Path", tfLogo);

        JButton btnBrowse = new JButton("Browse");
        btnBrowse.addActionListener(e -> pickLogo());
        c.gridx = 2;
        c.gridy = y++;
        p.add(btnBrowse, c);

        JButton btnSave = new JButton("Save");
        btnSave.addActionListener(e -> save());
        c.gridx = 1;
        c.gridy = y;
        c.anchor = GridBagConstraints.EAST;
        p.add(btnSave, c);

        setContentPane(p);
        pack();
        setLocationRelativeTo(owner);
    }

    private static void addRow(JPanel p, GridBagConstraints c, int y, String label, JComponent field) {
        c.gridx = 0;
        c.gridy = y;
        p.add(new JLabel(label), c);
        c.gridx = 1;
        p.add(field, c);
    }

    private void pickLogo() {
        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle("Select logo (PNG/JPG)");
        chooser.setFileFilter(new FileNameExtensionFilter("Images", "png", "jpg", "jpeg", "gif"));
        if (chooser.showOpenDialog(this) == JFileChooser.APPROVE_OPTION) {
            tfLogo.setText(chooser.getSelectedFile().getAbsolutePath());
        }
    }

    private void save() {
        CompanySettings s = new CompanySettings();
        s.setCompanyName(tfName.getText());
        s.setCompanyCity(tfCity.getText());
        s.setCompanyMobile(tfMobile.getText());
        s.setBankAccountName(tfAccountName.getText());
        s.setBankName(tfBank.getText());
        s.setBankAccountNo(tfAccountNo.getText());
        s.setBankIfsc(tfIfsc.getText());
        s.setLogoPath(tfLogo.getText());
        try {
            store.save(s);
        } catch (BillingException e) {
            logger.error("Saving settings failed: {}", e.getMessage(), e);
            JOptionPane.showMessageDialog(this, e.getMessage(), "Settings", JOptionPane.ERROR_MESSAGE);
            return;
        }
        dispose();
        JOptionPane.showMessageDialog(getOwner(), "Saved", "Settings", JOptionPane.INFORMATION_MESSAGE);
    }
}
