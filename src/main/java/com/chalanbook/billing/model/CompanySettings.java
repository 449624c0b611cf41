package com.chalanbook.billing.model;

/**
 * Company and bank details printed on every chalan.
 */
public class CompanySettings {

    public static final String DEFAULT_COMPANY_NAME = "COMPANY NAME";
    public static final String DEFAULT_COMPANY_CITY = "CITY";
    public static final String DEFAULT_COMPANY_MOBILE = "+91-123456789";
    public static final String DEFAULT_BANK_ACCOUNT_NAME = "VIVEK G. RUPAPARA";
    public static final String DEFAULT_BANK_NAME = "BANK";
    public static final String DEFAULT_BANK_ACCOUNT_NO = "123456789";
    public static final String DEFAULT_BANK_IFSC = "XYZ0123456";

    private String companyName = DEFAULT_COMPANY_NAME;
    private String companyCity = DEFAULT_COMPANY_CITY;
    private String companyMobile = DEFAULT_COMPANY_MOBILE;

    private String bankAccountName = DEFAULT_BANK_ACCOUNT_NAME;
    private String bankName = DEFAULT_BANK_NAME;
    private String bankAccountNo = DEFAULT_BANK_ACCOUNT_NO;
    private String bankIfsc = DEFAULT_BANK_IFSC;

    /** Optional image printed above the company name; blank for none. */
    private String logoPath = "";

    public CompanySettings() {}

    public String getCompanyName() { return companyName; }
    public void setCompanyName(String companyName) { this.companyName = companyName; }

    public String getCompanyCity() { return companyCity; }
    public void setCompanyCity(String companyCity) { this.companyCity = companyCity; }

    public String getCompanyMobile() { return companyMobile; }
    public void setCompanyMobile(String companyMobile) { this.companyMobile = companyMobile; }

    public String getBankAccountName() { return bankAccountName; }
    public void setBankAccountName(String bankAccountName) { this.bankAccountName = bankAccountName; }

    public String getBankName() { return bankName; }
    public void setBankName(String bankName) { this.bankName = bankName; }

    public String getBankAccountNo() { return bankAccountNo; }
    public void setBankAccountNo(String bankAccountNo) { this.bankAccountNo = bankAccountNo; }

    public String getBankIfsc() { return bankIfsc; }
    public void setBankIfsc(String bankIfsc) { this.bankIfsc = bankIfsc; }

    public String getLogoPath() { return logoPath; }
    public void setLogoPath(String logoPath) { this.logoPath = logoPath; }
}
