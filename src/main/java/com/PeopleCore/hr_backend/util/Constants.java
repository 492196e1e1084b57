package com.PeopleCore.hr_backend.util;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    // Pagination Constants
    public static final int MAX_PAGE_SIZE = 100;

    // Date Constants
    public static final String[] MONTH_NAMES = {
            "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"
    };

    // Operational log event codes for skipped batch members
    public static final String EVENT_RATES_MISSING = "ETF_EPF_RATES_MISSING";
    public static final String EVENT_GROSS_ZERO = "ETF_EPF_GROSS_ZERO";
    public static final String EVENT_ALREADY_PROCESSED = "ETF_EPF_ALREADY_PROCESSED";
    public static final String EVENT_TRANSFER_SKIP = "SALARY_TRANSFER_SKIP";

    // Audit action types
    public static final String AUDIT_CREATE = "CREATE";
    public static final String AUDIT_UPDATE = "UPDATE";
    public static final String AUDIT_DELETE = "DELETE";
    public static final String AUDIT_DECIDE = "DECIDE";
    public static final String AUDIT_PROCESS = "PROCESS";

    // Leave decision messages
    public static final String MSG_REQUEST_APPROVED = "Request approved";
    public static final String MSG_REQUEST_REJECTED = "Request rejected";
    public static final String MSG_RESPONSE_SAVED = "Response saved";

}
