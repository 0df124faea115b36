package com.finclinic.backend.enums;

/**
 * The six Financial Clinic categories. Declaration order is the scoring iteration order.
 * {@code priority} breaks ties when ranking weak categories (lower comes first).
 */
public enum FinancialCategory {
    INCOME_STREAM("Income Stream", "مصدر الدخل", 1),
    SAVINGS_HABIT("Savings Habit", "عادة الادخار", 3),
    EMERGENCY_SAVINGS("Emergency Savings", "مدخرات الطوارئ", 2),
    DEBT_MANAGEMENT("Debt Management", "إدارة الديون", 5),
    RETIREMENT_PLANNING("Retirement Planning", "التخطيط للتقاعد", 4),
    PROTECTING_FAMILY("Protecting Your Family", "حماية عائلتك", 6);

    private final String displayName;
    private final String displayNameAr;
    private final int priority;

    FinancialCategory(String displayName, String displayNameAr, int priority) {
        this.displayName = displayName;
        this.displayNameAr = displayNameAr;
        this.priority = priority;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDisplayNameAr() {
        return displayNameAr;
    }

    public int getPriority() {
        return priority;
    }
}
