package com.finclinic.backend.services.catalog;

import java.util.ArrayList;
import java.util.List;

import com.finclinic.backend.enums.FinancialCategory;

/**
 * Financial Clinic question content.
 *
 * Revision {@value #CURRENT_REVISION} is the live 15-question set. Revision
 * {@value #LEGACY_REVISION} is the earlier 16-question set, kept so submissions stored under it
 * can be re-scored with the weights they were answered against.
 */
public final class FinancialClinicQuestions {

    public static final String CURRENT_REVISION = "fc-15";
    public static final String LEGACY_REVISION = "fc-16";

    private FinancialClinicQuestions() {
    }

    public static List<Question> current() {
        List<Question> out = new ArrayList<>();
        out.add(q1());
        out.add(q2());
        out.add(q3());
        out.add(q4());
        out.add(q5());
        out.add(q6());
        out.add(q7(10));
        out.add(q8());
        out.add(q9());
        out.add(q10());
        out.add(q11());
        out.add(q12());
        out.add(q13());
        out.add(q14());
        out.add(childrenEducation("fc_q15", 15));
        return List.copyOf(out);
    }

    /**
     * 16-question revision: emergency savings coverage (Q7) weighed 5 instead of 10, and a
     * will/estate planning question preceded the children's education question.
     *
     * Only the ids and weights of this revision survive in the migration records. The Q15
     * wording and its options below are reconstructed; they affect display only, scoring
     * depends on the weights alone.
     */
    public static List<Question> legacy() {
        List<Question> out = new ArrayList<>();
        out.add(q1());
        out.add(q2());
        out.add(q3());
        out.add(q4());
        out.add(q5());
        out.add(q6());
        out.add(q7(5));
        out.add(q8());
        out.add(q9());
        out.add(q10());
        out.add(q11());
        out.add(q12());
        out.add(q13());
        out.add(q14());
        out.add(question("fc_q15", 15, FinancialCategory.PROTECTING_FAMILY, 5,
                "Have you prepared a will or an estate plan for your family?",
                "هل قمت بإعداد وصية أو خطة لتوزيع التركة لعائلتك؟",
                AnswerOption.of(5, "Yes, it is registered and reviewed regularly", "نعم، وهي مسجلة وتتم مراجعتها بانتظام"),
                AnswerOption.of(4, "Yes, it is registered but not reviewed recently", "نعم، وهي مسجلة ولكن لم تتم مراجعتها مؤخراً"),
                AnswerOption.of(3, "I have drafted one but not registered it", "قمت بصياغتها ولكن لم أسجلها"),
                AnswerOption.of(2, "I plan to prepare one soon", "أخطط لإعدادها قريباً"),
                AnswerOption.of(1, "I have not thought about it", "لم أفكر في ذلك")));
        out.add(childrenEducation("fc_q16", 16));
        return List.copyOf(out);
    }

    // ==================== INCOME STREAM ====================

    private static Question q1() {
        return question("fc_q1", 1, FinancialCategory.INCOME_STREAM, 5,
                "How well are you managing your household monthly expenses?",
                "ما مدى نجاحك في إدارة نفقاتك الشهرية المنزلية؟",
                AnswerOption.of(5, "My monthly expenses are always below my budget", "نفقاتي الشهرية دائماً أقل من ميزانيتي"),
                AnswerOption.of(4, "I stay within my budget every month", "أبقى ضمن ميزانيتي كل شهر"),
                AnswerOption.of(3, "My budget stays on track on most months", "ميزانيتي تسير على المسار الصحيح في معظم الأشهر"),
                AnswerOption.of(2, "I usually go over budget with my spending", "عادةً ما أتجاوز الميزانية مع إنفاقي"),
                AnswerOption.of(1, "I am unable to manage my monthly expenses", "أنا غير قادر على إدارة نفقاتي الشهرية"));
    }

    private static Question q2() {
        return question("fc_q2", 2, FinancialCategory.INCOME_STREAM, 10,
                "Do you have more than one source of income?",
                "هل لديك أكثر من مصدر دخل؟",
                AnswerOption.of(5, "I have multiple & consistent income streams", "لدي مصادر دخل متعددة ومتسقة"),
                AnswerOption.of(4, "I have additional income but they are not consistent", "لدي دخل إضافي ولكن ليس متسقاً"),
                AnswerOption.of(3, "I have only 1 stream of consistent income", "لدي مصدر دخل واحد فقط متسق"),
                AnswerOption.of(2, "I have only 1 stream of income and it is not consistent", "لدي مصدر دخل واحد فقط وليس متسقاً"),
                AnswerOption.of(1, "I currently have no income stream", "ليس لدي حالياً أي مصدر دخل"));
    }

    // ==================== SAVINGS HABIT ====================

    private static Question q3() {
        return question("fc_q3", 3, FinancialCategory.SAVINGS_HABIT, 10,
                "How much of your total income are you able to save every month?",
                "ما مقدار إجمالي دخلك الذي تستطيع ادخاره كل شهر؟",
                AnswerOption.of(5, "More than 20% of my income", "أكثر من 20٪ من دخلي"),
                AnswerOption.of(4, "15% to 20% of my income", "15٪ إلى 20٪ من دخلي"),
                AnswerOption.of(3, "5% to 15% of my income", "5٪ إلى 15٪ من دخلي"),
                AnswerOption.of(2, "Up to 5% of my income", "ما يصل إلى 5٪ من دخلي"),
                AnswerOption.of(1, "I am not able to save from my income", "لا أستطيع الادخار من دخلي"));
    }

    private static Question q4() {
        return question("fc_q4", 4, FinancialCategory.SAVINGS_HABIT, 5,
                "What is the typical duration of your savings goals?",
                "ما هي المدة النموذجية لأهداف الادخار الخاصة بك؟",
                AnswerOption.of(5, "I primarily save and invest for long-term goals (over 3 years)", "أدخر وأستثمر بشكل أساسي لأهداف طويلة الأجل (أكثر من 3 سنوات)"),
                AnswerOption.of(4, "I save for medium-term goals (1-3 years)", "أدخر لأهداف متوسطة الأجل (1-3 سنوات)"),
                AnswerOption.of(3, "I save for both short- and long-term goals", "أدخر لأهداف قصيرة وطويلة الأجل"),
                AnswerOption.of(2, "I save for short-term goals (less than 1 year)", "أدخر لأهداف قصيرة الأجل (أقل من سنة واحدة)"),
                AnswerOption.of(1, "I usually save only for immediate needs or emergencies", "عادةً أدخر فقط للاحتياجات الفورية أو حالات الطوارئ"));
    }

    private static Question q5() {
        return question("fc_q5", 5, FinancialCategory.SAVINGS_HABIT, 5,
                "When your income increases, how does your spending behavior change?",
                "عندما يزداد دخلك، كيف يتغير سلوك الإنفاق لديك؟",
                AnswerOption.of(5, "My spending remains the same", "إنفاقي يبقى كما هو"),
                AnswerOption.of(4, "My spending increases slightly", "إنفاقي يزداد قليلاً"),
                AnswerOption.of(3, "My spending increase is the same as my income increase", "زيادة إنفاقي تساوي زيادة دخلي"),
                AnswerOption.of(2, "My spending increase is slightly higher than my income increase", "زيادة إنفاقي أعلى قليلاً من زيادة دخلي"),
                AnswerOption.of(1, "My spending is much higher than my income increase", "إنفاقي أعلى بكثير من زيادة دخلي"));
    }

    // ==================== EMERGENCY SAVINGS ====================

    private static Question q6() {
        return question("fc_q6", 6, FinancialCategory.EMERGENCY_SAVINGS, 5,
                "Are you actively saving in an emergency fund?",
                "هل تدخر بنشاط في صندوق الطوارئ؟",
                AnswerOption.of(5, "I already have a sufficient emergency fund", "لدي بالفعل صندوق طوارئ كافٍ"),
                AnswerOption.of(4, "I save every month towards my emergency fund", "أدخر كل شهر لصندوق الطوارئ الخاص بي"),
                AnswerOption.of(3, "I try to save consistently but not every month", "أحاول الادخار بانتظام لكن ليس كل شهر"),
                AnswerOption.of(2, "I save when I can but not consistently", "أدخر عندما أستطيع ولكن ليس بشكل منتظم"),
                AnswerOption.of(1, "One day I will start saving", "يوماً ما سأبدأ في الادخار"));
    }

    private static Question q7(int weight) {
        return question("fc_q7", 7, FinancialCategory.EMERGENCY_SAVINGS, weight,
                "Do you have enough emergency savings that can cover your basic expenses?",
                "هل لديك مدخرات طوارئ كافية يمكن أن تغطي نفقاتك الأساسية؟",
                AnswerOption.of(5, "I can cover more than 6 months of my expenses", "أستطيع تغطية أكثر من 6 أشهر من نفقاتي"),
                AnswerOption.of(4, "I can cover 5 to 6 months of my expenses", "أستطيع تغطية 5 إلى 6 أشهر من نفقاتي"),
                AnswerOption.of(3, "I can cover 3 to 4 months of my expenses", "أستطيع تغطية 3 إلى 4 أشهر من نفقاتي"),
                AnswerOption.of(2, "I can cover up to 3 months of my expenses", "أستطيع تغطية ما يصل إلى 3 أشهر من نفقاتي"),
                AnswerOption.of(1, "I cannot cover my expenses", "لا أستطيع تغطية نفقاتي"));
    }

    private static Question q8() {
        return question("fc_q8", 8, FinancialCategory.EMERGENCY_SAVINGS, 5,
                "Where do you keep your emergency savings?",
                "أين تحتفظ بمدخرات الطوارئ الخاصة بك؟",
                AnswerOption.of(5, "In my savings or current bank account", "في حساب التوفير أو الحساب الجاري الخاص بي"),
                AnswerOption.of(4, "In term or fixed deposits", "في ودائع لأجل أو ثابتة"),
                AnswerOption.of(3, "In my investment account", "في حساب الاستثمار الخاص بي"),
                AnswerOption.of(2, "In the form of assets/commodities (gold/silver etc.)", "في شكل أصول/سلع (ذهب/فضة إلخ)"),
                AnswerOption.of(1, "I do not have emergency savings", "ليس لدي مدخرات طوارئ"));
    }

    // ==================== DEBT MANAGEMENT ====================

    private static Question q9() {
        return question("fc_q9", 9, FinancialCategory.DEBT_MANAGEMENT, 10,
                "How often are you able to pay your bills and loan installments on time?",
                "كم مرة تستطيع دفع فواتيرك وأقساط القروض في الوقت المحدد؟",
                AnswerOption.of(5, "I make my payments every month", "أقوم بدفع مستحقاتي كل شهر"),
                AnswerOption.of(4, "I make my monthly payments but not consistently", "أقوم بدفع مستحقاتي الشهرية ولكن ليس بشكل منتظم"),
                AnswerOption.of(3, "I occasionally make my monthly payments", "أحياناً أقوم بدفع مستحقاتي الشهرية"),
                AnswerOption.of(2, "I miss most of my monthly payments", "أفوت معظم مدفوعاتي الشهرية"),
                AnswerOption.of(1, "I am not able to make my monthly payments", "لا أستطيع دفع مستحقاتي الشهرية"));
    }

    private static Question q10() {
        return question("fc_q10", 10, FinancialCategory.DEBT_MANAGEMENT, 5,
                "What percentage of monthly income goes to debt payments?",
                "ما هي النسبة المئوية من الدخل الشهري التي تذهب لسداد الديون؟",
                AnswerOption.of(5, "I have no debt", "ليس لدي ديون"),
                AnswerOption.of(4, "Less than 20% of my monthly income", "أقل من 20٪ من دخلي الشهري"),
                AnswerOption.of(3, "Less than 35% of my monthly income", "أقل من 35٪ من دخلي الشهري"),
                AnswerOption.of(2, "Less than 50% of my monthly income", "أقل من 50٪ من دخلي الشهري"),
                AnswerOption.of(1, "More than 50% of my monthly income", "أكثر من 50٪ من دخلي الشهري"));
    }

    // ==================== RETIREMENT PLANNING ====================

    private static Question q11() {
        return question("fc_q11", 11, FinancialCategory.RETIREMENT_PLANNING, 5,
                "Are you actively saving or investing for retirement?",
                "هل تدخر أو تستثمر بنشاط للتقاعد؟",
                AnswerOption.of(5, "Yes, contributing regularly for a retirement plan and with a stable plan", "نعم، أساهم بانتظام في خطة تقاعد ولدي خطة مستقرة"),
                AnswerOption.of(4, "Yes, I save for retirement occasionally, but my contributions vary depending on my monthly expenses", "نعم، أدخر للتقاعد أحياناً، لكن مساهماتي تتفاوت حسب نفقاتي الشهرية"),
                AnswerOption.of(3, "I have started saving or investing for retirement, but I don't have a clear plan or specific goal", "بدأت في الادخار أو الاستثمار للتقاعد، لكن ليس لدي خطة واضحة أو هدف محدد"),
                AnswerOption.of(2, "Yes, but I save whenever I can and without a clear plan", "نعم، لكنني أدخر متى استطعت وبدون خطة واضحة"),
                AnswerOption.of(1, "No, I have not thought about saving for retirement", "لا، لم أفكر في الادخار للتقاعد"));
    }

    private static Question q12() {
        return question("fc_q12", 12, FinancialCategory.RETIREMENT_PLANNING, 10,
                "How confident do you feel about maintaining a comfortable lifestyle after retirement?",
                "ما مدى ثقتك في الحفاظ على نمط حياة مريح بعد التقاعد؟",
                AnswerOption.of(5, "I have already secured a retirement income", "لقد أمّنت بالفعل دخلاً للتقاعد"),
                AnswerOption.of(4, "I am highly confident of having a stable income after retirement", "أنا واثق جداً من الحصول على دخل مستقر بعد التقاعد"),
                AnswerOption.of(3, "I am somewhat confident of having a stable income after retirement", "أنا واثق إلى حد ما من الحصول على دخل مستقر بعد التقاعد"),
                AnswerOption.of(2, "I am not very confident of having a stable income after retirement", "لست واثقاً جداً من الحصول على دخل مستقر بعد التقاعد"),
                AnswerOption.of(1, "I am certain I will not have a stable income after retirement", "أنا متأكد أنني لن أحصل على دخل مستقر بعد التقاعد"));
    }

    private static Question q13() {
        return question("fc_q13", 13, FinancialCategory.RETIREMENT_PLANNING, 5,
                "How much of your current income will you be able to cover after your retirement?",
                "ما مقدار دخلك الحالي الذي ستتمكن من تغطيته بعد تقاعدك؟",
                AnswerOption.of(5, "My retirement income will be able to provide more than 80% of my current income", "سيتمكن دخل التقاعد من توفير أكثر من 80٪ من دخلي الحالي"),
                AnswerOption.of(4, "My retirement income will be able to provide 50% to 80% of my current income", "سيتمكن دخل التقاعد من توفير 50٪ إلى 80٪ من دخلي الحالي"),
                AnswerOption.of(3, "My retirement income will be able to provide 20% to 50% of my current income", "سيتمكن دخل التقاعد من توفير 20٪ إلى 50٪ من دخلي الحالي"),
                AnswerOption.of(2, "My retirement income will be able to provide up to 20% of my current income", "سيتمكن دخل التقاعد من توفير ما يصل إلى 20٪ من دخلي الحالي"),
                AnswerOption.of(1, "I am certain I will not have a stable income after retirement", "أنا متأكد أنني لن أحصل على دخل مستقر بعد التقاعد"));
    }

    // ==================== PROTECTING YOUR FAMILY ====================

    private static Question q14() {
        return question("fc_q14", 14, FinancialCategory.PROTECTING_FAMILY, 5,
                "Do you have adequate life Takaful/Insurance coverage?",
                "هل لديك تغطية تكافل/تأمين على الحياة كافية؟",
                AnswerOption.of(5, "I have sufficient coverage to cover 12 months of my income", "لدي تغطية كافية لتغطية 12 شهراً من دخلي"),
                AnswerOption.of(4, "I have sufficient coverage to cover up to 11 months of my income", "لدي تغطية كافية لتغطية ما يصل إلى 11 شهراً من دخلي"),
                AnswerOption.of(3, "I have enough coverage to cover up to 5 months of my income", "لدي تغطية كافية لتغطية ما يصل إلى 5 أشهر من دخلي"),
                AnswerOption.of(2, "I have enough coverage for up to 3 months of my income", "لدي تغطية كافية لما يصل إلى 3 أشهر من دخلي"),
                AnswerOption.of(1, "I do not have any coverage", "ليس لدي أي تغطية"));
    }

    // Only asked to respondents with dependents; everyone else is scored as if they answered 5.
    private static Question childrenEducation(String id, int number) {
        return new Question(id, number, FinancialCategory.PROTECTING_FAMILY, 5,
                LocalizedText.of(
                        "Are you actively saving for education savings for your children?",
                        "هل تدخر بنشاط لمدخرات تعليم أطفالك؟"),
                List.of(
                        AnswerOption.of(5, "I don't have any need to save for my children's education", "ليس لدي أي حاجة للادخار لتعليم أطفالي"),
                        AnswerOption.of(4, "Yes, I have sufficient funds for my children's education", "نعم، لدي أموال كافية لتعليم أطفالي"),
                        AnswerOption.of(3, "Yes, I am saving towards having a sufficient education fund", "نعم، أدخر نحو الحصول على صندوق تعليم كافٍ"),
                        AnswerOption.of(2, "Yes, but I am starting to save for an education fund", "نعم، لكنني بدأت في الادخار لصندوق تعليم"),
                        AnswerOption.of(1, "Yes, but I do not have any education saving for my children", "نعم، لكن ليس لدي أي مدخرات تعليمية لأطفالي")),
                true);
    }

    private static Question question(
            String id,
            int number,
            FinancialCategory category,
            int weight,
            String textEn,
            String textAr,
            AnswerOption... options
    ) {
        return new Question(id, number, category, weight, LocalizedText.of(textEn, textAr), List.of(options), false);
    }
}
