package com.finclinic.backend.services.insights;

import static com.finclinic.backend.enums.CategoryStatus.AT_RISK;
import static com.finclinic.backend.enums.CategoryStatus.EXCELLENT;
import static com.finclinic.backend.enums.CategoryStatus.GOOD;
import static com.finclinic.backend.enums.FinancialCategory.DEBT_MANAGEMENT;
import static com.finclinic.backend.enums.FinancialCategory.EMERGENCY_SAVINGS;
import static com.finclinic.backend.enums.FinancialCategory.INCOME_STREAM;
import static com.finclinic.backend.enums.FinancialCategory.PROTECTING_FAMILY;
import static com.finclinic.backend.enums.FinancialCategory.RETIREMENT_PLANNING;
import static com.finclinic.backend.enums.FinancialCategory.SAVINGS_HABIT;

import com.finclinic.backend.exceptions.CatalogInvariantException;

/**
 * Financial Clinic advisory content: 6 categories x 3 status levels, each with a default text
 * and, where the content team wrote one, demographic variants.
 */
public final class FinancialClinicInsights {

    public static final String VERSION = "fc-insights-2";

    private FinancialClinicInsights() {
    }

    public static InsightMatrix matrix() throws CatalogInvariantException {
        InsightMatrix.Builder b = InsightMatrix.builder(VERSION);

        // Income Stream
        b.add(INCOME_STREAM, AT_RISK, ConditionTag.INCOME_BELOW_30K,
                "Your income sources appear limited or inconsistent. Start by tracking your monthly budget closely "
                        + "and consider a small side activity or a skills course to add stability to your income.",
                "تبدو مصادر دخلك محدودة أو غير منتظمة. ابدأ بمتابعة ميزانيتك الشهرية عن كثب، "
                        + "وفكّر في نشاط جانبي صغير أو دورة لتطوير مهاراتك لإضافة الاستقرار إلى دخلك.");
        b.add(INCOME_STREAM, AT_RISK, ConditionTag.DEFAULT,
                "Your income sources appear limited or inconsistent. Consider building a safety net by "
                        + "diversifying income streams or exploring side opportunities.",
                "تبدو مصادر دخلك محدودة أو غير منتظمة. فكّر في بناء شبكة أمان من خلال تنويع مصادر دخلك "
                        + "أو استكشاف فرص جانبية.");
        b.add(INCOME_STREAM, GOOD, ConditionTag.INCOME_ABOVE_30K,
                "Your income health is reasonable. At your income level, putting surplus cash into a regular "
                        + "investment plan can create a second, passive income stream.",
                "وضع دخلك جيد إلى حد معقول. بمستوى دخلك الحالي، يمكن أن يؤدي استثمار الفائض النقدي في خطة استثمار "
                        + "منتظمة إلى خلق مصدر دخل ثانٍ غير مباشر.");
        b.add(INCOME_STREAM, GOOD, ConditionTag.INCOME_BELOW_30K,
                "Your income health is reasonable. Look for a consistent second source of income, such as "
                        + "part-time work or a skill you can offer, to strengthen your financial resilience.",
                "وضع دخلك جيد إلى حد معقول. ابحث عن مصدر دخل ثانٍ منتظم، مثل عمل بدوام جزئي أو مهارة يمكنك تقديمها، "
                        + "لتعزيز مرونتك المالية.");
        b.add(INCOME_STREAM, GOOD, ConditionTag.DEFAULT,
                "Your income health is reasonable and can be improved by looking for multiple streams of income "
                        + "to increase financial resilience.",
                "وضع دخلك جيد إلى حد معقول ويمكن تحسينه بالبحث عن مصادر دخل متعددة لزيادة مرونتك المالية.");
        b.add(INCOME_STREAM, EXCELLENT, ConditionTag.DEFAULT,
                "Your income stream is healthy and consistent. Continue to focus on long-term wealth building "
                        + "and optimizing your earning potential.",
                "مصدر دخلك صحي ومنتظم. واصل التركيز على بناء الثروة على المدى الطويل وتعظيم قدرتك على الكسب.");

        // Savings Habit
        b.add(SAVINGS_HABIT, AT_RISK, ConditionTag.INCOME_ABOVE_30K,
                "Your savings habit seems irregular despite a solid income. Automate a fixed transfer of at least "
                        + "15% of your salary to a savings account on payday.",
                "تبدو عادة الادخار لديك غير منتظمة رغم دخلك الجيد. اجعل تحويل 15٪ على الأقل من راتبك إلى حساب "
                        + "التوفير يتم تلقائياً في يوم استلام الراتب.");
        b.add(SAVINGS_HABIT, AT_RISK, ConditionTag.INCOME_BELOW_30K,
                "Your savings habit seems irregular or minimal. Start with a small automatic transfer, even 5% of "
                        + "your income, and increase it as your budget allows.",
                "تبدو عادة الادخار لديك غير منتظمة أو محدودة. ابدأ بتحويل تلقائي صغير، ولو بنسبة 5٪ من دخلك، "
                        + "وقم بزيادته كلما سمحت ميزانيتك بذلك.");
        b.add(SAVINGS_HABIT, AT_RISK, ConditionTag.DEFAULT,
                "Your savings habit seems irregular or minimal. Start small with automatic monthly savings "
                        + "transfers to build consistency and discipline.",
                "تبدو عادة الادخار لديك غير منتظمة أو محدودة. ابدأ بتحويلات ادخار شهرية تلقائية صغيرة "
                        + "لبناء الانتظام والانضباط.");
        b.add(SAVINGS_HABIT, GOOD, ConditionTag.EMIRATI_WOMAN,
                "You're saving occasionally. Set specific savings goals for yourself and explore savings schemes "
                        + "designed for Emirati women to grow your balance steadily.",
                "أنتِ تدخرين من حين لآخر. حددي أهدافاً ادخارية واضحة لنفسك واستكشفي برامج الادخار المصممة "
                        + "للمرأة الإماراتية لتنمية رصيدك بثبات.");
        b.add(SAVINGS_HABIT, GOOD, ConditionTag.DEFAULT,
                "You're saving occasionally, but your savings rate could be higher. Try setting specific savings "
                        + "goals aligned with your financial priorities.",
                "أنت تدخر من حين لآخر، لكن معدل ادخارك يمكن أن يكون أعلى. حاول تحديد أهداف ادخار واضحة "
                        + "تتماشى مع أولوياتك المالية.");
        b.add(SAVINGS_HABIT, EXCELLENT, ConditionTag.INCOME_ABOVE_30K,
                "You have a healthy and consistent savings routine. Consider moving part of your surplus into "
                        + "diversified long-term investments so your savings work harder for you.",
                "لديك روتين ادخار صحي ومنتظم. فكّر في نقل جزء من الفائض إلى استثمارات متنوعة طويلة الأجل "
                        + "لتعمل مدخراتك بشكل أفضل لصالحك.");
        b.add(SAVINGS_HABIT, EXCELLENT, ConditionTag.DEFAULT,
                "You have a healthy and consistent savings routine. You can now focus on optimizing returns "
                        + "through diversified investments.",
                "لديك روتين ادخار صحي ومنتظم. يمكنك الآن التركيز على تعظيم العوائد من خلال استثمارات متنوعة.");

        // Emergency Savings
        b.add(EMERGENCY_SAVINGS, AT_RISK, ConditionTag.CHILDREN_ZERO,
                "You do not have enough funds set aside for unexpected expenses. Aim to build an emergency fund "
                        + "covering at least 3 months of essential expenses in an easily accessible account.",
                "ليس لديك أموال كافية مخصصة للنفقات غير المتوقعة. احرص على بناء صندوق طوارئ يغطي 3 أشهر "
                        + "على الأقل من نفقاتك الأساسية في حساب يسهل الوصول إليه.");
        b.add(EMERGENCY_SAVINGS, AT_RISK, ConditionTag.CHILDREN_ABOVE_ZERO,
                "With dependents relying on you, an emergency fund is essential. Aim to set aside at least 6 months "
                        + "of household expenses, starting with a fixed monthly amount.",
                "مع وجود من يعتمدون عليك، يصبح صندوق الطوارئ أمراً ضرورياً. احرص على ادخار ما يعادل 6 أشهر "
                        + "على الأقل من نفقات الأسرة، بدءاً بمبلغ شهري ثابت.");
        b.add(EMERGENCY_SAVINGS, AT_RISK, ConditionTag.DEFAULT,
                "You do not have enough funds set aside for unexpected expenses. Aim to build an emergency fund "
                        + "covering at least 3-6 months of essential expenses.",
                "ليس لديك أموال كافية مخصصة للنفقات غير المتوقعة. احرص على بناء صندوق طوارئ يغطي من 3 إلى 6 أشهر "
                        + "على الأقل من نفقاتك الأساسية.");
        b.add(EMERGENCY_SAVINGS, GOOD, ConditionTag.CHILDREN_ABOVE_ZERO,
                "You have a partial safety net, but a family needs a larger buffer. Work towards 6 months of "
                        + "household expenses, including school fees.",
                "لديك شبكة أمان جزئية، لكن الأسرة تحتاج إلى احتياطي أكبر. اعمل على الوصول إلى ما يعادل 6 أشهر "
                        + "من نفقات الأسرة، بما في ذلك الرسوم المدرسية.");
        b.add(EMERGENCY_SAVINGS, GOOD, ConditionTag.ELSE,
                "You have a partial safety net. Keep adding to it every month until it covers 6 months of your "
                        + "expenses.",
                "لديك شبكة أمان جزئية. استمر في الإضافة إليها كل شهر حتى تغطي 6 أشهر من نفقاتك.");
        b.add(EMERGENCY_SAVINGS, GOOD, ConditionTag.DEFAULT,
                "You have a partial safety net, but it may not be sufficient for larger financial shocks. Work on "
                        + "increasing your emergency fund to 6 months of expenses.",
                "لديك شبكة أمان جزئية، لكنها قد لا تكفي لمواجهة الصدمات المالية الكبيرة. اعمل على زيادة صندوق "
                        + "الطوارئ ليغطي 6 أشهر من نفقاتك.");
        b.add(EMERGENCY_SAVINGS, EXCELLENT, ConditionTag.DEFAULT,
                "You're well-prepared for emergencies with strong liquidity. You can now focus on investing "
                        + "surplus funds for long-term growth.",
                "أنت مستعد جيداً لحالات الطوارئ بسيولة قوية. يمكنك الآن التركيز على استثمار الأموال الفائضة "
                        + "لتحقيق نمو طويل الأجل.");

        // Debt Management
        b.add(DEBT_MANAGEMENT, AT_RISK, ConditionTag.INCOME_BELOW_30K,
                "Debt repayments may be taking a large share of your income. Speak to your bank about "
                        + "restructuring, pay off high-interest debt first and avoid new borrowing.",
                "قد تستحوذ أقساط الديون على جزء كبير من دخلك. تحدث مع بنكك بشأن إعادة الجدولة، وسدد الديون "
                        + "ذات الفائدة المرتفعة أولاً، وتجنب الاقتراض الجديد.");
        b.add(DEBT_MANAGEMENT, AT_RISK, ConditionTag.DEFAULT,
                "Your debt levels or repayment habits may be affecting your financial flexibility. Prioritize "
                        + "paying off high-interest debt and avoid taking on new debt.",
                "قد يؤثر مستوى ديونك أو عادات السداد لديك على مرونتك المالية. أعطِ الأولوية لسداد الديون "
                        + "ذات الفائدة المرتفعة وتجنب الحصول على ديون جديدة.");
        b.add(DEBT_MANAGEMENT, GOOD, ConditionTag.DEFAULT,
                "You manage your debt moderately well, but there's room for improvement. Consider consolidating "
                        + "high-interest debts or increasing monthly payments.",
                "أنت تدير ديونك بشكل جيد إلى حد ما، لكن هناك مجال للتحسين. فكّر في دمج الديون ذات الفائدة "
                        + "المرتفعة أو زيادة الدفعات الشهرية.");
        b.add(DEBT_MANAGEMENT, EXCELLENT, ConditionTag.DEFAULT,
                "You maintain excellent control over your debt. Continue this discipline and use credit "
                        + "strategically for wealth-building purposes.",
                "تحافظ على سيطرة ممتازة على ديونك. واصل هذا الانضباط واستخدم الائتمان بشكل استراتيجي "
                        + "لأغراض بناء الثروة.");

        // Retirement Planning
        b.add(RETIREMENT_PLANNING, AT_RISK, ConditionTag.INCOME_ABOVE_30K,
                "You haven't yet started planning for retirement. Your income gives you room to start a regular "
                        + "retirement investment plan today, and time is your biggest advantage.",
                "لم تبدأ بعد في التخطيط للتقاعد. يتيح لك دخلك البدء بخطة استثمار منتظمة للتقاعد اليوم، "
                        + "والوقت هو أكبر ميزة لديك.");
        b.add(RETIREMENT_PLANNING, AT_RISK, ConditionTag.EMIRATI_WOMAN,
                "You haven't yet started planning for retirement. Review your pension entitlements and "
                        + "complement them with a personal savings plan, even with small contributions.",
                "لم تبدئي بعد في التخطيط للتقاعد. راجعي مستحقاتك التقاعدية وادعميها بخطة ادخار شخصية، "
                        + "ولو بمساهمات صغيرة.");
        b.add(RETIREMENT_PLANNING, AT_RISK, ConditionTag.DEFAULT,
                "You haven't yet started planning for retirement. Starting today, even with small contributions, "
                        + "can make a significant difference over time.",
                "لم تبدأ بعد في التخطيط للتقاعد. البدء اليوم، ولو بمساهمات صغيرة، يمكن أن يحدث فرقاً كبيراً "
                        + "مع مرور الوقت.");
        b.add(RETIREMENT_PLANNING, GOOD, ConditionTag.EMIRATI_WOMAN,
                "You have some plans for retirement. Review your pension entitlements and consider topping them "
                        + "up with a personal retirement savings plan.",
                "لديكِ بعض الخطط للتقاعد. راجعي مستحقاتك التقاعدية وفكّري في تعزيزها بخطة ادخار شخصية للتقاعد.");
        b.add(RETIREMENT_PLANNING, GOOD, ConditionTag.ELSE,
                "You have some plans for retirement but may not be saving enough. Increase your contributions "
                        + "gradually, for example with every salary raise.",
                "لديك بعض الخطط للتقاعد لكنك قد لا تدخر بما يكفي. قم بزيادة مساهماتك تدريجياً، "
                        + "على سبيل المثال مع كل زيادة في الراتب.");
        b.add(RETIREMENT_PLANNING, GOOD, ConditionTag.DEFAULT,
                "You have some plans for retirement but may not be saving enough. Consider increasing your "
                        + "contributions to retirement accounts and reviewing your investment strategy.",
                "لديك بعض الخطط للتقاعد لكنك قد لا تدخر بما يكفي. فكّر في زيادة مساهماتك في حسابات التقاعد "
                        + "ومراجعة استراتيجيتك الاستثمارية.");
        b.add(RETIREMENT_PLANNING, EXCELLENT, ConditionTag.DEFAULT,
                "You're actively preparing for retirement. Keep reviewing your portfolio to ensure it is "
                        + "well-diversified and aligned with your long-term goals.",
                "أنت تستعد للتقاعد بشكل فعّال. استمر في مراجعة محفظتك للتأكد من تنوعها وتوافقها "
                        + "مع أهدافك طويلة الأجل.");

        // Protecting Your Family
        b.add(PROTECTING_FAMILY, AT_RISK, ConditionTag.CHILDREN_ZERO,
                "You may not have adequate protection for yourself. Explore Takaful cover that protects your "
                        + "income and your future plans.",
                "قد لا تكون لديك حماية كافية لنفسك. استكشف تغطية التكافل التي تحمي دخلك وخططك المستقبلية.");
        b.add(PROTECTING_FAMILY, AT_RISK, ConditionTag.CHILDREN_ABOVE_ZERO,
                "Your family may not be adequately protected. Explore Takaful (Islamic insurance) and education "
                        + "savings plans to safeguard your children's future.",
                "قد لا تكون عائلتك محمية بشكل كافٍ. استكشف التكافل (التأمين الإسلامي) وخطط ادخار التعليم "
                        + "لحماية مستقبل أطفالك.");
        b.add(PROTECTING_FAMILY, AT_RISK, ConditionTag.DEFAULT,
                "You may not have adequate protection for yourself or your family. Explore Takaful (Islamic "
                        + "insurance) and savings plans to safeguard your loved ones.",
                "قد لا تكون لديك حماية كافية لنفسك أو لعائلتك. استكشف التكافل (التأمين الإسلامي) وخطط الادخار "
                        + "لحماية أحبائك.");
        b.add(PROTECTING_FAMILY, GOOD, ConditionTag.CHILDREN_ABOVE_ZERO,
                "You have basic protection for your family, but coverage may be limited. Review your Takaful "
                        + "cover and your children's education savings every year.",
                "لديك حماية أساسية لعائلتك، لكن التغطية قد تكون محدودة. راجع تغطية التكافل ومدخرات تعليم "
                        + "أطفالك كل عام.");
        b.add(PROTECTING_FAMILY, GOOD, ConditionTag.DEFAULT,
                "You have basic financial protection for your family, but coverage may be limited. Review your "
                        + "insurance needs annually as your circumstances change.",
                "لديك حماية مالية أساسية لعائلتك، لكن التغطية قد تكون محدودة. راجع احتياجاتك التأمينية سنوياً "
                        + "مع تغير ظروفك.");
        b.add(PROTECTING_FAMILY, EXCELLENT, ConditionTag.DEFAULT,
                "You have built-in systems for financial protection. Keep your coverage updated as your family "
                        + "situation and financial goals evolve.",
                "لديك أنظمة راسخة للحماية المالية. حافظ على تحديث تغطيتك مع تطور وضع عائلتك وأهدافك المالية.");

        return b.build();
    }
}
