package com.polychaeta.bot.triage;

public final class Texts {
    private Texts() {
    }

    public static final String AUTOCLOSE_SCHEDULED =
            "This issue will be automatically closed in one week unless there is further activity.";

    public static final String AUTOCLOSE_CANCELLED =
            "This issue will no longer be automatically closed.";

    public static final String PR_GREETING = "Thanks for your contribution to FRR!\n\n";

    public static final String PR_WARN_SIGNOFF =
            "* One of your commits is missing a `Signed-off-by` line; we can't accept your contribution until all of your commits have one\n";

    public static final String PR_WARN_COMMIT_MSG =
            "* One of your commits has an improperly formatted commit message\n";

    public static final String PR_GUIDELINES_REF =
            "\nIf you are a new contributor to FRR, please see our [contributing guidelines]"
                    + "(http://docs.frrouting.org/projects/dev-guide/en/latest/workflow.html#coding-practices-style).\n";

    /** Comment posted when a label schedules a close after {@code days} days. */
    public static String autocloseScheduled(int days) {
        if (days == 7) return AUTOCLOSE_SCHEDULED;
        return "This issue will be automatically closed in " + days + (days == 1 ? " day" : " days")
                + " unless there is further activity.";
    }
}
