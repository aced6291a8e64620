package com.gatekeeper.authgovernor.domain;

/**
 * Human-readable remaining-time strings and block notices in Arabic and English.
 */
public final class BlockMessages {

    private BlockMessages() {
    }

    public static String formatRemainingAr(long totalSeconds) {
        if (totalSeconds <= 0) {
            return "انتهت مدة الحظر";
        }
        long days = totalSeconds / 86_400;
        long hours = totalSeconds / 3_600;
        long minutes = totalSeconds / 60;
        if (days > 0) {
            return days + " يوم و " + (hours % 24) + " ساعة";
        }
        if (hours > 0) {
            return hours + " ساعة و " + (minutes % 60) + " دقيقة";
        }
        if (minutes > 0) {
            return minutes + " دقيقة";
        }
        return totalSeconds + " ثانية";
    }

    public static String formatRemainingEn(long totalSeconds) {
        if (totalSeconds <= 0) {
            return "block expired";
        }
        long days = totalSeconds / 86_400;
        long hours = totalSeconds / 3_600;
        long minutes = totalSeconds / 60;
        if (days > 0) {
            return plural(days, "day") + " " + plural(hours % 24, "hour");
        }
        if (hours > 0) {
            return plural(hours, "hour") + " " + plural(minutes % 60, "minute");
        }
        if (minutes > 0) {
            return plural(minutes, "minute");
        }
        return plural(totalSeconds, "second");
    }

    public static String blockNoticeAr(BlockType blockType, long remainingSeconds) {
        String operation = switch (blockType) {
            case LOGIN -> "تسجيل الدخول";
            case PASSWORD_RESET -> "إعادة تعيين كلمة المرور";
            case COMBINED -> "تسجيل الدخول وإعادة تعيين كلمة المرور";
        };
        return "تم حظر محاولات " + operation + " لهذا الرقم مؤقتاً بسبب تجاوز عدد المحاولات المسموحة. "
                + "سيتم رفع الحظر تلقائياً بعد " + formatRemainingAr(remainingSeconds) + ". "
                + "إذا لم تكن أنت من قام بهذه المحاولات، يرجى التواصل مع الدعم الفني فوراً.";
    }

    public static String blockNoticeEn(BlockType blockType, long remainingSeconds) {
        String operation = switch (blockType) {
            case LOGIN -> "Login";
            case PASSWORD_RESET -> "Password reset";
            case COMBINED -> "Login and password reset";
        };
        return operation + " attempts for this number are temporarily blocked after too many failed attempts. "
                + "The block lifts automatically in " + formatRemainingEn(remainingSeconds) + ". "
                + "If you did not make these attempts, please contact support immediately.";
    }

    private static String plural(long value, String unit) {
        return value + " " + unit + (value == 1 ? "" : "s");
    }
}
