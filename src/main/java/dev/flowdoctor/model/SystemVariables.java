package dev.flowdoctor.model;

import java.util.Locale;
import java.util.Set;

/**
 * Variables the platform binds for every conversation.
 */
public final class SystemVariables {

    public static final Set<String> NAMES = Set.of(
        "CHATID",
        "SESSION_ID",
        "LAST_USER_MESSAGE",
        "USER_PLATFORM",
        "USER_AGENT",
        "ENV",
        "BOT_ID",
        "COMPANY_NAME",
        "PLATFORM_ERROR",
        "AI_RESPONSE",
        "DETECTED_INTENT"
    );

    private SystemVariables() {}

    public static boolean isSystem(String name) {
        return name != null && NAMES.contains(name.toUpperCase(Locale.ROOT));
    }
}
