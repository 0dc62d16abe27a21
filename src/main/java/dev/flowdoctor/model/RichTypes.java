package dev.flowdoctor.model;

import java.util.Locale;
import java.util.Set;

/**
 * Rich Asset Type values with structural rules attached.
 */
public final class RichTypes {

    public static final String BUTTON = "button";
    public static final String BUTTONS = "buttons";
    public static final String QUICK_REPLY = "quick_reply";
    public static final String LISTPICKER = "listpicker";
    public static final String IMAGEBUTTON = "imagebutton";
    public static final String DATEPICKER = "datepicker";
    public static final String TIMEPICKER = "timepicker";
    public static final String FILE_UPLOAD = "file_upload";

    /** JSON option destinations written as strings. */
    public static final Set<String> STRING_DEST = Set.of(LISTPICKER, IMAGEBUTTON);

    /** JSON option destinations written as numbers. */
    public static final Set<String> NUMERIC_DEST = Set.of(BUTTONS, QUICK_REPLY);

    /** Inputs that need an answer and must disable free text. */
    public static final Set<String> PICKERS = Set.of(DATEPICKER, TIMEPICKER, FILE_UPLOAD);

    /** Pickers whose prompt lives in the JSON and whose Message column must be empty. */
    public static final Set<String> DATE_TIME = Set.of(DATEPICKER, TIMEPICKER);

    public static final String DYNAMIC_EMBED_TYPE = "dynamic";

    private RichTypes() {}

    public static String normalize(String richType) {
        return richType == null ? "" : richType.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean is(FlowNode.Decision decision, String type) {
        return normalize(decision.richType()).equals(type);
    }

    /** Rich content is a JSON object of type {@code dynamic}. */
    public static boolean isDynamicEmbed(FlowNode.Decision decision) {
        return RichContent.parse(decision.richContent()) instanceof RichContent.Json json
            && json.type().map(DYNAMIC_EMBED_TYPE::equals).orElse(false);
    }

    public static String defaultPickerMessage(String type) {
        return DATEPICKER.equals(type) ? "Please select a date" : "Please select a time";
    }
}
