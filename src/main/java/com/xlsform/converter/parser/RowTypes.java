package com.xlsform.converter.parser;

import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Catalogue of survey row type tokens.
 */
@UtilityClass
public class RowTypes {

    public static final String BEGIN_GROUP = "begin group";
    public static final String END_GROUP = "end group";
    public static final String BEGIN_REPEAT = "begin repeat";
    public static final String END_REPEAT = "end repeat";

    public static final String DECIMAL = "decimal";
    public static final String TEXT = "text";
    public static final String YES_NO = "select_one yes_no";
    public static final String NOTE = "note";
    public static final String DATE = "date";
    public static final String TIME = "time";
    public static final String CALCULATE = "calculate";

    public static final String SELECT_ONE_PREFIX = "select_one ";
    public static final String SELECT_MULTIPLE_PREFIX = "select_multiple ";
    public static final String RANK_PREFIX = "rank ";

    private static final Set<String> SUPPORTED_FIELDS = Set.of(
            DECIMAL, TEXT, YES_NO, NOTE, DATE, TIME, CALCULATE);

    private static final Set<String> UNSUPPORTED_FIELDS = Set.of(
            "integer", "range", "geopoint", "geotrace", "geoshape",
            "datetime", "image", "audio", "video", "file",
            "barcode", "acknowledge", "hidden", "xml-external",
            // metadata
            "start", "end", "today", "deviceid", "subscriberid",
            "simserial", "phonenumber", "username", "email");

    public static boolean isBlockOpen(String type) {
        return BEGIN_GROUP.equals(type) || BEGIN_REPEAT.equals(type);
    }

    public static boolean isBlockClose(String type) {
        return END_GROUP.equals(type) || END_REPEAT.equals(type);
    }

    public static boolean isSupportedField(String type) {
        return SUPPORTED_FIELDS.contains(type) || isSelectOne(type) || isSelectMultiple(type);
    }

    public static boolean isUnsupportedField(String type) {
        return UNSUPPORTED_FIELDS.contains(type) || type.startsWith(RANK_PREFIX);
    }

    /** Generic single choice; {@code select_one yes_no} is a boolean, not a single choice. */
    public static boolean isSelectOne(String type) {
        return type.startsWith(SELECT_ONE_PREFIX) && !YES_NO.equals(type);
    }

    public static boolean isSelectMultiple(String type) {
        return type.startsWith(SELECT_MULTIPLE_PREFIX);
    }

    /** The list name following the first space of a select token. */
    public static String listName(String type) {
        return type.substring(type.indexOf(' ') + 1);
    }
}
