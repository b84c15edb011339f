package com.libragraph.docmirror.core.remote;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One key/value pair attached to a remote document. Exactly one value field is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomMetadata(
        String key,
        String stringValue,
        Double numericValue,
        StringList stringListValue
) {

    public static final String ID = "id";
    public static final String HASH = "hash";
    public static final String CATEGORY = "category";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StringList(List<String> values) {}

    public static CustomMetadata ofString(String key, String value) {
        return new CustomMetadata(key, value, null, null);
    }

    public static CustomMetadata ofNumber(String key, double value) {
        return new CustomMetadata(key, null, value, null);
    }

    /** The metadata every uploaded document carries. */
    public static List<CustomMetadata> forDocument(long id, String hash, String category) {
        return List.of(
                ofNumber(ID, id),
                ofString(HASH, hash),
                ofString(CATEGORY, category == null ? "" : category));
    }

    /** The value as text; integral numbers render without a fraction. */
    @JsonIgnore
    public String text() {
        if (stringValue != null) return stringValue;
        if (numericValue != null) {
            double d = numericValue;
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (stringListValue != null && stringListValue.values() != null) {
            return String.join(",", stringListValue.values());
        }
        return null;
    }
}
